package com.esc.gitlabtools.topic.service;

import com.esc.gitlabtools.gitlab.client.GitLabClient;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.dto.Topic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * GitLab topic 및 topic별 프로젝트 조회
 */
@Slf4j
@Service
public class TopicProjectService {

    public List<Topic> listTopics(GitLabClient client, int page, int perPage) {
        return client.listTopics(page, perPage);
    }

    public List<Project> listProjects(GitLabClient client, String topic, int page, int perPage) {
        return client.listProjectsByTopic(topic, page, perPage);
    }

    /**
     * topic에 속한 모든 프로젝트를 조회. 빈 페이지 또는 perPage보다 작은 페이지가 나오면 종료합니다.
     */
    public List<Project> listAllProjects(GitLabClient client, String topic, int perPage) {
        if (perPage < 1) {
            throw new IllegalArgumentException("perPage must be positive: " + perPage);
        }

        List<Project> allProjects = new ArrayList<>();
        int page = 1;

        while (true) {
            List<Project> projects = client.listProjectsByTopic(topic, page, perPage);
            if (projects.isEmpty()) {
                break;
            }

            allProjects.addAll(projects);
            if (projects.size() < perPage) {
                break;
            }
            page++;
        }

        log.debug("Resolved {} project(s) for topic={} in {} page(s)", allProjects.size(), topic, page);
        return allProjects;
    }
}
