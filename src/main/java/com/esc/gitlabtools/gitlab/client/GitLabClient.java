package com.esc.gitlabtools.gitlab.client;

import com.esc.gitlabtools.gitlab.dto.Compare;
import com.esc.gitlabtools.gitlab.dto.MergeRequest;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.dto.Topic;

import java.util.List;

/**
 * GitLab REST API 중 gitlab-tools가 사용하는 기능
 *
 * 모든 메서드는 동기 호출이며, 실패 시 {@link com.esc.gitlabtools.gitlab.exception.GitLabApiException}을 던집니다.
 */
public interface GitLabClient {

    Project getProject(String projectPath);

    /**
     * 브랜치 존재 여부. 404는 오류가 아니라 false를 반환합니다.
     */
    boolean branchExists(long projectId, String branch);

    /**
     * target을 기준(from)으로 source(to)가 추가하는 커밋을 조회
     */
    Compare compareBranches(long projectId, String sourceBranch, String targetBranch);

    /**
     * source/target 조합이 정확히 일치하는 열린 MR 목록 (GitLab 응답 순서 유지)
     */
    List<MergeRequest> findOpenMergeRequests(long projectId, String sourceBranch, String targetBranch);

    MergeRequest createMergeRequest(
        long projectId,
        String sourceBranch,
        String targetBranch,
        String title,
        String description);

    List<MergeRequest> listOpenMergeRequestsByTarget(long projectId, String targetBranch);

    MergeRequest acceptMergeRequest(long projectId, long mrIid);

    List<Topic> listTopics(int page, int perPage);

    List<Project> listProjectsByTopic(String topic, int page, int perPage);
}
