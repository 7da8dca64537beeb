package com.esc.gitlabtools.gitlab.client;

import com.esc.gitlabtools.gitlab.dto.Compare;
import com.esc.gitlabtools.gitlab.dto.CreateMergeRequestRequest;
import com.esc.gitlabtools.gitlab.dto.MergeRequest;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.dto.Topic;
import com.esc.gitlabtools.gitlab.exception.GitLabApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * WebClient 기반 GitLab API 클라이언트
 *
 * 프로젝트를 하나씩 순차 처리하므로 각 호출은 응답을 받을 때까지 block 합니다.
 * 경로/쿼리 값은 URI 템플릿 변수로 전달하여 "group/repo" 같은 값이 %2F로 인코딩되도록 합니다.
 */
@Slf4j
public class GitLabApiClient implements GitLabClient {

    private static final ParameterizedTypeReference<List<MergeRequest>> MERGE_REQUEST_LIST =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Project>> PROJECT_LIST =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Topic>> TOPIC_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient gitLabWebClient;
    private final Duration timeout;

    public GitLabApiClient(WebClient gitLabWebClient, Duration timeout) {
        this.gitLabWebClient = gitLabWebClient;
        this.timeout = timeout;
    }

    @Override
    public Project getProject(String projectPath) {
        String failure = "failed to get project " + projectPath;

        Mono<Project> request = gitLabWebClient.get()
            .uri("/api/v4/projects/{path}", projectPath)
            .retrieve()
            .onStatus(
                status -> status.is4xxClientError() || status.is5xxServerError(),
                response -> toApiException(response, failure)
            )
            .bodyToMono(Project.class)
            .doOnNext(project -> log.debug("Resolved project {} -> id={}", projectPath, project.getId()));

        return await(request, failure);
    }

    @Override
    public boolean branchExists(long projectId, String branch) {
        String failure = "failed to check branch " + branch;

        Mono<Boolean> request = gitLabWebClient.get()
            .uri("/api/v4/projects/{id}/repository/branches/{branch}", projectId, branch)
            .exchangeToMono(response -> {
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    return response.releaseBody().thenReturn(false);
                }
                if (response.statusCode().is2xxSuccessful()) {
                    return response.releaseBody().thenReturn(true);
                }
                return this.<Boolean>toApiException(response, failure);
            });

        return await(request, failure);
    }

    @Override
    public Compare compareBranches(long projectId, String sourceBranch, String targetBranch) {
        String failure = "failed to compare branches";

        Mono<Compare> request = gitLabWebClient.get()
            .uri("/api/v4/projects/{id}/repository/compare?from={from}&to={to}",
                projectId, targetBranch, sourceBranch)
            .retrieve()
            .onStatus(
                status -> status.is4xxClientError() || status.is5xxServerError(),
                response -> toApiException(response, failure)
            )
            .bodyToMono(Compare.class)
            .doOnNext(compare -> log.debug("Compared {}...{} for project={}: {} commit(s)",
                targetBranch, sourceBranch, projectId,
                compare.getCommits() != null ? compare.getCommits().size() : 0));

        return await(request, failure);
    }

    @Override
    public List<MergeRequest> findOpenMergeRequests(long projectId, String sourceBranch, String targetBranch) {
        String failure = "failed to find merge requests";

        Mono<List<MergeRequest>> request = gitLabWebClient.get()
            .uri("/api/v4/projects/{id}/merge_requests?state=opened&source_branch={source}&target_branch={target}",
                projectId, sourceBranch, targetBranch)
            .retrieve()
            .onStatus(
                status -> status.is4xxClientError() || status.is5xxServerError(),
                response -> toApiException(response, failure)
            )
            .bodyToMono(MERGE_REQUEST_LIST)
            .defaultIfEmpty(List.of())
            .doOnSuccess(mrs -> log.debug("Found {} open MR(s) {} -> {} for project={}",
                mrs.size(), sourceBranch, targetBranch, projectId));

        return await(request, failure);
    }

    @Override
    public MergeRequest createMergeRequest(
            long projectId,
            String sourceBranch,
            String targetBranch,
            String title,
            String description) {

        String failure = "failed to create merge request";

        CreateMergeRequestRequest body = CreateMergeRequestRequest.builder()
            .sourceBranch(sourceBranch)
            .targetBranch(targetBranch)
            .title(title)
            .description(description)
            .build();

        Mono<MergeRequest> request = gitLabWebClient.post()
            .uri("/api/v4/projects/{id}/merge_requests", projectId)
            .bodyValue(body)
            .retrieve()
            .onStatus(
                status -> status.is4xxClientError() || status.is5xxServerError(),
                response -> toApiException(response, failure)
            )
            .bodyToMono(MergeRequest.class)
            .doOnNext(mr -> log.debug("Merge request created: project={}, iid={}", projectId, mr.getIid()));

        return await(request, failure);
    }

    @Override
    public List<MergeRequest> listOpenMergeRequestsByTarget(long projectId, String targetBranch) {
        String failure = "failed to list merge requests";

        Mono<List<MergeRequest>> request = gitLabWebClient.get()
            .uri("/api/v4/projects/{id}/merge_requests?state=opened&target_branch={target}", projectId, targetBranch)
            .retrieve()
            .onStatus(
                status -> status.is4xxClientError() || status.is5xxServerError(),
                response -> toApiException(response, failure)
            )
            .bodyToMono(MERGE_REQUEST_LIST)
            .defaultIfEmpty(List.of());

        return await(request, failure);
    }

    @Override
    public MergeRequest acceptMergeRequest(long projectId, long mrIid) {
        String failure = "failed to accept merge request";

        Mono<MergeRequest> request = gitLabWebClient.put()
            .uri("/api/v4/projects/{id}/merge_requests/{iid}/merge", projectId, mrIid)
            .retrieve()
            .onStatus(
                status -> status.is4xxClientError() || status.is5xxServerError(),
                response -> toApiException(response, failure)
            )
            .bodyToMono(MergeRequest.class)
            .doOnNext(mr -> log.info("Merge request accepted: project={}, iid={}", projectId, mrIid));

        return await(request, failure);
    }

    @Override
    public List<Topic> listTopics(int page, int perPage) {
        String failure = "failed to list topics";

        Mono<List<Topic>> request = gitLabWebClient.get()
            .uri("/api/v4/topics?page={page}&per_page={perPage}", page, perPage)
            .retrieve()
            .onStatus(
                status -> status.is4xxClientError() || status.is5xxServerError(),
                response -> toApiException(response, failure)
            )
            .bodyToMono(TOPIC_LIST)
            .defaultIfEmpty(List.of())
            .doOnSuccess(topics -> log.debug("Retrieved {} topic(s), page={}", topics.size(), page));

        return await(request, failure);
    }

    @Override
    public List<Project> listProjectsByTopic(String topic, int page, int perPage) {
        String failure = "failed to list projects for topic " + topic;

        Mono<List<Project>> request = gitLabWebClient.get()
            .uri("/api/v4/projects?topic={topic}&page={page}&per_page={perPage}", topic, page, perPage)
            .retrieve()
            .onStatus(
                status -> status.is4xxClientError() || status.is5xxServerError(),
                response -> toApiException(response, failure)
            )
            .bodyToMono(PROJECT_LIST)
            .defaultIfEmpty(List.of())
            .doOnSuccess(projects -> log.debug("Retrieved {} project(s) for topic={}, page={}",
                projects.size(), topic, page));

        return await(request, failure);
    }

    private <T> Mono<T> toApiException(ClientResponse response, String failure) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .flatMap(body -> {
                log.error("GitLab API error: status={}, body={}", status, body);
                return Mono.error(new GitLabApiException(
                    status,
                    failure + ": API request failed with status " + status + ": " + body
                ));
            });
    }

    /**
     * 빈 응답과 타임아웃을 오류로 처리하고 결과를 기다림.
     * 연결 실패나 역직렬화 실패도 GitLabApiException으로 감싸서 호출자는 한 가지 예외만 처리하면 됩니다.
     */
    private <T> T await(Mono<T> request, String failure) {
        return request
            .switchIfEmpty(Mono.error(() -> new GitLabApiException(failure + ": empty response")))
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof GitLabApiException),
                e -> new GitLabApiException(failure + ": " + e.getMessage(), e))
            .block();
    }
}
