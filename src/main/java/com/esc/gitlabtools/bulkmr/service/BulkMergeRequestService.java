package com.esc.gitlabtools.bulkmr.service;

import com.esc.gitlabtools.bulkmr.model.BulkMergeRequestConfig;
import com.esc.gitlabtools.bulkmr.model.BulkMergeRequestReport;
import com.esc.gitlabtools.bulkmr.model.ProjectResult;
import com.esc.gitlabtools.bulkmr.model.ResultStatus;
import com.esc.gitlabtools.gitlab.client.GitLabClient;
import com.esc.gitlabtools.gitlab.dto.Compare;
import com.esc.gitlabtools.gitlab.dto.MergeRequest;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.exception.GitLabApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 여러 프로젝트에 origin → target Merge Request를 일괄 생성
 *
 * 프로젝트마다 아래 순서로 확인하며 처음 해당하는 규칙에서 결과가 정해집니다.
 * <ol>
 *   <li>프로젝트 조회 실패 → ERROR</li>
 *   <li>origin / target 브랜치가 없음 → SKIPPED_NO_BRANCH</li>
 *   <li>같은 source/target의 열린 MR이 있음 → SKIPPED_EXISTS 또는 SKIPPED_DRAFT</li>
 *   <li>커밋 차이 없음 → SKIPPED_NO_CHANGE</li>
 *   <li>MR 생성 → CREATED</li>
 * </ol>
 * 열린 MR이 있으면 새로 만들지 않으므로 같은 명령을 다시 실행해도 안전합니다.
 * 한 프로젝트의 실패는 해당 프로젝트의 ERROR 결과로만 남고 나머지 처리는 계속됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkMergeRequestService {

    static final String TOOL_NAME = "gitlab-tools";

    private final ProgressListener progressListener;

    public BulkMergeRequestReport processProjects(GitLabClient client, BulkMergeRequestConfig config) {
        config.validate();

        List<ProjectResult> results = new ArrayList<>(config.getProjects().size());
        for (String projectPath : config.getProjects()) {
            ProjectResult result;
            try {
                result = processProject(client, config, projectPath);
            } catch (RuntimeException e) {
                log.error("[{}] Unexpected failure", projectPath, e);
                result = ProjectResult.error(projectPath, "unexpected error: " + e.getMessage());
            }
            log.debug("[{}] {}", projectPath, result.getStatus());
            results.add(result);
        }

        return BulkMergeRequestReport.of(results);
    }

    ProjectResult processProject(GitLabClient client, BulkMergeRequestConfig config, String projectPath) {
        String origin = config.getOriginBranch();
        String target = config.getTargetBranch();

        Project project;
        try {
            project = client.getProject(projectPath);
        } catch (GitLabApiException e) {
            return ProjectResult.error(projectPath, e.getMessage());
        }
        if (project.getId() == null) {
            return ProjectResult.error(projectPath, "failed to get project " + projectPath + ": response has no id");
        }
        long projectId = project.getId();

        if (config.isVerbose()) {
            progressListener.onBranchCheck(projectPath);
        }

        boolean originExists;
        try {
            originExists = client.branchExists(projectId, origin);
        } catch (GitLabApiException e) {
            return ProjectResult.error(projectPath, "failed to check origin branch: " + e.getMessage());
        }
        if (!originExists) {
            return ProjectResult.skipped(projectPath, ResultStatus.SKIPPED_NO_BRANCH,
                String.format("Origin branch '%s' does not exist", origin));
        }

        boolean targetExists;
        try {
            targetExists = client.branchExists(projectId, target);
        } catch (GitLabApiException e) {
            return ProjectResult.error(projectPath, "failed to check target branch: " + e.getMessage());
        }
        if (!targetExists) {
            return ProjectResult.skipped(projectPath, ResultStatus.SKIPPED_NO_BRANCH,
                String.format("Target branch '%s' does not exist", target));
        }

        if (config.isVerbose()) {
            progressListener.onMergeRequestLookup(projectPath);
        }

        List<MergeRequest> existing;
        try {
            existing = client.findOpenMergeRequests(projectId, origin, target);
        } catch (GitLabApiException e) {
            return ProjectResult.error(projectPath, "failed to find existing merge requests: " + e.getMessage());
        }
        if (!existing.isEmpty()) {
            return classifyExisting(projectPath, existing);
        }

        if (config.isVerbose()) {
            progressListener.onCompare(projectPath);
        }

        Compare compare;
        try {
            compare = client.compareBranches(projectId, origin, target);
        } catch (GitLabApiException e) {
            return ProjectResult.error(projectPath, "failed to compare branches: " + e.getMessage());
        }
        if (!compare.hasChanges()) {
            return ProjectResult.skipped(projectPath, ResultStatus.SKIPPED_NO_CHANGE,
                String.format("No changes between %s and %s", origin, target));
        }

        if (config.isVerbose()) {
            progressListener.onCreate(projectPath, compare.getCommits().size());
        }

        MergeRequest created;
        try {
            created = client.createMergeRequest(projectId, origin, target, title(origin, target), description(origin, target));
        } catch (GitLabApiException e) {
            return ProjectResult.error(projectPath, "failed to create merge request: " + e.getMessage());
        }

        log.info("Merge request created: project={}, iid={}", projectPath, created.getIid());

        return ProjectResult.builder()
            .project(projectPath)
            .status(ResultStatus.CREATED)
            .mergeRequestId(created.getId())
            .mergeRequestIid(created.getIid())
            .mergeRequestUrl(created.getWebUrl())
            .details(String.format("MR !%d: %s", created.getIid(), created.getWebUrl()))
            .build();
    }

    /**
     * 열린 MR을 순서대로 확인하여 첫 번째 non-draft MR이 나오면 바로 SKIPPED_EXISTS.
     * 모두 draft이면 마지막으로 확인한 draft MR로 SKIPPED_DRAFT.
     */
    private ProjectResult classifyExisting(String projectPath, List<MergeRequest> existing) {
        MergeRequest lastDraft = null;

        for (MergeRequest mr : existing) {
            if (!mr.isEffectiveDraft()) {
                return ProjectResult.builder()
                    .project(projectPath)
                    .status(ResultStatus.SKIPPED_EXISTS)
                    .mergeRequestId(mr.getId())
                    .mergeRequestIid(mr.getIid())
                    .mergeRequestUrl(mr.getWebUrl())
                    .details(String.format("Open MR already exists: !%d", mr.getIid()))
                    .build();
            }
            lastDraft = mr;
        }

        return ProjectResult.builder()
            .project(projectPath)
            .status(ResultStatus.SKIPPED_DRAFT)
            .mergeRequestId(lastDraft.getId())
            .mergeRequestIid(lastDraft.getIid())
            .mergeRequestUrl(lastDraft.getWebUrl())
            .details(String.format("Draft MR exists: !%d (%s)", lastDraft.getIid(), lastDraft.getTitle()))
            .build();
    }

    static String title(String origin, String target) {
        return String.format("Merge %s into %s", origin, target);
    }

    static String description(String origin, String target) {
        return String.format(
            "This merge request was created automatically by %s.\n\n**Source Branch**: `%s`\n**Target Branch**: `%s`",
            TOOL_NAME, origin, target);
    }
}
