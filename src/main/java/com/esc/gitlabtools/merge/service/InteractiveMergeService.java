package com.esc.gitlabtools.merge.service;

import com.esc.gitlabtools.console.ConsoleRenderer;
import com.esc.gitlabtools.gitlab.client.GitLabClient;
import com.esc.gitlabtools.gitlab.dto.MergeRequest;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.exception.GitLabApiException;
import com.esc.gitlabtools.merge.model.MergeSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * target 브랜치로 향하는 열린 MR을 하나씩 보여주고 확인(y/n) 후 머지
 *
 * draft MR은 후보에서 제외합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InteractiveMergeService {

    private final ConsoleRenderer renderer;

    public MergeSummary run(
            GitLabClient client,
            List<Project> projects,
            String targetBranch,
            BufferedReader in,
            PrintWriter out) {

        MergeSummary summary = new MergeSummary();

        for (Project project : projects) {
            List<MergeRequest> candidates;
            try {
                candidates = client.listOpenMergeRequestsByTarget(project.getId(), targetBranch).stream()
                    .filter(mr -> !mr.isEffectiveDraft())
                    .toList();
            } catch (GitLabApiException e) {
                out.println(renderer.styled("red", "✗ Error fetching MRs for " + project.getPathWithNamespace()
                    + ": " + e.getMessage()));
                summary.incrementErrors();
                continue;
            }

            for (MergeRequest mr : candidates) {
                renderer.printMergeCandidate(out, project, mr);

                String answer = readLine(in);
                if (answer == null) {
                    log.debug("Input closed, stopping prompts for {}", project.getPathWithNamespace());
                    break;
                }

                if (isYes(answer)) {
                    try {
                        client.acceptMergeRequest(project.getId(), mr.getIid());
                        out.println(renderer.markup("@|green ✓ Successfully merged!|@"));
                        summary.incrementMerged();
                    } catch (GitLabApiException e) {
                        out.println(renderer.styled("red", "✗ Failed to merge: " + e.getMessage()));
                        summary.incrementErrors();
                    }
                } else {
                    out.println(renderer.markup("@|yellow ⊘ Skipped|@"));
                    summary.incrementSkipped();
                }
                out.println();
            }
        }

        renderer.printMergeSummary(out, summary);
        out.flush();
        return summary;
    }

    static boolean isYes(String answer) {
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("y") || normalized.equals("yes");
    }

    private static String readLine(BufferedReader in) {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
    }
}
