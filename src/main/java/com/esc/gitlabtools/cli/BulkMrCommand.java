package com.esc.gitlabtools.cli;

import com.esc.gitlabtools.bulkmr.model.BulkMergeRequestConfig;
import com.esc.gitlabtools.bulkmr.model.BulkMergeRequestReport;
import com.esc.gitlabtools.bulkmr.service.BulkMergeRequestService;
import com.esc.gitlabtools.gitlab.client.GitLabClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Component
@RequiredArgsConstructor
@Command(
    name = "bulk-mr",
    description = "Create merge requests from origin branch to target branch across multiple projects",
    mixinStandardHelpOptions = true,
    footer = {
        "",
        "Examples:",
        "  # Create MRs from op-stage to op-rc for two projects",
        "  gitlab-tools bulk-mr --origin op-stage --target op-rc \\",
        "    --project group/repo-a --project group/repo-b",
        "",
        "  # With group prefix",
        "  gitlab-tools bulk-mr --origin op-stage --target op-rc \\",
        "    --group mygroup --project repo-a --project repo-b",
        "",
        "Environment Variables:",
        "  GITLAB_BASE_URL    GitLab instance base URL (e.g., https://gitlab.example.com)",
        "  GITLAB_TOKEN       Personal access token for GitLab API"
    })
public class BulkMrCommand implements Callable<Integer> {

    private final GitLabConnector gitLabConnector;
    private final BulkMergeRequestService bulkMergeRequestService;
    private final ReportPrinter reportPrinter;

    @Spec
    CommandSpec spec;

    @Mixin
    GitLabConnectionOptions connection;

    @Option(names = "--origin", required = true, paramLabel = "<branch>",
        description = "Origin (source) branch name (required)")
    String origin;

    @Option(names = "--target", required = true, paramLabel = "<branch>",
        description = "Target branch name (required)")
    String target;

    @Option(names = "--project", required = true, paramLabel = "<path>",
        description = "Project path (can be repeated)")
    List<String> projects;

    @Option(names = "--group", paramLabel = "<group>",
        description = "Default group/namespace prefix (optional)")
    String group;

    @Option(names = "--output", defaultValue = "TEXT", paramLabel = "<format>",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    OutputFormat output;

    @Override
    public Integer call() {
        BulkMergeRequestConfig config = BulkMergeRequestConfig.builder()
            .originBranch(origin)
            .targetBranch(target)
            .projects(expandProjects(group, projects))
            .verbose(connection.isVerbose())
            .build();

        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }

        GitLabClient client = gitLabConnector.connect(connection, spec);
        PrintWriter out = spec.commandLine().getOut();

        if (output == OutputFormat.TEXT) {
            out.printf("Processing %d project(s)...%n%n", config.getProjects().size());
            out.flush();
        }

        BulkMergeRequestReport report = bulkMergeRequestService.processProjects(client, config);
        reportPrinter.print(out, report, output);

        return report.hasErrors() ? 1 : 0;
    }

    /**
     * "/"가 없는 프로젝트 경로에는 --group 접두어를 붙임
     */
    static List<String> expandProjects(String group, List<String> projects) {
        List<String> expanded = new ArrayList<>(projects.size());
        for (String project : projects) {
            if (group != null && !group.isBlank() && !project.contains("/")) {
                expanded.add(group.trim() + "/" + project);
            } else {
                expanded.add(project);
            }
        }
        return expanded;
    }
}
