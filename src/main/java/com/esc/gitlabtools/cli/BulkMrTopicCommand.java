package com.esc.gitlabtools.cli;

import com.esc.gitlabtools.bulkmr.model.BulkMergeRequestConfig;
import com.esc.gitlabtools.bulkmr.model.BulkMergeRequestReport;
import com.esc.gitlabtools.bulkmr.service.BulkMergeRequestService;
import com.esc.gitlabtools.console.ConsoleRenderer;
import com.esc.gitlabtools.gitlab.client.GitLabClient;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.exception.GitLabApiException;
import com.esc.gitlabtools.topic.service.TopicProjectService;
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
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Component
@RequiredArgsConstructor
@Command(
    name = "bulk-mr-topic",
    description = "Create merge requests from origin to target branch for all projects in a topic",
    mixinStandardHelpOptions = true,
    footer = {
        "",
        "Examples:",
        "  # Create MRs from op-stage to op-rc for all backend projects",
        "  gitlab-tools bulk-mr-topic --origin op-stage --target op-rc --topic backend",
        "",
        "  # With verbose output",
        "  gitlab-tools bulk-mr-topic --origin op-stage --target op-rc --topic frontend --verbose"
    })
public class BulkMrTopicCommand implements Callable<Integer> {

    private final GitLabConnector gitLabConnector;
    private final TopicProjectService topicProjectService;
    private final BulkMergeRequestService bulkMergeRequestService;
    private final ReportPrinter reportPrinter;
    private final ConsoleRenderer renderer;

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

    @Option(names = "--topic", required = true, paramLabel = "<topic>",
        description = "Topic name (required)")
    String topic;

    @Option(names = "--per-page", defaultValue = "100", paramLabel = "<n>",
        description = "Number of projects to fetch per page (default: ${DEFAULT-VALUE})")
    int perPage;

    @Option(names = "--output", defaultValue = "TEXT", paramLabel = "<format>",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    OutputFormat output;

    @Override
    public Integer call() {
        if (origin.isBlank() || target.isBlank() || topic.isBlank()) {
            throw new ParameterException(spec.commandLine(), "Error: --origin, --target and --topic must not be blank");
        }
        if (perPage < 1) {
            throw new ParameterException(spec.commandLine(), "Error: --per-page must be positive");
        }

        GitLabClient client = gitLabConnector.connect(connection, spec);
        PrintWriter out = spec.commandLine().getOut();
        boolean text = output == OutputFormat.TEXT;

        if (text) {
            out.println("Fetching projects for topic: " + renderer.styled("bold,magenta", topic));
            out.println();
            out.flush();
        }

        List<Project> projects;
        try {
            projects = topicProjectService.listAllProjects(client, topic, perPage);
        } catch (GitLabApiException e) {
            log.debug("Project listing failed for topic={}", topic, e);
            spec.commandLine().getErr().println("Error fetching projects: " + e.getMessage());
            return 1;
        }

        if (projects.isEmpty()) {
            if (text) {
                out.println("No projects found for topic: " + topic);
                out.flush();
            } else {
                // stdout은 JSON만 출력
                spec.commandLine().getErr().println("No projects found for topic: " + topic);
                reportPrinter.print(out, BulkMergeRequestReport.of(List.of()), output);
            }
            return 0;
        }

        if (text) {
            out.println(String.format("Found %d project(s) in topic ", projects.size())
                + renderer.styled("bold,magenta", topic));
            out.println();
        }

        BulkMergeRequestConfig config = BulkMergeRequestConfig.builder()
            .originBranch(origin)
            .targetBranch(target)
            .projects(projects.stream().map(Project::getPathWithNamespace).toList())
            .verbose(connection.isVerbose())
            .build();

        BulkMergeRequestReport report = bulkMergeRequestService.processProjects(client, config);
        reportPrinter.print(out, report, output);

        return report.hasErrors() ? 1 : 0;
    }
}
