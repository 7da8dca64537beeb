package com.esc.gitlabtools.cli;

import com.esc.gitlabtools.console.ConsoleRenderer;
import com.esc.gitlabtools.gitlab.client.GitLabClient;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.exception.GitLabApiException;
import com.esc.gitlabtools.merge.model.MergeSummary;
import com.esc.gitlabtools.merge.service.InteractiveMergeService;
import com.esc.gitlabtools.topic.service.TopicProjectService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Component
@RequiredArgsConstructor
@Command(
    name = "merge",
    description = "Interactively merge open MRs targeting a branch for all projects in a topic",
    mixinStandardHelpOptions = true,
    footer = {
        "",
        "Examples:",
        "  gitlab-tools merge --target op-rc --topic backend"
    })
public class MergeCommand implements Callable<Integer> {

    static final int PER_PAGE = 100;

    private final GitLabConnector gitLabConnector;
    private final TopicProjectService topicProjectService;
    private final InteractiveMergeService interactiveMergeService;
    private final ConsoleRenderer renderer;

    @Spec
    CommandSpec spec;

    @Mixin
    GitLabConnectionOptions connection;

    @Option(names = "--target", required = true, paramLabel = "<branch>",
        description = "Target branch name (required)")
    String target;

    @Option(names = "--topic", required = true, paramLabel = "<topic>",
        description = "Topic name (required)")
    String topic;

    InputStream input = System.in;

    @Override
    public Integer call() {
        GitLabClient client = gitLabConnector.connect(connection, spec);
        PrintWriter out = spec.commandLine().getOut();

        out.println("📦 Fetching projects for topic: " + renderer.styled("bold,magenta", topic));
        out.flush();

        List<Project> projects;
        try {
            projects = topicProjectService.listAllProjects(client, topic, PER_PAGE);
        } catch (GitLabApiException e) {
            log.debug("Project listing failed for topic={}", topic, e);
            spec.commandLine().getErr().println("Error fetching projects: " + e.getMessage());
            return 1;
        }

        if (projects.isEmpty()) {
            out.println(renderer.styled("yellow", "⚠️ No projects found with topic: " + topic));
            out.flush();
            return 0;
        }

        out.println(renderer.markup(String.format("@|green ✓ Found %d projects|@", projects.size())));
        out.println();

        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        MergeSummary summary = interactiveMergeService.run(client, projects, target, reader, out);

        return summary.hasErrors() ? 1 : 0;
    }
}
