package com.esc.gitlabtools.cli;

import com.esc.gitlabtools.console.ConsoleRenderer;
import com.esc.gitlabtools.gitlab.client.GitLabClient;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.exception.GitLabApiException;
import com.esc.gitlabtools.topic.service.TopicProjectService;
import lombok.RequiredArgsConstructor;
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

@Component
@RequiredArgsConstructor
@Command(name = "projects", description = "List projects in a GitLab topic", mixinStandardHelpOptions = true)
public class ProjectsCommand implements Callable<Integer> {

    private final GitLabConnector gitLabConnector;
    private final TopicProjectService topicProjectService;
    private final ConsoleRenderer renderer;

    @Spec
    CommandSpec spec;

    @Mixin
    GitLabConnectionOptions connection;

    @Option(names = "--topic", required = true, paramLabel = "<topic>",
        description = "Topic name (required)")
    String topic;

    @Option(names = "--page", defaultValue = "1", paramLabel = "<n>",
        description = "Page number (default: ${DEFAULT-VALUE})")
    int page;

    @Option(names = "--per-page", defaultValue = "50", paramLabel = "<n>",
        description = "Projects per page (default: ${DEFAULT-VALUE})")
    int perPage;

    @Override
    public Integer call() {
        if (page < 1 || perPage < 1) {
            throw new ParameterException(spec.commandLine(), "Error: --page and --per-page must be positive");
        }

        GitLabClient client = gitLabConnector.connect(connection, spec);

        List<Project> projects;
        try {
            projects = topicProjectService.listProjects(client, topic, page, perPage);
        } catch (GitLabApiException e) {
            spec.commandLine().getErr().println("Error fetching projects: " + e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        renderer.printProjects(out, topic, projects);
        out.flush();
        return 0;
    }
}
