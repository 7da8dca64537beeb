package com.esc.gitlabtools.cli;

import com.esc.gitlabtools.console.ConsoleRenderer;
import com.esc.gitlabtools.gitlab.client.GitLabClient;
import com.esc.gitlabtools.gitlab.dto.Topic;
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
@Command(name = "topics", description = "List GitLab topics", mixinStandardHelpOptions = true)
public class TopicsCommand implements Callable<Integer> {

    private final GitLabConnector gitLabConnector;
    private final TopicProjectService topicProjectService;
    private final ConsoleRenderer renderer;

    @Spec
    CommandSpec spec;

    @Mixin
    GitLabConnectionOptions connection;

    @Option(names = "--page", defaultValue = "1", paramLabel = "<n>",
        description = "Page number (default: ${DEFAULT-VALUE})")
    int page;

    @Option(names = "--per-page", defaultValue = "50", paramLabel = "<n>",
        description = "Topics per page (default: ${DEFAULT-VALUE})")
    int perPage;

    @Override
    public Integer call() {
        if (page < 1 || perPage < 1) {
            throw new ParameterException(spec.commandLine(), "Error: --page and --per-page must be positive");
        }

        GitLabClient client = gitLabConnector.connect(connection, spec);

        List<Topic> topics;
        try {
            topics = topicProjectService.listTopics(client, page, perPage);
        } catch (GitLabApiException e) {
            spec.commandLine().getErr().println("Error fetching topics: " + e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        renderer.printTopics(out, topics);
        out.flush();
        return 0;
    }
}
