package com.esc.gitlabtools.cli;

import com.esc.gitlabtools.bulkmr.service.BulkMergeRequestService;
import com.esc.gitlabtools.bulkmr.service.ProgressListener;
import com.esc.gitlabtools.config.GitLabProperties;
import com.esc.gitlabtools.config.JacksonConfig;
import com.esc.gitlabtools.console.ConsoleRenderer;
import com.esc.gitlabtools.gitlab.client.FakeGitLabClient;
import com.esc.gitlabtools.gitlab.client.GitLabClientFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.logging.LoggingSystem;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BulkMrCommandTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    private FakeGitLabClient client;
    private GitLabConnector connector;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        client = new FakeGitLabClient();
        connector = mock(GitLabConnector.class);
        when(connector.connect(any(), any())).thenReturn(client);
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(GitLabConnector gitLabConnector, String... args) {
        BulkMrCommand command = new BulkMrCommand(
            gitLabConnector,
            new BulkMergeRequestService(mock(ProgressListener.class)),
            new ReportPrinter(new ConsoleRenderer(Ansi.OFF), objectMapper));

        CommandLine commandLine = GitLabToolsRunner.commandLine(command, CommandLine.defaultFactory());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private void readyProject(long id, String path, int commits) {
        client.addProject(id, path).addBranch(id, "op-stage").addBranch(id, "op-rc").setCommitCount(id, commits);
    }

    @Test
    void shouldCreateMergeRequestsAndExitZero() {
        readyProject(1, "group/a", 2);
        readyProject(2, "group/b", 0);

        int exitCode = execute(connector, "--origin", "op-stage", "--target", "op-rc",
            "--project", "group/a", "--project", "group/b");

        assertEquals(0, exitCode);
        String text = out.toString();
        assertTrue(text.startsWith("Processing 2 project(s)..."));
        assertTrue(text.contains("[group/a] ✓ CREATED"));
        assertTrue(text.contains("[group/b] ≡ SKIPPED_NO_CHANGE"));
        assertTrue(text.contains("✓ Completed successfully"));
    }

    @Test
    void shouldExitOneWhenAnyProjectFails() {
        readyProject(1, "group/a", 2);

        int exitCode = execute(connector, "--origin", "op-stage", "--target", "op-rc",
            "--project", "group/a", "--project", "group/missing");

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("[group/missing] ✗ ERROR"));
        assertTrue(out.toString().contains("✗ Completed with errors"));
    }

    @Test
    void shouldPrefixProjectsWithoutNamespace() {
        readyProject(1, "mygroup/a", 1);
        readyProject(2, "other/b", 1);

        int exitCode = execute(connector, "--origin", "op-stage", "--target", "op-rc",
            "--group", "mygroup", "--project", "a", "--project", "other/b");

        assertEquals(0, exitCode);
        assertEquals(2, client.getCreated().size());
        assertEquals(List.of("mygroup/a", "other/b"),
            BulkMrCommand.expandProjects("mygroup", List.of("a", "other/b")));
        assertEquals(List.of("a"), BulkMrCommand.expandProjects(null, List.of("a")));
        assertEquals(List.of("a"), BulkMrCommand.expandProjects("  ", List.of("a")));
    }

    @Test
    void shouldPrintJsonReport() throws Exception {
        readyProject(1, "group/a", 2);

        int exitCode = execute(connector, "--origin", "op-stage", "--target", "op-rc",
            "--project", "group/a", "--output", "json");

        assertEquals(0, exitCode);
        JsonNode report = objectMapper.readTree(out.toString());
        assertEquals("CREATED", report.get("results").get(0).get("status").asText());
        assertEquals(1, report.get("results").get(0).get("mergeRequestIid").asInt());
        assertEquals(1, report.get("summary").get("created").asInt());
        assertEquals(1, report.get("summary").get("total").asInt());
    }

    @Test
    void shouldRejectMissingRequiredOptions() {
        int exitCode = execute(connector, "--origin", "op-stage", "--project", "group/a");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("--target"));
        verifyNoInteractions(connector);
    }

    @Test
    void shouldRequireGitLabUrlBeforeAnyCall() {
        GitLabClientFactory factory = mock(GitLabClientFactory.class);
        GitLabConnector realConnector = new GitLabConnector(new GitLabProperties(), factory, mock(LoggingSystem.class));

        int exitCode = execute(realConnector, "--origin", "op-stage", "--target", "op-rc",
            "--project", "group/a", "--token", "secret");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("GitLab URL must be provided via --gitlab-url or GITLAB_BASE_URL env"));
        verifyNoInteractions(factory);
    }

    @Test
    void shouldRequireGitLabToken() {
        GitLabConnector realConnector = new GitLabConnector(new GitLabProperties(),
            mock(GitLabClientFactory.class), mock(LoggingSystem.class));

        int exitCode = execute(realConnector, "--origin", "op-stage", "--target", "op-rc",
            "--project", "group/a", "--gitlab-url", "https://gitlab.test");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("GitLab token must be provided via --token or GITLAB_TOKEN env"));
    }
}
