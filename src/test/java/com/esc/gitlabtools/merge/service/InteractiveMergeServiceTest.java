package com.esc.gitlabtools.merge.service;

import com.esc.gitlabtools.console.ConsoleRenderer;
import com.esc.gitlabtools.gitlab.client.FakeGitLabClient;
import com.esc.gitlabtools.gitlab.dto.MergeRequest;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.exception.GitLabApiException;
import com.esc.gitlabtools.merge.model.MergeSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InteractiveMergeServiceTest {

    private static final String TARGET = "op-rc";

    private FakeGitLabClient client;
    private InteractiveMergeService service;
    private StringWriter output;

    @BeforeEach
    void setUp() {
        client = new FakeGitLabClient();
        service = new InteractiveMergeService(new ConsoleRenderer(Ansi.OFF));
        output = new StringWriter();
    }

    private static Project project(long id, String path) {
        return Project.builder().id(id).pathWithNamespace(path).build();
    }

    private static MergeRequest mr(long iid, String title, boolean draft) {
        return MergeRequest.builder()
            .iid(iid)
            .title(title)
            .draft(draft)
            .sourceBranch("op-stage")
            .targetBranch(TARGET)
            .webUrl("https://gitlab.test/mr/" + iid)
            .build();
    }

    private MergeSummary run(List<Project> projects, String input) {
        return service.run(client, projects, TARGET,
            new BufferedReader(new StringReader(input)), new PrintWriter(output));
    }

    @Test
    void shouldMergeOnlyConfirmedCandidates() {
        client.addOpenMergeRequest(1, mr(1, "First", false))
            .addOpenMergeRequest(1, mr(2, "Second", false))
            .addOpenMergeRequest(1, mr(3, "Third", false));

        MergeSummary summary = run(List.of(project(1, "group/a")), "y\nn\nYES\n");

        assertEquals(2, summary.getMerged());
        assertEquals(1, summary.getSkipped());
        assertEquals(0, summary.getErrors());
        assertEquals(List.of(1L, 3L), client.getAccepted());
        assertTrue(output.toString().contains("Merge this MR? (y/n): "));
        assertTrue(output.toString().contains("✓ Successfully merged!"));
        assertTrue(output.toString().contains("⊘ Skipped"));
    }

    @Test
    void shouldExcludeDraftMergeRequests() {
        client.addOpenMergeRequest(1, mr(1, "Draft: not yet", false))
            .addOpenMergeRequest(1, mr(2, "flagged", true))
            .addOpenMergeRequest(1, mr(3, "Ready", false));

        MergeSummary summary = run(List.of(project(1, "group/a")), "y\n");

        assertEquals(1, summary.getMerged());
        assertEquals(List.of(3L), client.getAccepted());
        assertFalse(output.toString().contains("not yet"));
    }

    @Test
    void shouldCountListingFailureAndContinue() {
        client.failOn("listOpenMergeRequestsByTarget:1", new GitLabApiException(403, "forbidden"))
            .addOpenMergeRequest(2, mr(9, "Other", false));

        MergeSummary summary = run(List.of(project(1, "group/a"), project(2, "group/b")), "y\n");

        assertEquals(1, summary.getErrors());
        assertEquals(1, summary.getMerged());
        assertTrue(output.toString().contains("✗ Error fetching MRs for group/a: forbidden"));
        assertTrue(summary.hasErrors());
    }

    @Test
    void shouldCountFailedMergeAsError() {
        client.addOpenMergeRequest(1, mr(1, "First", false))
            .failOn("acceptMergeRequest", new GitLabApiException(405, "not mergeable"));

        MergeSummary summary = run(List.of(project(1, "group/a")), "y\n");

        assertEquals(0, summary.getMerged());
        assertEquals(1, summary.getErrors());
        assertTrue(output.toString().contains("✗ Failed to merge: not mergeable"));
    }

    @Test
    void shouldShowErrorBodyVerbatim() {
        client.addOpenMergeRequest(1, mr(1, "First", false))
            .failOn("acceptMergeRequest", new GitLabApiException(422, "{\"message\":\"@|red blocked|@\"}"));

        run(List.of(project(1, "group/a")), "y\n");

        assertTrue(output.toString().contains("✗ Failed to merge: {\"message\":\"@|red blocked|@\"}"));
    }

    @Test
    void shouldStopPromptingWhenInputEnds() {
        client.addOpenMergeRequest(1, mr(1, "First", false))
            .addOpenMergeRequest(1, mr(2, "Second", false));

        MergeSummary summary = run(List.of(project(1, "group/a")), "");

        assertEquals(0, summary.getMerged());
        assertEquals(0, summary.getSkipped());
        assertTrue(client.getAccepted().isEmpty());
        assertTrue(output.toString().contains("📊 Summary"));
    }

    @Test
    void shouldAcceptOnlyYesAnswers() {
        assertTrue(InteractiveMergeService.isYes(" Y "));
        assertTrue(InteractiveMergeService.isYes("yes"));
        assertFalse(InteractiveMergeService.isYes(""));
        assertFalse(InteractiveMergeService.isYes("yep"));
    }
}
