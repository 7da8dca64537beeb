package com.esc.gitlabtools.console;

import com.esc.gitlabtools.bulkmr.model.ProjectResult;
import com.esc.gitlabtools.bulkmr.model.ResultStatus;
import com.esc.gitlabtools.bulkmr.model.Summary;
import com.esc.gitlabtools.gitlab.dto.MergeRequest;
import com.esc.gitlabtools.gitlab.dto.Project;
import com.esc.gitlabtools.gitlab.dto.Topic;
import com.esc.gitlabtools.merge.model.MergeSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.IStyle;
import picocli.CommandLine.Help.Ansi.Style;

import java.io.PrintWriter;
import java.util.List;

/**
 * 터미널 출력 포맷
 *
 * 색상은 picocli ANSI 마크업(@|style text|@)을 사용하며, 터미널이 아니면 자동으로 제거됩니다.
 */
@Component
public class ConsoleRenderer {

    private static final int DESCRIPTION_LIMIT = 80;
    private static final String SEPARATOR = "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";

    private final Ansi ansi;

    public ConsoleRenderer() {
        this(Ansi.AUTO);
    }

    public ConsoleRenderer(Ansi ansi) {
        this.ansi = ansi;
    }

    public String markup(String text) {
        return ansi.string(text);
    }

    /**
     * GitLab에서 받은 값(제목, 설명, 오류 메시지 등)에 스타일 적용. 값 안의 @|...|@는 해석하지 않습니다.
     */
    public String styled(String style, String value) {
        String text = value != null ? value : "";
        if (!ansi.enabled()) {
            return text;
        }
        IStyle[] styles = Style.parse(style);
        return Style.on(styles) + text + Style.off(styles);
    }

    public void printResult(PrintWriter out, ProjectResult result) {
        out.printf("[%s] %s %s%n", result.getProject(), statusIcon(result.getStatus()), result.getStatus());

        if (result.getDetails() != null && !result.getDetails().isEmpty()) {
            out.printf("  %s%n", result.getDetails());
        }
        if (result.getErrorMessage() != null && !result.getErrorMessage().isEmpty()) {
            out.printf("  Error: %s%n", result.getErrorMessage());
        }

        out.println();
    }

    public void printSummary(PrintWriter out, Summary summary) {
        out.println("Summary:");
        out.printf("  Total projects: %d%n", summary.getTotal());
        out.printf("  Created: %d%n", summary.getCreated());
        out.printf("  Skipped (exists): %d%n", summary.getSkippedExists());
        out.printf("  Skipped (draft): %d%n", summary.getSkippedDraft());
        out.printf("  Skipped (no changes): %d%n", summary.getSkippedNoChange());
        out.printf("  Skipped (no branch): %d%n", summary.getSkippedBranch());
        out.printf("  Errors: %d%n", summary.getErrors());
        out.println();

        if (summary.getErrors() == 0) {
            out.println(markup("@|green ✓ Completed successfully|@"));
        } else {
            out.println(markup("@|red ✗ Completed with errors|@"));
        }
    }

    public void printTopics(PrintWriter out, List<Topic> topics) {
        out.println();
        out.println(markup("📚 @|bold,magenta GitLab Topics|@"));
        out.println();

        if (topics.isEmpty()) {
            out.println(markup("@|faint No topics found.|@"));
            return;
        }

        for (int i = 0; i < topics.size(); i++) {
            Topic topic = topics.get(i);
            StringBuilder line = new StringBuilder(markup(String.format("@|bold %d.|@ ", i + 1)))
                .append(styled("bold,magenta", topic.getName()));
            if (hasText(topic.getTitle()) && !topic.getTitle().equals(topic.getName())) {
                line.append(" - ").append(topic.getTitle());
            }
            out.println(line);

            if (topic.getTotalProjectsCount() > 0) {
                out.println(markup(String.format("   @|magenta 📦 %d projects|@", topic.getTotalProjectsCount())));
            }
            if (hasText(topic.getDescription()) && !topic.getDescription().equals(topic.getTitle())) {
                out.println("   " + styled("faint", truncate(topic.getDescription(), DESCRIPTION_LIMIT)));
            }
            out.println();
        }
    }

    public void printProjects(PrintWriter out, String topicName, List<Project> projects) {
        out.println();
        out.println(markup("📁 @|bold,magenta Projects in topic:|@ ") + styled("bold,magenta", topicName));
        out.println();

        if (projects.isEmpty()) {
            out.println(markup("@|faint No projects found for this topic.|@"));
            return;
        }

        for (int i = 0; i < projects.size(); i++) {
            Project project = projects.get(i);
            out.println(markup(String.format("@|bold %d.|@ ", i + 1)) + styled("bold", project.getName()));
            out.println("   " + styled("faint", project.getPathWithNamespace()));

            if (hasText(project.getDescription())) {
                out.println("   " + styled("italic,faint", truncate(project.getDescription(), DESCRIPTION_LIMIT)));
            }

            if (project.getTopics() != null && !project.getTopics().isEmpty()) {
                StringBuilder tags = new StringBuilder("   ");
                for (String tag : project.getTopics()) {
                    if (!tag.equals(topicName)) {
                        tags.append(styled("bg_magenta,white", " " + tag + " ")).append(' ');
                    }
                }
                out.println(tags);
            }

            out.println("   " + styled("underline,green", project.getWebUrl()));
            out.println();
        }
    }

    public void printMergeCandidate(PrintWriter out, Project project, MergeRequest mr) {
        out.println(markup("@|cyan " + SEPARATOR + "|@"));
        out.println(markup("@|bold,cyan Project:|@ ") + project.getPathWithNamespace());
        out.println(markup("@|bold,cyan MR Title:|@ ") + mr.getTitle());
        out.println(markup("@|bold,cyan Branches:|@ ") + mr.getSourceBranch() + " → " + mr.getTargetBranch());
        out.println(markup("@|bold,cyan URL:|@ ") + mr.getWebUrl());
        out.println(markup("@|cyan " + SEPARATOR + "|@"));
        out.print(markup("@|bold,yellow Merge this MR? (y/n): |@"));
        out.flush();
    }

    public void printMergeSummary(PrintWriter out, MergeSummary summary) {
        out.println(markup("@|cyan " + SEPARATOR + "|@"));
        out.println(markup("@|bold,cyan 📊 Summary|@"));
        out.println(markup("@|cyan " + SEPARATOR + "|@"));
        out.println(markup(String.format("@|green ✓ Merged:  %d|@", summary.getMerged())));
        out.println(markup(String.format("@|yellow ⊘ Skipped: %d|@", summary.getSkipped())));
        if (summary.hasErrors()) {
            out.println(markup(String.format("@|red ✗ Errors:  %d|@", summary.getErrors())));
        }
        out.println(markup("@|cyan " + SEPARATOR + "|@"));
    }

    public static String statusIcon(ResultStatus status) {
        return switch (status) {
            case CREATED -> "✓";
            case SKIPPED_EXISTS -> "→";
            case SKIPPED_DRAFT -> "⊘";
            case SKIPPED_NO_BRANCH -> "⚠";
            case SKIPPED_NO_CHANGE -> "≡";
            case ERROR -> "✗";
        };
    }

    public static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit - 3) + "...";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
