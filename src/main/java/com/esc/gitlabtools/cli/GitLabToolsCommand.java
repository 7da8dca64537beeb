package com.esc.gitlabtools.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Component
@Command(
    name = "gitlab-tools",
    description = "GitLab Tools - CLI toolkit for managing GitLab branches and merge requests",
    mixinStandardHelpOptions = true,
    version = GitLabToolsCommand.VERSION,
    subcommands = {
        BulkMrCommand.class,
        BulkMrTopicCommand.class,
        MergeCommand.class,
        TopicsCommand.class,
        ProjectsCommand.class,
        VersionCommand.class,
        HelpCommand.class
    })
public class GitLabToolsCommand implements Runnable {

    public static final String VERSION = "gitlab-tools v1.0.0";

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 하위 명령 없이 실행하면 사용법 출력
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
