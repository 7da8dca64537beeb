package com.esc.gitlabtools.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Spring 컨텍스트가 뜬 뒤 picocli 명령을 실행하고, 종료 코드를 SpringApplication.exit()으로 전달
 */
@Component
@RequiredArgsConstructor
public class GitLabToolsRunner implements CommandLineRunner, ExitCodeGenerator {

    private final GitLabToolsCommand gitLabToolsCommand;
    private final IFactory factory;

    private int exitCode;

    @Override
    public void run(String... args) {
        exitCode = commandLine(gitLabToolsCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(Object command, IFactory factory) {
        return new CommandLine(command, factory)
            .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
