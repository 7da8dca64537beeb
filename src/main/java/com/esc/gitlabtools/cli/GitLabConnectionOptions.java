package com.esc.gitlabtools.cli;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * 모든 GitLab 명령이 공유하는 접속 옵션
 */
@Getter
public class GitLabConnectionOptions {

    @Option(names = "--gitlab-url", paramLabel = "<url>",
        description = "GitLab base URL (default: GITLAB_BASE_URL env)")
    private String gitlabUrl;

    @Option(names = "--token", paramLabel = "<token>",
        description = "GitLab API token (default: GITLAB_TOKEN env)")
    private String token;

    @Option(names = "--verbose", description = "Enable verbose logging")
    private boolean verbose;
}
