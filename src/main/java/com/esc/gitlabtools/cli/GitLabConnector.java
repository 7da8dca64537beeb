package com.esc.gitlabtools.cli;

import com.esc.gitlabtools.GitLabToolsApplication;
import com.esc.gitlabtools.config.GitLabProperties;
import com.esc.gitlabtools.gitlab.client.GitLabClient;
import com.esc.gitlabtools.gitlab.client.GitLabClientFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;

/**
 * 명령행 옵션과 설정값을 합쳐 GitLab 클라이언트를 준비
 *
 * --gitlab-url, --token 옵션이 gitlabtools.gitlab.* 설정(GITLAB_BASE_URL, GITLAB_TOKEN)보다 우선합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GitLabConnector {

    private final GitLabProperties gitLabProperties;
    private final GitLabClientFactory gitLabClientFactory;
    private final LoggingSystem loggingSystem;

    public GitLabClient connect(GitLabConnectionOptions options, CommandSpec spec) {
        String url = firstNonBlank(options.getGitlabUrl(), gitLabProperties.getUrl());
        String token = firstNonBlank(options.getToken(), gitLabProperties.getToken());

        if (url == null) {
            throw new ParameterException(spec.commandLine(),
                "Error: GitLab URL must be provided via --gitlab-url or GITLAB_BASE_URL env");
        }
        if (token == null) {
            throw new ParameterException(spec.commandLine(),
                "Error: GitLab token must be provided via --token or GITLAB_TOKEN env");
        }

        if (options.isVerbose()) {
            loggingSystem.setLogLevel(GitLabToolsApplication.class.getPackageName(), LogLevel.DEBUG);
            log.debug("Verbose logging enabled");
        }

        return gitLabClientFactory.create(url, token);
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        return null;
    }
}
