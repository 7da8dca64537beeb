package com.esc.gitlabtools.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * GitLab 접속 설정
 *
 * url/token은 GITLAB_BASE_URL, GITLAB_TOKEN 환경 변수(.env 포함)에서 기본값을 가져오며
 * 명령행의 --gitlab-url, --token 옵션이 우선합니다.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "gitlabtools.gitlab")
public class GitLabProperties {

    private String url;

    private String token;

    @NotNull
    private Duration timeout = Duration.ofSeconds(15);

    @Min(1024)
    private int maxInMemorySize = 2 * 1024 * 1024;
}
