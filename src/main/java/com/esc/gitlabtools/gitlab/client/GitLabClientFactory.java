package com.esc.gitlabtools.gitlab.client;

import com.esc.gitlabtools.config.GitLabProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * GitLab 인스턴스별 {@link GitLabClient} 생성
 *
 * URL과 토큰은 명령행 옵션으로 덮어쓸 수 있으므로 WebClient를 빈으로 고정하지 않고
 * 명령 실행 시점에 만듭니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GitLabClientFactory {

    static final String PRIVATE_TOKEN_HEADER = "PRIVATE-TOKEN";

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final GitLabProperties gitLabProperties;

    public GitLabClient create(String baseUrl, String token) {
        String normalizedUrl = stripTrailingSlashes(baseUrl);

        WebClient webClient = webClientBuilder.clone()
            .baseUrl(normalizedUrl)
            .defaultHeader(PRIVATE_TOKEN_HEADER, token)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .codecs(configurer -> {
                configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                configurer.defaultCodecs().maxInMemorySize(gitLabProperties.getMaxInMemorySize());
            })
            .filter(logRequest())
            .build();

        log.debug("Created GitLab client for {}", normalizedUrl);
        return new GitLabApiClient(webClient, gitLabProperties.getTimeout());
    }

    private ExchangeFilterFunction logRequest() {
        return (request, next) -> next.exchange(request)
            .doOnNext(response -> log.debug("{} {} -> {}",
                request.method(), request.url(), response.statusCode().value()));
    }

    static String stripTrailingSlashes(String url) {
        String result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
