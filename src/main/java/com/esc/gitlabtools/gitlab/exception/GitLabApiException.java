package com.esc.gitlabtools.gitlab.exception;

import lombok.Getter;

/**
 * GitLab API 호출 실패
 *
 * status는 응답을 받은 경우의 HTTP 상태 코드이며, 연결 실패나 타임아웃처럼
 * 응답이 없는 경우에는 0입니다.
 */
@Getter
public class GitLabApiException extends RuntimeException {

    private final int status;

    public GitLabApiException(String message) {
        this(0, message);
    }

    public GitLabApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public GitLabApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }
}
