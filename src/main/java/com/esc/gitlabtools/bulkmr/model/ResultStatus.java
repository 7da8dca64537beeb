package com.esc.gitlabtools.bulkmr.model;

/**
 * 프로젝트별 처리 결과. 결과 하나에는 정확히 하나의 상태만 지정됩니다.
 */
public enum ResultStatus {
    CREATED,
    SKIPPED_EXISTS,
    SKIPPED_DRAFT,
    SKIPPED_NO_BRANCH,
    SKIPPED_NO_CHANGE,
    ERROR
}
