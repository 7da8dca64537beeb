package com.esc.gitlabtools.bulkmr.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BulkMergeRequestConfig {
    String originBranch;
    String targetBranch;

    // 입력 순서 유지, 중복 허용
    @Singular
    List<String> projects;

    boolean verbose;

    /**
     * 처리 시작 전에 확인하는 설정 오류. 이 오류만 실행 전체를 중단시킵니다.
     */
    public void validate() {
        if (originBranch == null || originBranch.isBlank()) {
            throw new IllegalArgumentException("origin branch is required");
        }
        if (targetBranch == null || targetBranch.isBlank()) {
            throw new IllegalArgumentException("target branch is required");
        }
        if (projects.isEmpty()) {
            throw new IllegalArgumentException("at least one project is required");
        }
    }
}
