package com.esc.gitlabtools.bulkmr.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Summary {
    private int total;
    private int created;
    private int skippedExists;
    private int skippedDraft;
    private int skippedBranch;
    private int skippedNoChange;
    private int errors;

    /**
     * 결과 목록을 한 번 훑어 상태별로 집계. total은 입력 프로젝트 수(= 결과 수)와 같습니다.
     */
    public static Summary of(List<ProjectResult> results) {
        Summary summary = new Summary();
        summary.setTotal(results.size());

        for (ProjectResult result : results) {
            switch (result.getStatus()) {
                case CREATED -> summary.created++;
                case SKIPPED_EXISTS -> summary.skippedExists++;
                case SKIPPED_DRAFT -> summary.skippedDraft++;
                case SKIPPED_NO_BRANCH -> summary.skippedBranch++;
                case SKIPPED_NO_CHANGE -> summary.skippedNoChange++;
                case ERROR -> summary.errors++;
            }
        }

        return summary;
    }
}
