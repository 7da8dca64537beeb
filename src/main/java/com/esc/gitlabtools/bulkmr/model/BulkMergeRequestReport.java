package com.esc.gitlabtools.bulkmr.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;

@Value
public class BulkMergeRequestReport {
    List<ProjectResult> results;
    Summary summary;

    public static BulkMergeRequestReport of(List<ProjectResult> results) {
        return new BulkMergeRequestReport(List.copyOf(results), Summary.of(results));
    }

    /**
     * ERROR 결과가 하나라도 있으면 실패로 간주 (SKIPPED_* 는 정상 종료)
     */
    @JsonIgnore
    public boolean hasErrors() {
        return summary.getErrors() > 0;
    }
}
