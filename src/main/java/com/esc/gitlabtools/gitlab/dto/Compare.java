package com.esc.gitlabtools.gitlab.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * repository/compare 응답 (from = target, to = source)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Compare {
    private Commit commit;

    @Builder.Default
    private List<Commit> commits = new ArrayList<>();

    @Builder.Default
    private List<Diff> diffs = new ArrayList<>();

    /**
     * source에만 있는 커밋이 하나라도 있으면 변경 사항이 있는 것으로 판단 (diff 내용은 보지 않음)
     */
    public boolean hasChanges() {
        return commits != null && !commits.isEmpty();
    }
}
