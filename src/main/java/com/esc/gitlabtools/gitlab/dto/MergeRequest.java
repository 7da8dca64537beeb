package com.esc.gitlabtools.gitlab.dto;

import com.esc.gitlabtools.gitlab.util.DraftDetector;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequest {
    private Long id;
    private Long iid;
    private String title;

    @JsonProperty("web_url")
    private String webUrl;

    private String state;

    // GitLab의 draft 플래그 (제목 접두어는 isEffectiveDraft()에서 함께 판단)
    private boolean draft;

    @JsonProperty("source_branch")
    private String sourceBranch;

    @JsonProperty("target_branch")
    private String targetBranch;

    @JsonProperty("project_id")
    private Long projectId;

    /**
     * draft 플래그 또는 "Draft:" / "WIP:" 제목 접두어 중 하나라도 해당하면 draft로 취급
     */
    @JsonIgnore
    public boolean isEffectiveDraft() {
        return DraftDetector.isDraft(draft, title);
    }
}
