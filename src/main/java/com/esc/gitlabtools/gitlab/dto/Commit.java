package com.esc.gitlabtools.gitlab.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Commit {
    private String id;

    @JsonProperty("short_id")
    private String shortId;

    private String title;
}
