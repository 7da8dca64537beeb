package com.esc.gitlabtools.bulkmr.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProjectResult {
    String project;
    ResultStatus status;
    Long mergeRequestId;
    Long mergeRequestIid;
    String mergeRequestUrl;
    String details;
    String errorMessage;

    public static ProjectResult error(String project, String errorMessage) {
        return ProjectResult.builder()
            .project(project)
            .status(ResultStatus.ERROR)
            .errorMessage(errorMessage)
            .build();
    }

    public static ProjectResult skipped(String project, ResultStatus status, String details) {
        return ProjectResult.builder()
            .project(project)
            .status(status)
            .details(details)
            .build();
    }
}
