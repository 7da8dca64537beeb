package com.esc.gitlabtools.bulkmr.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingProgressListener implements ProgressListener {

    @Override
    public void onBranchCheck(String project) {
        log.info("[{}] Checking branches...", project);
    }

    @Override
    public void onMergeRequestLookup(String project) {
        log.info("[{}] Checking existing merge requests...", project);
    }

    @Override
    public void onCompare(String project) {
        log.info("[{}] Comparing branches...", project);
    }

    @Override
    public void onCreate(String project, int commitCount) {
        log.info("[{}] Found {} commit(s) with changes, creating merge request...", project, commitCount);
    }
}
