package com.esc.gitlabtools.bulkmr.service;

/**
 * verbose 모드에서 프로젝트 처리 단계마다 호출되는 관찰자
 */
public interface ProgressListener {

    void onBranchCheck(String project);

    void onMergeRequestLookup(String project);

    void onCompare(String project);

    void onCreate(String project, int commitCount);
}
