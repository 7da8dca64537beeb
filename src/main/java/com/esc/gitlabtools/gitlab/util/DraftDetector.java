package com.esc.gitlabtools.gitlab.util;

import java.util.List;
import java.util.Locale;

/**
 * Merge Request draft 판별
 *
 * GitLab의 draft 플래그와 예전 방식의 제목 접두어("Draft:", "WIP:")를 모두 인정하며,
 * 둘 중 하나만 만족해도 draft로 판단합니다.
 */
public final class DraftDetector {

    private static final List<String> DRAFT_PREFIXES = List.of("draft:", "wip:");

    private DraftDetector() {
    }

    public static boolean isDraft(boolean draftFlag, String title) {
        if (draftFlag) {
            return true;
        }
        if (title == null) {
            return false;
        }

        String normalized = title.trim().toLowerCase(Locale.ROOT);
        return DRAFT_PREFIXES.stream().anyMatch(normalized::startsWith);
    }
}
