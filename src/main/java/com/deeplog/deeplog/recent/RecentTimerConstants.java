package com.deeplog.deeplog.recent;

/**
 * Shared constants for the recent-timers cache.
 */
public final class RecentTimerConstants {

    private RecentTimerConstants() {
    }

    public static final String DEFAULT_SLOT_KEY = "deeplog_recent_timers";
    public static final String SLOT_KEY_SEPARATOR = ":";
    public static final int DEFAULT_MAX_DESCRIPTION_LENGTH = 60;
    public static final int DEFAULT_LIMIT = 10;
    public static final int DEFAULT_MAX_LIMIT = 50;

    public static final int MATCH_POINTS = 1;
    public static final int WORD_START_BONUS = 5;
    public static final int CONSECUTIVE_BONUS = 5;

    public static final String MSG_LOAD_FAILED = "Recent timers could not be loaded: %s";
    public static final String MSG_SAVE_FAILED = "Recent timers could not be saved: %s";
    public static final String MSG_CLEAR_FAILED = "Recent timers could not be cleared: %s";
    public static final String MSG_DESCRIPTION_REQUIRED = "description is required";
    public static final String MSG_ID_REQUIRED = "id is required";
    public static final String MSG_NULL_TAG_ID = "tagIds must not contain null";
    public static final String MSG_BODY_REQUIRED = "request body is required";
    public static final String MSG_NEGATIVE_LIMIT = "limit must not be negative: %d";
}
