package com.deeplog.deeplog.recent;

import java.util.List;

/**
 * One cached timer configuration, derived from the time entry {@code id}.
 * Tag order is kept for display; identity comparisons go through {@link #identity()}.
 */
public record RecentTimerEntry(long id, String description, Long projectId, List<Long> tagIds, int usageCount) {

    public RecentTimerEntry {
        tagIds = tagIds == null ? List.of() : List.copyOf(tagIds);
        usageCount = Math.max(0, usageCount);
    }

    public RecentTimerEntry(long id, String description, Long projectId, List<Long> tagIds) {
        this(id, description, projectId, tagIds, 0);
    }

    public TimerIdentity identity() {
        return TimerIdentity.of(description, projectId, tagIds);
    }

    public RecentTimerEntry withUsageCount(int count) {
        return new RecentTimerEntry(id, description, projectId, tagIds, count);
    }
}
