package com.deeplog.deeplog.recent;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Time entry as returned by the time-tracking backend, passed verbatim into reconciliation.
 */
public record FetchedTimeEntry(
        long id,
        String description,
        @JsonProperty("project_id") Long projectId,
        @JsonProperty("tag_ids") List<Long> tagIds
) {

    public FetchedTimeEntry {
        tagIds = tagIds == null ? List.of() : List.copyOf(tagIds);
    }

    public TimerIdentity identity() {
        return TimerIdentity.of(description, projectId, tagIds);
    }

    RecentTimerEntry toEntry(int usageCount) {
        return new RecentTimerEntry(id, description, projectId, tagIds, usageCount);
    }
}
