package com.deeplog.deeplog.recent;

import java.util.Collection;
import java.util.Set;

/**
 * Logical identity of a timer configuration: description, project and the set of tags.
 */
public record TimerIdentity(String description, Long projectId, Set<Long> tagIds) {

    public TimerIdentity {
        tagIds = tagIds == null ? Set.of() : Set.copyOf(tagIds);
    }

    public static TimerIdentity of(String description, Long projectId, Collection<Long> tagIds) {
        return new TimerIdentity(description, projectId, tagIds == null ? Set.of() : Set.copyOf(tagIds));
    }
}
