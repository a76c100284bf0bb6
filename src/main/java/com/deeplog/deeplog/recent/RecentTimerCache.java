package com.deeplog.deeplog.recent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recent-timers cache for one client context: deduplicating upsert, reconciliation against
 * fetched time entries, usage counting and fuzzy search.
 * <p>
 * The list never holds two entries with the same {@link TimerIdentity}. Position 0 is the most
 * recently touched entry. Every operation reads the whole list from the store and, when it
 * mutates, writes the whole list back; operations on one cache never interleave.
 */
public class RecentTimerCache {

    private static final Logger log = LoggerFactory.getLogger(RecentTimerCache.class);

    private static final Comparator<RecentTimerEntry> BY_USAGE_DESC =
            Comparator.comparingInt(RecentTimerEntry::usageCount).reversed();

    private final RecentTimerStore store;
    private final int maxDescriptionLength;

    public RecentTimerCache(RecentTimerStore store, int maxDescriptionLength) {
        this.store = store;
        this.maxDescriptionLength = maxDescriptionLength;
    }

    public RecentTimerCache(RecentTimerStore store) {
        this(store, RecentTimerConstants.DEFAULT_MAX_DESCRIPTION_LENGTH);
    }

    /**
     * Stored entries in store order.
     */
    public synchronized StoreOutcome<List<RecentTimerEntry>> entries() {
        return store.load();
    }

    /**
     * Inserts {@code entry} at the front, superseding an entry with the same identity or,
     * failing that, an older version of the same time entry id.
     */
    public synchronized StoreOutcome<List<RecentTimerEntry>> add(RecentTimerEntry entry) {
        requireDescription(entry);
        List<RecentTimerEntry> timers = new ArrayList<>(store.load().value());
        upsertInto(timers, entry);
        return store.save(timers);
    }

    /**
     * Drops cached entries contradicted by {@code fetched}, then upserts every admitted fetched
     * entry in input order, carrying usage counts over from surviving identical entries.
     */
    public synchronized StoreOutcome<List<RecentTimerEntry>> reconcile(List<FetchedTimeEntry> fetched) {
        List<FetchedTimeEntry> incoming = fetched == null
                ? List.of()
                : fetched.stream().filter(Objects::nonNull).toList();

        Map<Long, List<TimerIdentity>> fetchedIdentities = new HashMap<>();
        for (FetchedTimeEntry entry : incoming) {
            fetchedIdentities.computeIfAbsent(entry.id(), id -> new ArrayList<>()).add(entry.identity());
        }

        List<RecentTimerEntry> cached = store.load().value();
        List<RecentTimerEntry> baseline = new ArrayList<>(cached.size());
        for (RecentTimerEntry entry : cached) {
            List<TimerIdentity> versions = fetchedIdentities.get(entry.id());
            if (versions == null || versions.contains(entry.identity())) {
                baseline.add(entry);
            }
        }
        StoreOutcome<List<RecentTimerEntry>> cleaned = store.save(baseline);

        List<FetchedTimeEntry> admitted = incoming.stream().filter(this::isAdmitted).toList();
        log.debug("Reconciled recent timers: cached={}, stale={}, fetched={}, admitted={}",
                cached.size(), cached.size() - baseline.size(), incoming.size(), admitted.size());
        if (admitted.isEmpty()) {
            return cleaned;
        }

        List<RecentTimerEntry> timers = new ArrayList<>(baseline);
        for (FetchedTimeEntry entry : admitted) {
            upsertInto(timers, entry.toEntry(carriedUsage(baseline, entry.identity())));
        }
        return store.save(timers);
    }

    /**
     * Adds one use to the entry with the given identity. Never creates an entry.
     */
    public synchronized StoreOutcome<List<RecentTimerEntry>> incrementUsage(
            String description,
            Long projectId,
            Collection<Long> tagIds
    ) {
        requireTagIds(tagIds);
        TimerIdentity identity = TimerIdentity.of(description, projectId, tagIds);
        StoreOutcome<List<RecentTimerEntry>> loaded = store.load();
        List<RecentTimerEntry> timers = new ArrayList<>(loaded.value());
        int index = indexOfIdentity(timers, identity);
        if (index < 0) {
            return loaded;
        }
        RecentTimerEntry current = timers.get(index);
        timers.set(index, current.withUsageCount(current.usageCount() == Integer.MAX_VALUE
                ? Integer.MAX_VALUE
                : current.usageCount() + 1));
        return store.save(timers);
    }

    /**
     * Suggestions for {@code query}. A blank query lists entries by usage count. Otherwise the
     * best {@code limit} fuzzy matches are selected by score and then ordered by usage count.
     * Both sorts are stable.
     */
    public synchronized List<RecentTimerEntry> search(String query, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException(String.format(RecentTimerConstants.MSG_NEGATIVE_LIMIT, limit));
        }
        List<RecentTimerEntry> timers = store.load().value();

        if (query == null || query.isBlank()) {
            return timers.stream()
                    .sorted(BY_USAGE_DESC)
                    .limit(limit)
                    .toList();
        }

        return timers.stream()
                .map(timer -> new ScoredTimer(timer, FuzzyMatcher.match(query, timer.description())))
                .filter(scored -> scored.match().matches())
                .sorted(Comparator.comparingInt((ScoredTimer scored) -> scored.match().score()).reversed())
                .limit(limit)
                .map(ScoredTimer::timer)
                .sorted(BY_USAGE_DESC)
                .toList();
    }

    public List<RecentTimerEntry> search(String query) {
        return search(query, RecentTimerConstants.DEFAULT_LIMIT);
    }

    public synchronized StoreOutcome<List<RecentTimerEntry>> clear() {
        return store.clear();
    }

    boolean isAdmitted(FetchedTimeEntry entry) {
        String description = entry.description();
        return description != null && !description.isEmpty() && description.length() < maxDescriptionLength;
    }

    private static void upsertInto(List<RecentTimerEntry> timers, RecentTimerEntry entry) {
        int duplicate = indexOfIdentity(timers, entry.identity());
        if (duplicate >= 0) {
            timers.remove(duplicate);
        } else {
            int sameId = indexOfId(timers, entry.id());
            if (sameId >= 0) {
                timers.remove(sameId);
            }
        }
        timers.add(0, entry);
    }

    private static int carriedUsage(List<RecentTimerEntry> baseline, TimerIdentity identity) {
        int index = indexOfIdentity(baseline, identity);
        return index < 0 ? 0 : baseline.get(index).usageCount();
    }

    private static int indexOfIdentity(List<RecentTimerEntry> timers, TimerIdentity identity) {
        for (int i = 0; i < timers.size(); i++) {
            if (timers.get(i).identity().equals(identity)) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfId(List<RecentTimerEntry> timers, long id) {
        for (int i = 0; i < timers.size(); i++) {
            if (timers.get(i).id() == id) {
                return i;
            }
        }
        return -1;
    }

    private static void requireDescription(RecentTimerEntry entry) {
        if (entry == null || entry.description() == null || entry.description().isBlank()) {
            throw new IllegalArgumentException(RecentTimerConstants.MSG_DESCRIPTION_REQUIRED);
        }
    }

    private static void requireTagIds(Collection<Long> tagIds) {
        if (tagIds != null && tagIds.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException(RecentTimerConstants.MSG_NULL_TAG_ID);
        }
    }

    private record ScoredTimer(RecentTimerEntry timer, FuzzyMatch match) {
    }
}
