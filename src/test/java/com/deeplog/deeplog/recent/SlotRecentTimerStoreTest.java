package com.deeplog.deeplog.recent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlotRecentTimerStoreTest {

    private static final String SLOT = "deeplog_recent_timers:ctx";

    private InMemorySlotStorage storage;
    private SlotRecentTimerStore store;

    @BeforeEach
    void setUp() {
        storage = new InMemorySlotStorage();
        store = new SlotRecentTimerStore(storage, new ObjectMapper(), SLOT);
    }

    @Test
    void shouldReturnEmptyListForMissingSlot() {
        StoreOutcome<List<RecentTimerEntry>> outcome = store.load();

        assertEquals(StoreStatus.EMPTY, outcome.status());
        assertTrue(outcome.value().isEmpty());
        assertFalse(outcome.degraded());
    }

    @Test
    void shouldRecoverFromCorruptSlot() {
        storage.put(SLOT, "{not json");

        StoreOutcome<List<RecentTimerEntry>> outcome = store.load();

        assertEquals(StoreStatus.RECOVERED, outcome.status());
        assertTrue(outcome.value().isEmpty());
        assertNotNull(outcome.detail());
    }

    @Test
    void shouldRecoverFromWrongJsonShape() {
        storage.put(SLOT, "{\"id\": 1}");

        StoreOutcome<List<RecentTimerEntry>> outcome = store.load();

        assertEquals(StoreStatus.RECOVERED, outcome.status());
        assertTrue(outcome.value().isEmpty());
    }

    @Test
    void shouldRecoverFromStorageReadFailure() {
        storage.failReads(true);

        StoreOutcome<List<RecentTimerEntry>> outcome = store.load();

        assertTrue(outcome.degraded());
        assertTrue(outcome.value().isEmpty());
    }

    @Test
    void shouldDefaultMissingUsageCountWithoutWritingBack() {
        String legacy = "[{\"id\":7,\"description\":\"Standup\",\"projectId\":3,\"tagIds\":[2,1]},"
                + "{\"id\":8,\"description\":\"Email\",\"projectId\":null,\"tagIds\":[],\"usageCount\":4}]";
        storage.put(SLOT, legacy);

        StoreOutcome<List<RecentTimerEntry>> outcome = store.load();

        assertEquals(StoreStatus.OK, outcome.status());
        assertEquals(List.of(
                new RecentTimerEntry(7, "Standup", 3L, List.of(2L, 1L), 0),
                new RecentTimerEntry(8, "Email", null, List.of(), 4)
        ), outcome.value());
        assertEquals(legacy, storage.get(SLOT));
        assertEquals(0, storage.writes());
    }

    @Test
    void shouldIgnoreUnknownFieldsAndMissingTags() {
        storage.put(SLOT, "[{\"id\":1,\"description\":\"Review\",\"color\":\"red\"}]");

        StoreOutcome<List<RecentTimerEntry>> outcome = store.load();

        assertEquals(StoreStatus.OK, outcome.status());
        assertEquals(List.of(new RecentTimerEntry(1, "Review", null, List.of(), 0)), outcome.value());
    }

    @Test
    void shouldRoundTripSavedEntriesInOrder() {
        List<RecentTimerEntry> entries = List.of(
                new RecentTimerEntry(2, "Write tests", 9L, List.of(5L, 4L), 3),
                new RecentTimerEntry(1, "Deploy", null, List.of(), 0)
        );

        StoreOutcome<List<RecentTimerEntry>> saved = store.save(entries);
        StoreOutcome<List<RecentTimerEntry>> loaded = store.load();

        assertEquals(StoreStatus.OK, saved.status());
        assertEquals(entries, loaded.value());

        store.save(loaded.value());
        assertEquals(entries, store.load().value());
    }

    @Test
    void shouldSwallowWriteFailure() {
        storage.failWrites(true);
        List<RecentTimerEntry> entries = List.of(new RecentTimerEntry(1, "Deploy", null, List.of()));

        StoreOutcome<List<RecentTimerEntry>> outcome = store.save(entries);

        assertEquals(StoreStatus.RECOVERED, outcome.status());
        assertEquals(entries, outcome.value());
        assertNull(storage.get(SLOT));
    }

    @Test
    void shouldClearSlot() {
        store.save(List.of(new RecentTimerEntry(1, "Deploy", null, List.of())));

        StoreOutcome<List<RecentTimerEntry>> cleared = store.clear();

        assertEquals(StoreStatus.EMPTY, cleared.status());
        assertNull(storage.get(SLOT));
        assertEquals(StoreStatus.EMPTY, store.load().status());
    }
}
