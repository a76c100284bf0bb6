package com.deeplog.deeplog.recent;

import com.deeplog.deeplog.storage.SlotStorage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores the recent-timers list as a JSON array in a single {@link SlotStorage} slot.
 * Records written before {@code usageCount} existed read back with a count of 0.
 */
public class SlotRecentTimerStore implements RecentTimerStore {

    private static final Logger log = LoggerFactory.getLogger(SlotRecentTimerStore.class);

    private final SlotStorage slotStorage;
    private final ObjectMapper objectMapper;
    private final ObjectReader entryListReader;
    private final String slotKey;

    public SlotRecentTimerStore(SlotStorage slotStorage, ObjectMapper objectMapper, String slotKey) {
        this.slotStorage = slotStorage;
        this.objectMapper = objectMapper;
        this.entryListReader = objectMapper
                .readerFor(new TypeReference<List<RecentTimerEntry>>() {
                })
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.slotKey = slotKey;
    }

    @Override
    public StoreOutcome<List<RecentTimerEntry>> load() {
        try {
            Optional<String> raw = slotStorage.read(slotKey);
            if (raw.isEmpty() || raw.get().isBlank()) {
                return StoreOutcome.empty(List.of());
            }
            List<RecentTimerEntry> entries = entryListReader.readValue(raw.get());
            if (entries == null) {
                return StoreOutcome.empty(List.of());
            }
            return StoreOutcome.ok(entries.stream().filter(Objects::nonNull).toList());
        } catch (JsonProcessingException | DataAccessException ex) {
            log.warn("Failed to load recent timers from slot {}: {}", slotKey, ex.getMessage());
            return StoreOutcome.recovered(List.of(), String.format(RecentTimerConstants.MSG_LOAD_FAILED, ex.getMessage()));
        }
    }

    @Override
    public StoreOutcome<List<RecentTimerEntry>> save(List<RecentTimerEntry> entries) {
        List<RecentTimerEntry> snapshot = List.copyOf(entries);
        try {
            slotStorage.write(slotKey, objectMapper.writeValueAsString(snapshot));
            return StoreOutcome.ok(snapshot);
        } catch (JsonProcessingException | DataAccessException ex) {
            log.warn("Failed to save {} recent timers to slot {}: {}", snapshot.size(), slotKey, ex.getMessage());
            return StoreOutcome.recovered(snapshot, String.format(RecentTimerConstants.MSG_SAVE_FAILED, ex.getMessage()));
        }
    }

    @Override
    public StoreOutcome<List<RecentTimerEntry>> clear() {
        try {
            slotStorage.remove(slotKey);
            return StoreOutcome.empty(List.of());
        } catch (DataAccessException ex) {
            log.warn("Failed to clear recent timers slot {}: {}", slotKey, ex.getMessage());
            return StoreOutcome.recovered(List.of(), String.format(RecentTimerConstants.MSG_CLEAR_FAILED, ex.getMessage()));
        }
    }
}
