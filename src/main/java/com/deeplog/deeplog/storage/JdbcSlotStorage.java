package com.deeplog.deeplog.storage;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * {@link SlotStorage} backed by the {@code client_slot} table.
 */
@Component
public class JdbcSlotStorage implements SlotStorage {

    private final JdbcTemplate jdbcTemplate;

    public JdbcSlotStorage(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        ensureTable();
    }

    @Override
    public Optional<String> read(String key) {
        List<String> values = jdbcTemplate.queryForList(
                "SELECT slot_value FROM client_slot WHERE slot_key = ?",
                String.class,
                key
        );
        return values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    @Override
    public void write(String key, String value) {
        long now = System.currentTimeMillis();
        int updated = jdbcTemplate.update(
                "UPDATE client_slot SET slot_value = ?, updated_at = ? WHERE slot_key = ?",
                value, now, key
        );
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO client_slot (slot_key, slot_value, updated_at) VALUES (?, ?, ?)",
                    key, value, now
            );
        }
    }

    @Override
    public void remove(String key) {
        jdbcTemplate.update("DELETE FROM client_slot WHERE slot_key = ?", key);
    }

    private void ensureTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS client_slot (
                    slot_key VARCHAR(255) PRIMARY KEY,
                    slot_value TEXT NOT NULL,
                    updated_at BIGINT NOT NULL
                )
                """);
    }
}
