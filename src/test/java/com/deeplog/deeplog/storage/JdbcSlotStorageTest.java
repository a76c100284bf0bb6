package com.deeplog.deeplog.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class JdbcSlotStorageTest {

    @Autowired
    private JdbcSlotStorage slotStorage;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTable() {
        jdbcTemplate.update("DELETE FROM client_slot");
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        assertTrue(slotStorage.read("missing").isEmpty());
    }

    @Test
    void shouldInsertThenOverwriteSlot() {
        slotStorage.write("slot-a", "[]");
        slotStorage.write("slot-a", "[{\"id\":1}]");

        assertEquals(Optional.of("[{\"id\":1}]"), slotStorage.read("slot-a"));
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM client_slot", Integer.class);
        assertEquals(1, rows);
    }

    @Test
    void shouldKeepSlotsIndependent() {
        slotStorage.write("slot-a", "a");
        slotStorage.write("slot-b", "b");

        slotStorage.remove("slot-a");

        assertTrue(slotStorage.read("slot-a").isEmpty());
        assertEquals(Optional.of("b"), slotStorage.read("slot-b"));
    }
}
