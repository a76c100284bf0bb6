package com.deeplog.deeplog.storage;

import java.util.Optional;

/**
 * Durable string slots addressed by key. Each slot is read and written whole.
 */
public interface SlotStorage {

    Optional<String> read(String key);

    void write(String key, String value);

    void remove(String key);
}
