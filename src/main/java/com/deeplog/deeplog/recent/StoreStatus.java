package com.deeplog.deeplog.recent;

public enum StoreStatus {
    /** Slot read or written normally. */
    OK,
    /** Slot had no data yet. */
    EMPTY,
    /** Storage or parse failure was absorbed; the value is a fallback. */
    RECOVERED
}
