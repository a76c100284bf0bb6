package com.deeplog.deeplog.recent;

/**
 * Result of a store operation that never throws. {@code detail} describes a recovered failure.
 */
public record StoreOutcome<T>(T value, StoreStatus status, String detail) {

    public static <T> StoreOutcome<T> ok(T value) {
        return new StoreOutcome<>(value, StoreStatus.OK, null);
    }

    public static <T> StoreOutcome<T> empty(T value) {
        return new StoreOutcome<>(value, StoreStatus.EMPTY, null);
    }

    public static <T> StoreOutcome<T> recovered(T value, String detail) {
        return new StoreOutcome<>(value, StoreStatus.RECOVERED, detail);
    }

    public boolean degraded() {
        return status == StoreStatus.RECOVERED;
    }
}
