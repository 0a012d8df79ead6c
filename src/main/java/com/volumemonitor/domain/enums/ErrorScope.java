package com.volumemonitor.domain.enums;

/**
 * Where a monitoring error originated. Only FATAL implies the engine has stopped.
 */
public enum ErrorScope {
    BATCH("batch"),
    RESOLVE("resolve"),
    FATAL("fatal");

    private final String wireName;

    ErrorScope(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isFatal() {
        return this == FATAL;
    }
}
