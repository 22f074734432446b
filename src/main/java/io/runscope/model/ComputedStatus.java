package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComputedStatus {
    EXECUTING("executing"),
    STALLED("stalled"),
    COMPLETED("completed"),
    FAILED("failed"),
    INTERRUPTED("interrupted"),
    UNKNOWN("unknown");

    private final String wireName;

    ComputedStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ComputedStatus derive(RunStatus status, boolean alive) {
        if (status == null) {
            return UNKNOWN;
        }
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case FAILED, STOPPED -> FAILED;
            case INTERRUPTED -> INTERRUPTED;
            case EXECUTING -> alive ? EXECUTING : STALLED;
            case PENDING -> UNKNOWN;
        };
    }
}
