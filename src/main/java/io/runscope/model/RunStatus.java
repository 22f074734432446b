package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    PENDING("pending"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    FAILED("failed"),
    STOPPED("stopped"),
    INTERRUPTED("interrupted");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED || this == INTERRUPTED;
    }

    /** Unknown or blank values map to {@code null} so a newer writer never breaks the read. */
    @JsonCreator
    public static RunStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (RunStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return null;
    }
}
