package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StageStatus {
    RUNNING("running"),
    PASS("pass"),
    FAIL("fail");

    private final String wireName;

    StageStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Maps a terminal outcome label. Only an explicit {@code fail} is a failure; custom outcome
     * labels mean the stage completed and picked a branch.
     */
    public static StageStatus fromOutcome(String raw) {
        return "fail".equals(raw) ? FAIL : PASS;
    }

    @JsonCreator
    public static StageStatus fromWire(String raw) {
        for (StageStatus value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown stage status: " + raw);
    }
}
