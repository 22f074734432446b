package io.runscope.replay;

public enum ProgressEventKind {
    STAGE_ATTEMPT_START("stage_attempt_start"),
    STAGE_ATTEMPT_END("stage_attempt_end"),
    BRANCH_PROGRESS("branch_progress"),
    CYCLE_CHECK("deterministic_failure_cycle_check"),
    CYCLE_BREAKER("deterministic_failure_cycle_breaker"),
    LOOP_RESTART("loop_restart"),
    /** Any event this reader does not interpret; kept so newer logs still replay. */
    UNKNOWN("");

    private final String wireName;

    ProgressEventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ProgressEventKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (ProgressEventKind value : values()) {
            if (value != UNKNOWN && value.wireName.equals(raw)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
