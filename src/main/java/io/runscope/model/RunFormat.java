package io.runscope.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunFormat {
    /** Single {@code run.json} status file written by the dashboard sync. */
    KILROY_DASH("kilroy-dash", "run.json"),
    /** Raw engine layout: manifest, checkpoint, final outcome and progress log. */
    ATTRACTOR("attractor", "manifest.json");

    private final String wireName;
    private final String markerFile;

    RunFormat(String wireName, String markerFile) {
        this.wireName = wireName;
        this.markerFile = markerFile;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String markerFile() {
        return markerFile;
    }
}
