package io.loopforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FileStatus {
    PENDING("pending"),
    PROMPT_IN_PROGRESS("prompt_in_progress"),
    AWAITING_VERIFICATION("awaiting_verification"),
    VERIFY_IN_PROGRESS("verify_in_progress"),
    FIXUP_IN_PROGRESS("fixup_in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    FileStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Statuses that only exist while a worker holds the file's claim and runs an external step.
     */
    public boolean isInFlight() {
        return this == PROMPT_IN_PROGRESS || this == VERIFY_IN_PROGRESS || this == FIXUP_IN_PROGRESS;
    }

    @JsonCreator
    public static FileStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        for (FileStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown file status: " + raw);
    }
}
