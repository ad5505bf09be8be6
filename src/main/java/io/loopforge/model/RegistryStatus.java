package io.loopforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RegistryStatus {
    INCOMPLETE("incomplete"),
    COMPLETED("completed");

    private final String wireName;

    RegistryStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RegistryStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INCOMPLETE;
        }
        for (RegistryStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown registry status: " + raw);
    }
}
