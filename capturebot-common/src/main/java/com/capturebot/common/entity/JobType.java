package com.capturebot.common.entity;

import java.util.Optional;

/**
 * Known job types. Jobs store the raw string so a worker can tell an
 * unsupported type apart from a missing one.
 */
public enum JobType {

    MEDIA("media"), // payload: {media_urls: [...], caption?}
    TEXT("text"); // payload: {text}

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<JobType> fromValue(String raw) {
        if (raw == null || raw.isBlank())
            return Optional.empty();

        String normalized = raw.trim().toLowerCase();
        for (JobType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
