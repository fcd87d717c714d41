package com.example.bugservice.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum BugPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    BugPriority(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<BugPriority> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.value.equals(normalized))
                .findFirst();
    }
}
