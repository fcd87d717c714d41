package com.example.bugservice.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Bug status labels. Any transition between them is legal.
 */
public enum BugStatus {
    OPEN("open"),
    REVIEWING("reviewing"),
    FIXED("fixed"),
    WONT_FIX("wont_fix");

    private final String value;

    BugStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Statuses that carry a resolution timestamp.
     */
    public boolean isResolved() {
        return this == FIXED || this == WONT_FIX;
    }

    public static Optional<BugStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst();
    }
}
