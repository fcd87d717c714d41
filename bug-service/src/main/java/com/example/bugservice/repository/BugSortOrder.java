package com.example.bugservice.repository;

import java.util.Arrays;

public enum BugSortOrder {
    RECENT("recent", "b.createdAt DESC"),
    POPULAR("popular", "b.voteCount DESC, b.createdAt DESC"),
    TRENDING("trending", "b.voteCount DESC, b.createdAt DESC"),
    OLDEST("oldest", "b.createdAt ASC");

    private final String value;
    private final String orderBy;

    BugSortOrder(String value, String orderBy) {
        this.value = value;
        this.orderBy = orderBy;
    }

    public String getValue() {
        return value;
    }

    String getOrderBy() {
        return orderBy;
    }

    /**
     * Unknown or missing values fall back to RECENT.
     */
    public static BugSortOrder fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst()
                .orElse(RECENT);
    }
}
