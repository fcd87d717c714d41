package com.example.bugservice.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Role of a user inside a company team.
 */
public enum CompanyRole {
    MEMBER("member"),
    ADMIN("admin");

    private final String value;

    CompanyRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<CompanyRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(r -> r.value.equals(value))
                .findFirst();
    }
}
