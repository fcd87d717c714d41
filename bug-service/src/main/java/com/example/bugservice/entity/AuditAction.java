package com.example.bugservice.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Moderation actions recorded in the audit log.
 */
public enum AuditAction {
    BUG_FLAG("bug_flag"),
    BUG_REMOVE("bug_remove"),
    BUG_MERGE("bug_merge"),
    BUG_RESTORE("bug_restore"),
    COMPANY_VERIFY("company_verify");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<AuditAction> fromValue(String value) {
        return Arrays.stream(values())
                .filter(a -> a.value.equals(value))
                .findFirst();
    }
}
