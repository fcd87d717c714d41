package com.example.bugservice.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persist status and priority as their lower-case wire values.
 */
public final class LowercaseEnumConverters {

    private LowercaseEnumConverters() {
    }

    @Converter
    public static class StatusConverter implements AttributeConverter<BugStatus, String> {

        @Override
        public String convertToDatabaseColumn(BugStatus attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public BugStatus convertToEntityAttribute(String dbData) {
            return BugStatus.fromValue(dbData)
                    .orElseThrow(() -> new IllegalStateException("Unknown bug status in database: " + dbData));
        }
    }

    @Converter
    public static class PriorityConverter implements AttributeConverter<BugPriority, String> {

        @Override
        public String convertToDatabaseColumn(BugPriority attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public BugPriority convertToEntityAttribute(String dbData) {
            return BugPriority.fromValue(dbData)
                    .orElseThrow(() -> new IllegalStateException("Unknown bug priority in database: " + dbData));
        }
    }

    @Converter
    public static class CompanyRoleConverter implements AttributeConverter<CompanyRole, String> {

        @Override
        public String convertToDatabaseColumn(CompanyRole attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public CompanyRole convertToEntityAttribute(String dbData) {
            return CompanyRole.fromValue(dbData)
                    .orElseThrow(() -> new IllegalStateException("Unknown company role in database: " + dbData));
        }
    }
}
