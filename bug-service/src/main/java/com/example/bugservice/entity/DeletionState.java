package com.example.bugservice.entity;

import java.time.Instant;
import java.util.Objects;

/**
 * Soft-delete state of a bug report.
 * The nullable {@code deleted_at} column only exists at the persistence boundary;
 * domain code branches on this type instead.
 */
public interface DeletionState {

    boolean isDeleted();

    static DeletionState fromTombstone(Instant deletedAt) {
        return deletedAt == null ? new Active() : new Deleted(deletedAt);
    }

    record Active() implements DeletionState {

        @Override
        public boolean isDeleted() {
            return false;
        }
    }

    record Deleted(Instant at) implements DeletionState {

        public Deleted {
            Objects.requireNonNull(at, "at");
        }

        @Override
        public boolean isDeleted() {
            return true;
        }
    }
}
