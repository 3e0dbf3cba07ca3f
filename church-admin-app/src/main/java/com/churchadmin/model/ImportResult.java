package com.churchadmin.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one import run, serialized as {@code {success, failed, errors}}.
 */
public record ImportResult(
    int success,
    int failed,
    List<String> errors
) {
    public ImportResult {
        errors = List.copyOf(errors);
    }

    public int processed() {
        return success + failed;
    }

    /**
     * Mutable tally filled while rows are processed and frozen once at the end.
     */
    public static class Tally {
        private int success;
        private int failed;
        private final List<String> errors = new ArrayList<>();

        public void rowFailed(String message) {
            failed++;
            errors.add(message);
        }

        public void committed(int count) {
            success += count;
        }

        public void batchFailed(int count, String message) {
            failed += count;
            errors.add(message);
        }

        public ImportResult build() {
            return new ImportResult(success, failed, errors);
        }
    }
}
