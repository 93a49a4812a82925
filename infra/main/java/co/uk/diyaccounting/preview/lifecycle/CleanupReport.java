/*
 * SPDX-License-Identifier: AGPL-3.0-only
 * Copyright (C) 2025-2026 DIY Accounting Ltd
 */

package co.uk.diyaccounting.preview.lifecycle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Outcome of each cleanup step, in the order they ran.
 */
public record CleanupReport(
        @JsonProperty("hostname") String hostname, @JsonProperty("results") List<StepResult> results) {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String DELETED = "deleted";
    public static final String ABSENT = "absent";
    public static final String WARNING = "warning";

    public CleanupReport {
        results = List.copyOf(results);
    }

    public boolean hasWarnings() {
        return results.stream().anyMatch(r -> WARNING.equals(r.status()));
    }

    public StepResult resultFor(String step) {
        return results.stream()
                .filter(r -> r.step().equals(step))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("no result for step " + step));
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public record StepResult(
            @JsonProperty("step") String step,
            @JsonProperty("status") String status,
            @JsonProperty("detail") String detail) {

        static StepResult deletedOrAbsent(String step, boolean deleted) {
            return new StepResult(step, deleted ? DELETED : ABSENT, null);
        }

        static StepResult warning(String step, String detail) {
            return new StepResult(step, WARNING, detail);
        }
    }
}
