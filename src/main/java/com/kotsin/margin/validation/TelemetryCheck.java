package com.kotsin.margin.validation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Verdict on one telemetry record. Any rejected field keeps the record out of the engine;
 * advisories are only logged.
 */
@Value
@Builder
public class TelemetryCheck {

    String accountId;

    /** Field name to rejection reason, in check order. */
    @Singular("reject")
    Map<String, String> rejectedFields;

    @Singular
    List<String> advisories;

    public boolean isAccepted() {
        return rejectedFields.isEmpty();
    }

    public boolean hasAdvisories() {
        return !advisories.isEmpty();
    }

    public String summary() {
        return rejectedFields.entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
