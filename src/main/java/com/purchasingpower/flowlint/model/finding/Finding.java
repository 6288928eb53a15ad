package com.purchasingpower.flowlint.model.finding;

import lombok.Builder;
import lombok.Value;

/**
 * Single structural defect reported by an analysis pass.
 *
 * <p>Immutable and thread-safe.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class Finding {

    /** Page column for findings that are not about a particular page. */
    public static final String NOT_APPLICABLE = "N/A";

    String flow;        // flow display name
    String page;        // page display name, "Start", or N/A
    FindingCategory category;
    String message;     // e.g. "Missing Event Handler: no-input"
    Severity severity;

    @Override
    public String toString() {
        return String.format("[%s] %s / %s: %s", severity.getLabel(), flow, page, message);
    }
}
