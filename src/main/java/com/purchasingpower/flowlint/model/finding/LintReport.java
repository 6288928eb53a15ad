package com.purchasingpower.flowlint.model.finding;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of linting one exported agent.
 *
 * <p>Findings keep the fixed pass order produced by the aggregator.
 * Immutable and thread-safe.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class LintReport {
    String agentDir;
    List<Finding> findings;
    long durationMs;

    public boolean isClean() {
        return findings.isEmpty();
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.getSeverity() == severity).count();
    }

    public Map<Severity, Long> countsBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, count(severity));
        }
        return counts;
    }

    /**
     * Findings grouped by flow display name, flows in first-seen order.
     */
    public Map<String, List<Finding>> byFlow() {
        Map<String, List<Finding>> grouped = new LinkedHashMap<>();
        for (Finding finding : findings) {
            grouped.computeIfAbsent(finding.getFlow(), k -> new ArrayList<>()).add(finding);
        }
        return grouped;
    }

    /**
     * Findings restricted to the given flows. An empty selection yields nothing.
     */
    public List<Finding> forFlows(Collection<String> flowNames) {
        return findings.stream()
                .filter(f -> flowNames.contains(f.getFlow()))
                .toList();
    }

    public String summary() {
        if (isClean()) {
            return "No graph issues found";
        }
        return String.format("Found %d issues (%d errors, %d warnings, %d info)",
                findings.size(), count(Severity.ERROR), count(Severity.WARNING), count(Severity.INFO));
    }
}
