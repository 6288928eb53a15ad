package com.purchasingpower.flowlint.service;

import com.google.common.base.Preconditions;
import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.loader.AgentDirectoryLoader;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.model.finding.LintReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for linting an unpacked agent export: load once, then analyze.
 *
 * <p>Load failures surface as {@link com.purchasingpower.flowlint.exception.AgentLoadException}
 * before any pass runs.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentLintService {

    private final AgentDirectoryLoader loader;
    private final FindingAggregator aggregator;

    public LintReport lint(Path agentDir) {
        Preconditions.checkNotNull(agentDir, "Agent directory cannot be null");
        long start = System.currentTimeMillis();

        AgentGraph graph = loader.load(agentDir);
        List<Finding> findings = aggregator.aggregate(graph);

        LintReport report = LintReport.builder()
                .agentDir(agentDir.toString())
                .findings(findings)
                .durationMs(System.currentTimeMillis() - start)
                .build();

        log.info("Linted {} in {}ms: {}", agentDir, report.getDurationMs(), report.summary());
        return report;
    }
}
