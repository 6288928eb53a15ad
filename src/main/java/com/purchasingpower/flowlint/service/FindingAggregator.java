package com.purchasingpower.flowlint.service;

import com.purchasingpower.flowlint.configuration.FlowLintProperties;
import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.service.analysis.FlowGraphAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs every analysis pass over one graph and concatenates their findings.
 *
 * <p>Passes are ordered by their {@code @Order} (reachability, handler completeness,
 * stuck state, route group usage, loop detection) and their outputs are joined in
 * that order whether they ran in parallel or not. No deduplication across passes:
 * a page may show up in several of them.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class FindingAggregator {

    private final List<FlowGraphAnalyzer> analyzers;
    private final Executor executor;
    private final boolean parallel;

    public FindingAggregator(List<FlowGraphAnalyzer> analyzers,
                             @Qualifier("analysisExecutor") Executor executor,
                             FlowLintProperties properties) {
        this.analyzers = List.copyOf(analyzers);
        this.executor = executor;
        this.parallel = properties.isParallel();
        log.info("Finding aggregator initialized with {} passes (parallel={})", this.analyzers.size(), parallel);
    }

    public List<Finding> aggregate(AgentGraph graph) {
        List<List<Finding>> perPass = parallel ? runParallel(graph) : runSequential(graph);

        List<Finding> combined = new ArrayList<>();
        for (int i = 0; i < analyzers.size(); i++) {
            List<Finding> findings = perPass.get(i);
            log.debug("Pass '{}' produced {} findings", analyzers.get(i).getName(), findings.size());
            combined.addAll(findings);
        }
        return List.copyOf(combined);
    }

    public List<String> passNames() {
        return analyzers.stream().map(FlowGraphAnalyzer::getName).toList();
    }

    private List<List<Finding>> runSequential(AgentGraph graph) {
        List<List<Finding>> results = new ArrayList<>();
        for (FlowGraphAnalyzer analyzer : analyzers) {
            results.add(analyzer.analyze(graph));
        }
        return results;
    }

    private List<List<Finding>> runParallel(AgentGraph graph) {
        List<CompletableFuture<List<Finding>>> futures = analyzers.stream()
                .map(analyzer -> CompletableFuture.supplyAsync(() -> analyzer.analyze(graph), executor))
                .toList();

        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            log.error("Analysis pass failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
