package com.purchasingpower.flowlint.service.analysis.impl;

import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.graph.FlowGraph;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.model.finding.FindingCategory;
import com.purchasingpower.flowlint.model.finding.Severity;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.Transition;
import com.purchasingpower.flowlint.service.analysis.FlowGraphAnalyzer;
import com.purchasingpower.flowlint.service.analysis.FlowNavigator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Reports pages that no path from the flow's Start page ever reaches.
 *
 * <p>Breadth-first search per flow. Form reprompt handlers are not followed here.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@Order(1)
@RequiredArgsConstructor
public class ReachabilityAnalyzer implements FlowGraphAnalyzer {

    static final String MESSAGE = "Unreachable Page";

    private final FlowNavigator navigator;

    @Override
    public String getName() {
        return "reachability";
    }

    @Override
    public List<Finding> analyze(AgentGraph graph) {
        List<Finding> findings = new ArrayList<>();

        for (FlowGraph flow : graph.getFlows()) {
            Set<String> reachable = findReachable(graph, flow);

            for (Page page : flow.pageList()) {
                if (!reachable.contains(page.getName())) {
                    findings.add(Finding.builder()
                            .flow(flow.getDisplayName())
                            .page(page.label())
                            .category(FindingCategory.UNREACHABLE_PAGE)
                            .message(MESSAGE)
                            .severity(Severity.WARNING)
                            .build());
                }
            }
        }

        log.debug("Reachability pass: {} unreachable pages", findings.size());
        return findings;
    }

    /**
     * All addresses reachable from Start in one flow, Start included.
     */
    public Set<String> findReachable(AgentGraph graph, FlowGraph flow) {
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();

        visited.add(FlowGraph.START_PAGE);
        queue.add(FlowGraph.START_PAGE);

        while (!queue.isEmpty()) {
            String current = queue.poll();

            for (Transition edge : navigator.outgoing(graph, flow, current, false)) {
                Optional<String> target = navigator.intraFlowTarget(graph, flow, edge);
                if (target.isPresent() && visited.add(target.get())) {
                    queue.add(target.get());
                }
            }
        }

        return visited;
    }
}
