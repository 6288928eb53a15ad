package com.purchasingpower.flowlint.service.analysis.impl;

import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.graph.FlowGraph;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.model.finding.FindingCategory;
import com.purchasingpower.flowlint.model.finding.Severity;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.RouteGroup;
import com.purchasingpower.flowlint.service.analysis.FlowGraphAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports route groups defined in a flow that neither the flow nor any of its pages uses.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@Order(4)
public class RouteGroupUsageAnalyzer implements FlowGraphAnalyzer {

    @Override
    public String getName() {
        return "route-group-usage";
    }

    @Override
    public List<Finding> analyze(AgentGraph graph) {
        List<Finding> findings = new ArrayList<>();

        for (FlowGraph flow : graph.getFlows()) {
            Set<String> used = new HashSet<>();
            markUsed(graph, flow, flow.getFlow().getTransitionRouteGroups(), used);
            for (Page page : flow.pageList()) {
                markUsed(graph, flow, page.getTransitionRouteGroups(), used);
            }

            for (RouteGroup group : flow.getRouteGroups().values()) {
                if (!used.contains(group.getName())) {
                    findings.add(Finding.builder()
                            .flow(flow.getDisplayName())
                            .page(Finding.NOT_APPLICABLE)
                            .category(FindingCategory.UNUSED_ROUTE_GROUP)
                            .message("Unused Route Group: " + group.label())
                            .severity(Severity.INFO)
                            .build());
                }
            }
        }

        log.debug("Route group usage pass: {} unused groups", findings.size());
        return findings;
    }

    private void markUsed(AgentGraph graph, FlowGraph flow, List<String> references, Set<String> used) {
        for (String reference : references) {
            graph.getResolver().resolveRouteGroup(flow.getId(), reference)
                    .ifPresent(group -> used.add(group.getName()));
        }
    }
}
