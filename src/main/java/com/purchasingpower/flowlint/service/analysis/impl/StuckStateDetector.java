package com.purchasingpower.flowlint.service.analysis.impl;

import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.graph.FlowGraph;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.model.finding.FindingCategory;
import com.purchasingpower.flowlint.model.finding.Severity;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.TransitionRoute;
import com.purchasingpower.flowlint.service.analysis.FlowGraphAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags pages that neither wait for the user nor have a {@code condition: "true"} route.
 *
 * <p>Reported as errors: once the conversation lands on such a page nothing moves it on.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@Order(3)
public class StuckStateDetector implements FlowGraphAnalyzer {

    static final String MESSAGE = "Potential Stuck Page (No Input, No True Route)";

    @Override
    public String getName() {
        return "stuck-state";
    }

    @Override
    public List<Finding> analyze(AgentGraph graph) {
        List<Finding> findings = new ArrayList<>();

        for (FlowGraph flow : graph.getFlows()) {
            for (Page page : flow.pageList()) {
                if (page.acceptsInput()) {
                    continue;
                }

                boolean hasTrueRoute = page.getTransitionRoutes().stream()
                        .anyMatch(TransitionRoute::isUnconditional);
                if (!hasTrueRoute) {
                    findings.add(Finding.builder()
                            .flow(flow.getDisplayName())
                            .page(page.label())
                            .category(FindingCategory.STUCK_PAGE)
                            .message(MESSAGE)
                            .severity(Severity.ERROR)
                            .build());
                }
            }
        }

        log.debug("Stuck state pass: {} stuck pages", findings.size());
        return findings;
    }
}
