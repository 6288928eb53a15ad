package com.purchasingpower.flowlint.service.analysis.impl;

import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.graph.FlowGraph;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.model.finding.FindingCategory;
import com.purchasingpower.flowlint.model.finding.Severity;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.service.analysis.FlowGraphAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags input-accepting pages that cannot handle silence or an unrecognized answer.
 *
 * <p>Each missing category is its own finding, so one page yields zero, one or two.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@Order(2)
public class HandlerCompletenessChecker implements FlowGraphAnalyzer {

    static final String NO_INPUT = "no-input";
    static final String NO_MATCH = "no-match";
    private static final List<String> REQUIRED_EVENTS = List.of(NO_INPUT, NO_MATCH);

    @Override
    public String getName() {
        return "handler-completeness";
    }

    @Override
    public List<Finding> analyze(AgentGraph graph) {
        List<Finding> findings = new ArrayList<>();

        for (FlowGraph flow : graph.getFlows()) {
            for (Page page : flow.pageList()) {
                if (!page.acceptsInput()) {
                    continue;
                }

                List<String> events = page.handledEvents();
                for (String required : REQUIRED_EVENTS) {
                    if (events.stream().noneMatch(event -> event.contains(required))) {
                        findings.add(Finding.builder()
                                .flow(flow.getDisplayName())
                                .page(page.label())
                                .category(FindingCategory.MISSING_EVENT_HANDLER)
                                .message("Missing Event Handler: " + required)
                                .severity(Severity.WARNING)
                                .build());
                    }
                }
            }
        }

        log.debug("Handler completeness pass: {} missing handlers", findings.size());
        return findings;
    }
}
