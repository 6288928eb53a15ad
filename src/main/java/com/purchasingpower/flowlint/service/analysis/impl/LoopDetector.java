package com.purchasingpower.flowlint.service.analysis.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.flowlint.configuration.FlowLintProperties;
import com.purchasingpower.flowlint.configuration.LoopDetectionProperties;
import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.graph.FlowGraph;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.model.finding.FindingCategory;
import com.purchasingpower.flowlint.model.finding.Severity;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.Transition;
import com.purchasingpower.flowlint.service.analysis.FlowGraphAnalyzer;
import com.purchasingpower.flowlint.service.analysis.FlowNavigator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds conversational paths that cycle, or run too long, without handing the turn
 * back to the user.
 *
 * <p>Seeds are Start plus every input-accepting page. From each seed a depth-first
 * walk follows page edges and form reprompt handlers, paying
 * {@code entryActionWeight} to enter a page with an entry fulfillment and
 * {@code defaultWeight} otherwise. For each edge, in order:
 * <ul>
 *   <li>target already on the current path: report the cycle (from the target's
 *       first occurrence back to itself), stop this branch
 *   <li>accumulated cost reaches the threshold: report a long chain, stop this branch
 *   <li>target accepts input: the user gets the turn back, stop this branch
 *   <li>otherwise keep walking
 * </ul>
 * Edges into another flow end the branch silently. The walk uses an explicit
 * stack; the threshold bounds its depth.
 *
 * <p>Messages are deduplicated per flow across all seeds. Findings are tagged with
 * the seed that first discovered them.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@Order(5)
public class LoopDetector implements FlowGraphAnalyzer {

    static final String CYCLE_PREFIX = "Infinite Loop Detected: ";
    static final String LONG_CHAIN_FORMAT = "Possible Infinite Loop (Depth %d): %s";
    private static final String ARROW = " -> ";

    private final FlowNavigator navigator;
    private final LoopDetectionProperties settings;

    public LoopDetector(FlowNavigator navigator, FlowLintProperties properties) {
        this.navigator = navigator;
        this.settings = properties.getLoop();
    }

    @Override
    public String getName() {
        return "loop-detection";
    }

    @Override
    public List<Finding> analyze(AgentGraph graph) {
        return detect(graph, settings.getThreshold());
    }

    /**
     * Runs detection with an explicit cost threshold instead of the configured one.
     */
    public List<Finding> detect(AgentGraph graph, int threshold) {
        Preconditions.checkArgument(threshold > 0, "Loop threshold must be positive, got %s", threshold);

        List<Finding> findings = new ArrayList<>();
        for (FlowGraph flow : graph.getFlows()) {
            // Partitioned by flow, so seeds of different flows never share state
            Set<String> reported = new HashSet<>();

            for (String seed : seeds(flow)) {
                walk(graph, flow, seed, threshold, reported, findings);
            }
        }

        log.debug("Loop detection pass: {} findings (threshold {})", findings.size(), threshold);
        return findings;
    }

    private List<String> seeds(FlowGraph flow) {
        List<String> seeds = new ArrayList<>();
        seeds.add(FlowGraph.START_PAGE);
        for (Page page : flow.pageList()) {
            if (page.acceptsInput()) {
                seeds.add(page.getName());
            }
        }
        return seeds;
    }

    private void walk(AgentGraph graph, FlowGraph flow, String seed, int threshold,
                      Set<String> reported, List<Finding> findings) {
        String seedLabel = flow.labelOf(seed);

        Deque<Step> stack = new ArrayDeque<>();
        stack.push(new Step(seed, List.of(seed), List.of(seedLabel), 0));

        while (!stack.isEmpty()) {
            Step step = stack.pop();
            List<Step> next = new ArrayList<>();

            for (Transition edge : navigator.outgoing(graph, flow, step.address(), true)) {
                Optional<String> targetId = navigator.intraFlowTarget(graph, flow, edge);
                if (targetId.isEmpty()) {
                    continue;
                }

                Page target = flow.getPages().get(targetId.get());
                String targetLabel = target.label();
                int cost = step.cost() + weightOf(target);

                List<String> path = new ArrayList<>(step.path());
                path.add(targetLabel);

                int loopStart = step.visited().indexOf(target.getName());
                if (loopStart >= 0) {
                    // Report the cycle only, not the approach to it
                    List<String> cycle = path.subList(loopStart, path.size());
                    report(flow, seedLabel, FindingCategory.INFINITE_LOOP,
                            CYCLE_PREFIX + String.join(ARROW, cycle), reported, findings);
                } else if (cost >= threshold) {
                    report(flow, seedLabel, FindingCategory.LONG_TRANSITION_CHAIN,
                            String.format(LONG_CHAIN_FORMAT, cost, String.join(ARROW, path)), reported, findings);
                } else if (!target.acceptsInput()) {
                    List<String> visited = new ArrayList<>(step.visited());
                    visited.add(target.getName());
                    next.add(new Step(target.getName(), List.copyOf(visited), List.copyOf(path), cost));
                }
            }

            // Reverse so edges are explored in declaration order
            for (int i = next.size() - 1; i >= 0; i--) {
                stack.push(next.get(i));
            }
        }
    }

    private int weightOf(Page page) {
        return page.hasEntryAction() ? settings.getEntryActionWeight() : settings.getDefaultWeight();
    }

    private void report(FlowGraph flow, String seedLabel, FindingCategory category, String message,
                        Set<String> reported, List<Finding> findings) {
        if (!reported.add(message)) {
            return;
        }
        findings.add(Finding.builder()
                .flow(flow.getDisplayName())
                .page(seedLabel)
                .category(category)
                .message(message)
                .severity(Severity.WARNING)
                .build());
    }

    /**
     * {@code visited} holds the page identifiers along {@code path}, index for index.
     */
    private record Step(String address, List<String> visited, List<String> path, int cost) {
    }
}
