package com.purchasingpower.flowlint.service.analysis;

import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.model.finding.Finding;

import java.util.List;

/**
 * One structural analysis pass over a loaded agent.
 *
 * <p>Implementations:
 * <ul>
 *   <li>Reachability - pages never reached from Start
 *   <li>Handler completeness - input pages without no-input/no-match handling
 *   <li>Stuck state - non-input pages with no unconditional exit
 *   <li>Route group usage - route groups nobody references
 *   <li>Loop detection - cycles and long input-free chains
 * </ul>
 *
 * <p>Passes are read-only over the graph and never throw for a loaded graph:
 * a reference that does not resolve is simply not an edge.
 *
 * @since 1.0.0
 */
public interface FlowGraphAnalyzer {

    /**
     * Short name used in logs.
     */
    String getName();

    /**
     * Runs the pass.
     *
     * @param graph loaded agent, never mutated
     * @return findings in flow load order, possibly empty
     */
    List<Finding> analyze(AgentGraph graph);
}
