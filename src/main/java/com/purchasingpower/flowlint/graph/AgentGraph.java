package com.purchasingpower.flowlint.graph;

import com.google.common.base.Preconditions;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of an exported agent: every flow, plus the reference
 * indexes built over them.
 *
 * <p>Built once by the loader and shared read-only by all analysis passes,
 * so it is safe to hand to several threads at once.
 *
 * @since 1.0.0
 */
@Getter
public final class AgentGraph {

    private final List<FlowGraph> flows;
    private final ReferenceResolver resolver;

    public AgentGraph(List<FlowGraph> flows) {
        Map<String, FlowGraph> byId = new LinkedHashMap<>();
        for (FlowGraph flow : flows) {
            Preconditions.checkArgument(byId.put(flow.getId(), flow) == null,
                    "Duplicate flow identifier %s", flow.getId());
        }
        this.flows = List.copyOf(byId.values());
        this.resolver = new IndexedReferenceResolver(this.flows);
    }

    public static AgentGraph empty() {
        return new AgentGraph(Collections.emptyList());
    }

    public Optional<FlowGraph> findFlow(String flowId) {
        return flows.stream().filter(f -> f.getId().equals(flowId)).findFirst();
    }

    public int pageCount() {
        return flows.stream().mapToInt(f -> f.getPages().size()).sum();
    }

    public int routeGroupCount() {
        return flows.stream().mapToInt(f -> f.getRouteGroups().size()).sum();
    }
}
