package com.purchasingpower.flowlint.service.analysis;

import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.graph.FlowGraph;
import com.purchasingpower.flowlint.model.flow.Flow;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.RouteGroup;
import com.purchasingpower.flowlint.model.flow.Transition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes the outgoing edges of an address within a flow.
 *
 * <p>For {@code "Start"} edges come from the flow document; for a page from the
 * page document. In both cases the order is: own transition routes, routes of the
 * referenced route groups, event handlers and, when asked for, form reprompt handlers.
 *
 * @since 1.0.0
 */
@Component
public class FlowNavigator {

    public List<Transition> outgoing(AgentGraph graph, FlowGraph flow, String address, boolean includeReprompts) {
        List<Transition> edges = new ArrayList<>();

        if (FlowGraph.START_PAGE.equals(address)) {
            Flow document = flow.getFlow();
            edges.addAll(document.getTransitionRoutes());
            edges.addAll(routeGroupRoutes(graph, flow, document.getTransitionRouteGroups()));
            edges.addAll(document.getEventHandlers());
            return edges;
        }

        Optional<Page> found = flow.findPage(address);
        if (found.isEmpty()) {
            return edges;
        }

        Page page = found.get();
        edges.addAll(page.getTransitionRoutes());
        edges.addAll(routeGroupRoutes(graph, flow, page.getTransitionRouteGroups()));
        edges.addAll(page.getEventHandlers());
        if (includeReprompts) {
            edges.addAll(page.repromptEventHandlers());
        }
        return edges;
    }

    /**
     * Page identifier the edge lands on, if it stays inside the flow and resolves.
     */
    public Optional<String> intraFlowTarget(AgentGraph graph, FlowGraph flow, Transition edge) {
        if (edge.leavesFlow() || !edge.hasTargetPage()) {
            return Optional.empty();
        }
        return graph.getResolver().resolvePage(flow.getId(), edge.getTargetPage());
    }

    private List<Transition> routeGroupRoutes(AgentGraph graph, FlowGraph flow, List<String> references) {
        List<Transition> routes = new ArrayList<>();
        for (String reference : references) {
            graph.getResolver().resolveRouteGroup(flow.getId(), reference)
                    .map(RouteGroup::getTransitionRoutes)
                    .ifPresent(routes::addAll);
        }
        return routes;
    }
}
