package com.purchasingpower.flowlint.graph;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.purchasingpower.flowlint.model.flow.EventHandler;
import com.purchasingpower.flowlint.model.flow.FillBehavior;
import com.purchasingpower.flowlint.model.flow.Flow;
import com.purchasingpower.flowlint.model.flow.Form;
import com.purchasingpower.flowlint.model.flow.FormParameter;
import com.purchasingpower.flowlint.model.flow.Fulfillment;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.RouteGroup;
import com.purchasingpower.flowlint.model.flow.TransitionRoute;

import java.util.List;

/**
 * Small builders for in-memory agents used across analyzer tests.
 *
 * Page identifiers are the display name prefixed with "id-", so tests can
 * tell which resolution path was taken.
 */
public final class GraphFixtures {

    public static final String FLOW_ID = "flow-1";
    public static final String FLOW_NAME = "Main Flow";

    private GraphFixtures() {
    }

    public static String idOf(String displayName) {
        return "id-" + displayName;
    }

    public static TransitionRoute always(String targetPage) {
        return TransitionRoute.builder().condition("true").targetPage(targetPage).build();
    }

    public static TransitionRoute when(String condition, String targetPage) {
        return TransitionRoute.builder().condition(condition).targetPage(targetPage).build();
    }

    public static TransitionRoute onIntent(String intent, String targetPage) {
        return TransitionRoute.builder().intent(intent).targetPage(targetPage).build();
    }

    public static TransitionRoute toFlow(String targetFlow) {
        return TransitionRoute.builder().condition("true").targetFlow(targetFlow).build();
    }

    public static EventHandler handler(String event) {
        return EventHandler.builder().event(event).build();
    }

    public static EventHandler handler(String event, String targetPage) {
        return EventHandler.builder().event(event).targetPage(targetPage).build();
    }

    public static Fulfillment message(String text) {
        return Fulfillment.builder()
                .messages(List.of(JsonNodeFactory.instance.objectNode().put("text", text)))
                .build();
    }

    public static Page page(String displayName, TransitionRoute... routes) {
        return Page.builder()
                .name(idOf(displayName))
                .displayName(displayName)
                .transitionRoutes(List.of(routes))
                .build();
    }

    public static Page withEntry(Page page) {
        return page.toBuilder().entryFulfillment(message("Hello from " + page.getDisplayName())).build();
    }

    public static Page withHandlers(Page page, EventHandler... handlers) {
        return page.toBuilder().eventHandlers(List.of(handlers)).build();
    }

    public static Page withGroups(Page page, String... groupRefs) {
        return page.toBuilder().transitionRouteGroups(List.of(groupRefs)).build();
    }

    public static Page withForm(Page page, EventHandler... repromptHandlers) {
        FormParameter parameter = FormParameter.builder()
                .displayName("param")
                .required(true)
                .fillBehavior(FillBehavior.builder()
                        .initialPromptFulfillment(message("Please provide a value"))
                        .repromptEventHandlers(List.of(repromptHandlers))
                        .build())
                .build();
        return page.toBuilder().form(Form.builder().parameters(List.of(parameter)).build()).build();
    }

    public static RouteGroup group(String displayName, TransitionRoute... routes) {
        return RouteGroup.builder()
                .name(idOf(displayName))
                .displayName(displayName)
                .transitionRoutes(List.of(routes))
                .build();
    }

    public static Flow flow(TransitionRoute... startRoutes) {
        return Flow.builder()
                .name(FLOW_ID)
                .displayName(FLOW_NAME)
                .transitionRoutes(List.of(startRoutes))
                .build();
    }

    public static AgentGraph agent(Flow flow, List<Page> pages) {
        return agent(flow, pages, List.of());
    }

    public static AgentGraph agent(Flow flow, List<Page> pages, List<RouteGroup> groups) {
        return new AgentGraph(List.of(new FlowGraph(flow.getName(), flow, pages, groups)));
    }
}
