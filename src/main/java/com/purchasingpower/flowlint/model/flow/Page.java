package com.purchasingpower.flowlint.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Stream;

/**
 * A state within a flow, loaded from {@code flows/<flow>/pages/*.json}.
 *
 * <p>{@code name} is the page identifier. When the document omits it the loader
 * fills in the file name, so it is never null once the graph is built.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Page {

    String name;
    String displayName;
    Fulfillment entryFulfillment;
    Form form;

    @Builder.Default
    List<TransitionRoute> transitionRoutes = List.of();

    @Builder.Default
    List<EventHandler> eventHandlers = List.of();

    @Builder.Default
    List<String> transitionRouteGroups = List.of();

    /**
     * Display name, or the identifier when the page has none.
     */
    public String label() {
        return displayName != null && !displayName.isBlank() ? displayName : name;
    }

    public List<FormParameter> formParameters() {
        if (form == null || form.getParameters() == null) {
            return List.of();
        }
        return form.getParameters();
    }

    /**
     * Input-accepting pages wait for the user: an intent-bearing route or a form to fill.
     */
    public boolean acceptsInput() {
        return !formParameters().isEmpty()
                || transitionRoutes.stream().anyMatch(TransitionRoute::hasIntent);
    }

    public boolean hasEntryAction() {
        return entryFulfillment != null && entryFulfillment.hasContent();
    }

    /**
     * Reprompt handlers declared across all form parameters, in parameter order.
     */
    public List<EventHandler> repromptEventHandlers() {
        return formParameters().stream()
                .flatMap(parameter -> parameter.repromptEventHandlers().stream())
                .toList();
    }

    /**
     * Event names from the page's own handlers and every parameter's reprompt handlers.
     */
    public List<String> handledEvents() {
        return Stream.concat(eventHandlers.stream(), repromptEventHandlers().stream())
                .map(EventHandler::getEvent)
                .filter(event -> event != null)
                .toList();
    }
}
