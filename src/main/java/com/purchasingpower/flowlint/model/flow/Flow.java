package com.purchasingpower.flowlint.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Flow document, {@code flows/<flow>/<flow>.json}.
 *
 * <p>The flow's routes and handlers belong to its implicit Start page.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Flow {

    String name;
    String displayName;

    @Builder.Default
    List<TransitionRoute> transitionRoutes = List.of();

    @Builder.Default
    List<EventHandler> eventHandlers = List.of();

    @Builder.Default
    List<String> transitionRouteGroups = List.of();

    public String label() {
        return displayName != null && !displayName.isBlank() ? displayName : name;
    }
}
