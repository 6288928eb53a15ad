package com.purchasingpower.flowlint.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Reusable bundle of transition routes, scoped to one flow.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteGroup {

    String name;
    String displayName;

    @Builder.Default
    List<TransitionRoute> transitionRoutes = List.of();

    public String label() {
        return displayName != null && !displayName.isBlank() ? displayName : name;
    }
}
