package com.purchasingpower.flowlint.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormParameter {

    String displayName;
    String entityType;
    boolean required;
    FillBehavior fillBehavior;

    public List<EventHandler> repromptEventHandlers() {
        if (fillBehavior == null || fillBehavior.getRepromptEventHandlers() == null) {
            return List.of();
        }
        return fillBehavior.getRepromptEventHandlers();
    }
}
