package com.purchasingpower.flowlint.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Conditional or intent-triggered edge leaving a flow, page or route group.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransitionRoute implements Transition {

    private static final String ALWAYS = "true";

    String condition;
    String intent;
    String targetPage;
    String targetFlow;
    Fulfillment triggerFulfillment;

    /**
     * A route whose condition is the literal {@code true} fires without user input.
     */
    public boolean isUnconditional() {
        return condition != null && ALWAYS.equalsIgnoreCase(condition.trim());
    }

    public boolean hasIntent() {
        return intent != null && !intent.isBlank();
    }
}
