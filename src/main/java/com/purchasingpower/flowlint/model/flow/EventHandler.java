package com.purchasingpower.flowlint.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Handler fired by a named event such as {@code sys.no-match-default}.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventHandler implements Transition {

    String event;
    String targetPage;
    String targetFlow;
    Fulfillment triggerFulfillment;

    public boolean handles(String eventFragment) {
        return event != null && event.contains(eventFragment);
    }
}
