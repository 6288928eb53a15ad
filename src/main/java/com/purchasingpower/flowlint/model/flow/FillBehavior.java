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
public class FillBehavior {

    Fulfillment initialPromptFulfillment;

    @Builder.Default
    List<EventHandler> repromptEventHandlers = List.of();
}
