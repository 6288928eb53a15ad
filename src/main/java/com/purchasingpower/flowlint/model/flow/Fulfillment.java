package com.purchasingpower.flowlint.model.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Messages and webhook call executed when a page is entered or a route fires.
 *
 * <p>Message bodies are kept as raw JSON, the linter only cares whether any exist.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Fulfillment {

    @Builder.Default
    List<JsonNode> messages = List.of();

    String webhook;
    String tag;

    public boolean hasContent() {
        return (messages != null && !messages.isEmpty())
                || (webhook != null && !webhook.isBlank());
    }
}
