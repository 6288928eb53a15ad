package com.purchasingpower.flowlint.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Heuristic constants for loop detection, bound from {@code flowlint.loop}.
 *
 * <p>Example:
 * <pre>
 * flowlint:
 *   loop:
 *     threshold: 25
 *     entry-action-weight: 2
 *     default-weight: 1
 * </pre>
 */
@Data
public class LoopDetectionProperties {

    /**
     * Accumulated transition cost at which an input-free chain is reported.
     * Default: 25
     */
    @Min(1)
    private int threshold = 25;

    /**
     * Cost of entering a page that runs an entry fulfillment.
     * Default: 2
     */
    @Min(1)
    private int entryActionWeight = 2;

    /**
     * Cost of entering any other page.
     * Default: 1
     */
    @Min(1)
    private int defaultWeight = 1;
}
