package com.purchasingpower.flowlint.model.finding;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Category tag attached to each finding, one per kind of structural defect.
 *
 * @since 1.0.0
 */
@Getter
@RequiredArgsConstructor
public enum FindingCategory {
    UNREACHABLE_PAGE("unreachable-page"),
    MISSING_EVENT_HANDLER("missing-event-handler"),
    STUCK_PAGE("stuck-page"),
    UNUSED_ROUTE_GROUP("unused-route-group"),
    INFINITE_LOOP("infinite-loop"),
    LONG_TRANSITION_CHAIN("long-transition-chain");

    private final String tag;
}
