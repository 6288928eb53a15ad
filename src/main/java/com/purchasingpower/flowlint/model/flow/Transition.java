package com.purchasingpower.flowlint.model.flow;

/**
 * Anything that can move the conversation to another page or flow.
 *
 * <p>Both {@link TransitionRoute} and {@link EventHandler} act as graph edges
 * during traversal, so the analyzers only see this view of them.
 *
 * @since 1.0.0
 */
public interface Transition {

    /**
     * Target page reference (id, full resource path or display name), may be null.
     */
    String getTargetPage();

    /**
     * Target flow reference, may be null.
     */
    String getTargetFlow();

    /**
     * True when the edge hands control to another flow.
     */
    default boolean leavesFlow() {
        return getTargetFlow() != null && !getTargetFlow().isBlank();
    }

    /**
     * True when the edge names a target page at all.
     */
    default boolean hasTargetPage() {
        return getTargetPage() != null && !getTargetPage().isBlank();
    }
}
