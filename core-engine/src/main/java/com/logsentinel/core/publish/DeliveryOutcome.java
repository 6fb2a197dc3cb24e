package com.logsentinel.core.publish;

/**
 * What {@link DecisionPublisher#publish} did with a decision.
 *
 * @since 1.0.0
 */
public enum DeliveryOutcome {

    /** Handed off and acknowledged. */
    PUBLISHED,

    /** Already published within the dedup window; swallowed. */
    DUPLICATE,

    /** Hand-off failed for good; passed to the undelivered handler. */
    UNDELIVERED,

    /** Not anomalous, nothing to publish. */
    SKIPPED
}
