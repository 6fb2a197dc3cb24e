package com.logsentinel.core.model;

/**
 * Why an {@link AlertDecision} was judged anomalous. Declared in rule
 * priority order.
 *
 * @since 1.0.0
 */
public enum AlertReason {

    /** First-ever sighting of the signature. */
    NEW_SIGNATURE,

    /** Count exceeds the signature's own baseline by the spike factor. */
    RATE_SPIKE,

    /** Count reached the absolute volume floor. */
    VOLUME_THRESHOLD,

    /** Signature alerted recently and is still above the repeat floor. */
    RECURRING
}
