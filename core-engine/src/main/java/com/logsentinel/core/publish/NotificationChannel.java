package com.logsentinel.core.publish;

import com.logsentinel.core.exception.PublishFailureException;
import com.logsentinel.core.model.AlertDecision;

/**
 * Downstream hand-off for anomalous decisions. Rendering and delivery to
 * humans happen behind this seam.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface NotificationChannel {

    /**
     * Hand a decision off; returning normally is the acknowledgment. An
     * implementation returns only once the decision is durable downstream,
     * since the publisher records it as delivered right after.
     *
     * @param decision an anomalous decision
     * @throws PublishFailureException if the hand-off was not acknowledged
     */
    void send(AlertDecision decision);
}
