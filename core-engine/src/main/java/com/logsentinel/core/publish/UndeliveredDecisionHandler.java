package com.logsentinel.core.publish;

import com.logsentinel.core.exception.PublishFailureException;
import com.logsentinel.core.model.AlertDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives decisions the publisher could not deliver, so that the failure is
 * itself observable.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface UndeliveredDecisionHandler {

    /** Logs the undelivered decision at ERROR. */
    UndeliveredDecisionHandler LOGGING = new UndeliveredDecisionHandler() {
        private final Logger log = LoggerFactory.getLogger(UndeliveredDecisionHandler.class);

        @Override
        public void onUndelivered(AlertDecision decision, PublishFailureException cause) {
            log.error("UNDELIVERED alert [{}] for [{}] observed at {}: {}", decision.getReason(),
                    decision.getSignatureKey(), decision.getObservedAt(), cause.getMessage(), cause);
        }
    };

    /**
     * @param decision the decision that was not delivered
     * @param cause    the last delivery failure
     */
    void onUndelivered(AlertDecision decision, PublishFailureException cause);
}
