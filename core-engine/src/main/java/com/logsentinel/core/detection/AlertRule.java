package com.logsentinel.core.detection;

import com.logsentinel.core.model.AlertReason;

import java.io.Serializable;

/**
 * One rule of the anomaly filter's chain.
 *
 * <p>
 * Rules are <strong>stateless</strong>: all history they need arrives in the
 * {@link RuleContext}, read fresh from the signature store for every event.
 * They are {@link Serializable} so the stream job can ship them to workers.
 * </p>
 */
public interface AlertRule extends Serializable {

    /**
     * @param context history and event under evaluation
     * @return {@code true} if this rule judges the event anomalous
     */
    boolean fires(RuleContext context);

    /**
     * @return the reason reported when this rule fires
     */
    AlertReason getReason();
}
