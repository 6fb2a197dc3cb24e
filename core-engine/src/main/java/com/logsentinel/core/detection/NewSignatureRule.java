package com.logsentinel.core.detection;

import com.logsentinel.core.model.AlertReason;

/**
 * Fires on the first-ever sighting of a signature.
 *
 * @since 1.0.0
 */
public class NewSignatureRule implements AlertRule {

    private static final long serialVersionUID = 1L;

    @Override
    public boolean fires(RuleContext context) {
        return context.isNewSignature();
    }

    @Override
    public AlertReason getReason() {
        return AlertReason.NEW_SIGNATURE;
    }
}
