package com.logsentinel.core.store;

import com.logsentinel.core.model.AlertReason;
import com.logsentinel.core.model.HistoryRecord;

import java.time.Instant;
import java.util.Optional;

/**
 * Callback deciding, inside a signature's atomic update, whether the event
 * being merged is alert-worthy.
 *
 * <p>
 * May be invoked several times for one event when the write races with other
 * writers; each invocation sees freshly read state. Implementations must be
 * free of side effects.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertEvaluator {

    /** Evaluator that never alerts. */
    AlertEvaluator NEVER = (previous, merged, count, now) -> Optional.empty();

    /**
     * @param previous the record before this event, or {@code null} if the
     *                 signature is new
     * @param merged   the record with this event merged in
     * @param count    the event's occurrence count
     * @param now      store clock reading for this attempt
     * @return the alert reason, or empty if the event is noise
     */
    Optional<AlertReason> evaluate(HistoryRecord previous, HistoryRecord merged, long count, Instant now);
}
