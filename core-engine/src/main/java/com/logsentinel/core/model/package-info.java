/**
 * Domain model for Log Sentinel.
 *
 * <ul>
 * <li>{@link com.logsentinel.core.model.ErrorSignature}: level plus verbatim
 * message, the identity key of an error pattern</li>
 * <li>{@link com.logsentinel.core.model.ClusterEvent}: one clustered signature
 * observed in one analysis run</li>
 * <li>{@link com.logsentinel.core.model.HistoryRecord}: immutable, versioned
 * occurrence history of one signature</li>
 * <li>{@link com.logsentinel.core.model.AlertDecision}: filter outcome handed to
 * the notification channel</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.model;
