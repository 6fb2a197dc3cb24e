/**
 * Anomaly filter: the rule chain deciding which error clusters alert.
 *
 * <p>
 * {@link com.logsentinel.core.detection.AnomalyFilter} merges each event into
 * the signature store and evaluates a
 * {@link com.logsentinel.core.detection.RuleChain} built by
 * {@link com.logsentinel.core.detection.RuleChainFactory}. Rules, in priority
 * order:
 * </p>
 * <ul>
 * <li>{@link com.logsentinel.core.detection.NewSignatureRule}</li>
 * <li>{@link com.logsentinel.core.detection.RateSpikeRule}: count over
 * baseline × factor</li>
 * <li>{@link com.logsentinel.core.detection.VolumeThresholdRule}: absolute
 * floor</li>
 * <li>{@link com.logsentinel.core.detection.RecurringRule}: alerted recently and
 * still elevated</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.detection;
