/**
 * Policy configuration for Log Sentinel.
 *
 * <p>
 * Thresholds, retention and retry bounds are defined in YAML and loaded by
 * {@link com.logsentinel.core.config.ConfigLoader} into a
 * {@link com.logsentinel.core.config.SentinelConfig}. Validation runs
 * automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.config;
