/**
 * Decision publisher: deduplicated hand-off of anomalous decisions to a
 * {@link com.logsentinel.core.publish.NotificationChannel}.
 */
package com.logsentinel.core.publish;
