package com.logsentinel.flink;

import com.logsentinel.core.publish.NotificationChannel;

import java.io.Serializable;

/**
 * Creates the {@link NotificationChannel} of one {@link AnomalyFilterFunction}
 * instance when the task opens. Shipped to the task managers with the function.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface NotificationChannelFactory extends Serializable {

    NotificationChannel create();
}
