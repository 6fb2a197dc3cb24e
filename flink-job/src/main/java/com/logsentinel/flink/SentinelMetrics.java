package com.logsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Log Sentinel.
 * <p>
 * Exposed through the cluster's configured metric reporters; the job only
 * defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code events_processed_total} – cluster events run through the filter</li>
 * <li>{@code anomalies_detected_total} – anomalous decisions</li>
 * <li>{@code duplicates_total} – redelivered events and swallowed re-publishes</li>
 * <li>{@code invalid_events_total} – events rejected as malformed</li>
 * <li>{@code undelivered_total} – decisions the publisher gave up on</li>
 * <li>{@code processing_latency_ms} – histogram of per-event latency</li>
 * </ul>
 */
public class SentinelMetrics {

    private final Counter eventsProcessed;
    private final Counter anomaliesDetected;
    private final Counter duplicates;
    private final Counter invalidEvents;
    private final Counter undelivered;
    private final Histogram processingLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup sentinelGroup = metricGroup.addGroup("log_sentinel");

        this.eventsProcessed = sentinelGroup.counter("events_processed_total");
        this.anomaliesDetected = sentinelGroup.counter("anomalies_detected_total");
        this.duplicates = sentinelGroup.counter("duplicates_total");
        this.invalidEvents = sentinelGroup.counter("invalid_events_total");
        this.undelivered = sentinelGroup.counter("undelivered_total");
        this.processingLatency = sentinelGroup
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementEventsProcessed() {
        eventsProcessed.inc();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.inc();
    }

    public void incrementDuplicates() {
        duplicates.inc();
    }

    public void incrementInvalidEvents() {
        invalidEvents.inc();
    }

    public void incrementUndelivered() {
        undelivered.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
