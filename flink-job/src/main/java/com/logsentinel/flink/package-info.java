/**
 * Flink job wiring the anomaly filter between Kafka topics, plus the HTTP
 * query server.
 */
package com.logsentinel.flink;
