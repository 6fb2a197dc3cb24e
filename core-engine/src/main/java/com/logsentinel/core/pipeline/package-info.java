/**
 * Batch processing of one analysis run's clusters.
 */
package com.logsentinel.core.pipeline;
