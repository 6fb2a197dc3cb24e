/**
 * History query service: read-only occurrence counts per signature for the
 * UI.
 */
package com.logsentinel.core.query;
