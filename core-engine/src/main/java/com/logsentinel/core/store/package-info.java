/**
 * Signature store: durable, per-signature atomic occurrence history.
 *
 * <p>
 * {@link com.logsentinel.core.store.SignatureStore} runs optimistic
 * read-merge-write cycles over a
 * {@link com.logsentinel.core.store.RecordStore} backend
 * ({@link com.logsentinel.core.store.InMemoryRecordStore} or
 * {@link com.logsentinel.core.store.FileRecordStore}). The same records also
 * carry the short-lived ledgers used to make event processing and alert
 * publication idempotent.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.store;
