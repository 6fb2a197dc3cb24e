package com.logsentinel.core.store;

import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;

import java.util.Optional;

/**
 * Persistence seam for {@link HistoryRecord}s: a keyed map with a per-key
 * compare-and-set write.
 *
 * <p>
 * Implementations must make {@link #compareAndSet} atomic per signature and
 * must not serialize writers of different signatures behind one lock. A record
 * is either fully replaced or left untouched; readers never observe a partial
 * write.
 * </p>
 *
 * @since 1.0.0
 */
public interface RecordStore {

    /**
     * Read the current record of a signature.
     *
     * @param signature the signature
     * @return the record, or empty if the signature was never seen
     * @throws StoreUnavailableException on transient backend failure
     */
    Optional<HistoryRecord> load(ErrorSignature signature);

    /**
     * Replace the record of {@code signature} only if its current version is
     * {@code expectedVersion}.
     *
     * @param signature       the signature
     * @param expectedVersion version read before computing {@code updated};
     *                        {@code 0} means the record must not exist yet
     * @param updated         the replacement record
     * @return {@code true} if written, {@code false} if another writer got there
     *         first
     * @throws StoreUnavailableException on transient backend failure
     */
    boolean compareAndSet(ErrorSignature signature, long expectedVersion, HistoryRecord updated);
}
