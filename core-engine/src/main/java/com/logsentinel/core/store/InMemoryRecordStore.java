package com.logsentinel.core.store;

import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link RecordStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>
 * The version check and replacement run inside
 * {@link ConcurrentHashMap#computeIfPresent}, which is atomic for one key and
 * leaves other keys writable.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryRecordStore implements RecordStore {

    private final ConcurrentMap<ErrorSignature, HistoryRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<HistoryRecord> load(ErrorSignature signature) {
        Objects.requireNonNull(signature, "signature must not be null");
        return Optional.ofNullable(records.get(signature));
    }

    @Override
    public boolean compareAndSet(ErrorSignature signature, long expectedVersion, HistoryRecord updated) {
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(updated, "updated record must not be null");

        if (expectedVersion == 0) {
            return records.putIfAbsent(signature, updated) == null;
        }
        boolean[] swapped = new boolean[1];
        records.computeIfPresent(signature, (key, current) -> {
            if (current.getVersion() != expectedVersion) {
                return current;
            }
            swapped[0] = true;
            return updated;
        });
        return swapped[0];
    }

    /**
     * @return number of signatures held
     */
    public int size() {
        return records.size();
    }
}
