package com.logsentinel.core.query;

import com.logsentinel.core.exception.InvalidQueryException;
import com.logsentinel.core.exception.QueryFailedException;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.LogLevel;
import com.logsentinel.core.store.SignatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Read-only projection over the {@link SignatureStore} for the history UI.
 *
 * <p>
 * Never goes through the anomaly filter and never writes. An unknown
 * signature is answered with a count of zero.
 * </p>
 *
 * @since 1.0.0
 */
public class HistoryQueryService {

    private static final Logger LOG = LoggerFactory.getLogger(HistoryQueryService.class);

    private final SignatureStore store;

    public HistoryQueryService(SignatureStore store) {
        this.store = Objects.requireNonNull(store, "SignatureStore must not be null");
    }

    /**
     * @param query the caller's request
     * @return the occurrence count within the lookback
     * @throws InvalidQueryException if the signature or lookback is malformed
     * @throws QueryFailedException  if the store could not be read
     */
    public OccurrenceReport query(OccurrenceQuery query) {
        if (query == null) {
            throw new InvalidQueryException("Query must not be null");
        }
        ErrorSignature signature = resolveSignature(query);
        int lookbackHours = query.getLookbackHours();
        if (lookbackHours < 1) {
            throw new InvalidQueryException("hours must be a positive integer, got: " + lookbackHours);
        }

        long count;
        try {
            count = store.queryOccurrences(signature, lookbackHours);
        } catch (StoreUnavailableException e) {
            LOG.error("History query for [{}] failed: {}", signature.key(), e.getMessage());
            throw new QueryFailedException("Could not read history for '" + signature.key() + "': "
                    + e.getMessage(), e);
        }
        LOG.debug("History query [{}] over {}h -> {}", signature.key(), lookbackHours, count);
        return new OccurrenceReport(signature.key(), lookbackHours, count);
    }

    private static ErrorSignature resolveSignature(OccurrenceQuery query) {
        if (query.getSignature() != null) {
            try {
                return ErrorSignature.parse(query.getSignature());
            } catch (IllegalArgumentException e) {
                throw new InvalidQueryException(e.getMessage(), e);
            }
        }
        if (isBlank(query.getLevel())) {
            throw new InvalidQueryException("level is required");
        }
        if (isBlank(query.getMessage())) {
            throw new InvalidQueryException("message is required");
        }
        LogLevel level;
        try {
            level = LogLevel.parse(query.getLevel());
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException(e.getMessage(), e);
        }
        return ErrorSignature.of(level, query.getMessage());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
