package com.logsentinel.core.store;

import com.logsentinel.core.config.StorePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates the {@link RecordStore} backend named by a {@link StorePolicy}.
 *
 * @since 1.0.0
 */
public final class RecordStores {

    private static final Logger LOG = LoggerFactory.getLogger(RecordStores.class);

    private RecordStores() {
        // utility class
    }

    /**
     * @param policy store settings; must not be {@code null}
     * @return a new backend instance
     * @throws IllegalArgumentException if the store type is unknown
     */
    public static RecordStore create(StorePolicy policy) {
        Objects.requireNonNull(policy, "StorePolicy must not be null");
        Objects.requireNonNull(policy.getType(), "Store type must not be null");

        String type = policy.getType().toLowerCase(Locale.ROOT);
        LOG.info("Creating '{}' record store", type);
        return switch (type) {
            case "memory" -> new InMemoryRecordStore();
            case "file" -> new FileRecordStore(
                    Path.of(Objects.requireNonNull(policy.getDirectory(),
                            "store.directory is required for a file store")),
                    policy.getLockTimeoutMillis());
            default -> throw new IllegalArgumentException(
                    "Unknown store type: '" + policy.getType() + "'. Supported types: memory, file");
        };
    }
}
