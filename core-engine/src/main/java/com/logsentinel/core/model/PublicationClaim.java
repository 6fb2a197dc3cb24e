package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Marks the alert for one {@code (signature, observedAt)} pair as being handed
 * to the notification channel ({@code confirmedAt == null}, a pending claim) or
 * as acknowledged by it.
 *
 * @since 1.0.0
 */
public final class PublicationClaim implements Serializable {

    private static final long serialVersionUID = 2L;

    private final Instant observedAt;
    private final Instant claimedAt;
    private final Instant confirmedAt;

    public PublicationClaim(Instant observedAt, Instant claimedAt) {
        this(observedAt, claimedAt, null);
    }

    @JsonCreator
    public PublicationClaim(@JsonProperty("observedAt") Instant observedAt,
            @JsonProperty("claimedAt") Instant claimedAt,
            @JsonProperty("confirmedAt") Instant confirmedAt) {
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt must not be null");
        this.claimedAt = Objects.requireNonNull(claimedAt, "claimedAt must not be null");
        this.confirmedAt = confirmedAt;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    /**
     * @return when the channel acknowledged the hand-off, or {@code null} while
     *         the claim is pending
     */
    public Instant getConfirmedAt() {
        return confirmedAt;
    }

    @JsonIgnore
    public boolean isConfirmed() {
        return confirmedAt != null;
    }

    public PublicationClaim confirm(Instant at) {
        return new PublicationClaim(observedAt, claimedAt, at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PublicationClaim that))
            return false;
        return observedAt.equals(that.observedAt) && claimedAt.equals(that.claimedAt)
                && Objects.equals(confirmedAt, that.confirmedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(observedAt, claimedAt, confirmedAt);
    }

    @Override
    public String toString() {
        return "PublicationClaim{observedAt=" + observedAt + ", claimedAt=" + claimedAt
                + ", confirmedAt=" + confirmedAt + '}';
    }
}
