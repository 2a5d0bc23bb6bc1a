package com.fleetrank.core.pipeline;

import com.fleetrank.core.model.EntityKey;

import java.util.Objects;

/**
 * A node partition that could not be scored, with the reason.
 *
 * <p>
 * Callers can retry just the failed keys; every other partition's scores are
 * already part of the same run's output.
 * </p>
 *
 * @since 1.0.0
 */
public final class PartitionFailure {

    private final EntityKey key;
    private final String reason;
    private final Throwable cause;

    public PartitionFailure(EntityKey key, Throwable cause) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.cause = Objects.requireNonNull(cause, "cause must not be null");
        this.reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }

    public EntityKey getKey() {
        return key;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getCause() {
        return cause;
    }

    /**
     * @return simple class name of the failure, e.g. {@code ValidationException}
     */
    public String getErrorType() {
        return cause.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return "PartitionFailure{key=" + key + ", type=" + getErrorType() + ", reason='" + reason + "'}";
    }
}
