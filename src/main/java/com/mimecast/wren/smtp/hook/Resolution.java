package com.mimecast.wren.smtp.hook;

import java.util.Optional;

/**
 * Outcome of a resolved continuation.
 *
 * <p>Either accepted, with an optional override value, or rejected.
 *
 * @param <R> Override type.
 */
public final class Resolution<R> {

    private final R override;
    private final Rejection rejection;

    private Resolution(R override, Rejection rejection) {
        this.override = override;
        this.rejection = rejection;
    }

    /**
     * Accepted resolution.
     *
     * @param override Override value or null.
     * @param <R>      Override type.
     * @return Resolution instance.
     */
    public static <R> Resolution<R> accepted(R override) {
        return new Resolution<>(override, null);
    }

    /**
     * Rejected resolution.
     *
     * @param rejection Rejection instance.
     * @param <R>       Override type.
     * @return Resolution instance.
     */
    public static <R> Resolution<R> rejected(Rejection rejection) {
        return new Resolution<>(null, rejection);
    }

    /**
     * Is accepted.
     *
     * @return Boolean.
     */
    public boolean isAccepted() {
        return rejection == null;
    }

    /**
     * Gets override value.
     *
     * @return Optional of override.
     */
    public Optional<R> getOverride() {
        return Optional.ofNullable(override);
    }

    /**
     * Gets rejection.
     *
     * @return Rejection instance, null when accepted.
     */
    public Rejection getRejection() {
        return rejection;
    }

    @Override
    public String toString() {
        return isAccepted() ? "accepted" + (override != null ? " [" + override + "]" : "") : "rejected [" + rejection.toReply() + "]";
    }
}
