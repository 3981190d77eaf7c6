package com.splayrope;

/**
 * The outcome of a rope operation that reports failures as a value instead of
 * throwing them. Either holds the value of a successful operation or the
 * {@link RopeException} that rejected it.
 *
 * @param <T>
 *            The type of value returned on success.
 */
public sealed abstract class Result<T> permits Result.Ok, Result.Err {
    private Result() {
    }

    /**
     * Return whether this result represents a rejected operation.
     *
     * @return {@code true} if this is an error, {@code false} otherwise.
     */
    public abstract boolean isError();

    /**
     * Get the value of a successful operation.
     *
     * @return The value or {@code null} if this is an error.
     */
    public abstract T getValue();

    /**
     * Get the reason the operation was rejected.
     *
     * @return The error or {@code null} if this is not an error.
     */
    public abstract RopeException getError();

    /**
     * Get the value, or rethrow the error that rejected the operation.
     *
     * @return The value of a successful operation.
     * @throws RopeException
     *             The stored error, if this is an error result.
     */
    public abstract T orElseThrow();

    /**
     * Build a successful result.
     *
     * @param <T>
     *            Type of result value.
     * @param value
     *            The value of the result.
     * @return The result.
     */
    public static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * Build an error result.
     *
     * @param <T>
     *            Type of result value.
     * @param error
     *            The error that rejected the operation.
     * @return The result.
     */
    public static <T> Result<T> err(RopeException error) {
        return new Err<>(error);
    }

    /**
     * A successful result.
     *
     * @param <T>
     *            The type of value returned on success.
     */
    public static final class Ok<T> extends Result<T> {
        private final T value;

        private Ok(T value) {
            this.value = value;
        }

        @Override
        public boolean isError() {
            return false;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public RopeException getError() {
            return null;
        }

        @Override
        public T orElseThrow() {
            return value;
        }
    }

    /**
     * A rejected operation.
     *
     * @param <T>
     *            The type of value returned on success.
     */
    public static final class Err<T> extends Result<T> {
        private final RopeException error;

        private Err(RopeException error) {
            this.error = error;
        }

        @Override
        public boolean isError() {
            return true;
        }

        @Override
        public T getValue() {
            return null;
        }

        @Override
        public RopeException getError() {
            return error;
        }

        @Override
        public T orElseThrow() {
            throw error;
        }
    }
}
