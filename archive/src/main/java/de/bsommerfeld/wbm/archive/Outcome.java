package de.bsommerfeld.wbm.archive;

/**
 * Per-item result of a bulk store operation. A walk over thousands of entries
 * reports an unreadable entry as a {@link Failure} item and keeps going instead
 * of aborting the whole sequence.
 *
 * @param <T> the type of the success value
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    record Success<T>(T value) implements Outcome<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public ArchiveException errorOrNull() {
            return null;
        }
    }

    record Failure<T>(ArchiveException error) implements Outcome<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() throws ArchiveException {
            throw error;
        }

        @Override
        public ArchiveException errorOrNull() {
            return error;
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the value, or rethrows the recorded error.
     */
    T getOrThrow() throws ArchiveException;

    ArchiveException errorOrNull();

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(ArchiveException error) {
        return new Failure<>(error);
    }
}
