package com.mikov.emailverifier.model;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a single check. Exactly one of four variants:
 * <ul>
 *     <li>{@link Passed} - the check ran and its success condition held</li>
 *     <li>{@link Failed} - the check ran and gave a definitive negative answer</li>
 *     <li>{@link Skipped} - the check was disabled or its precondition did not hold</li>
 *     <li>{@link Errored} - a collaborator failed, no verdict is available</li>
 * </ul>
 * Callers handle every variant through {@link #fold}.
 *
 * @param <T> type of the data the check produces
 */
public sealed interface CheckResult<T>
        permits CheckResult.Passed, CheckResult.Failed, CheckResult.Skipped, CheckResult.Errored {

    <R> R fold(Function<? super T, ? extends R> onPassed,
               Function<? super T, ? extends R> onFailed,
               Supplier<? extends R> onSkipped,
               Function<? super Throwable, ? extends R> onErrored);

    Status status();

    default boolean isPassed() {
        return status() == Status.PASSED;
    }

    default boolean isFailed() {
        return status() == Status.FAILED;
    }

    default boolean isSkipped() {
        return status() == Status.SKIPPED;
    }

    default boolean isErrored() {
        return status() == Status.ERRORED;
    }

    /**
     * Data attached to a passed or failed check, if any.
     */
    default Optional<T> payload() {
        return fold(Optional::ofNullable, Optional::ofNullable, Optional::empty, error -> Optional.empty());
    }

    static <T> CheckResult<T> passed(final T data) {
        return new Passed<>(data);
    }

    static <T> CheckResult<T> failed(final T data) {
        return new Failed<>(data);
    }

    @SuppressWarnings("unchecked")
    static <T> CheckResult<T> skipped() {
        return (CheckResult<T>) Skipped.INSTANCE;
    }

    static <T> CheckResult<T> errored(final Throwable error) {
        return new Errored<>(error);
    }

    enum Status {
        PASSED, FAILED, SKIPPED, ERRORED
    }

    record Passed<T>(T data) implements CheckResult<T> {

        @Override
        public <R> R fold(final Function<? super T, ? extends R> onPassed,
                          final Function<? super T, ? extends R> onFailed,
                          final Supplier<? extends R> onSkipped,
                          final Function<? super Throwable, ? extends R> onErrored) {
            return onPassed.apply(data);
        }

        @Override
        public Status status() {
            return Status.PASSED;
        }
    }

    /**
     * @param data may be null when the check has nothing to report
     */
    record Failed<T>(T data) implements CheckResult<T> {

        @Override
        public <R> R fold(final Function<? super T, ? extends R> onPassed,
                          final Function<? super T, ? extends R> onFailed,
                          final Supplier<? extends R> onSkipped,
                          final Function<? super Throwable, ? extends R> onErrored) {
            return onFailed.apply(data);
        }

        @Override
        public Status status() {
            return Status.FAILED;
        }
    }

    record Skipped<T>() implements CheckResult<T> {

        private static final Skipped<?> INSTANCE = new Skipped<>();

        @Override
        public <R> R fold(final Function<? super T, ? extends R> onPassed,
                          final Function<? super T, ? extends R> onFailed,
                          final Supplier<? extends R> onSkipped,
                          final Function<? super Throwable, ? extends R> onErrored) {
            return onSkipped.get();
        }

        @Override
        public Status status() {
            return Status.SKIPPED;
        }
    }

    record Errored<T>(Throwable error) implements CheckResult<T> {

        @Override
        public <R> R fold(final Function<? super T, ? extends R> onPassed,
                          final Function<? super T, ? extends R> onFailed,
                          final Supplier<? extends R> onSkipped,
                          final Function<? super Throwable, ? extends R> onErrored) {
            return onErrored.apply(error);
        }

        @Override
        public Status status() {
            return Status.ERRORED;
        }
    }
}
