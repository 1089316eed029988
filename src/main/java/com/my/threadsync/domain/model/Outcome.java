package com.my.threadsync.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 항목 단위 처리 결과. 실패는 예외가 아니라 값으로 전달된다.
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Failed {

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> failed(String reason) {
        return new Failed<>(reason);
    }

    static <T> Outcome<T> failed(Throwable error) {
        String reason = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new Failed<>(reason);
    }

    boolean isOk();

    Optional<T> toOptional();

    record Ok<T>(T value) implements Outcome<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.of(value);
        }
    }

    record Failed<T>(String reason) implements Outcome<T> {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }
    }
}
