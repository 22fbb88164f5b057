package com.autoya.backend.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success/failure envelope returned by every mutating service operation.
 *
 * Exactly one of {@link #getValue()} and {@link #getError()} is non-null.
 *
 * @param <T> type of the successful value
 */
public final class ServiceResult<T> {

    private final T value;
    private final ServiceError error;

    private ServiceResult(T value, ServiceError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ServiceResult<T> success(T value) {
        return new ServiceResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ServiceResult<T> failure(ServiceError error) {
        return new ServiceResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        return value;
    }

    public ServiceError getError() {
        return error;
    }

    /**
     * Shortcut for {@code getError().message()}; null on success.
     */
    public String getMessage() {
        return error != null ? error.message() : null;
    }

    public <R> ServiceResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
