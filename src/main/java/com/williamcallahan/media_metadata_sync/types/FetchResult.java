/**
 * Explicit success-or-failure value returned from remote catalog calls
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.types;

import java.util.Optional;
import java.util.function.Function;

/**
 * @param value    payload on success, null on failure
 * @param failure  failure kind, null on success
 * @param attempts number of transport attempts made
 * @param detail   human readable failure detail
 */
public record FetchResult<T>(T value, FetchFailure failure, int attempts, String detail) {

    public static <T> FetchResult<T> success(T value, int attempts) {
        return new FetchResult<>(value, null, attempts, null);
    }

    public static <T> FetchResult<T> failure(FetchFailure failure, int attempts, String detail) {
        return new FetchResult<>(null, failure, attempts, detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> FetchResult<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return new FetchResult<>(null, failure, attempts, detail);
        }
        return new FetchResult<>(mapper.apply(value), null, attempts, null);
    }
}
