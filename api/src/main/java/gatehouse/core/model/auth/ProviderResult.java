package gatehouse.core.model.auth;

import java.util.function.Function;

/**
 * Outcome of a single identity-provider operation.
 *
 * <p>Provider responses are untyped JSON; adapters translate them into either
 * a typed success payload or one of the named {@link AuthErrorKind}s so that
 * callers never inspect raw response maps.
 *
 * @param <T> success payload type
 */
public sealed interface ProviderResult<T> {

    /**
     * The provider accepted the request.
     *
     * @param value parsed payload
     */
    record Success<T>(T value) implements ProviderResult<T> {
        public Success {
            if (value == null) {
                throw new IllegalArgumentException("Success value cannot be null");
            }
        }
    }

    /**
     * The operation failed.
     *
     * @param kind   classified failure
     * @param detail internal detail for logs; never sent to clients
     */
    record Failure<T>(AuthErrorKind kind, String detail) implements ProviderResult<T> {
        public Failure {
            if (kind == null) {
                throw new IllegalArgumentException("Failure kind cannot be null");
            }
            if (detail == null) {
                detail = kind.code();
            }
        }
    }

    static <T> ProviderResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ProviderResult<T> failure(AuthErrorKind kind, String detail) {
        return new Failure<>(kind, detail);
    }

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    /**
     * Transform the success payload, passing failures through unchanged.
     */
    default <R> ProviderResult<R> map(Function<T, R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        final var failure = (Failure<T>) this;
        return new Failure<>(failure.kind(), failure.detail());
    }
}
