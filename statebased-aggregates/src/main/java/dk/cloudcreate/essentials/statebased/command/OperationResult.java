package dk.cloudcreate.essentials.statebased.command;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The outcome of a command: either a success carrying an (optional) value, or a failure with a {@link FailureReason} and a detail message
 *
 * @param <R> the value type
 */
public final class OperationResult<R> {
    public static final int OK      = 200;
    public static final int CREATED = 201;

    private final int           statusCode;
    private final R             value;
    private final FailureReason failureReason;
    private final String        detail;

    private OperationResult(int statusCode, R value, FailureReason failureReason, String detail) {
        this.statusCode = statusCode;
        this.value = value;
        this.failureReason = failureReason;
        this.detail = detail;
    }

    public static <R> OperationResult<R> ok(R value) {
        return new OperationResult<>(OK, value, null, null);
    }

    public static <R> OperationResult<R> created(R value) {
        return new OperationResult<>(CREATED, value, null, null);
    }

    public static <R> OperationResult<R> failure(FailureReason failureReason, String detail) {
        requireNonNull(failureReason, "No failureReason provided");
        return new OperationResult<>(failureReason.statusCode, null, failureReason, detail);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public boolean isFailure() {
        return failureReason != null;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * The value of a successful result (may be null)
     *
     * @throws IllegalStateException if the result is a failure
     */
    public R value() {
        if (isFailure()) {
            throw new IllegalStateException(msg("Result is a {} failure: {}", failureReason, detail));
        }
        return value;
    }

    public Optional<FailureReason> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * The failure detail or null for a successful result
     */
    public String detail() {
        return detail;
    }

    /**
     * Can the command be retried, i.e. is this a failure with a retryable {@link FailureReason}
     */
    public boolean isRetryable() {
        return failureReason != null && failureReason.retryable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationResult<?> that = (OperationResult<?>) o;
        return statusCode == that.statusCode && Objects.equals(value, that.value) && failureReason == that.failureReason && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statusCode, value, failureReason, detail);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "OperationResult{" +
                    "statusCode=" + statusCode +
                    ", value=" + value +
                    '}';
        }
        return "OperationResult{" +
                "statusCode=" + statusCode +
                ", failureReason=" + failureReason +
                ", detail='" + detail + '\'' +
                '}';
    }
}
