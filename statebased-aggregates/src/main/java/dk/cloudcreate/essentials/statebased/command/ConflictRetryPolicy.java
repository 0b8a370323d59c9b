package dk.cloudcreate.essentials.statebased.command;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * How often, and with which delays, a command that failed with a {@link FailureReason#CONCURRENCY_CONFLICT} is retried.<br>
 * The delay before retry number <code>n</code> (starting at 0) is
 * <code>min(maximumDelay, initialDelay * delayMultiplier^n + followupDelay * n)</code>
 */
public class ConflictRetryPolicy {
    public final Duration initialDelay;
    public final Duration followupDelay;
    public final double   delayMultiplier;
    public final Duration maximumDelay;
    public final int      maximumNumberOfRetries;

    public ConflictRetryPolicy(Duration initialDelay,
                               Duration followupDelay,
                               double delayMultiplier,
                               Duration maximumDelay,
                               int maximumNumberOfRetries) {
        this.initialDelay = requireNonNull(initialDelay, "You must specify an initialDelay");
        this.followupDelay = requireNonNull(followupDelay, "You must specify a followupDelay");
        requireTrue(delayMultiplier >= 1.0d, "delayMultiplier must be 1.0 or larger");
        this.delayMultiplier = delayMultiplier;
        this.maximumDelay = requireNonNull(maximumDelay, "You must specify a maximumDelay");
        requireTrue(maximumNumberOfRetries >= 0, "maximumNumberOfRetries must be 0 or larger");
        this.maximumNumberOfRetries = maximumNumberOfRetries;
    }

    public Duration calculateRetryDelay(int retryNumber) {
        requireTrue(retryNumber >= 0, "retryNumber must be 0 or larger");
        var delayInMillis = initialDelay.toMillis() * Math.pow(delayMultiplier, retryNumber) + followupDelay.toMillis() * (double) retryNumber;
        return Duration.ofMillis((long) Math.min(delayInMillis, (double) maximumDelay.toMillis()));
    }

    /**
     * Same delay before every retry
     */
    public static ConflictRetryPolicy fixedBackoff(Duration retryDelay,
                                                   int maximumNumberOfRetries) {
        return new ConflictRetryPolicy(retryDelay,
                                       Duration.ZERO,
                                       1.0d,
                                       retryDelay,
                                       maximumNumberOfRetries);
    }

    /**
     * The delay grows by <code>retryDelay</code> for each retry, up to <code>maximumDelay</code>
     */
    public static ConflictRetryPolicy linearBackoff(Duration retryDelay,
                                                    Duration maximumDelay,
                                                    int maximumNumberOfRetries) {
        return new ConflictRetryPolicy(retryDelay,
                                       retryDelay,
                                       1.0d,
                                       maximumDelay,
                                       maximumNumberOfRetries);
    }

    /**
     * The delay is multiplied by <code>delayMultiplier</code> for each retry, up to <code>maximumDelay</code>
     */
    public static ConflictRetryPolicy exponentialBackoff(Duration initialDelay,
                                                         double delayMultiplier,
                                                         Duration maximumDelay,
                                                         int maximumNumberOfRetries) {
        return new ConflictRetryPolicy(initialDelay,
                                       Duration.ZERO,
                                       delayMultiplier,
                                       maximumDelay,
                                       maximumNumberOfRetries);
    }

    @Override
    public String toString() {
        return "ConflictRetryPolicy{" +
                "initialDelay=" + initialDelay +
                ", followupDelay=" + followupDelay +
                ", delayMultiplier=" + delayMultiplier +
                ", maximumDelay=" + maximumDelay +
                ", maximumNumberOfRetries=" + maximumNumberOfRetries +
                '}';
    }
}
