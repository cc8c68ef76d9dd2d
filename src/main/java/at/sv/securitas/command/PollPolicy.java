package at.sv.securitas.command;

import java.time.Duration;
import java.util.Objects;

/**
 * How long a command is polled before the poller gives up with {@link CommandState#TIMEOUT}.
 *
 * @param interval      delay between a response and the next poll
 * @param maxAttempts   maximum number of polls per command
 * @param budget        maximum wall clock time from the first poll
 * @param forceOverride re-issue an arm command once with forcing, if the backend allows it
 */
public record PollPolicy(Duration interval, int maxAttempts, Duration budget, boolean forceOverride) {

    public PollPolicy {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(budget, "budget");

        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be non-negative");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (budget.isNegative() || budget.isZero()) {
            throw new IllegalArgumentException("budget must be positive");
        }
    }

    public static PollPolicy defaults() {
        return new PollPolicy(Duration.ofSeconds(2), 30, Duration.ofSeconds(60), false);
    }

    public PollPolicy withForceOverride(boolean forceOverride) {
        return new PollPolicy(interval, maxAttempts, budget, forceOverride);
    }
}
