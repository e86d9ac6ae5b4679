package com.connectk.core.ai;

import com.connectk.core.ConfigurationException;
import java.time.Duration;

/**
 * How long a single search may run: either a fixed number of iterations or a wall-clock limit.
 * Exactly one of the two is set; the other is {@code 0} or {@link Duration#ZERO}.
 */
public record SearchBudget(long iterations, Duration timeLimit) {

    public SearchBudget {
        if (timeLimit == null) {
            throw new ConfigurationException("timeLimit must not be null");
        }
        if (iterations < 0L) {
            throw new ConfigurationException("iterations must not be negative");
        }
        if (timeLimit.isNegative()) {
            throw new ConfigurationException("timeLimit must not be negative");
        }
        try {
            timeLimit.toNanos();
        } catch (ArithmeticException ex) {
            throw new ConfigurationException("timeLimit " + timeLimit + " does not fit in a nanosecond count", ex);
        }
        if ((iterations > 0L) == !timeLimit.isZero()) {
            throw new ConfigurationException("Exactly one of iterations or timeLimit must be positive");
        }
    }

    /**
     * Returns a budget of exactly {@code iterations} selection/expansion/simulation/backpropagation
     * cycles.
     */
    public static SearchBudget iterations(long iterations) {
        return new SearchBudget(iterations, Duration.ZERO);
    }

    /**
     * Returns a wall-clock budget. The deadline is checked between iterations only.
     */
    public static SearchBudget time(Duration timeLimit) {
        return new SearchBudget(0L, timeLimit);
    }

    public static SearchBudget timeMillis(long millis) {
        return time(Duration.ofMillis(millis));
    }

    public boolean isTimed() {
        return iterations == 0L;
    }

    @Override
    public String toString() {
        return isTimed() ? timeLimit.toMillis() + "ms" : iterations + " iterations";
    }
}
