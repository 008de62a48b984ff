package work.lcod.taskgen.cluster;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries an action with exponential backoff until it succeeds or {@code maxDuration} has elapsed.
 */
public final class RetryPolicy {
    public static final Duration DEFAULT_MAX_DURATION = Duration.ofSeconds(30);

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final Duration maxDuration;
    private final Duration initialInterval;
    private final double multiplier;
    private final Duration maxInterval;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryPolicy(Duration maxDuration, Duration initialInterval, double multiplier, Duration maxInterval, Sleeper sleeper, Clock clock) {
        this.maxDuration = Objects.requireNonNull(maxDuration, "maxDuration");
        this.initialInterval = Objects.requireNonNull(initialInterval, "initialInterval");
        this.multiplier = Math.max(1.0, multiplier);
        this.maxInterval = Objects.requireNonNull(maxInterval, "maxInterval");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Exponential backoff from 500ms doubling up to 5s, sleeping on the calling thread.
     */
    public static RetryPolicy withMaxDuration(Duration maxDuration) {
        return new RetryPolicy(maxDuration, Duration.ofMillis(500), 2.0, Duration.ofSeconds(5), d -> Thread.sleep(d.toMillis()), Clock.systemUTC());
    }

    public Duration maxDuration() {
        return maxDuration;
    }

    /**
     * Runs {@code action} until it succeeds. A wait that would pass the deadline is shortened so the
     * last attempt happens at the deadline; a zero duration allows exactly one attempt.
     *
     * @throws ApplyException with the last failure as cause once the budget is spent
     */
    public <T> T execute(String description, Supplier<T> action) {
        Instant deadline = clock.instant().plus(maxDuration);
        Duration interval = initialInterval;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (RuntimeException ex) {
                Instant now = clock.instant();
                if (!now.isBefore(deadline)) {
                    throw new ApplyException(
                        "Failed to " + description + " after " + attempt + " attempts within " + maxDuration + ": " + ex.getMessage(),
                        ex
                    );
                }
                Duration remaining = Duration.between(now, deadline);
                Duration wait = interval.compareTo(remaining) > 0 ? remaining : interval;
                log.debug("Attempt {} to {} failed, retrying in {}: {}", attempt, description, wait, ex.getMessage());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ApplyException("Interrupted while retrying to " + description, interrupted);
                }
                interval = next(interval);
            }
        }
    }

    private Duration next(Duration interval) {
        long nextMillis = (long) (interval.toMillis() * multiplier);
        return nextMillis > maxInterval.toMillis() ? maxInterval : Duration.ofMillis(nextMillis);
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
