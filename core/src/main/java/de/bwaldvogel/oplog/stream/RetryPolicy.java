package de.bwaldvogel.oplog.stream;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Controls how a {@link TailingOplogStream} reacts to failing and empty reads.
 * <p>
 * Consecutive failures are retried with exponential backoff. Once more than {@link #getMaxConsecutiveFailures()}
 * failures happened in a row, the stream gives up.
 */
public final class RetryPolicy {

    static final String PROPERTY_PREFIX = "oplog.retry.";
    static final String MAX_CONSECUTIVE_FAILURES = PROPERTY_PREFIX + "maxConsecutiveFailures";
    static final String INITIAL_BACKOFF_MILLIS = PROPERTY_PREFIX + "initialBackoffMillis";
    static final String MAX_BACKOFF_MILLIS = PROPERTY_PREFIX + "maxBackoffMillis";
    static final String MULTIPLIER = PROPERTY_PREFIX + "multiplier";
    static final String IDLE_POLL_INTERVAL_MILLIS = PROPERTY_PREFIX + "idlePollIntervalMillis";

    private static final int UNLIMITED = -1;

    private static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 10;
    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(100);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);
    private static final double DEFAULT_MULTIPLIER = 2.0;
    private static final Duration DEFAULT_IDLE_POLL_INTERVAL = Duration.ZERO;

    private final int maxConsecutiveFailures;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;
    private final Duration idlePollInterval;

    private RetryPolicy(int maxConsecutiveFailures, Duration initialBackoff, Duration maxBackoff,
                        double multiplier, Duration idlePollInterval) {
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.initialBackoff = validateDuration(initialBackoff, "initial backoff");
        this.maxBackoff = validateDuration(maxBackoff, "max backoff");
        this.multiplier = multiplier;
        this.idlePollInterval = validateDuration(idlePollInterval, "idle poll interval");
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Max backoff " + maxBackoff + " is smaller than initial backoff " + initialBackoff);
        }
        if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("Illegal backoff multiplier: " + multiplier);
        }
    }

    private static Duration validateDuration(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Illegal " + name + ": " + duration);
        }
        return duration;
    }

    public static RetryPolicy withDefaults() {
        return new RetryPolicy(DEFAULT_MAX_CONSECUTIVE_FAILURES, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF,
            DEFAULT_MULTIPLIER, DEFAULT_IDLE_POLL_INTERVAL);
    }

    /**
     * Never gives up: failures are retried with backoff for as long as the stream is consumed.
     */
    public static RetryPolicy unbounded() {
        return new RetryPolicy(UNLIMITED, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF,
            DEFAULT_MULTIPLIER, DEFAULT_IDLE_POLL_INTERVAL);
    }

    public static RetryPolicy fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Overrides the defaults with the {@code oplog.retry.*} entries of the given properties. The combination is
     * validated once all entries are read.
     */
    public static RetryPolicy fromProperties(Properties properties) {
        int maxConsecutiveFailures = DEFAULT_MAX_CONSECUTIVE_FAILURES;
        Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
        Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        double multiplier = DEFAULT_MULTIPLIER;
        Duration idlePollInterval = DEFAULT_IDLE_POLL_INTERVAL;

        String maxFailures = properties.getProperty(MAX_CONSECUTIVE_FAILURES);
        if (maxFailures != null) {
            maxConsecutiveFailures = validateMaxConsecutiveFailures(
                Math.toIntExact(parseLong(MAX_CONSECUTIVE_FAILURES, maxFailures)));
        }
        String initialBackoffMillis = properties.getProperty(INITIAL_BACKOFF_MILLIS);
        if (initialBackoffMillis != null) {
            initialBackoff = Duration.ofMillis(parseLong(INITIAL_BACKOFF_MILLIS, initialBackoffMillis));
        }
        String maxBackoffMillis = properties.getProperty(MAX_BACKOFF_MILLIS);
        if (maxBackoffMillis != null) {
            maxBackoff = Duration.ofMillis(parseLong(MAX_BACKOFF_MILLIS, maxBackoffMillis));
        }
        String multiplierValue = properties.getProperty(MULTIPLIER);
        if (multiplierValue != null) {
            multiplier = parseDouble(MULTIPLIER, multiplierValue);
        }
        String idlePollIntervalMillis = properties.getProperty(IDLE_POLL_INTERVAL_MILLIS);
        if (idlePollIntervalMillis != null) {
            idlePollInterval = Duration.ofMillis(parseLong(IDLE_POLL_INTERVAL_MILLIS, idlePollIntervalMillis));
        }
        return new RetryPolicy(maxConsecutiveFailures, initialBackoff, maxBackoff, multiplier, idlePollInterval);
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Illegal value for " + key + ": '" + value + "'", e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Illegal value for " + key + ": '" + value + "'", e);
        }
    }

    private static int validateMaxConsecutiveFailures(int maxConsecutiveFailures) {
        if (maxConsecutiveFailures < 0) {
            throw new IllegalArgumentException("Illegal max consecutive failures: " + maxConsecutiveFailures);
        }
        return maxConsecutiveFailures;
    }

    public RetryPolicy withMaxConsecutiveFailures(int maxConsecutiveFailures) {
        return new RetryPolicy(validateMaxConsecutiveFailures(maxConsecutiveFailures), initialBackoff, maxBackoff,
            multiplier, idlePollInterval);
    }

    public RetryPolicy withInitialBackoff(Duration initialBackoff) {
        return new RetryPolicy(maxConsecutiveFailures, initialBackoff, maxBackoff, multiplier, idlePollInterval);
    }

    public RetryPolicy withMaxBackoff(Duration maxBackoff) {
        return new RetryPolicy(maxConsecutiveFailures, initialBackoff, maxBackoff, multiplier, idlePollInterval);
    }

    public RetryPolicy withMultiplier(double multiplier) {
        return new RetryPolicy(maxConsecutiveFailures, initialBackoff, maxBackoff, multiplier, idlePollInterval);
    }

    public RetryPolicy withIdlePollInterval(Duration idlePollInterval) {
        return new RetryPolicy(maxConsecutiveFailures, initialBackoff, maxBackoff, multiplier, idlePollInterval);
    }

    public boolean isBounded() {
        return maxConsecutiveFailures != UNLIMITED;
    }

    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getIdlePollInterval() {
        return idlePollInterval;
    }

    boolean shouldGiveUp(int consecutiveFailures) {
        return isBounded() && consecutiveFailures > maxConsecutiveFailures;
    }

    /**
     * @param consecutiveFailures number of failures in a row, starting at 1
     */
    Duration getBackoff(int consecutiveFailures) {
        if (consecutiveFailures < 1) {
            throw new IllegalArgumentException("Illegal number of failures: " + consecutiveFailures);
        }
        double backoffMillis = initialBackoff.toMillis() * Math.pow(multiplier, consecutiveFailures - 1);
        if (Double.isInfinite(backoffMillis) || backoffMillis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) backoffMillis);
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxConsecutiveFailures=" + (isBounded() ? String.valueOf(maxConsecutiveFailures) : "unlimited")
            + ", initialBackoff=" + initialBackoff
            + ", maxBackoff=" + maxBackoff
            + ", multiplier=" + multiplier
            + ", idlePollInterval=" + idlePollInterval
            + "]";
    }

}
