package com.sailfish.retry.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Retry settings read from a configuration map, e.g. a section of a YAML or
 * properties file already parsed by the host application.
 *
 * Durations are given as {@link Duration} values, as numbers of seconds, or as
 * strings such as {@code "500ms"}, {@code "30s"}, {@code "10m"}, {@code "7h"},
 * {@code "2d"} or ISO-8601 ({@code "PT10M"}).
 */
public final class RetryConfig {

    private static final Logger log = LoggerFactory.getLogger(RetryConfig.class);

    public static final String CONFIG_NUM_RETRIES = "num_retries";
    public static final String CONFIG_RETRY_TIMEDELTA = "retry_timedelta";
    public static final String CONFIG_SLEEP_BASE = "sleep_base";
    public static final String CONFIG_MAX_SLEEP = "max_sleep";
    public static final String CONFIG_JITTER = "jitter";

    private final int numRetries;
    private final Duration retryTimedelta;
    private final Duration sleepBase;
    private final Duration maxSleep;
    private final boolean addJitter;

    private RetryConfig(int numRetries, Duration retryTimedelta, Duration sleepBase, Duration maxSleep, boolean addJitter) {
        this.numRetries = numRetries;
        this.retryTimedelta = retryTimedelta;
        this.sleepBase = sleepBase;
        this.maxSleep = maxSleep;
        this.addJitter = addJitter;
    }

    /**
     * Reads the settings, falling back to the {@link Retry} defaults for missing keys.
     *
     * @throws IllegalArgumentException if a value has the wrong type or cannot be parsed.
     */
    public static RetryConfig fromMap(Map<String, ?> config) {
        Objects.requireNonNull(config, "config cannot be null");
        int numRetries = readInt(config, CONFIG_NUM_RETRIES, Retry.UNLIMITED_RETRIES);
        if (numRetries < 0) {
            throw new IllegalArgumentException(CONFIG_NUM_RETRIES + " must be non-negative, got " + numRetries);
        }
        Duration retryTimedelta = readDuration(config, CONFIG_RETRY_TIMEDELTA, null);
        Duration sleepBase = readDuration(config, CONFIG_SLEEP_BASE, Retry.DEFAULT_SLEEP_BASE);
        Duration maxSleep = readDuration(config, CONFIG_MAX_SLEEP, Retry.DEFAULT_MAX_SLEEP);
        boolean addJitter = readBoolean(config, CONFIG_JITTER, true);

        RetryConfig result = new RetryConfig(numRetries, retryTimedelta, sleepBase, maxSleep, addJitter);
        log.debug("Loaded {}", result);
        return result;
    }

    /**
     * Copies these settings onto a builder.
     */
    public <T> Retry.Builder<T> applyTo(Retry.Builder<T> builder) {
        return builder
                .numRetries(numRetries)
                .retryTimedelta(retryTimedelta)
                .sleepBase(sleepBase)
                .maxSleep(maxSleep)
                .addJitter(addJitter);
    }

    static Duration parseDuration(String text) {
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Empty duration");
        }
        try {
            if (value.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
            } else if (value.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1)));
            } else if (value.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1)));
            } else if (value.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1)));
            } else if (value.endsWith("d")) {
                return Duration.ofDays(Long.parseLong(value.substring(0, value.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(value));
        } catch (NumberFormatException e) {
            try {
                return Duration.parse(text.trim().toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException pe) {
                throw new IllegalArgumentException("Cannot parse duration '" + text + "'", pe);
            }
        }
    }

    private static int readInt(Map<String, ?> config, String key, int defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            Number number = (Number) value;
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble) || asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(key + " must be a whole number in int range, got " + value);
            }
            return number.intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
            }
        }
        throw new IllegalArgumentException(key + " must be a number, got " + value.getClass().getName());
    }

    private static Duration readDuration(Map<String, ?> config, String key, Duration defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            return Duration.ofMillis(Math.round(((Number) value).doubleValue() * 1000));
        }
        if (value instanceof String) {
            return parseDuration((String) value);
        }
        throw new IllegalArgumentException(key + " must be a duration, got " + value.getClass().getName());
    }

    private static boolean readBoolean(Map<String, ?> config, String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        throw new IllegalArgumentException(key + " must be a boolean, got " + value.getClass().getName());
    }

    public int getNumRetries() { return numRetries; }
    public Duration getRetryTimedelta() { return retryTimedelta; }
    public Duration getSleepBase() { return sleepBase; }
    public Duration getMaxSleep() { return maxSleep; }
    public boolean isAddJitter() { return addJitter; }

    @Override
    public String toString() {
        return "RetryConfig{" +
               "numRetries=" + numRetries +
               ", retryTimedelta=" + retryTimedelta +
               ", sleepBase=" + sleepBase +
               ", maxSleep=" + maxSleep +
               ", addJitter=" + addJitter +
               '}';
    }
}
