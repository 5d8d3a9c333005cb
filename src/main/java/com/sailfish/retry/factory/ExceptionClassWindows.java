package com.sailfish.retry.factory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A {@link RetryWindow} keyed by failure class.
 * Windows should be registered while the retry policy is being set up.
 *
 * Lookup walks the registrations in order and returns the window of the first
 * class the failure is an instance of, so register narrower classes first.
 */
public class ExceptionClassWindows implements RetryWindow {

    private static final Logger log = LoggerFactory.getLogger(ExceptionClassWindows.class);

    private final Map<Class<? extends Throwable>, Duration> windows = new ConcurrentHashMap<>();
    private final List<Class<? extends Throwable>> order = new CopyOnWriteArrayList<>();

    /**
     * Registers the window length for a failure class. Registering a class again
     * replaces its window but keeps its position.
     *
     * @param failureClass The failure class, subclasses included.
     * @param window The window length. Must be positive.
     * @return this registry, for chaining.
     */
    public ExceptionClassWindows register(Class<? extends Throwable> failureClass, Duration window) {
        if (failureClass == null) {
            throw new IllegalArgumentException("failureClass cannot be null");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        log.debug("Registering retry window {} for {}", window, failureClass.getName());
        if (windows.put(failureClass, window) == null) {
            order.add(failureClass);
        }
        return this;
    }

    @Override
    public Optional<Duration> windowFor(Throwable failure) {
        if (failure == null) {
            return Optional.empty();
        }
        for (Class<? extends Throwable> type : order) {
            if (type.isInstance(failure)) {
                return Optional.ofNullable(windows.get(type));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return order.size();
    }
}
