package com.sailfish.retry.factory;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps a failure to the length of a secondary retry window.
 *
 * A driver opens the window on the first failure for which a length is returned
 * and stops retrying once it has closed, even if the overall deadline is further
 * away. Later failures do not move the window.
 */
@FunctionalInterface
public interface RetryWindow {

    /**
     * @param failure The failure of the last attempt.
     * @return The window length for this failure, or empty when the failure has none.
     */
    Optional<Duration> windowFor(Throwable failure);
}
