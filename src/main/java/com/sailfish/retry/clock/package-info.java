/**
 * Time primitives used by the retry engine: {@link com.sailfish.retry.clock.RetryClock}
 * and its wall-clock implementation {@link com.sailfish.retry.clock.SystemClock}.
 */
package com.sailfish.retry.clock;
