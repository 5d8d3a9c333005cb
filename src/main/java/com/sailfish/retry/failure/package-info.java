/**
 * Failure classification: which failures are retryable and how failures
 * carried by futures are unwrapped before classification.
 */
package com.sailfish.retry.failure;
