package com.scholary.tracklist.identify;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/**
 * Circuit breaker settings, applied to every provider.
 *
 * @param enabled false lets every call through
 * @param failureThreshold consecutive failed calls that open the breaker
 * @param resetTimeout how long an open breaker skips its provider before one trial call
 */
public record CircuitBreakerProperties(
    boolean enabled, @Positive int failureThreshold, @NotNull Duration resetTimeout) {}
