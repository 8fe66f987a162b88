package com.scholary.tracklist.retry;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/**
 * Retry settings for provider calls.
 *
 * @param maxAttempts attempts per provider per segment, including the first one
 * @param baseDelay delay before the second attempt
 * @param maxDelay upper bound for computed delays; a provider's Retry-After is used as sent
 */
public record RetryProperties(
    @Positive int maxAttempts, @NotNull Duration baseDelay, @NotNull Duration maxDelay) {}
