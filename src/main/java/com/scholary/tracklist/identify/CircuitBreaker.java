package com.scholary.tracklist.identify;

import com.scholary.tracklist.config.ConfigurationException;
import com.scholary.tracklist.logging.StructuredLogger;
import com.scholary.tracklist.provider.ErrorKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breaker for one provider during one run.
 *
 * <p>States:
 *
 * <ul>
 *   <li>CLOSED: calls go through. Opens after {@code failureThreshold} consecutive failed calls,
 *       or at once when a call ends with an auth error or is still rate limited after its retries.
 *   <li>OPEN: the provider is skipped. After {@code resetTimeout} one trial call is let through.
 *   <li>HALF_OPEN: the trial call is in flight and other calls are skipped. Success closes the
 *       breaker; failure opens it again.
 * </ul>
 *
 * <p>A failed call is one that still failed after its retries. A clean "no match" counts as a
 * success. Thread-safe; segments identified concurrently share one breaker per provider.
 */
public class CircuitBreaker {

  private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreaker.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public enum State {
    CLOSED,
    OPEN,
    HALF_OPEN
  }

  private final String provider;
  private final CircuitBreakerProperties properties;
  private final Clock clock;

  private State state = State.CLOSED;
  private int consecutiveFailures;
  private Instant openedAt;
  private boolean trialInFlight;
  private long trips;
  private ErrorKind lastFailure = ErrorKind.UNKNOWN;

  public CircuitBreaker(String provider, CircuitBreakerProperties properties, Clock clock) {
    if (properties.failureThreshold() < 1
        || properties.resetTimeout() == null
        || properties.resetTimeout().isNegative()) {
      throw new ConfigurationException(
          "circuitBreaker needs failureThreshold >= 1 and a resetTimeout >= 0");
    }
    this.provider = provider;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Ask to call the provider. Every {@code true} must be followed by exactly one of {@link
   * #recordSuccess}, {@link #recordFailure} or {@link #recordAbandoned}.
   *
   * @return false if the provider should be skipped
   */
  public synchronized boolean tryAcquire() {
    if (!properties.enabled() || state == State.CLOSED) {
      return true;
    }
    if (state == State.HALF_OPEN) {
      if (trialInFlight) {
        return false;
      }
      trialInFlight = true;
      return true;
    }
    Duration open = Duration.between(openedAt, clock.instant());
    if (open.compareTo(properties.resetTimeout()) < 0) {
      return false;
    }
    state = State.HALF_OPEN;
    trialInFlight = true;
    STRUCTURED_LOGGER.logCircuitStateChanged(provider, state.name(), consecutiveFailures, trips);
    return true;
  }

  public synchronized void recordSuccess() {
    if (!properties.enabled()) {
      return;
    }
    consecutiveFailures = 0;
    if (state == State.HALF_OPEN) {
      trialInFlight = false;
      state = State.CLOSED;
      STRUCTURED_LOGGER.logCircuitStateChanged(provider, state.name(), 0, trips);
    }
  }

  public synchronized void recordFailure(ErrorKind kind) {
    if (!properties.enabled()) {
      return;
    }
    lastFailure = kind;
    consecutiveFailures++;
    if (state == State.HALF_OPEN) {
      trialInFlight = false;
      open();
    } else if (state == State.CLOSED
        && (consecutiveFailures >= properties.failureThreshold() || isCritical(kind))) {
      open();
    }
  }

  /** The call ended without an outcome (interrupted); a half-open breaker may try again. */
  public synchronized void recordAbandoned() {
    if (state == State.HALF_OPEN) {
      trialInFlight = false;
    }
  }

  public synchronized State state() {
    return state;
  }

  /** Times the breaker went from CLOSED or HALF_OPEN to OPEN. */
  public synchronized long trips() {
    return trips;
  }

  /** Kind of the most recent failed call, reported for skipped calls. */
  public synchronized ErrorKind lastFailure() {
    return lastFailure;
  }

  private void open() {
    state = State.OPEN;
    openedAt = clock.instant();
    trips++;
    STRUCTURED_LOGGER.logCircuitStateChanged(provider, state.name(), consecutiveFailures, trips);
  }

  private static boolean isCritical(ErrorKind kind) {
    return kind == ErrorKind.AUTH_ERROR || kind == ErrorKind.RATE_LIMITED;
  }
}
