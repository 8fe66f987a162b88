package com.scholary.tracklist.provider;

import java.time.Duration;
import java.util.Objects;

/**
 * A single recognition attempt failed.
 *
 * <p>Never escapes the orchestrator: it is turned into a retry, a fallback or a failed {@link
 * ProviderResult}.
 */
public class ProviderException extends RuntimeException {

  private final String providerName;
  private final ErrorKind kind;
  private final Duration retryAfter;

  public ProviderException(String providerName, ErrorKind kind, String message) {
    this(providerName, kind, message, null, null);
  }

  public ProviderException(String providerName, ErrorKind kind, String message, Throwable cause) {
    this(providerName, kind, message, null, cause);
  }

  public ProviderException(
      String providerName, ErrorKind kind, String message, Duration retryAfter, Throwable cause) {
    super(message, cause);
    this.providerName = providerName;
    this.kind = Objects.requireNonNull(kind, "kind");
    this.retryAfter = retryAfter;
  }

  public static ProviderException rateLimited(
      String providerName, String message, Duration retryAfter) {
    return new ProviderException(providerName, ErrorKind.RATE_LIMITED, message, retryAfter, null);
  }

  public String getProviderName() {
    return providerName;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /**
   * Server-supplied wait before the next attempt.
   *
   * @return the hint, or null when the provider did not send one
   */
  public Duration getRetryAfter() {
    return retryAfter;
  }
}
