package com.scholary.tracklist.config;

import java.util.List;

/**
 * Invalid pipeline configuration.
 *
 * <p>Always raised before any segment is processed. Carries every violation found, not just the
 * first one.
 */
public class ConfigurationException extends RuntimeException {

  private final List<String> violations;

  public ConfigurationException(String message) {
    this(List.of(message));
  }

  public ConfigurationException(List<String> violations) {
    super("Invalid configuration: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
