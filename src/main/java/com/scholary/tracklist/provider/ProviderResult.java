package com.scholary.tracklist.provider;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * Outcome of one (segment, provider) attempt.
 *
 * <p>Three shapes: a match (succeeded, title and artist set), a clean "no match" (succeeded,
 * confidence 0, no title), and a failure (not succeeded, {@code errorKind} set, confidence 0).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderResult(
    String providerName,
    String trackTitle,
    String artist,
    double confidence,
    double matchedAtOffsetSeconds,
    Map<String, Object> rawMetadata,
    boolean succeeded,
    ErrorKind errorKind) {

  public ProviderResult {
    if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
      throw new IllegalArgumentException("Confidence must be within [0, 1], got " + confidence);
    }
    rawMetadata = rawMetadata == null ? Map.of() : Map.copyOf(rawMetadata);
  }

  public static ProviderResult match(
      String providerName,
      String trackTitle,
      String artist,
      double confidence,
      double matchedAtOffsetSeconds,
      Map<String, Object> rawMetadata) {
    return new ProviderResult(
        providerName,
        trackTitle,
        artist,
        confidence,
        matchedAtOffsetSeconds,
        rawMetadata,
        true,
        null);
  }

  public static ProviderResult noMatch(String providerName, double matchedAtOffsetSeconds) {
    return new ProviderResult(
        providerName, null, null, 0.0, matchedAtOffsetSeconds, Map.of(), true, null);
  }

  public static ProviderResult failed(
      String providerName, ErrorKind errorKind, double matchedAtOffsetSeconds, String message) {
    Map<String, Object> metadata = message == null ? Map.of() : Map.of("error", message);
    return new ProviderResult(
        providerName, null, null, 0.0, matchedAtOffsetSeconds, metadata, false, errorKind);
  }

  /**
   * Whether this result names a track.
   *
   * @return true for successful results carrying a title
   */
  @JsonIgnore
  public boolean hasMatch() {
    return succeeded && trackTitle != null && !trackTitle.isBlank();
  }
}
