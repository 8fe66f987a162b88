package com.scholary.tracklist.logging;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields in the MDC for the duration of one log call, so the JSON encoder
 * emits them as top-level fields that can be queried in Kibana.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log segment started event. */
  public void logSegmentStarted(int segmentIndex, double start, double durationSeconds) {
    try {
      MDC.put("event_type", "segment_started");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.debug(
          "Segment started: index={}, start={}s, duration={}s",
          segmentIndex,
          start,
          durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment identified event, whatever the outcome. */
  public void logSegmentIdentified(
      int segmentIndex,
      String provider,
      String title,
      String artist,
      double confidence,
      long identifyMs) {
    try {
      MDC.put("event_type", "segment_identified");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("provider", provider);
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("identifyMs", String.valueOf(identifyMs));

      logger.debug(
          "Segment identified: index={}, provider={}, track={} - {}, confidence={}, took={}ms",
          segmentIndex,
          provider,
          artist,
          title,
          confidence,
          identifyMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log cache hit event. */
  public void logCacheHit(int segmentIndex, String fingerprint) {
    try {
      MDC.put("event_type", "cache_hit");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("fingerprint", fingerprint);

      logger.debug("Cache hit: segment={}, fingerprint={}", segmentIndex, fingerprint);
    } finally {
      clearEventFields();
    }
  }

  /** Log provider retry event. */
  public void logProviderRetry(
      int segmentIndex,
      String provider,
      int attempt,
      int maxAttempts,
      String errorKind,
      long delayMs,
      String message) {
    try {
      MDC.put("event_type", "provider_retry");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("provider", provider);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorKind", errorKind);
      MDC.put("delayMs", String.valueOf(delayMs));

      logger.warn(
          "Provider retry: segment={}, provider={}, attempt={}/{}, error={}, delay={}ms, msg={}",
          segmentIndex,
          provider,
          attempt,
          maxAttempts,
          errorKind,
          delayMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log provider failure event; the provider has been given up on for this segment. */
  public void logProviderFailed(
      int segmentIndex, String provider, int attempts, String errorKind, String message) {
    try {
      MDC.put("event_type", "provider_failed");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("provider", provider);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorKind", errorKind);

      logger.warn(
          "Provider failed: segment={}, provider={}, attempts={}, error={}, message={}",
          segmentIndex,
          provider,
          attempts,
          errorKind,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log fallback to the next provider. */
  public void logProviderFallback(
      int segmentIndex, String fromProvider, String toProvider, String reason) {
    try {
      MDC.put("event_type", "provider_fallback");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("provider", fromProvider);
      MDC.put("fallbackProvider", toProvider);

      logger.info(
          "Provider fallback: segment={}, from={}, to={}, reason={}",
          segmentIndex,
          fromProvider,
          toProvider,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a provider's circuit breaker changing state. Opening is logged as a warning. */
  public void logCircuitStateChanged(
      String provider, String state, int consecutiveFailures, long trips) {
    try {
      MDC.put("event_type", "circuit_" + state.toLowerCase(Locale.ROOT));
      MDC.put("provider", provider);
      MDC.put("circuitState", state);
      MDC.put("consecutiveFailures", String.valueOf(consecutiveFailures));
      MDC.put("circuitTrips", String.valueOf(trips));

      if ("OPEN".equals(state)) {
        logger.warn(
            "Circuit opened: provider={}, consecutiveFailures={}, trips={}",
            provider,
            consecutiveFailures,
            trips);
      } else {
        logger.info("Circuit {}: provider={}, trips={}", state, provider, trips);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a segment whose audio could not be read. */
  public void logSegmentUnreadable(int segmentIndex, double start, String message) {
    try {
      MDC.put("event_type", "segment_unreadable");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("start", String.valueOf(start));

      logger.warn(
          "Segment unreadable: segment={}, start={}s, error={}", segmentIndex, start, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a track entering the tracklist. */
  public void logTrackAccepted(
      String title, String artist, double offsetSeconds, double confidence, String provider) {
    try {
      MDC.put("event_type", "track_accepted");
      MDC.put("start", String.valueOf(offsetSeconds));
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("provider", provider);

      logger.info(
          "Track accepted: {} - {} at {}s (confidence={}, provider={})",
          artist,
          title,
          offsetSeconds,
          confidence,
          provider);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int segmentsProcessed, int totalSegments, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("segmentsProcessed", String.valueOf(segmentsProcessed));
      MDC.put("totalSegments", String.valueOf(totalSegments));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, segments={}/{}, progress={}%",
          jobId,
          phase,
          segmentsProcessed,
          totalSegments,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String sourceId) {
    MDC.put("jobId", jobId);
    MDC.put("sourceId", sourceId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sourceId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("segment_index");
    MDC.remove("start");
    MDC.remove("durationSeconds");
    MDC.remove("provider");
    MDC.remove("fallbackProvider");
    MDC.remove("confidence");
    MDC.remove("identifyMs");
    MDC.remove("fingerprint");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("errorKind");
    MDC.remove("delayMs");
    MDC.remove("segmentsProcessed");
    MDC.remove("totalSegments");
    MDC.remove("percentComplete");
    MDC.remove("phase");
    MDC.remove("circuitState");
    MDC.remove("consecutiveFailures");
    MDC.remove("circuitTrips");
  }
}
