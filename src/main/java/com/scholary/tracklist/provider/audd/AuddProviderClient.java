package com.scholary.tracklist.provider.audd;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tracklist.audio.WavEncoder;
import com.scholary.tracklist.provider.AbstractHttpProviderClient;
import com.scholary.tracklist.provider.ErrorKind;
import com.scholary.tracklist.provider.MultipartBody;
import com.scholary.tracklist.provider.ProviderException;
import com.scholary.tracklist.provider.ProviderResult;
import com.scholary.tracklist.segment.AudioSegment;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the AudD recognition API.
 *
 * <p>Errors come back as HTTP 200 with {@code status=error} and a numeric code. Codes 900 and 904
 * are token problems, 901 and 902 are request limits, 300-799 are problems with the uploaded
 * audio.
 */
public class AuddProviderClient extends AbstractHttpProviderClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AuddProviderClient.class);

  public static final String NAME = "audd";

  private final AuddProperties properties;

  public AuddProviderClient(AuddProperties properties, ObjectMapper objectMapper) {
    super(
        objectMapper,
        Duration.ofSeconds(properties.connectTimeout()),
        Duration.ofSeconds(properties.readTimeout()));
    this.properties = properties;
    LOGGER.info("Initialized AudD client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ProviderResult identify(AudioSegment segment) {
    if (!segment.hasSamples()) {
      throw new ProviderException(NAME, ErrorKind.MALFORMED_REQUEST, "Segment has no audio");
    }
    MultipartBody body =
        new MultipartBody()
            .field("api_token", properties.apiToken())
            .field("return", "")
            .file(
                "file",
                "segment-" + segment.index() + ".wav",
                "audio/wav",
                WavEncoder.encode(segment.samples(), segment.format()));

    String json = postMultipart(URI.create(properties.baseUrl()), body);
    return toResult(readJson(json, AuddResponse.class), segment);
  }

  ProviderResult toResult(AuddResponse response, AudioSegment segment) {
    if (response == null || response.status() == null) {
      throw new ProviderException(NAME, ErrorKind.UNKNOWN, "Response without status");
    }
    if ("error".equals(response.status())) {
      AuddResponse.Error error = response.error();
      if (error == null) {
        throw new ProviderException(NAME, ErrorKind.UNKNOWN, "Error response without details");
      }
      throw new ProviderException(
          NAME,
          classify(error.errorCode()),
          "AudD error " + error.errorCode() + ": " + error.errorMessage());
    }

    AuddResponse.Result result = response.result();
    if (result == null || result.title() == null || result.title().isBlank()) {
      LOGGER.debug("No result for segment {}", segment.index());
      return ProviderResult.noMatch(NAME, segment.startOffsetSeconds());
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    putIfPresent(metadata, "album", result.album());
    putIfPresent(metadata, "label", result.label());
    putIfPresent(metadata, "releaseDate", result.releaseDate());
    putIfPresent(metadata, "songLink", result.songLink());
    Double trackOffset = parseTimecode(result.timecode());
    if (trackOffset != null) {
      metadata.put("trackOffsetSeconds", trackOffset);
    }

    String artist =
        result.artist() == null || result.artist().isBlank() ? "Unknown" : result.artist();
    return ProviderResult.match(
        NAME,
        result.title(),
        artist,
        properties.matchConfidence(),
        segment.startOffsetSeconds(),
        metadata);
  }

  static ErrorKind classify(int errorCode) {
    if (errorCode == 900 || errorCode == 904) {
      return ErrorKind.AUTH_ERROR;
    }
    if (errorCode == 901 || errorCode == 902) {
      return ErrorKind.RATE_LIMITED;
    }
    if (errorCode >= 300 && errorCode < 800) {
      return ErrorKind.MALFORMED_REQUEST;
    }
    return ErrorKind.UNKNOWN;
  }

  /** Parses {@code mm:ss} or {@code hh:mm:ss}; returns null for anything else. */
  static Double parseTimecode(String timecode) {
    if (timecode == null || timecode.isBlank()) {
      return null;
    }
    String[] parts = timecode.trim().split(":");
    if (parts.length < 2 || parts.length > 3) {
      return null;
    }
    double seconds = 0;
    try {
      for (String part : parts) {
        seconds = seconds * 60 + Integer.parseInt(part);
      }
    } catch (NumberFormatException e) {
      return null;
    }
    return seconds;
  }

  private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
    if (value != null) {
      metadata.put(key, value);
    }
  }
}
