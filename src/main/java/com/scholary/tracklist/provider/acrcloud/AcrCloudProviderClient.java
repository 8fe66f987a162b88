package com.scholary.tracklist.provider.acrcloud;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tracklist.audio.WavEncoder;
import com.scholary.tracklist.provider.AbstractHttpProviderClient;
import com.scholary.tracklist.provider.ErrorKind;
import com.scholary.tracklist.provider.MultipartBody;
import com.scholary.tracklist.provider.ProviderException;
import com.scholary.tracklist.provider.ProviderResult;
import com.scholary.tracklist.segment.AudioSegment;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the ACRCloud identification API.
 *
 * <p>Requests are signed with HMAC-SHA1 over {@code POST\n/v1/identify\n<key>\naudio\n1\n<ts>}.
 * ACRCloud answers 200 for most errors and reports them in {@code status.code}:
 *
 * <ul>
 *   <li>0: match
 *   <li>1001: no result
 *   <li>2000-2005: the sample could not be decoded or fingerprinted
 *   <li>3001, 3014: bad access key or signature
 *   <li>3003, 3015: quota or QPS limit
 * </ul>
 */
public class AcrCloudProviderClient extends AbstractHttpProviderClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AcrCloudProviderClient.class);

  public static final String NAME = "acrcloud";
  private static final String ENDPOINT = "/v1/identify";

  private final AcrCloudProperties properties;
  private final Clock clock;

  public AcrCloudProviderClient(AcrCloudProperties properties, ObjectMapper objectMapper) {
    this(properties, objectMapper, Clock.systemUTC());
  }

  AcrCloudProviderClient(AcrCloudProperties properties, ObjectMapper objectMapper, Clock clock) {
    super(
        objectMapper,
        Duration.ofSeconds(properties.connectTimeout()),
        Duration.ofSeconds(properties.readTimeout()));
    this.properties = properties;
    this.clock = clock;
    LOGGER.info("Initialized ACRCloud client: baseUrl={}", properties.baseUrl());
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
    byte[] wav = WavEncoder.encode(segment.samples(), segment.format());
    String timestamp = String.valueOf(clock.instant().getEpochSecond());

    MultipartBody body =
        new MultipartBody()
            .field("access_key", properties.accessKey())
            .field("data_type", "audio")
            .field("signature_version", "1")
            .field("signature", sign(timestamp))
            .field("sample_bytes", String.valueOf(wav.length))
            .field("timestamp", timestamp)
            .file("sample", "segment-" + segment.index() + ".wav", "audio/wav", wav);

    String json = postMultipart(URI.create(properties.baseUrl() + ENDPOINT), body);
    return toResult(readJson(json, AcrCloudResponse.class), segment);
  }

  String sign(String timestamp) {
    String stringToSign =
        String.join("\n", "POST", ENDPOINT, properties.accessKey(), "audio", "1", timestamp);
    try {
      Mac mac = Mac.getInstance("HmacSHA1");
      byte[] key = properties.accessSecret().getBytes(StandardCharsets.UTF_8);
      mac.init(new SecretKeySpec(key, "HmacSHA1"));
      byte[] digest = mac.doFinal(stringToSign.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(digest);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA1 unavailable", e);
    }
  }

  ProviderResult toResult(AcrCloudResponse response, AudioSegment segment) {
    if (response == null || response.status() == null) {
      throw new ProviderException(NAME, ErrorKind.UNKNOWN, "Response without status");
    }
    int code = response.status().code();
    String msg = response.status().msg();

    if (code == 1001) {
      LOGGER.debug("No result for segment {}", segment.index());
      return ProviderResult.noMatch(NAME, segment.startOffsetSeconds());
    }
    if (code != 0) {
      throw new ProviderException(NAME, classify(code), "ACRCloud status " + code + ": " + msg);
    }

    List<AcrCloudResponse.Music> music =
        response.metadata() != null ? response.metadata().music() : null;
    if (music == null || music.isEmpty()) {
      return ProviderResult.noMatch(NAME, segment.startOffsetSeconds());
    }
    AcrCloudResponse.Music best = music.get(0);

    String artist =
        best.artists() == null || best.artists().isEmpty()
            ? "Unknown"
            : best.artists().get(0).name();
    double confidence = best.score() == null ? 0.0 : Math.min(100.0, best.score()) / 100.0;

    Map<String, Object> metadata = new LinkedHashMap<>();
    putIfPresent(metadata, "album", best.album() != null ? best.album().name() : null);
    putIfPresent(metadata, "label", best.label());
    putIfPresent(metadata, "releaseDate", best.releaseDate());
    putIfPresent(metadata, "acrid", best.acrid());
    if (best.playOffsetMs() != null) {
      metadata.put("trackOffsetSeconds", best.playOffsetMs() / 1000.0);
    }
    if (best.durationMs() != null) {
      metadata.put("trackDurationSeconds", best.durationMs() / 1000.0);
    }
    if (best.externalIds() != null) {
      best.externalIds().forEach((k, v) -> putIfPresent(metadata, k, v));
    }

    return ProviderResult.match(
        NAME, best.title(), artist, confidence, segment.startOffsetSeconds(), metadata);
  }

  static ErrorKind classify(int statusCode) {
    if (statusCode == 3001 || statusCode == 3014) {
      return ErrorKind.AUTH_ERROR;
    }
    if (statusCode == 3003 || statusCode == 3015) {
      return ErrorKind.RATE_LIMITED;
    }
    if (statusCode >= 2000 && statusCode < 3000) {
      return ErrorKind.MALFORMED_REQUEST;
    }
    return ErrorKind.UNKNOWN;
  }

  private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
    if (value != null) {
      metadata.put(key, value);
    }
  }
}
