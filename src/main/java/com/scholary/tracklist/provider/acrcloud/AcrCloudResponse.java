package com.scholary.tracklist.provider.acrcloud;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Response from the ACRCloud {@code /v1/identify} endpoint.
 *
 * <p>Only the fields we use are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AcrCloudResponse(Status status, Metadata metadata) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Status(int code, String msg) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Metadata(List<Music> music) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Music(
      String title,
      List<Artist> artists,
      Album album,
      String label,
      @JsonProperty("release_date") String releaseDate,
      Double score,
      @JsonProperty("play_offset_ms") Long playOffsetMs,
      @JsonProperty("duration_ms") Long durationMs,
      @JsonProperty("external_ids") Map<String, Object> externalIds,
      String acrid) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Artist(String name) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Album(String name) {}
}
