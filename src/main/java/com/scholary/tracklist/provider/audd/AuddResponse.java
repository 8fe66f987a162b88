package com.scholary.tracklist.provider.audd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Response from the AudD recognition endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuddResponse(String status, Result result, Error error) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(
      String artist,
      String title,
      String album,
      @JsonProperty("release_date") String releaseDate,
      String label,
      String timecode,
      @JsonProperty("song_link") String songLink) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Error(
      @JsonProperty("error_code") int errorCode,
      @JsonProperty("error_message") String errorMessage) {}
}
