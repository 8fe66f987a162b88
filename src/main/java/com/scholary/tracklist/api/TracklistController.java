package com.scholary.tracklist.api;

import com.scholary.tracklist.service.TracklistService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous tracklist identification.
 *
 * <p>Holds the connection for the whole run; use {@code /v1/jobs} for long mixes, or set a
 * {@code timeBudgetSeconds} to get a partial tracklist back in bounded time.
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "Tracklists", description = "Identify the tracks played in a DJ mix")
public class TracklistController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TracklistController.class);

  private final TracklistService tracklistService;

  public TracklistController(TracklistService tracklistService) {
    this.tracklistService = tracklistService;
  }

  @PostMapping("/tracklists")
  @Operation(
      summary = "Identify a tracklist",
      description =
          "Split the stored mix into segments, identify each one against the configured "
              + "recognition providers and return the consolidated tracklist.")
  public ResponseEntity<TracklistResponse> identify(@Valid @RequestBody TracklistRequest request) {
    LOGGER.info("Tracklist request: bucket={}, key={}", request.bucket(), request.key());
    return ResponseEntity.ok(tracklistService.identify(request));
  }
}
