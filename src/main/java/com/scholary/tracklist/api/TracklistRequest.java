package com.scholary.tracklist.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request to identify the tracks of a mix stored as raw PCM in object storage.
 *
 * @param format PCM layout; defaults to 44.1 kHz stereo 16-bit
 * @param overrides pipeline options for this request only
 * @param timeBudgetSeconds stop starting new segments after this many seconds and return what was
 *     found so far
 */
public record TracklistRequest(
    @NotBlank String bucket,
    @NotBlank String key,
    @Valid PcmFormatRequest format,
    PipelineOverrides overrides,
    @Positive Long timeBudgetSeconds) {}
