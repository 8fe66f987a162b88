package com.scholary.tracklist.api;

import com.scholary.tracklist.audio.PcmFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/** PCM layout of the stored mix. Missing fields default to 44.1 kHz, stereo, 16-bit. */
public record PcmFormatRequest(
    @Min(8000) @Max(192000) Integer sampleRate,
    @Min(1) @Max(8) Integer channels,
    Integer bitsPerSample) {

  public PcmFormat toPcmFormat() {
    PcmFormat defaults = PcmFormat.CD_QUALITY;
    return new PcmFormat(
        sampleRate != null ? sampleRate : defaults.sampleRate(),
        channels != null ? channels : defaults.channels(),
        bitsPerSample != null ? bitsPerSample : defaults.bitsPerSample());
  }
}
