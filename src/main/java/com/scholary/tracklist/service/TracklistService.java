package com.scholary.tracklist.service;

import com.scholary.tracklist.api.PcmFormatRequest;
import com.scholary.tracklist.api.TracklistRequest;
import com.scholary.tracklist.api.TracklistResponse;
import com.scholary.tracklist.audio.AudioSource;
import com.scholary.tracklist.audio.ObjectStoreAudioSource;
import com.scholary.tracklist.audio.PcmFormat;
import com.scholary.tracklist.config.ConfigurationException;
import com.scholary.tracklist.config.TracklistProperties;
import com.scholary.tracklist.logging.StructuredLogger;
import com.scholary.tracklist.matching.Track;
import com.scholary.tracklist.objectstore.ObjectStoreClient;
import com.scholary.tracklist.pipeline.CancellationToken;
import com.scholary.tracklist.pipeline.PipelineListener;
import com.scholary.tracklist.pipeline.PipelineRun;
import com.scholary.tracklist.pipeline.PipelineSettings;
import com.scholary.tracklist.pipeline.TracklistPipeline;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Identifies the tracklist of a mix stored in object storage.
 *
 * <p>Merges request overrides into the configured defaults, opens the stored PCM as an {@link
 * AudioSource} and runs the {@link TracklistPipeline}. Used directly by the synchronous endpoint
 * and by {@link com.scholary.tracklist.job.JobRunner} for async jobs.
 */
@Service
public class TracklistService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TracklistService.class);

  private final ObjectStoreClient objectStoreClient;
  private final TracklistPipeline pipeline;
  private final PipelineSettings defaults;

  public TracklistService(
      ObjectStoreClient objectStoreClient,
      TracklistPipeline pipeline,
      TracklistProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.pipeline = pipeline;
    this.defaults = PipelineSettings.from(properties);
  }

  /** Run a request synchronously, honouring its time budget. */
  public TracklistResponse identify(TracklistRequest request) {
    return identify(
        request,
        UUID.randomUUID().toString(),
        cancellationFor(request),
        PipelineListener.NONE);
  }

  /**
   * Run a request.
   *
   * @param request what to identify
   * @param jobId correlation id, put in the MDC for every log line of the run
   * @param cancellation cooperative cancellation for the run
   * @param listener progress callbacks
   * @return the tracklist, partial if the run was cancelled
   * @throws ConfigurationException if the merged settings or the format are invalid
   * @throws com.scholary.tracklist.audio.AudioSourceException if the mix cannot be read
   */
  public TracklistResponse identify(
      TracklistRequest request,
      String jobId,
      CancellationToken cancellation,
      PipelineListener listener) {
    PipelineSettings settings = settingsFor(request);
    PcmFormat format = formatFor(request.format());

    AudioSource source =
        new ObjectStoreAudioSource(objectStoreClient, request.bucket(), request.key(), format);
    try {
      StructuredLogger.setJobContext(jobId, source.sourceId());
      LOGGER.info(
          "Identifying tracklist: source={}, segmentLength={}s, overlap={}s, providers={}",
          source.sourceId(),
          settings.segmentLengthSeconds(),
          settings.overlapSeconds(),
          settings.providerPriorityOrder());

      PipelineRun run = pipeline.run(source, settings, cancellation, listener);
      return toResponse(jobId, source.sourceId(), run);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Effective settings for a request.
   *
   * @throws ConfigurationException if any merged option is out of range
   */
  public PipelineSettings settingsFor(TracklistRequest request) {
    PipelineSettings settings =
        request.overrides() == null ? defaults : request.overrides().applyTo(defaults);
    return settings.validate();
  }

  public static CancellationToken cancellationFor(TracklistRequest request) {
    return request.timeBudgetSeconds() == null
        ? CancellationToken.create()
        : CancellationToken.withBudget(Duration.ofSeconds(request.timeBudgetSeconds()));
  }

  static TracklistResponse toResponse(String jobId, String sourceId, PipelineRun run) {
    List<TracklistResponse.TrackEntry> entries = new ArrayList<>();
    List<Track> tracks = run.tracklist().tracks();
    for (int i = 0; i < tracks.size(); i++) {
      entries.add(TracklistResponse.TrackEntry.of(i + 1, tracks.get(i)));
    }
    return new TracklistResponse(jobId, sourceId, entries, run.partial(), run.diagnostics());
  }

  private static PcmFormat formatFor(PcmFormatRequest format) {
    if (format == null) {
      return PcmFormat.CD_QUALITY;
    }
    try {
      return format.toPcmFormat();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage());
    }
  }
}
