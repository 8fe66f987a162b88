package com.scholary.tracklist.pipeline;

import com.scholary.tracklist.audio.AudioSource;
import com.scholary.tracklist.cache.IdentificationCache;
import com.scholary.tracklist.audio.AudioSourceException;
import com.scholary.tracklist.identify.CircuitBreakerProperties;
import com.scholary.tracklist.identify.OrchestratorStats;
import com.scholary.tracklist.identify.ProviderOrchestrator;
import com.scholary.tracklist.logging.StructuredLogger;
import com.scholary.tracklist.matching.MatchDecision;
import com.scholary.tracklist.matching.TrackMatcher;
import com.scholary.tracklist.matching.Tracklist;
import com.scholary.tracklist.provider.ErrorKind;
import com.scholary.tracklist.provider.ProviderClient;
import com.scholary.tracklist.provider.ProviderRegistry;
import com.scholary.tracklist.provider.ProviderResult;
import com.scholary.tracklist.ratelimit.RateLimiter;
import com.scholary.tracklist.retry.RetryPolicy;
import com.scholary.tracklist.segment.AudioSegment;
import com.scholary.tracklist.segment.SegmentReadException;
import com.scholary.tracklist.segment.Segmenter;
import java.time.Clock;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs segmentation, identification and matching for one recording.
 *
 * <p>The calling thread reads segments lazily and hands each one to the segment executor, with at
 * most {@code maxConcurrentSegments} in flight. Completed identifications come back in any order
 * and pass through a {@link ReorderingBuffer}, so the {@link TrackMatcher} always sees segments
 * in index order. The matcher is only touched by the calling thread.
 *
 * <p>On cancellation no further segment is started; segments already in flight are awaited and
 * delivered, and the tracklist built so far is returned flagged as partial.
 *
 * <p>A segment whose audio cannot be read is delivered as a failed, zero-confidence result and the
 * run moves on. The run only fails on unreadable audio when not a single segment could be read.
 */
@Component
public class TracklistPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(TracklistPipeline.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final long POLL_MILLIS = 50;

  private final Segmenter segmenter;
  private final ProviderRegistry providerRegistry;
  private final IdentificationCache cache;
  private final RateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;
  private final CircuitBreakerProperties circuitBreaker;
  private final Executor segmentExecutor;

  public TracklistPipeline(
      Segmenter segmenter,
      ProviderRegistry providerRegistry,
      IdentificationCache cache,
      RateLimiter rateLimiter,
      RetryPolicy retryPolicy,
      CircuitBreakerProperties circuitBreaker,
      @Qualifier("segmentExecutor") Executor segmentExecutor) {
    this.segmenter = segmenter;
    this.providerRegistry = providerRegistry;
    this.cache = cache;
    this.rateLimiter = rateLimiter;
    this.retryPolicy = retryPolicy;
    this.circuitBreaker = circuitBreaker;
    this.segmentExecutor = segmentExecutor;
  }

  /** Run to completion without cancellation or progress reporting. */
  public Tracklist run(AudioSource source, PipelineSettings settings) {
    return run(source, settings, CancellationToken.create(), PipelineListener.NONE).tracklist();
  }

  /**
   * Identify the tracks of a recording.
   *
   * @param source the normalized recording
   * @param settings options for this run
   * @param cancellation checked before each segment is started
   * @param listener progress callbacks
   * @return the tracklist with diagnostics
   * @throws com.scholary.tracklist.config.ConfigurationException before any processing if the
   *     settings are invalid
   * @throws AudioSourceException if no segment of the audio could be read
   */
  public PipelineRun run(
      AudioSource source,
      PipelineSettings settings,
      CancellationToken cancellation,
      PipelineListener listener) {
    settings.validate();
    List<ProviderClient> providers = providerRegistry.resolve(settings.providerPriorityOrder());
    Iterable<AudioSegment> segments =
        segmenter.segment(source, settings.segmentLengthSeconds(), settings.overlapSeconds());
    int total =
        segmenter.countSegments(
            source.durationSeconds(), settings.segmentLengthSeconds(), settings.overlapSeconds());

    ProviderOrchestrator orchestrator =
        new ProviderOrchestrator(
            providers,
            cache,
            rateLimiter,
            retryPolicy,
            settings.acceptanceThreshold(),
            settings.fallbackEnabled(),
            settings.cacheTtl(),
            circuitBreaker,
            Clock.systemUTC());
    Run run = new Run(orchestrator, new TrackMatcher(settings.matcherSettings()), listener, total);

    long start = System.currentTimeMillis();
    LOGGER.info(
        "Starting pipeline: source={}, segments={}, providers={}, maxConcurrentSegments={}",
        source.sourceId(),
        total,
        settings.providerPriorityOrder(),
        settings.maxConcurrentSegments());
    listener.onStarted(source.sourceId(), total);

    boolean cancelled = run.execute(segments, settings.maxConcurrentSegments(), cancellation);
    if (run.firstReadFailure != null && run.unreadable == run.delivered) {
      throw run.firstReadFailure;
    }

    Tracklist tracklist = run.matcher.finalizeTracklist();
    OrchestratorStats stats = orchestrator.stats();
    PipelineDiagnostics diagnostics =
        new PipelineDiagnostics(
            total,
            run.delivered,
            stats.cacheHits(),
            stats.providerCalls(),
            stats.exhaustedSegments(),
            run.unreadable,
            stats.providerCallsByName(),
            stats.circuitTripsByName(),
            cancelled,
            System.currentTimeMillis() - start);
    boolean partial = cancelled && run.delivered < total;

    LOGGER.info(
        "Pipeline finished: source={}, tracks={}, segments={}/{}, cacheHits={}, cancelled={}",
        source.sourceId(),
        tracklist.size(),
        run.delivered,
        total,
        stats.cacheHits(),
        cancelled);
    return new PipelineRun(tracklist, diagnostics, partial);
  }

  /** State of one run. Everything except {@link #completed} is confined to the calling thread. */
  private final class Run {

    private final ProviderOrchestrator orchestrator;
    private final TrackMatcher matcher;
    private final PipelineListener listener;
    private final int total;
    private final ReorderingBuffer<Outcome> buffer = new ReorderingBuffer<>();
    private final BlockingQueue<Outcome> completed = new LinkedBlockingQueue<>();
    private int submitted;
    private int delivered;
    private int unreadable;
    private AudioSourceException firstReadFailure;

    Run(
        ProviderOrchestrator orchestrator,
        TrackMatcher matcher,
        PipelineListener listener,
        int total) {
      this.orchestrator = orchestrator;
      this.matcher = matcher;
      this.listener = listener;
      this.total = total;
    }

    /** Returns whether the run was cancelled before every segment was started. */
    boolean execute(
        Iterable<AudioSegment> segments, int maxConcurrent, CancellationToken cancellation) {
      Semaphore slots = new Semaphore(maxConcurrent);
      Map<String, String> context = MDC.getCopyOfContextMap();
      Iterator<AudioSegment> iterator = segments.iterator();
      boolean cancelled = false;
      boolean interrupted = false;

      try {
        while (true) {
          drainCompleted();
          if (cancellation.isCancelled()) {
            cancelled = iterator.hasNext();
            break;
          }
          if (!iterator.hasNext()) {
            break;
          }
          if (!slots.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            continue;
          }
          AudioSegment segment;
          try {
            segment = iterator.next();
          } catch (SegmentReadException e) {
            slots.release();
            skipUnreadable(e);
            continue;
          } catch (RuntimeException e) {
            slots.release();
            throw e;
          }
          submit(segment, slots, context);
        }
        awaitInFlight();
      } catch (InterruptedException e) {
        LOGGER.warn("Pipeline interrupted, finishing with segments already started");
        cancellation.cancel();
        cancelled = true;
        interrupted = true;
        awaitInFlightUninterruptibly();
      } finally {
        // Never return while workers may still touch the queue.
        slots.acquireUninterruptibly(maxConcurrent);
        slots.release(maxConcurrent);
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
      return cancelled;
    }

    private void submit(AudioSegment segment, Semaphore slots, Map<String, String> context) {
      STRUCTURED_LOGGER.logSegmentStarted(
          segment.index(), segment.startOffsetSeconds(), segment.durationSeconds());
      try {
        segmentExecutor.execute(
            () -> {
              if (context != null) {
                MDC.setContextMap(context);
              }
              try {
                completed.add(new Outcome(withoutSamples(segment), identify(segment)));
              } finally {
                slots.release();
                MDC.clear();
              }
            });
        submitted++;
      } catch (RejectedExecutionException e) {
        slots.release();
        throw e;
      }
    }

    private void skipUnreadable(SegmentReadException e) {
      AudioSegment segment = e.getSegment();
      STRUCTURED_LOGGER.logSegmentUnreadable(
          segment.index(), segment.startOffsetSeconds(), e.getMessage());
      if (firstReadFailure == null) {
        // The storage failure itself, so callers can tell a missing object from an outage.
        firstReadFailure = (AudioSourceException) e.getCause();
      }
      unreadable++;
      submitted++;
      completed.add(
          new Outcome(
              segment,
              List.of(
                  ProviderResult.failed(
                      "pipeline",
                      ErrorKind.UNKNOWN,
                      segment.startOffsetSeconds(),
                      "Audio unreadable: " + e.getCause().getMessage()))));
    }

    private List<ProviderResult> identify(AudioSegment segment) {
      try {
        return orchestrator.identify(segment);
      } catch (RuntimeException e) {
        LOGGER.error("Unexpected failure identifying segment {}", segment.index(), e);
        return List.of(
            ProviderResult.failed(
                "pipeline", ErrorKind.UNKNOWN, segment.startOffsetSeconds(), e.toString()));
      }
    }

    private void drainCompleted() {
      Outcome outcome;
      while ((outcome = completed.poll()) != null) {
        deliver(outcome);
      }
    }

    private void awaitInFlight() throws InterruptedException {
      while (delivered < submitted) {
        Outcome outcome = completed.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (outcome != null) {
          deliver(outcome);
        }
      }
    }

    private void awaitInFlightUninterruptibly() {
      while (delivered < submitted) {
        try {
          awaitInFlight();
        } catch (InterruptedException e) {
          LOGGER.debug("Interrupted again, still awaiting {} segments", submitted - delivered);
        }
      }
    }

    private void deliver(Outcome outcome) {
      for (Outcome ready : buffer.offer(outcome.segment().index(), outcome)) {
        MatchDecision decision = matcher.consume(ready.segment(), ready.results());
        delivered++;
        listener.onSegmentDelivered(ready.segment().index(), delivered, total, decision);
      }
    }
  }

  private static AudioSegment withoutSamples(AudioSegment segment) {
    return new AudioSegment(
        segment.index(),
        segment.sourceId(),
        segment.startOffsetSeconds(),
        segment.durationSeconds(),
        segment.format(),
        null);
  }

  private record Outcome(AudioSegment segment, List<ProviderResult> results) {}
}
