package com.scholary.tracklist.matching;

import com.scholary.tracklist.logging.StructuredLogger;
import com.scholary.tracklist.provider.ProviderResult;
import com.scholary.tracklist.segment.AudioSegment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consolidates per-segment results into a tracklist.
 *
 * <p>Segments must be fed in index order. Only the top-ranked result of each segment is looked
 * at. For an accepted result (succeeded, titled, at or above the confidence threshold):
 *
 * <ul>
 *   <li>same track as the last accepted one and within the time threshold of its last sighting:
 *       extend that entry
 *   <li>same track as an earlier entry still within the time threshold: extend that entry, even
 *       though another track was accepted in between. This goes beyond continuing only the most
 *       recent track, so a brief misidentification inside a track does not split it in two
 *   <li>same track as an earlier entry, further apart than the threshold: new entry if the track
 *       has fewer than {@code maxDuplicates} entries, otherwise only bump the count of its latest
 *       entry
 *   <li>otherwise: new entry
 * </ul>
 *
 * <p>Not thread-safe. One instance per run, owned by the consolidating thread.
 */
public class TrackMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackMatcher.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final MatcherSettings settings;
  private final List<Entry> entries = new ArrayList<>();
  private final Map<TrackIdentity, List<Entry>> entriesByIdentity = new HashMap<>();
  private Entry lastAccepted;
  private boolean finalized;

  public TrackMatcher(MatcherSettings settings) {
    this.settings = settings;
  }

  /**
   * Feed the results for the next segment.
   *
   * @param segment the segment, in index order
   * @param results results ranked best first, possibly empty
   * @return what happened to the segment
   * @throws IllegalStateException after {@link #finalizeTracklist()}
   */
  public MatchDecision consume(AudioSegment segment, List<ProviderResult> results) {
    if (finalized) {
      throw new IllegalStateException("Tracklist already finalized");
    }
    if (results.isEmpty()) {
      return MatchDecision.REJECTED;
    }
    ProviderResult top = results.get(0);
    if (!top.hasMatch() || top.confidence() < settings.minConfidenceThreshold()) {
      return MatchDecision.REJECTED;
    }

    TrackIdentity identity = TrackIdentity.of(top.trackTitle(), top.artist());
    double offset = segment.startOffsetSeconds();

    if (lastAccepted != null
        && lastAccepted.identity.equals(identity)
        && withinThreshold(lastAccepted, offset)) {
      lastAccepted.extend(offset, top);
      return MatchDecision.CONTINUED;
    }

    List<Entry> previous = entriesByIdentity.get(identity);
    if (previous == null) {
      append(identity, offset, top);
      return MatchDecision.NEW;
    }

    Entry latest = previous.get(previous.size() - 1);
    if (withinThreshold(latest, offset)) {
      latest.extend(offset, top);
      lastAccepted = latest;
      return MatchDecision.MERGED;
    }
    if (previous.size() < settings.maxDuplicates()) {
      append(identity, offset, top);
      return MatchDecision.REPLAYED;
    }
    latest.occurrenceCount++;
    LOGGER.debug(
        "Suppressed replay of {} at {}s: {} entries already", identity, offset, previous.size());
    return MatchDecision.SUPPRESSED;
  }

  /** Current state, ordered like the final tracklist. Safe to call at any time. */
  public Tracklist snapshot() {
    List<Track> tracks = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      tracks.add(entry.toTrack());
    }
    tracks.sort(Comparator.comparingDouble(Track::firstSeenOffsetSeconds));
    return new Tracklist(tracks);
  }

  /**
   * Finish consolidation. Further {@link #consume} calls are rejected.
   *
   * @return the tracks ordered by first sighting
   */
  public Tracklist finalizeTracklist() {
    finalized = true;
    return snapshot();
  }

  private boolean withinThreshold(Entry entry, double offset) {
    return offset - entry.lastSeen <= settings.timeThresholdSeconds();
  }

  private void append(TrackIdentity identity, double offset, ProviderResult result) {
    Entry entry = new Entry(identity, offset, result);
    entries.add(entry);
    entriesByIdentity.computeIfAbsent(identity, k -> new ArrayList<>()).add(entry);
    lastAccepted = entry;
    STRUCTURED_LOGGER.logTrackAccepted(
        result.trackTitle(), result.artist(), offset, result.confidence(), result.providerName());
  }

  private static final class Entry {
    private final TrackIdentity identity;
    private final String title;
    private final String artist;
    private final double firstSeen;
    private double lastSeen;
    private double confidence;
    private String sourceProvider;
    private int occurrenceCount;

    Entry(TrackIdentity identity, double offset, ProviderResult result) {
      this.identity = identity;
      this.title = result.trackTitle();
      this.artist = result.artist();
      this.firstSeen = offset;
      this.lastSeen = offset;
      this.confidence = result.confidence();
      this.sourceProvider = result.providerName();
      this.occurrenceCount = 1;
    }

    void extend(double offset, ProviderResult result) {
      lastSeen = Math.max(lastSeen, offset);
      occurrenceCount++;
      if (result.confidence() > confidence) {
        confidence = result.confidence();
        sourceProvider = result.providerName();
      }
    }

    Track toTrack() {
      return new Track(
          title, artist, confidence, firstSeen, lastSeen, sourceProvider, occurrenceCount);
    }
  }
}
