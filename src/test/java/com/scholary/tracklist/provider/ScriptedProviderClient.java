package com.scholary.tracklist.provider;

import com.scholary.tracklist.segment.AudioSegment;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** Provider client whose answers are computed by a test-supplied function. */
public final class ScriptedProviderClient implements ProviderClient {

  private final String name;
  private final Function<AudioSegment, ProviderResult> behaviour;
  private final List<Integer> calls = new CopyOnWriteArrayList<>();

  public ScriptedProviderClient(String name, Function<AudioSegment, ProviderResult> behaviour) {
    this.name = name;
    this.behaviour = behaviour;
  }

  public static ScriptedProviderClient matching(
      String name, String title, String artist, double confidence) {
    return new ScriptedProviderClient(
        name,
        segment ->
            ProviderResult.match(
                name, title, artist, confidence, segment.startOffsetSeconds(), Map.of()));
  }

  public static ScriptedProviderClient failing(String name, ErrorKind kind) {
    return new ScriptedProviderClient(
        name,
        segment -> {
          throw new ProviderException(name, kind, "scripted " + kind);
        });
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public ProviderResult identify(AudioSegment segment) {
    calls.add(segment.index());
    return behaviour.apply(segment);
  }

  public int callCount() {
    return calls.size();
  }

  /** Segment indexes in call order. */
  public List<Integer> calls() {
    return calls;
  }
}
