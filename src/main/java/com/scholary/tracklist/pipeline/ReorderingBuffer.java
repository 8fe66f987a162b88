package com.scholary.tracklist.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Turns items completed in any order back into index order.
 *
 * <p>Indexes start at 0 and must be dense; each one is offered once. Not thread-safe.
 */
public final class ReorderingBuffer<T> {

  private final NavigableMap<Integer, T> pending = new TreeMap<>();
  private int nextIndex;

  /**
   * Add a completed item.
   *
   * @return the items that can now be delivered, in index order; often empty
   * @throws IllegalArgumentException if the index was already delivered or is already pending
   */
  public List<T> offer(int index, T item) {
    if (index < nextIndex || pending.containsKey(index)) {
      throw new IllegalArgumentException("Index " + index + " offered twice");
    }
    pending.put(index, item);
    List<T> ready = new ArrayList<>();
    while (!pending.isEmpty() && pending.firstKey() == nextIndex) {
      ready.add(pending.pollFirstEntry().getValue());
      nextIndex++;
    }
    return ready;
  }

  public int nextIndex() {
    return nextIndex;
  }

  public int pendingCount() {
    return pending.size();
  }
}
