package com.streamfirst.mosaic.application;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed-capacity ring of the most recently placed tile indices; adding to a full ring evicts the
 * oldest entry. Membership checks are constant time.
 */
final class RecentTiles {

  private final int[] ring;
  private final Map<Integer, Integer> counts = new HashMap<>();
  private int head;
  private int size;

  RecentTiles(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
    }
    this.ring = new int[capacity];
  }

  void add(int tileIndex) {
    if (ring.length == 0) {
      return;
    }
    if (size == ring.length) {
      int evicted = ring[head];
      counts.computeIfPresent(evicted, (k, n) -> n == 1 ? null : n - 1);
    } else {
      size++;
    }
    ring[head] = tileIndex;
    counts.merge(tileIndex, 1, Integer::sum);
    head = (head + 1) % ring.length;
  }

  boolean contains(int tileIndex) {
    return counts.containsKey(tileIndex);
  }

  int size() {
    return size;
  }

  int capacity() {
    return ring.length;
  }
}
