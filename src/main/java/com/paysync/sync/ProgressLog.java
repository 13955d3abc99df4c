package com.paysync.sync;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity circular buffer of progress events. Pushing past capacity
 * evicts the oldest entry; snapshots are newest-first.
 */
public class ProgressLog {
  private final ProgressEvent[] buffer;
  private int next;
  private int size;

  public ProgressLog(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.buffer = new ProgressEvent[capacity];
  }

  public synchronized void push(ProgressEvent event) {
    buffer[next] = event;
    next = (next + 1) % buffer.length;
    if (size < buffer.length) {
      size++;
    }
  }

  public synchronized List<ProgressEvent> snapshot() {
    List<ProgressEvent> events = new ArrayList<>(size);
    for (int i = 1; i <= size; i++) {
      events.add(buffer[(next - i + buffer.length) % buffer.length]);
    }
    return List.copyOf(events);
  }

  public synchronized void clear() {
    Arrays.fill(buffer, null);
    next = 0;
    size = 0;
  }

  public synchronized int size() {
    return size;
  }

  public int capacity() {
    return buffer.length;
  }
}
