/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package tracescope.channel;

import tracescope.util.FiberOnly;
import com.google.common.base.Ticker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Bounded history of keyed messages, oldest first. When full, adding a message evicts the
 * oldest one; with a maximum age set, messages older than that are evicted as well. Keys
 * must be added in increasing order.
 * <p/>
 * Not thread safe; owned by the fiber of a {@link ReliableChannel}.
 */
public class ReplayBuffer<T> {
  private final int capacity;
  private final long maxAgeNanos;
  private final Ticker ticker;
  private final Deque<Entry<T>> entries;

  private long highestEvictedKey = 0;

  /**
   * @param capacity     Maximum number of retained messages.
   * @param maxAgeMillis Maximum age of a retained message, or 0 for no age limit.
   * @param ticker       Time source for message ages.
   */
  public ReplayBuffer(int capacity, long maxAgeMillis, Ticker ticker) {
    checkArgument(capacity > 0, "capacity must be positive");
    checkArgument(maxAgeMillis >= 0, "max age must not be negative");
    this.capacity = capacity;
    this.maxAgeNanos = TimeUnit.MILLISECONDS.toNanos(maxAgeMillis);
    this.ticker = ticker;
    this.entries = new ArrayDeque<>(capacity);
  }

  @FiberOnly
  public void add(long key, T message) {
    evictExpired();
    if (entries.size() == capacity) {
      evictOldest();
    }
    entries.addLast(new Entry<>(key, message, ticker.read()));
  }

  /**
   * @return Retained messages with a key greater than {@code key}, in key order.
   */
  @FiberOnly
  public List<T> entriesAfter(long key) {
    evictExpired();
    List<T> result = new ArrayList<>();
    for (Entry<T> entry : entries) {
      if (entry.key > key) {
        result.add(entry.message);
      }
    }
    return result;
  }

  /**
   * Whether messages newer than {@code key} have already been evicted, meaning a reader
   * resuming after {@code key} has missed some.
   */
  @FiberOnly
  public boolean hasEvictedAfter(long key) {
    evictExpired();
    return highestEvictedKey > key;
  }

  @FiberOnly
  public int size() {
    return entries.size();
  }

  /**
   * @return The oldest retained key, or 0 if nothing is retained.
   */
  @FiberOnly
  public long oldestKey() {
    Entry<T> oldest = entries.peekFirst();
    return oldest == null ? 0 : oldest.key;
  }

  private void evictExpired() {
    if (maxAgeNanos == 0) {
      return;
    }
    long now = ticker.read();
    while (!entries.isEmpty() && now - entries.peekFirst().insertedAtNanos > maxAgeNanos) {
      evictOldest();
    }
  }

  private void evictOldest() {
    highestEvictedKey = entries.removeFirst().key;
  }

  private static class Entry<T> {
    private final long key;
    private final T message;
    private final long insertedAtNanos;

    private Entry(long key, T message, long insertedAtNanos) {
      this.key = key;
      this.message = message;
      this.insertedAtNanos = insertedAtNanos;
    }
  }
}
