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

package tracescope.critic;

import tracescope.util.FiberOnly;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A bounded FIFO that makes room for a new element by evicting the oldest one. Not thread
 * safe; owned by the critic fiber.
 */
public class DropOldestBuffer<T> {
  private final int capacity;
  private final Deque<T> elements;
  private long droppedCount = 0;

  public DropOldestBuffer(int capacity) {
    checkArgument(capacity > 0, "capacity must be positive");
    this.capacity = capacity;
    this.elements = new ArrayDeque<>(capacity);
  }

  /**
   * @return The element evicted to make room, or null if there was room.
   */
  @FiberOnly
  public T add(T element) {
    T evicted = null;
    if (elements.size() == capacity) {
      evicted = elements.removeFirst();
      droppedCount++;
    }
    elements.addLast(element);
    return evicted;
  }

  /**
   * Remove and return up to {@code max} of the oldest elements, oldest first.
   */
  @FiberOnly
  public List<T> take(int max) {
    int count = Math.min(max, elements.size());
    List<T> taken = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      taken.add(elements.removeFirst());
    }
    return taken;
  }

  @FiberOnly
  public int size() {
    return elements.size();
  }

  @FiberOnly
  public boolean isEmpty() {
    return elements.isEmpty();
  }

  public int capacity() {
    return capacity;
  }

  @FiberOnly
  public long droppedCount() {
    return droppedCount;
  }
}
