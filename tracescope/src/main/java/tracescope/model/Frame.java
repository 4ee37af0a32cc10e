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

package tracescope.model;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A captured screen image for a session. Frames are disposable: only the newest one per
 * session matters, and any frame may be dropped.
 */
public final class Frame {
  private final String sessionId;
  private final long timestamp;
  private final long sequence;
  private final String encoding;
  private final byte[] bytes;
  private final int width;
  private final int height;

  public Frame(String sessionId, long timestamp, long sequence, String encoding, byte[] bytes, int width, int height) {
    this.sessionId = checkNotNull(sessionId);
    this.timestamp = timestamp;
    this.sequence = sequence;
    this.encoding = checkNotNull(encoding);
    this.bytes = checkNotNull(bytes).clone();
    this.width = width;
    this.height = height;
  }

  public String getSessionId() {
    return sessionId;
  }

  public long getTimestamp() {
    return timestamp;
  }

  /**
   * @return Frame-local sequence, independent of trace event sequences.
   */
  public long getSequence() {
    return sequence;
  }

  public String getEncoding() {
    return encoding;
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  public int getByteLength() {
    return bytes.length;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public boolean isNewerThan(Frame other) {
    return other == null || sequence > other.sequence;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    Frame frame = (Frame) o;

    return timestamp == frame.timestamp
        && sequence == frame.sequence
        && width == frame.width
        && height == frame.height
        && sessionId.equals(frame.sessionId)
        && encoding.equals(frame.encoding)
        && Arrays.equals(bytes, frame.bytes);
  }

  @Override
  public int hashCode() {
    int result = sessionId.hashCode();
    result = 31 * result + (int) (sequence ^ (sequence >>> 32));
    result = 31 * result + Arrays.hashCode(bytes);
    return result;
  }

  @Override
  public String toString() {
    return "Frame{" +
        "sessionId=" + sessionId +
        ", sequence=" + sequence +
        ", timestamp=" + timestamp +
        ", encoding=" + encoding +
        ", size=" + width + "x" + height +
        ", bytes=" + bytes.length +
        '}';
  }
}
