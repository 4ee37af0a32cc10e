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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One observation of agent activity. The sequence number is assigned by the trace source
 * and increases strictly within a session; everything downstream orders by it.
 */
public final class TraceEvent {
  private final long sequence;
  private final long timestamp;
  private final EventKind kind;
  private final String agentId;
  private final TracePayload payload;

  public TraceEvent(long sequence, long timestamp, EventKind kind, String agentId, TracePayload payload) {
    checkArgument(sequence > 0, "sequence must be positive: %s", sequence);
    this.sequence = sequence;
    this.timestamp = timestamp;
    this.kind = checkNotNull(kind);
    this.agentId = checkNotNull(agentId);
    this.payload = checkNotNull(payload);
  }

  public long getSequence() {
    return sequence;
  }

  /**
   * @return Milliseconds since the epoch.
   */
  public long getTimestamp() {
    return timestamp;
  }

  public EventKind getKind() {
    return kind;
  }

  public String getAgentId() {
    return agentId;
  }

  public TracePayload getPayload() {
    return payload;
  }

  public boolean isFailedToolResult() {
    return kind == EventKind.TOOL_RESULT && !payload.isSuccess();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    TraceEvent that = (TraceEvent) o;

    return sequence == that.sequence
        && timestamp == that.timestamp
        && kind == that.kind
        && agentId.equals(that.agentId)
        && payload.equals(that.payload);
  }

  @Override
  public int hashCode() {
    int result = (int) (sequence ^ (sequence >>> 32));
    result = 31 * result + (int) (timestamp ^ (timestamp >>> 32));
    result = 31 * result + kind.hashCode();
    result = 31 * result + agentId.hashCode();
    result = 31 * result + payload.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "TraceEvent{" +
        "sequence=" + sequence +
        ", timestamp=" + timestamp +
        ", kind=" + kind +
        ", agentId=" + agentId +
        ", payload=" + payload +
        '}';
  }
}
