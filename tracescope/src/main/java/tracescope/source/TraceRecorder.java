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

package tracescope.source;

import tracescope.interfaces.EventBusModule;
import tracescope.model.EventKind;
import tracescope.model.TraceEvent;
import tracescope.model.TracePayload;

import java.util.function.LongSupplier;

/**
 * Live trace source: numbers events as they are recorded and publishes them on the bus.
 * Recording is serialized so the bus sees events in sequence order.
 */
public class TraceRecorder {
  private final EventBusModule eventBus;
  private final LongSupplier clock;
  private long lastSequence;

  public TraceRecorder(EventBusModule eventBus) {
    this(eventBus, 0, System::currentTimeMillis);
  }

  /**
   * @param lastSequence Sequence number the next event follows, for resuming a session.
   * @param clock        Source of event timestamps, in epoch milliseconds.
   */
  public TraceRecorder(EventBusModule eventBus, long lastSequence, LongSupplier clock) {
    this.eventBus = eventBus;
    this.lastSequence = lastSequence;
    this.clock = clock;
  }

  public synchronized TraceEvent record(EventKind kind, String agentId, TracePayload payload) {
    TraceEvent event = new TraceEvent(lastSequence + 1, clock.getAsLong(), kind, agentId, payload);
    lastSequence = event.getSequence();
    eventBus.publish(event);
    return event;
  }

  public synchronized long getLastSequence() {
    return lastSequence;
  }
}
