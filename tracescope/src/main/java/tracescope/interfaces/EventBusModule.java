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

package tracescope.interfaces;

import tracescope.interfaces.bus.SinkSubscription;
import tracescope.interfaces.bus.TraceSink;
import tracescope.model.TraceEvent;

/**
 * In-process fan-out of trace events. Publishing only hands the event to each subscriber's
 * dispatch fiber, so a slow or failing sink never holds up the producer or other sinks.
 */
public interface EventBusModule extends TracescopeModule {

  void publish(TraceEvent event);

  /**
   * The sink receives every event published after this call returns, in publish order.
   */
  SinkSubscription subscribe(TraceSink sink);

  void unsubscribe(SinkSubscription subscription);

  long getPublishedCount();

  long getSinkFailureCount();

  /**
   * @return Deliveries skipped because a sink already had its limit of events queued.
   */
  long getSinkOverflowCount();

  int getSubscriberCount();
}
