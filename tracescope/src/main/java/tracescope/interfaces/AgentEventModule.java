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

import tracescope.interfaces.channel.ChannelSubscription;
import tracescope.interfaces.channel.ChannelStatistics;
import tracescope.interfaces.channel.OutboundConnection;
import tracescope.model.TraceEvent;

/**
 * Reliable, ordered delivery of trace events to UI clients, with replay of recent history
 * to clients that reconnect.
 */
public interface AgentEventModule extends TracescopeModule {

  /**
   * Replays every retained event with a sequence above {@code lastAckedSequence}, then
   * forwards live events.
   */
  ChannelSubscription subscribe(long lastAckedSequence, OutboundConnection<TraceEvent> connection);

  ChannelStatistics getStatistics();
}
