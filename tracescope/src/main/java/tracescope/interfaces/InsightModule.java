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

import tracescope.interfaces.channel.ChannelStatistics;
import tracescope.interfaces.channel.ChannelSubscription;
import tracescope.interfaces.channel.OutboundConnection;
import tracescope.model.Insight;

/**
 * Publishes critic insights to UI clients with the same ordering and replay guarantees as
 * the agent event channel.
 */
public interface InsightModule extends TracescopeModule {

  /**
   * Assigns the next insight sequence and publishes the insight.
   */
  void publish(Insight insight);

  ChannelSubscription subscribe(long lastAckedSequence, OutboundConnection<Insight> connection);

  ChannelStatistics getStatistics();
}
