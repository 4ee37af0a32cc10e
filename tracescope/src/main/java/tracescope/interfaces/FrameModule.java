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
import tracescope.interfaces.channel.OutboundConnection;
import tracescope.model.Frame;

/**
 * Latest-wins frame delivery. Subscribers see the newest frame of their session whenever
 * their connection is ready; anything in between is dropped.
 */
public interface FrameModule extends TracescopeModule {

  void publish(Frame frame);

  ChannelSubscription subscribe(String sessionId, OutboundConnection<Frame> connection);

  /**
   * Drop the session's slot and close its subscribers. A later publish for the same
   * session starts it afresh.
   */
  void endSession(String sessionId);

  /**
   * @return The newest frame published for the session, or null.
   */
  Frame latestFrame(String sessionId);

  long getDroppedFrameCount();
}
