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

package tracescope.interfaces.channel;

import com.google.common.util.concurrent.ListenableFuture;

/**
 * The transport side of a subscription. Channels call {@link #send} with at most one send
 * outstanding per connection and wait for the returned future before sending again.
 *
 * @param <T> Message type carried by the connection.
 */
public interface OutboundConnection<T> {

  /**
   * Begin writing a message. The future completes when the transport has accepted the
   * message, or fails if the write failed.
   */
  ListenableFuture<?> send(T message);

  /**
   * Close the connection, telling the client why.
   */
  void close(String reason);
}
