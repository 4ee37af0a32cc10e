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

/**
 * Point-in-time counters of a reliable channel.
 */
public class ChannelStatistics {
  public final long accepted;
  public final long rejected;
  public final long backpressureDisconnects;
  public final long lastKey;
  public final int retained;
  public final int subscribers;

  public ChannelStatistics(long accepted,
                           long rejected,
                           long backpressureDisconnects,
                           long lastKey,
                           int retained,
                           int subscribers) {
    this.accepted = accepted;
    this.rejected = rejected;
    this.backpressureDisconnects = backpressureDisconnects;
    this.lastKey = lastKey;
    this.retained = retained;
    this.subscribers = subscribers;
  }

  @Override
  public String toString() {
    return "ChannelStatistics{" +
        "accepted=" + accepted +
        ", rejected=" + rejected +
        ", backpressureDisconnects=" + backpressureDisconnects +
        ", lastKey=" + lastKey +
        ", retained=" + retained +
        ", subscribers=" + subscribers +
        '}';
  }
}
