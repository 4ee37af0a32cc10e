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

package tracescope.server.codec;

import tracescope.model.Frame;

public class FrameMessage {
  private String sessionId;
  private long sequence;
  private long timestamp;
  private String encoding;
  private int width;
  private int height;
  private byte[] data;

  public FrameMessage() {
  }

  public static FrameMessage from(Frame frame) {
    FrameMessage message = new FrameMessage();
    message.sessionId = frame.getSessionId();
    message.sequence = frame.getSequence();
    message.timestamp = frame.getTimestamp();
    message.encoding = frame.getEncoding();
    message.width = frame.getWidth();
    message.height = frame.getHeight();
    message.data = frame.getBytes();
    return message;
  }

  public String getSessionId() {
    return sessionId;
  }

  public long getSequence() {
    return sequence;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public String getEncoding() {
    return encoding;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public byte[] getData() {
    return data;
  }
}
