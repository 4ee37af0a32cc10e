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
import tracescope.model.Insight;
import tracescope.model.TraceEvent;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.protostuff.JsonIOUtil;
import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Encodes pipeline messages as websocket frames. Events and insights go out as JSON text
 * frames wrapped in a {@code {"type": ..., "data": ...}} envelope; frames go out as binary
 * protostuff frames.
 */
public final class PushMessages {
  public static final String EVENT_TYPE = "event";
  public static final String INSIGHT_TYPE = "insight";

  private static final Schema<EventMessage> EVENT_SCHEMA = RuntimeSchema.getSchema(EventMessage.class);
  private static final Schema<InsightMessage> INSIGHT_SCHEMA = RuntimeSchema.getSchema(InsightMessage.class);
  private static final Schema<FrameMessage> FRAME_SCHEMA = RuntimeSchema.getSchema(FrameMessage.class);

  private PushMessages() {
  }

  public static WebSocketFrame eventFrame(TraceEvent event) {
    return new TextWebSocketFrame(envelope(EVENT_TYPE, toJson(EventMessage.from(event), EVENT_SCHEMA)));
  }

  public static WebSocketFrame insightFrame(Insight insight) {
    return new TextWebSocketFrame(envelope(INSIGHT_TYPE, toJson(InsightMessage.from(insight), INSIGHT_SCHEMA)));
  }

  public static WebSocketFrame frameFrame(Frame frame) {
    byte[] bytes = ProtostuffIOUtil.toByteArray(
        FrameMessage.from(frame), FRAME_SCHEMA, LinkedBuffer.allocate(LinkedBuffer.DEFAULT_BUFFER_SIZE));
    return new BinaryWebSocketFrame(Unpooled.wrappedBuffer(bytes));
  }

  public static EventMessage parseEvent(String json) throws IOException {
    EventMessage message = new EventMessage();
    JsonIOUtil.mergeFrom(json.getBytes(StandardCharsets.UTF_8), message, EVENT_SCHEMA, false);
    return message;
  }

  public static InsightMessage parseInsight(String json) throws IOException {
    InsightMessage message = new InsightMessage();
    JsonIOUtil.mergeFrom(json.getBytes(StandardCharsets.UTF_8), message, INSIGHT_SCHEMA, false);
    return message;
  }

  public static FrameMessage parseFrame(byte[] bytes) {
    FrameMessage message = new FrameMessage();
    ProtostuffIOUtil.mergeFrom(bytes, message, FRAME_SCHEMA);
    return message;
  }

  private static String envelope(String type, String json) {
    return "{\"type\":\"" + type + "\", \"data\": " + json + "}";
  }

  private static <T> String toJson(T message, Schema<T> schema) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      JsonIOUtil.writeTo(out, message, schema, false);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }
}
