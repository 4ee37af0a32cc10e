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

package tracescope.server;

import tracescope.interfaces.PipelineServer;
import tracescope.interfaces.channel.ChannelSubscription;
import tracescope.server.codec.PushMessages;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Attaches a websocket client to the channel named by its request path once the handshake
 * has completed, and cancels the subscription when the socket closes. Clients only listen;
 * anything they send is discarded.
 */
public class PushSocketHandler extends ChannelInboundHandlerAdapter {
  private static final Logger LOG = LoggerFactory.getLogger(PushSocketHandler.class);
  static final int POLICY_VIOLATION = 1008;

  public static final String EVENTS_PATH = "/push/events";
  public static final String INSIGHTS_PATH = "/push/insights";
  public static final String FRAMES_PATH = "/push/frames";

  private final PipelineServer pipeline;
  private ChannelSubscription subscription;

  public PushSocketHandler(PipelineServer pipeline) {
    this.pipeline = pipeline;
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
      attach(ctx, ((WebSocketServerProtocolHandler.HandshakeComplete) evt).requestUri());
    } else {
      super.userEventTriggered(ctx, evt);
    }
  }

  private void attach(ChannelHandlerContext ctx, String uri) {
    QueryStringDecoder decoder = new QueryStringDecoder(uri);
    String path = decoder.path();
    try {
      switch (path) {
        case EVENTS_PATH:
          subscription = pipeline.getAgentEvents().subscribe(
              lastAcked(decoder), new WebSocketConnection<>(ctx.channel(), PushMessages::eventFrame));
          break;
        case INSIGHTS_PATH:
          subscription = pipeline.getInsights().subscribe(
              lastAcked(decoder), new WebSocketConnection<>(ctx.channel(), PushMessages::insightFrame));
          break;
        case FRAMES_PATH:
          String session = parameter(decoder, "session");
          if (session == null || session.isEmpty()) {
            reject(ctx, "session parameter required");
            return;
          }
          subscription = pipeline.getFrames().subscribe(
              session, new WebSocketConnection<>(ctx.channel(), PushMessages::frameFrame));
          break;
        default:
          reject(ctx, "unknown endpoint " + path);
          return;
      }
      LOG.debug("Client {} subscribed to {}", ctx.channel().remoteAddress(), uri);
    } catch (IllegalArgumentException e) {
      reject(ctx, e.getMessage());
    }
  }

  private static long lastAcked(QueryStringDecoder decoder) {
    String value = parameter(decoder, "lastAcked");
    if (value == null || value.isEmpty()) {
      return 0;
    }
    try {
      long lastAcked = Long.parseLong(value);
      if (lastAcked < 0) {
        throw new IllegalArgumentException("lastAcked must not be negative");
      }
      return lastAcked;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("lastAcked is not a number");
    }
  }

  private static String parameter(QueryStringDecoder decoder, String name) {
    List<String> values = decoder.parameters().get(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  private static void reject(ChannelHandlerContext ctx, String reason) {
    LOG.info("Rejecting client {}: {}", ctx.channel().remoteAddress(), reason);
    ctx.writeAndFlush(new CloseWebSocketFrame(POLICY_VIOLATION, reason)).addListener(ChannelFutureListener.CLOSE);
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
    try {
      if (msg instanceof FullHttpRequest) {
        // a plain http request that is not for the websocket path
        FullHttpResponse response = new DefaultFullHttpResponse(
            HttpVersion.HTTP_1_1, HttpResponseStatus.NOT_FOUND, Unpooled.EMPTY_BUFFER);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
      }
    } finally {
      ReferenceCountUtil.release(msg);
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    if (subscription != null) {
      subscription.cancel();
      subscription = null;
    }
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
    LOG.debug("Closing client {} after error", ctx.channel().remoteAddress(), cause);
    ctx.close();
  }
}
