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

import tracescope.interfaces.channel.OutboundConnection;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.channels.ClosedChannelException;
import java.util.function.Function;

/**
 * Sends pipeline messages to one websocket client. A send completes when netty has written
 * the frame to the socket.
 */
public class WebSocketConnection<T> implements OutboundConnection<T> {
  private static final Logger LOG = LoggerFactory.getLogger(WebSocketConnection.class);
  static final int GOING_AWAY = 1001;

  private final Channel channel;
  private final Function<T, WebSocketFrame> encoder;

  public WebSocketConnection(Channel channel, Function<T, WebSocketFrame> encoder) {
    this.channel = channel;
    this.encoder = encoder;
  }

  @Override
  public ListenableFuture<?> send(T message) {
    if (!channel.isActive()) {
      return Futures.immediateFailedFuture(new ClosedChannelException());
    }

    WebSocketFrame frame;
    try {
      frame = encoder.apply(message);
    } catch (RuntimeException e) {
      return Futures.immediateFailedFuture(e);
    }

    SettableFuture<Void> written = SettableFuture.create();
    channel.writeAndFlush(frame).addListener((ChannelFutureListener) future -> {
      if (future.isSuccess()) {
        written.set(null);
      } else {
        written.setException(future.cause());
      }
    });
    return written;
  }

  @Override
  public void close(String reason) {
    LOG.debug("Closing websocket {}: {}", channel.remoteAddress(), reason);
    if (channel.isActive()) {
      channel.writeAndFlush(new CloseWebSocketFrame(GOING_AWAY, reason))
          .addListener(ChannelFutureListener.CLOSE);
    }
  }
}
