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

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;

import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Websocket client for tests: connects to a push endpoint and queues what the server sends.
 * Text frames are queued as strings, binary frames as byte arrays; a close frame is
 * queued as its {@link CloseWebSocketFrame#statusCode() status code}.
 */
public class PushClient implements AutoCloseable {
  private final EventLoopGroup group = new NioEventLoopGroup(1);
  private final BlockingQueue<Object> received = new LinkedBlockingQueue<>();
  private Channel channel;

  public PushClient connect(URI uri) throws Exception {
    final Handler handler = new Handler(
        WebSocketClientHandshakerFactory.newHandshaker(
            uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders()));

    Bootstrap b = new Bootstrap();
    b.group(group)
        .channel(NioSocketChannel.class)
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          public void initChannel(SocketChannel ch) throws Exception {
            ChannelPipeline pipeline = ch.pipeline();
            pipeline.addLast("http-codec", new HttpClientCodec());
            pipeline.addLast("aggregator", new HttpObjectAggregator(65536));
            pipeline.addLast("ws-handler", handler);
          }
        });

    channel = b.connect(uri.getHost(), uri.getPort()).sync().channel();
    handler.handshakeFuture().sync();
    return this;
  }

  /**
   * @return The next thing received, or null if nothing arrived in time.
   */
  public Object poll(long timeout, TimeUnit unit) throws InterruptedException {
    return received.poll(timeout, unit);
  }

  public String pollText(long timeout, TimeUnit unit) throws InterruptedException {
    Object next = poll(timeout, unit);
    if (next != null && !(next instanceof String)) {
      throw new AssertionError("expected a text frame, got " + next);
    }
    return (String) next;
  }

  public boolean isOpen() {
    return channel != null && channel.isActive();
  }

  @Override
  public void close() {
    try {
      if (channel != null && channel.isActive()) {
        channel.writeAndFlush(new CloseWebSocketFrame());
        channel.closeFuture().awaitUninterruptibly(1, TimeUnit.SECONDS);
      }
    } finally {
      group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
  }

  private class Handler extends SimpleChannelInboundHandler<Object> {
    private final WebSocketClientHandshaker handshaker;
    private ChannelPromise handshakeFuture;

    private Handler(WebSocketClientHandshaker handshaker) {
      this.handshaker = handshaker;
    }

    private ChannelPromise handshakeFuture() {
      return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) throws Exception {
      handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
      handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelRead0(ChannelHandlerContext ctx, Object msg) throws Exception {
      Channel ch = ctx.channel();
      if (!handshaker.isHandshakeComplete()) {
        handshaker.finishHandshake(ch, (FullHttpResponse) msg);
        handshakeFuture.setSuccess();
        return;
      }

      if (msg instanceof FullHttpResponse) {
        throw new IllegalStateException("Unexpected http response " + ((FullHttpResponse) msg).status());
      }

      WebSocketFrame frame = (WebSocketFrame) msg;
      if (frame instanceof TextWebSocketFrame) {
        received.add(((TextWebSocketFrame) frame).text());
      } else if (frame instanceof BinaryWebSocketFrame) {
        received.add(ByteBufUtil.getBytes(frame.content()));
      } else if (frame instanceof CloseWebSocketFrame) {
        received.add(((CloseWebSocketFrame) frame).statusCode());
        ch.close();
      }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
      if (!handshakeFuture.isDone()) {
        handshakeFuture.setFailure(cause);
      }
      ctx.close();
    }
  }
}
