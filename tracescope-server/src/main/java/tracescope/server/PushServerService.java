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

import tracescope.TracescopeConstants;
import tracescope.interfaces.ModuleType;
import tracescope.interfaces.PipelineServer;
import tracescope.interfaces.TracescopeModule;
import com.google.common.util.concurrent.AbstractService;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Websocket server through which UI clients follow a pipeline. Clients connect to
 * {@code /push/events} or {@code /push/insights} (optionally with {@code ?lastAcked=N} to
 * resume), or to {@code /push/frames?session=S}.
 */
public class PushServerService extends AbstractService implements TracescopeModule {
  private static final Logger LOG = LoggerFactory.getLogger(PushServerService.class);

  private final PipelineServer pipeline;
  private final int port;
  private final EventLoopGroup acceptGroup = new NioEventLoopGroup(1);
  private final EventLoopGroup workerGroup = new NioEventLoopGroup();
  private final ServerBootstrap bootstrap = new ServerBootstrap();
  private Channel listenChannel;

  /**
   * @param port Port to listen on; 0 picks a free one, see {@link #getBoundPort()}.
   */
  public PushServerService(PipelineServer pipeline, int port) {
    this.pipeline = pipeline;
    this.port = port;
    bootstrap.childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT);
  }

  @Override
  protected void doStart() {
    bootstrap.group(acceptGroup, workerGroup)
        .option(ChannelOption.SO_REUSEADDR, true)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) throws Exception {
            ChannelPipeline p = ch.pipeline();
            p.addLast("http-server-codec", new HttpServerCodec());
            p.addLast("http-agg", new HttpObjectAggregator(TracescopeConstants.MAX_CONTENT_LENGTH_HTTP_AGG));
            p.addLast("websocket", new WebSocketServerProtocolHandler(
                TracescopeConstants.WEBSOCKET_PATH, null, true, TracescopeConstants.MAX_WEBSOCKET_FRAME_SIZE,
                false, true));
            p.addLast("handler", new PushSocketHandler(pipeline));
          }
        });

    bootstrap.bind(port).addListener(new ChannelFutureListener() {
      @Override
      public void operationComplete(ChannelFuture future) throws Exception {
        if (future.isSuccess()) {
          listenChannel = future.channel();
          LOG.info("Push server listening on {}", listenChannel.localAddress());
          notifyStarted();
        } else {
          LOG.error("Unable to bind push server to port {}", port, future.cause());
          shutdownEventLoops();
          notifyFailed(future.cause());
        }
      }
    });
  }

  @Override
  protected void doStop() {
    if (listenChannel != null) {
      listenChannel.close().syncUninterruptibly();
    }
    shutdownEventLoops();
    notifyStopped();
  }

  private void shutdownEventLoops() {
    acceptGroup.shutdownGracefully();
    workerGroup.shutdownGracefully();
  }

  /**
   * @return The port the server is listening on, once it is running.
   */
  public int getBoundPort() {
    return ((InetSocketAddress) listenChannel.localAddress()).getPort();
  }

  @Override
  public ModuleType getModuleType() {
    return ModuleType.PushServer;
  }
}
