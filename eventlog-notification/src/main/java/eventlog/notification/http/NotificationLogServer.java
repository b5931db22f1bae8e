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

package eventlog.notification.http;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import eventlog.NotificationConstants;
import eventlog.codec.SectionCodec;
import eventlog.interfaces.notification.NotificationLog;
import eventlog.interfaces.notification.NotificationSection;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Serves notification logs over HTTP: {@code GET /notifications/{log}/{sectionId}} returns the
 * section as JSON.
 * <p>
 * Archived sections never change, so they are marked cacheable indefinitely; the current section
 * must be revalidated on every use. Every response carries an ETag of its body, and a request
 * whose If-None-Match matches it is answered with 304 Not Modified.
 * <p>
 * Sections are read on a separate pool of threads; storage reads never block the event loop.
 */
public class NotificationLogServer extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationLogServer.class);
  private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();

  private final EventLoopGroup bossGroup;
  private final EventLoopGroup workerGroup;
  private final int port;
  private final ImmutableMap<String, NotificationLog> logs;
  private final ListeningExecutorService sectionReaders;
  private final ChannelGroup allChannels;

  private Channel listenChannel;
  private volatile int boundPort = -1;

  /**
   * @param port port to listen on, or 0 for any free port; see {@link #getPort()}.
   * @param logs logs to serve, by the name used in their URLs.
   */
  public NotificationLogServer(EventLoopGroup bossGroup,
                               EventLoopGroup workerGroup,
                               int port,
                               Map<String, NotificationLog> logs) {
    this.bossGroup = bossGroup;
    this.workerGroup = workerGroup;
    this.port = port;
    this.logs = ImmutableMap.copyOf(logs);
    this.sectionReaders = MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(NotificationConstants.SECTION_READER_THREADS));
    this.allChannels = new DefaultChannelGroup(workerGroup.next());
  }

  /**
   * The port actually bound. Only valid once the service is running.
   */
  public int getPort() {
    return boundPort;
  }

  @Override
  protected void doStart() {
    ServerBootstrap serverBootstrap = new ServerBootstrap();
    serverBootstrap.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .option(ChannelOption.SO_REUSEADDR, true)
        .option(ChannelOption.SO_BACKLOG, NotificationConstants.HTTP_SO_BACKLOG)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) throws Exception {
            ChannelPipeline p = ch.pipeline();
            p.addLast("httpCodec", new HttpServerCodec());
            p.addLast("aggregator", new HttpObjectAggregator(NotificationConstants.HTTP_MAX_CONTENT_LENGTH));
            p.addLast("sections", new SectionRequestHandler());
          }
        });

    serverBootstrap.bind(port).addListener((ChannelFutureListener) future -> {
      if (future.isSuccess()) {
        listenChannel = future.channel();
        boundPort = ((InetSocketAddress) listenChannel.localAddress()).getPort();
        LOG.info("Serving notification logs {} on port {}", logs.keySet(), getPort());
        notifyStarted();
      } else {
        LOG.error("Unable to bind notification log server to port {}", port, future.cause());
        sectionReaders.shutdown();
        notifyFailed(future.cause());
      }
    });
  }

  @Override
  protected void doStop() {
    sectionReaders.shutdown();
    allChannels.close();
    listenChannel.close().addListener((ChannelFutureListener) future -> {
      LOG.info("Notification log server on port {} stopped", getPort());
      notifyStopped();
    });
  }

  private class SectionRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
      allChannels.add(ctx.channel());
      super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
      final boolean keepAlive = HttpUtil.isKeepAlive(request);

      if (!request.decoderResult().isSuccess()) {
        sendText(ctx, HttpResponseStatus.BAD_REQUEST, "Malformed request", false);
        return;
      }
      if (!HttpMethod.GET.equals(request.method())) {
        sendText(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED, "Only GET is supported", keepAlive);
        return;
      }

      final String path = new QueryStringDecoder(request.uri()).path();
      final List<String> segments = PATH_SPLITTER.splitToList(path);
      if (segments.size() != 3 || !("/" + segments.get(0)).equals(NotificationConstants.HTTP_PATH_PREFIX)) {
        sendText(ctx, HttpResponseStatus.NOT_FOUND, "No such resource: " + path, keepAlive);
        return;
      }

      final String logName = segments.get(1);
      final String sectionId = segments.get(2);
      final NotificationLog log = logs.get(logName);
      if (log == null) {
        sendText(ctx, HttpResponseStatus.NOT_FOUND, "No such notification log: " + logName, keepAlive);
        return;
      }

      final String ifNoneMatch = request.headers().get(HttpHeaderNames.IF_NONE_MATCH);
      final ListenableFuture<NotificationSection> section = sectionReaders.submit(() -> log.getSection(sectionId));

      Futures.addCallback(section, new FutureCallback<NotificationSection>() {
        @Override
        public void onSuccess(NotificationSection result) {
          sendSection(ctx, result, ifNoneMatch, keepAlive);
        }

        @Override
        public void onFailure(Throwable t) {
          if (t instanceof IllegalArgumentException) {
            sendText(ctx, HttpResponseStatus.BAD_REQUEST, t.getMessage(), keepAlive);
          } else {
            LOG.error("Unable to read section {} of notification log {}", sectionId, logName, t);
            sendText(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Unable to read section", keepAlive);
          }
        }
      }, ctx.executor());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
      LOG.warn("Closing connection from {} after error", ctx.channel().remoteAddress(), cause);
      ctx.close();
    }
  }

  private static void sendSection(ChannelHandlerContext ctx, NotificationSection section, String ifNoneMatch,
                                  boolean keepAlive) {
    final byte[] body = SectionCodec.encode(section);
    final String etag = "\"" + Hashing.sha256().hashBytes(body) + "\"";
    final boolean notModified = etag.equals(ifNoneMatch);

    final FullHttpResponse response = notModified
        ? new DefaultFullHttpResponse(HTTP_1_1, HttpResponseStatus.NOT_MODIFIED)
        : new DefaultFullHttpResponse(HTTP_1_1, HttpResponseStatus.OK, Unpooled.wrappedBuffer(body));

    response.headers()
        .set(HttpHeaderNames.ETAG, etag)
        .set(HttpHeaderNames.CACHE_CONTROL, section.isArchived()
            ? NotificationConstants.ARCHIVED_CACHE_CONTROL
            : NotificationConstants.CURRENT_CACHE_CONTROL);
    if (!notModified) {
      response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
    }
    send(ctx, response, keepAlive);
  }

  private static void sendText(ChannelHandlerContext ctx, HttpResponseStatus status, String text, boolean keepAlive) {
    final FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status,
        Unpooled.copiedBuffer(String.valueOf(text), StandardCharsets.UTF_8));
    response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN);
    send(ctx, response, keepAlive);
  }

  private static void send(ChannelHandlerContext ctx, FullHttpResponse response, boolean keepAlive) {
    HttpUtil.setContentLength(response, response.content().readableBytes());
    if (keepAlive) {
      response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
      ctx.writeAndFlush(response);
    } else {
      ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
  }
}
