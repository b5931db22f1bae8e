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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.Uninterruptibles;
import eventlog.NotificationConstants;
import eventlog.codec.SectionCodec;
import eventlog.interfaces.notification.NotificationLog;
import eventlog.interfaces.notification.NotificationSection;
import eventlog.interfaces.notification.SectionId;
import eventlog.interfaces.store.InvalidPosition;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * A {@link NotificationLog} served by a {@link NotificationLogServer} elsewhere.
 * <p>
 * Archived sections are cached and never fetched twice. Any other section is cached with its
 * ETag and revalidated on each request, so an unchanged current section costs a 304 and no body.
 */
public class RemoteNotificationLog implements NotificationLog {
  private static final Logger LOG = LoggerFactory.getLogger(RemoteNotificationLog.class);

  private final Bootstrap bootstrap;
  private final String host;
  private final int port;
  private final String logName;
  private final long timeoutMillis;
  private final Cache<String, CachedSection> sections = CacheBuilder.newBuilder()
      .maximumSize(NotificationConstants.REMOTE_CACHE_MAX_SECTIONS)
      .build();

  private volatile int knownSectionSize = 0;

  public RemoteNotificationLog(EventLoopGroup workerGroup, String host, int port, String logName) {
    this(workerGroup, host, port, logName, NotificationConstants.REMOTE_REQUEST_TIMEOUT_MILLIS);
  }

  public RemoteNotificationLog(EventLoopGroup workerGroup, String host, int port, String logName,
                               long timeoutMillis) {
    this.host = host;
    this.port = port;
    this.logName = logName;
    this.timeoutMillis = timeoutMillis;
    this.bootstrap = new Bootstrap()
        .group(workerGroup)
        .channel(NioSocketChannel.class)
        .option(ChannelOption.TCP_NODELAY, true)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE));
  }

  @Override
  public NotificationSection getSection(String sectionId) throws IOException {
    try {
      return Uninterruptibles.getUninterruptibly(getSectionAsync(sectionId), timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      } else if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IOException(cause);
    } catch (TimeoutException e) {
      throw new IOException("Timed out fetching section " + sectionId + " of " + describe(), e);
    }
  }

  /**
   * Unknown until the first section has been fetched.
   */
  @Override
  public OptionalInt getSectionSize() {
    final int size = knownSectionSize;
    return size == 0 ? OptionalInt.empty() : OptionalInt.of(size);
  }

  /**
   * Fetch a section without blocking. The future fails with {@link InvalidPosition} if the server
   * rejects the id, or with an IOException for any other failure.
   */
  public ListenableFuture<NotificationSection> getSectionAsync(String sectionId) {
    final CachedSection cached = sections.getIfPresent(sectionId);
    if (cached != null
        && cached.section.isArchived()
        && !SectionId.isCurrent(sectionId)) {
      return Futures.immediateFuture(cached.section);
    }

    final String etag = cached == null ? null : cached.etag;
    return Futures.transformAsync(
        request(NotificationConstants.HTTP_PATH_PREFIX + "/" + logName + "/" + sectionId, etag),
        response -> Futures.immediateFuture(handleResponse(sectionId, cached, response)),
        MoreExecutors.directExecutor());
  }

  private NotificationSection handleResponse(String sectionId, @Nullable CachedSection cached, Response response)
      throws IOException {
    if (response.status == HttpResponseStatus.NOT_MODIFIED.code()) {
      if (cached == null) {
        throw new IOException("Server reported section " + sectionId + " unmodified, but no copy is cached");
      }
      return cached.section;

    } else if (response.status == HttpResponseStatus.OK.code()) {
      final NotificationSection section = SectionCodec.decode(response.body);
      knownSectionSize = Ints.saturatedCast(SectionId.parse(section.getSectionId()).size());
      final CachedSection fresh = new CachedSection(section, response.etag);
      sections.put(sectionId, fresh);
      if (section.isArchived() && !section.getSectionId().equals(sectionId)) {
        sections.put(section.getSectionId(), fresh);
      }
      return section;

    } else if (response.status == HttpResponseStatus.BAD_REQUEST.code()) {
      throw new InvalidPosition(new String(response.body, StandardCharsets.UTF_8));
    }

    throw new IOException("Unexpected status " + response.status + " fetching section " + sectionId
        + " of " + describe() + ": " + new String(response.body, StandardCharsets.UTF_8));
  }

  private ListenableFuture<Response> request(String uri, @Nullable String etag) {
    final SettableFuture<Response> result = SettableFuture.create();

    final DefaultFullHttpRequest request = new DefaultFullHttpRequest(HTTP_1_1, HttpMethod.GET, uri);
    request.headers()
        .set(HttpHeaderNames.HOST, host + ":" + port)
        .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)
        .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
    if (etag != null) {
      request.headers().set(HttpHeaderNames.IF_NONE_MATCH, etag);
    }

    bootstrap.clone()
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) throws Exception {
            ch.pipeline().addLast("httpCodec", new HttpClientCodec());
            ch.pipeline().addLast("aggregator", new HttpObjectAggregator(NotificationConstants.HTTP_MAX_CONTENT_LENGTH));
            ch.pipeline().addLast("response", new ResponseHandler(result));
          }
        })
        .connect(host, port)
        .addListener((ChannelFutureListener) connected -> {
          if (!connected.isSuccess()) {
            LOG.debug("Unable to connect to {}", describe(), connected.cause());
            result.setException(connected.cause());
            return;
          }
          connected.channel().writeAndFlush(request).addListener((ChannelFutureListener) written -> {
            if (!written.isSuccess()) {
              result.setException(written.cause());
              written.channel().close();
            }
          });
        });

    return result;
  }

  private String describe() {
    return "notification log " + logName + " at " + host + ":" + port;
  }

  private static class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
    private final SettableFuture<Response> result;

    ResponseHandler(SettableFuture<Response> result) {
      this.result = result;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
      result.set(new Response(
          msg.status().code(),
          msg.headers().get(HttpHeaderNames.ETAG),
          ByteBufUtil.getBytes(msg.content())));
      ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
      // No-op if a response already arrived.
      result.setException(new IOException("Connection closed before a response arrived"));
      super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
      result.setException(cause);
      ctx.close();
    }
  }

  private static class Response {
    final int status;
    @Nullable final String etag;
    final byte[] body;

    Response(int status, @Nullable String etag, byte[] body) {
      this.status = status;
      this.etag = etag;
      this.body = body;
    }
  }

  private static class CachedSection {
    final NotificationSection section;
    @Nullable final String etag;

    CachedSection(NotificationSection section, @Nullable String etag) {
      this.section = section;
      this.etag = etag;
    }
  }
}
