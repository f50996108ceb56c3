// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import static sh.pylon.rpc.internal.RpcUtils.WS_SCHEMES;
import static sh.pylon.rpc.internal.RpcUtils.validateUrl;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
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
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pylon.core.concurrent.Scope;

/**
 * {@link Dialer} opening WebSocket connections with Netty.
 *
 * <p>
 * Supports both {@code ws://} and {@code wss://}; TLS is configured
 * automatically from the URL scheme. Each {@link Connection} is one WebSocket;
 * text and binary frames are delivered whole (fragmented messages are
 * aggregated up to {@link WebSocketConfig#maxFrameSize()}), and pings are
 * answered automatically.
 *
 * <pre>{@code
 * try (WebSocketDialer dialer = WebSocketDialer.create()) {
 *     EventsQueryClient events = DefaultEventsQueryClient.create(dialer, "wss://node.example/websocket");
 *     ...
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe. A single dialer can serve any number of connections; they share
 * its event loop group.
 *
 * @since 0.1.0
 */
public final class WebSocketDialer implements Dialer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebSocketDialer.class);

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private final WebSocketConfig config;
    private final EventLoopGroup group;
    /** True if we created the EventLoopGroup internally and are responsible for shutting it down. */
    private final boolean ownsEventLoopGroup;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private WebSocketDialer(final WebSocketConfig config) {
        this.config = config;
        if (config.eventLoopGroup() != null) {
            this.group = config.eventLoopGroup();
            this.ownsEventLoopGroup = false;
        } else {
            ThreadFactory threadFactory = r -> {
                Thread t = new Thread(r, "pylon-netty-io-" + (IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF));
                t.setDaemon(true);
                return t;
            };
            this.group = new NioEventLoopGroup(config.ioThreads(), threadFactory);
            this.ownsEventLoopGroup = true;
        }
    }

    public static WebSocketDialer create() {
        return new WebSocketDialer(WebSocketConfig.defaults());
    }

    public static WebSocketDialer create(final WebSocketConfig config) {
        return new WebSocketDialer(config);
    }

    @Override
    public Connection dial(final Scope scope, final URI uri) throws IOException {
        if (closed.get()) {
            throw new IOException("dialer is closed");
        }
        validateUrl(uri.toString(), WS_SCHEMES);
        final boolean secure = "wss".equals(uri.getScheme().toLowerCase(Locale.ROOT));
        final SslContext sslContext = secure ? SslContextBuilder.forClient().build() : null;
        final int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);

        final WebSocketConnection connection = new WebSocketConnection(uri, config);
        final WebSocketClientHandler handler = new WebSocketClientHandler(
                WebSocketClientHandshakerFactory.newHandshaker(
                        uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), config.maxFrameSize()),
                connection);

        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        p.addLast(new WebSocketFrameAggregator(config.maxFrameSize()));
                        p.addLast(handler);
                    }
                });

        final long deadline = System.nanoTime() + config.connectTimeout().toNanos();
        final ChannelFuture connectFuture = b.connect(uri.getHost(), port);
        try (Scope.Registration ignored = scope.onCancel(() -> {
            connectFuture.cancel(false);
            connectFuture.channel().close();
        })) {
            if (!connectFuture.await(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
                connectFuture.channel().close();
                throw new IOException("timed out connecting to " + uri);
            }
            if (!connectFuture.isSuccess()) {
                throw new IOException("failed to connect to " + uri, connectFuture.cause());
            }
            Channel channel = connectFuture.channel();
            ChannelFuture handshake = handler.handshakeFuture();
            if (!handshake.await(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
                channel.close();
                throw new IOException("timed out waiting for WebSocket handshake with " + uri);
            }
            if (!handshake.isSuccess()) {
                channel.close();
                throw new IOException("WebSocket handshake with " + uri + " failed", handshake.cause());
            }
            if (scope.isCancelled()) {
                channel.close();
                throw new InterruptedIOException("dial cancelled");
            }
            connection.attach(channel);
            log.debug("Opened WebSocket connection to {}", uri.getHost());
            return connection;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connectFuture.channel().close();
            throw new InterruptedIOException("interrupted while dialing " + uri);
        }
    }

    private static long remainingMillis(final long deadlineNanos) {
        return Math.max(1L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    /**
     * Shuts down the event loop group if this dialer created it. Connections
     * opened through this dialer stop working.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (ownsEventLoopGroup) {
            try {
                group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while shutting down EventLoopGroup", e);
            }
        }
    }

    /**
     * One WebSocket. Inbound frames are queued until {@link #receive()} takes them.
     */
    static final class WebSocketConnection implements Connection {

        private final URI uri;
        private final WebSocketConfig config;
        private final BlockingQueue<Object> inbox = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicBoolean terminated = new AtomicBoolean(false);
        private volatile @Nullable Channel channel;

        WebSocketConnection(final URI uri, final WebSocketConfig config) {
            this.uri = uri;
            this.config = config;
        }

        void attach(final Channel channel) {
            this.channel = channel;
        }

        void onMessage(final byte[] payload) {
            inbox.offer(payload);
        }

        void onTerminated(final IOException cause) {
            if (terminated.compareAndSet(false, true)) {
                inbox.offer(new Terminated(cause));
            }
        }

        @Override
        public void send(final byte[] message) throws IOException {
            Channel ch = channel;
            if (closed.get() || ch == null || !ch.isActive()) {
                throw new IOException("connection to " + uri.getHost() + " is closed");
            }
            ChannelFuture write = ch.writeAndFlush(new TextWebSocketFrame(Unpooled.wrappedBuffer(message)));
            try {
                if (!write.await(config.writeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new IOException("timed out writing to " + uri.getHost());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted while writing to " + uri.getHost());
            }
            if (!write.isSuccess()) {
                throw new IOException("failed to write to " + uri.getHost(), write.cause());
            }
        }

        @Override
        public byte[] receive() throws IOException {
            final Object next;
            try {
                next = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted while reading from " + uri.getHost());
            }
            if (next instanceof Terminated terminated) {
                // Keep the marker so every later receive fails the same way
                inbox.offer(terminated);
                throw new IOException(terminated.cause().getMessage(), terminated.cause());
            }
            return (byte[]) next;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            Channel ch = channel;
            if (ch != null && ch.isActive()) {
                ch.writeAndFlush(new CloseWebSocketFrame());
                ch.close();
            }
            onTerminated(new IOException("connection closed"));
        }
    }

    private record Terminated(IOException cause) {
    }

    private static final class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {
        private final WebSocketClientHandshaker handshaker;
        private final WebSocketConnection connection;
        private ChannelPromise handshakeFuture;

        WebSocketClientHandler(final WebSocketClientHandshaker handshaker, final WebSocketConnection connection) {
            this.handshaker = handshaker;
            this.connection = connection;
        }

        ChannelFuture handshakeFuture() {
            return handshakeFuture;
        }

        @Override
        public void handlerAdded(final ChannelHandlerContext ctx) {
            handshakeFuture = ctx.newPromise();
        }

        @Override
        public void channelActive(final ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) {
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(new IOException("connection closed during handshake"));
            }
            connection.onTerminated(new IOException("connection closed by peer"));
        }

        @Override
        protected void channelRead0(final ChannelHandlerContext ctx, final Object msg) {
            Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                        handshakeFuture.setSuccess();
                    } catch (WebSocketHandshakeException e) {
                        handshakeFuture.setFailure(e);
                    }
                }
                return;
            }

            if (!(msg instanceof WebSocketFrame frame)) {
                log.warn("Ignoring unexpected message {} on WebSocket channel", msg.getClass().getSimpleName());
                return;
            }
            if (frame instanceof TextWebSocketFrame || frame instanceof BinaryWebSocketFrame) {
                connection.onMessage(ByteBufUtil.getBytes(frame.content()));
            } else if (frame instanceof PingWebSocketFrame) {
                ch.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            } else if (frame instanceof CloseWebSocketFrame) {
                ch.close();
            }
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.warn("WebSocket channel error: {}", cause.toString());
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(cause);
            }
            connection.onTerminated(new IOException("channel error", cause));
            ctx.close();
        }
    }
}
