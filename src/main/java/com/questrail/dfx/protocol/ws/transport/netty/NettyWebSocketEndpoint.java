package com.questrail.dfx.protocol.ws.transport.netty;

import com.questrail.dfx.protocol.ws.transport.DfxTransportException;
import com.questrail.dfx.protocol.ws.transport.MessageEndpoint;
import com.questrail.dfx.protocol.ws.transport.MessageEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link MessageEndpoint} port, speaking
 * WebSocket (RFC 6455) as a client.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse DFX frames or classify inbound messages</li>
 *   <li>Correlate requests with responses</li>
 *   <li>Retry, poll, or time out exchanges</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Fragmented messages are reassembled before delivery. Binary and text
 * messages are both delivered as raw bytes. All reference-counted buffers are
 * released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} connects, performs the opening handshake with an
 *   {@code Authorization: Bearer} header, and reports up on completion.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyWebSocketEndpoint implements MessageEndpoint
{
    /** Largest reassembled inbound message accepted. */
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 16 * 1024 * 1024;

    private final URI uri;
    private final String host;
    private final int port;
    private final SslContext sslContext;
    private final WebSocketClientHandshaker handshaker;
    private final int maxMessageBytes;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean downNotified = new AtomicBoolean();

    private volatile MessageEndpointListener listener;
    private volatile Channel channel;

    public NettyWebSocketEndpoint(URI uri, String bearerToken)
    {
        this(uri, bearerToken, DEFAULT_MAX_MESSAGE_BYTES);
    }

    /**
     * Construct an endpoint for {@code uri}.
     *
     * <p>A dedicated single-threaded {@link NioEventLoopGroup} keeps the adapter
     * self-contained. That thread is the only reader of the socket.</p>
     */
    public NettyWebSocketEndpoint(URI uri, String bearerToken, int maxMessageBytes)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(bearerToken, "bearerToken");
        this.maxMessageBytes = maxMessageBytes;

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        boolean secure;
        if ("wss".equals(scheme)) {
            secure = true;
        }
        else if ("ws".equals(scheme)) {
            secure = false;
        }
        else {
            throw new IllegalArgumentException("Unsupported WebSocket scheme: " + uri);
        }

        this.host = Objects.requireNonNull(uri.getHost(), "uri host");
        this.port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
        this.sslContext = secure ? buildSslContext() : null;

        HttpHeaders headers = new DefaultHttpHeaders();
        headers.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + bearerToken);
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, headers, maxMessageBytes);

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(64 * 1024));
                        p.addLast(new WebSocketClientProtocolHandler(handshaker));
                        p.addLast(new WebSocketFrameAggregator(NettyWebSocketEndpoint.this.maxMessageBytes));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(MessageEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();

        ChannelFuture f = bootstrap.connect(host, port);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                // Up is reported once the handshake completes (see InboundHandler).
            }
            else {
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ChannelFuture closed = ch.close();
            if (!ch.eventLoop().inEventLoop()) {
                closed.awaitUninterruptibly();
            }
        }

        group.shutdownGracefully();
        notifyDown(null);
    }

    @Override
    public void send(byte[] message)
    {
        Objects.requireNonNull(message, "message");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new DfxTransportException("WebSocket to " + uri + " is not open");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(message);
        ChannelFuture written = ch.writeAndFlush(new BinaryWebSocketFrame(buf));
        written.awaitUninterruptibly();
        if (!written.isSuccess()) {
            throw new DfxTransportException("WebSocket write to " + uri + " failed", written.cause());
        }
    }

    private MessageEndpointListener requireListener()
    {
        MessageEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MessageEndpointListener must be set before start()");
        }
        return l;
    }

    private void notifyDown(Throwable cause)
    {
        MessageEndpointListener l = listener;
        if (l != null && downNotified.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private static SslContext buildSslContext()
    {
        try {
            return SslContextBuilder.forClient().build();
        }
        catch (SSLException e) {
            throw new DfxTransportException("Unable to initialise TLS", e);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives reassembled WebSocket data frames and forwards raw bytes to the
     * port listener. Control frames are consumed by the protocol handler.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<WebSocketFrame>
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                MessageEndpointListener l = listener;
                if (l != null) {
                    l.onTransportUp();
                }
            }
            else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                notifyDown(new DfxTransportException("WebSocket handshake with " + uri + " timed out"));
                ctx.close();
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
        {
            if (!(frame instanceof BinaryWebSocketFrame) && !(frame instanceof TextWebSocketFrame)) {
                return;
            }

            MessageEndpointListener l = listener;
            if (l == null) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = frame.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onMessage(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            notifyDown(null);
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
