package com.questrail.meshlink.transport.tcp.netty;

import com.questrail.meshlink.api.PeerDevice;
import com.questrail.meshlink.error.TransportUnavailableException;
import com.questrail.meshlink.transport.CharacteristicId;
import com.questrail.meshlink.transport.MeshServiceProfile;
import com.questrail.meshlink.transport.TransportLink;
import com.questrail.meshlink.transport.TransportLinkListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * TcpStreamTransportLink
 * =============================================================================
 * Netty-backed {@link TransportLink} for radios reachable over a TCP byte
 * stream (network-attached nodes, serial-to-TCP bridges).
 *
 * <h2>Characteristic mapping</h2>
 * <ul>
 *   <li>{@code ToRadio} writes become one stream frame each; a reliable write
 *       is a plain write, the stream already confirms delivery.</li>
 *   <li>Inbound frames are buffered; a {@code FromRadio} read returns the
 *       oldest one, or an empty array when none is waiting.</li>
 *   <li>Once notifications on {@code FromNum} are enabled, every inbound frame
 *       is announced with a {@code FromNum} notification carrying the
 *       running frame count.</li>
 * </ul>
 *
 * <h2>Architectural Role</h2>
 * A pure transport adapter: it does not decode frames, retry or reconnect.
 * Netty types do not escape this package; inbound payloads are copied into
 * {@code byte[]}.
 *
 * <h2>Lifecycle</h2>
 * {@link #connect(PeerDevice)} opens a channel to the device address
 * ({@code host:port}); {@link #disconnect()} closes it without reporting a
 * link-down. {@link #close()} releases the event loop group.
 */
public final class TcpStreamTransportLink implements TransportLink, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(TcpStreamTransportLink.class);

    /** Reported when the connection could not be established. */
    public static final int REASON_CONNECT_FAILED = 1;

    /** Reported when the peer closed the stream or it broke. */
    public static final int REASON_STREAM_CLOSED = 8;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final Queue<byte[]> inbound = new ConcurrentLinkedQueue<>();

    private volatile TransportLinkListener listener;
    private volatile Channel channel;
    private volatile boolean notifyFromNum;
    private volatile long inboundCount;

    public TcpStreamTransportLink() {
        this(5_000);
    }

    /**
     * @param connectTimeoutMillis socket connect timeout
     */
    public TcpStreamTransportLink(int connectTimeoutMillis) {
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new StreamFrameDecoder());
                        p.addLast(new StreamFrameEncoder());
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(TransportLinkListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect(PeerDevice device) {
        Objects.requireNonNull(device, "device");
        TransportLinkListener l = requireListener();

        closeChannel();

        InetSocketAddress remote = parseAddress(device.address());
        ChannelFuture f = bootstrap.connect(remote);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                log.debug("Stream link to {} established", remote);
                channel = future.channel();
                l.onLinkUp();
            } else {
                log.debug("Stream link to {} failed: {}", remote, String.valueOf(future.cause()));
                l.onLinkDown(REASON_CONNECT_FAILED);
            }
        });
    }

    @Override
    public void disconnect() {
        closeChannel();
    }

    /**
     * TCP has no pairing step; authorization is always granted.
     */
    @Override
    public void requestAuthorization(PeerDevice device) {
        requireListener().onAuthorizationResult(true);
    }

    @Override
    public boolean isAvailable(CharacteristicId characteristic) {
        Channel ch = channel;
        return ch != null && ch.isActive() && MeshServiceProfile.REQUIRED.contains(characteristic);
    }

    @Override
    public CompletionStage<Set<CharacteristicId>> discoverServices() {
        if (activeChannel() == null) {
            return notConnected();
        }
        return CompletableFuture.completedFuture(MeshServiceProfile.REQUIRED);
    }

    @Override
    public CompletionStage<Integer> requestTransferUnit(int requestedSize) {
        if (activeChannel() == null) {
            return notConnected();
        }
        return CompletableFuture.completedFuture(Math.min(requestedSize, StreamFrameDecoder.MAX_PAYLOAD));
    }

    @Override
    public CompletionStage<Void> performWrite(CharacteristicId destination, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (!MeshServiceProfile.TO_RADIO.equals(destination)) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException(destination + " is not writable"));
        }
        if (payload.length > StreamFrameDecoder.MAX_PAYLOAD) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "payload of " + payload.length + " bytes exceeds " + StreamFrameDecoder.MAX_PAYLOAD));
        }
        Channel ch = activeChannel();
        if (ch == null) {
            return notConnected();
        }

        CompletableFuture<Void> written = new CompletableFuture<>();
        ch.writeAndFlush(payload.clone()).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                written.complete(null);
            } else {
                written.completeExceptionally(future.cause());
            }
        });
        return written;
    }

    @Override
    public CompletionStage<byte[]> performRead(CharacteristicId source) {
        if (!MeshServiceProfile.FROM_RADIO.equals(source)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(source + " is not readable"));
        }
        if (activeChannel() == null) {
            return notConnected();
        }
        byte[] next = inbound.poll();
        return CompletableFuture.completedFuture(next == null ? new byte[0] : next);
    }

    @Override
    public CompletionStage<Void> setNotify(CharacteristicId source, boolean enabled) {
        if (!MeshServiceProfile.FROM_NUM.equals(source)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(source + " does not notify"));
        }
        if (activeChannel() == null) {
            return notConnected();
        }
        notifyFromNum = enabled;
        if (enabled && !inbound.isEmpty()) {
            announce();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<Void> performReliableWrite(CharacteristicId destination, byte[] payload) {
        return performWrite(destination, payload);
    }

    /**
     * Closes the channel and shuts the event loop group down.
     */
    @Override
    public void close() {
        closeChannel();
        group.shutdownGracefully();
    }

    /** Frames received and not yet read, for diagnostics. */
    public int bufferedFrames() {
        return inbound.size();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void closeChannel() {
        Channel ch = channel;
        channel = null;
        notifyFromNum = false;
        inbound.clear();
        if (ch != null) {
            ch.close();
        }
    }

    private Channel activeChannel() {
        Channel ch = channel;
        return ch != null && ch.isActive() ? ch : null;
    }

    private void announce() {
        TransportLinkListener l = listener;
        if (l == null) {
            return;
        }
        long count = inboundCount;
        byte[] value = new byte[] {
                (byte) count, (byte) (count >>> 8), (byte) (count >>> 16), (byte) (count >>> 24)
        };
        l.onNotification(MeshServiceProfile.FROM_NUM, value);
    }

    private static <T> CompletableFuture<T> notConnected() {
        return CompletableFuture.failedFuture(new TransportUnavailableException("stream link is not connected"));
    }

    private TransportLinkListener requireListener() {
        TransportLinkListener l = listener;
        if (l == null) {
            throw new IllegalStateException("TransportLinkListener must be set before connect()");
        }
        return l;
    }

    static InetSocketAddress parseAddress(String address) {
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("expected host:port, got '" + address + "'");
        }
        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in '" + address + "'", e);
        }
        return InetSocketAddress.createUnresolved(host, port);
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Buffers decoded frames and reports stream loss for the current channel.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<byte[]>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, byte[] frame) {
            if (ctx.channel() != channel) {
                return;
            }
            inbound.add(frame);
            inboundCount++;
            if (notifyFromNum) {
                announce();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            // A channel we closed ourselves is no longer current.
            if (ctx.channel() != channel) {
                return;
            }
            channel = null;
            notifyFromNum = false;
            TransportLinkListener l = listener;
            if (l != null) {
                l.onLinkDown(REASON_STREAM_CLOSED);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Stream link error, closing channel", cause);
            ctx.close();
        }
    }
}
