package miniredis.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import miniredis.Config;
import miniredis.commands.CommandDispatcher;
import miniredis.network.ClientHandler;
import miniredis.network.ConnectionLimiter;
import miniredis.protocol.RespCodec;
import miniredis.protocol.netty.NettyRespDecoder;
import miniredis.protocol.netty.NettyRespEncoder;
import miniredis.utils.Log;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Owns the listening socket and the worker pool.
 * <p>
 * Each accepted connection is pinned to one worker event loop and gets its own
 * decoder, encoder and {@link ClientHandler}. At most {@code maxClients} connections
 * are serviced at once, see {@link ConnectionLimiter}.
 */
public class ConnectionServer {
    private static final long SHUTDOWN_QUIET_MS = 0;
    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final Config config;
    private final CommandDispatcher dispatcher;
    private final RespCodec codec = new RespCodec();
    private final ChannelGroup connectedClients = new DefaultChannelGroup("clients", GlobalEventExecutor.INSTANCE);
    private final ConnectionLimiter limiter;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;
    private volatile boolean running = false;

    public ConnectionServer(Config config, CommandDispatcher dispatcher) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.limiter = new ConnectionLimiter(config.maxClients);
    }

    /**
     * Binds the listening socket. Returns once the server accepts connections.
     *
     * @throws InterruptedException if interrupted while binding
     */
    public synchronized void start() throws InterruptedException {
        if (bossGroup != null) throw new IllegalStateException("Server can only be started once");

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .handler(limiter)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new NettyRespDecoder(codec));
                     ch.pipeline().addLast(new NettyRespEncoder(codec));
                     ch.pipeline().addLast(new ClientHandler(dispatcher, connectedClients));
                 }
             });

            serverChannel = b.bind(config.host, config.port).sync().channel();
        } catch (Exception e) {
            bossGroup.shutdownGracefully(SHUTDOWN_QUIET_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            workerGroup.shutdownGracefully(SHUTDOWN_QUIET_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            throw e;
        }
        running = true;
        Log.info("Ready on " + config.host + ":" + getPort() + " (max clients: " + config.maxClients + ")");
    }

    /**
     * Stops accepting, lets every live connection flush the replies already written,
     * then closes it. Never cuts a reply frame short.
     */
    public synchronized void stop() {
        if (!running) return;
        running = false;
        Log.info("Shutting down...");

        serverChannel.close().syncUninterruptibly();
        for (Channel ch : connectedClients) {
            ch.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        }
        connectedClients.newCloseFuture().awaitUninterruptibly(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);

        workerGroup.shutdownGracefully(SHUTDOWN_QUIET_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        bossGroup.shutdownGracefully(SHUTDOWN_QUIET_MS, SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS).syncUninterruptibly();
        Log.info("Server stopped.");
    }

    /**
     * Blocks until the listening channel is closed.
     */
    public void awaitTermination() throws InterruptedException {
        Channel ch = serverChannel;
        if (ch != null) ch.closeFuture().sync();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * The bound port; differs from the configured one when binding to port 0.
     */
    public int getPort() {
        if (serverChannel == null) throw new IllegalStateException("Server not started");
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public int getActiveConnections() {
        return limiter.getActiveConnections();
    }

    public CommandDispatcher getDispatcher() {
        return dispatcher;
    }
}
