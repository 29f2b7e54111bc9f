package miniredis.network;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import miniredis.utils.Log;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sits on the listening channel and bounds the number of connections being serviced.
 * <p>
 * Accepted connections beyond the capacity are held back, in arrival order, and handed
 * to the worker pool once a serviced connection closes. Accepting pauses while the pool
 * is full. All state changes run on the listening channel's event loop.
 */
public class ConnectionLimiter extends ChannelInboundHandlerAdapter {
    private final int capacity;
    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private final Deque<Channel> pending = new ConcurrentLinkedDeque<>();

    public ConnectionLimiter(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof Channel)) {
            super.channelRead(ctx, msg);
            return;
        }
        Channel child = (Channel) msg;
        if (activeConnections.get() < capacity && pending.isEmpty()) {
            admit(ctx, child);
        } else {
            pending.addLast(child);
        }
        if (activeConnections.get() >= capacity && ctx.channel().config().isAutoRead()) {
            Log.warn("Connection pool full (" + capacity + "), pausing accept");
            ctx.channel().config().setAutoRead(false);
        }
    }

    private void admit(ChannelHandlerContext ctx, Channel child) {
        activeConnections.incrementAndGet();
        child.closeFuture().addListener(f -> {
            if (!ctx.executor().isShuttingDown()) ctx.executor().execute(() -> release(ctx));
        });
        ctx.fireChannelRead(child);
    }

    private void release(ChannelHandlerContext ctx) {
        activeConnections.decrementAndGet();
        while (activeConnections.get() < capacity && !pending.isEmpty()) {
            Channel next = pending.pollFirst();
            if (next.isOpen()) admit(ctx, next);
        }
        if (activeConnections.get() < capacity && !ctx.channel().config().isAutoRead() && ctx.channel().isActive()) {
            Log.info("Connection pool has capacity again, resuming accept");
            ctx.channel().config().setAutoRead(true);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        closePending();
        super.channelInactive(ctx);
    }

    /**
     * Drops connections that were accepted but never admitted. They are not registered
     * with any event loop yet, so they are closed forcibly.
     */
    void closePending() {
        Channel ch;
        while ((ch = pending.pollFirst()) != null) {
            ch.unsafe().closeForcibly();
        }
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public int getPendingConnections() {
        return pending.size();
    }
}
