package miniredis.network;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.group.ChannelGroup;
import miniredis.commands.CommandDispatcher;
import miniredis.commands.CommandResult;
import miniredis.protocol.DecodeResult;
import miniredis.protocol.RespError;
import miniredis.protocol.RespValue;
import miniredis.utils.Log;

import java.io.IOException;

/**
 * Per-connection request loop: takes decoded requests, dispatches them and writes one
 * reply per request. Command errors are answered on the wire and keep the connection open.
 * <p>
 * One instance per channel.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final CommandDispatcher dispatcher;
    private final ChannelGroup connectedClients;

    public ClientHandler(CommandDispatcher dispatcher) {
        this(dispatcher, null);
    }

    public ClientHandler(CommandDispatcher dispatcher, ChannelGroup connectedClients) {
        this.dispatcher = dispatcher;
        this.connectedClients = connectedClients;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        if (connectedClients != null) connectedClients.add(ctx.channel());
        Log.debug("Client connected: " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Log.debug("Client disconnected: " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof DecodeResult)) {
            super.channelRead(ctx, msg);
            return;
        }
        DecodeResult request = (DecodeResult) msg;
        ctx.writeAndFlush(handleRequest(request));
    }

    RespValue handleRequest(DecodeResult request) {
        if (request.isCommandError()) {
            return new RespError(request.getMessage());
        }
        CommandResult result = dispatcher.execute(request.getValue());
        if (result.isError() && Log.isDebugEnabled()) {
            Log.debug("Command rejected: " + result.getError());
        }
        return result.toReply();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            // Usually "connection reset by peer"
            Log.debug("I/O error on " + ctx.channel().remoteAddress() + ": " + cause.getMessage());
        } else {
            Log.warn("Unexpected error on " + ctx.channel().remoteAddress() + ": " + cause);
        }
        ctx.close();
    }
}
