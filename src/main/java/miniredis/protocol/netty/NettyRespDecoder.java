package miniredis.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import miniredis.protocol.DecodeResult;
import miniredis.protocol.RespCodec;
import miniredis.utils.Log;

import java.util.List;

/**
 * Netty decoder for RESP requests.
 * <p>
 * Runs {@link RespCodec#decode} over the bytes received so far. A frame that ends
 * early (disconnect or truncated error) is not an error here: the reader index is
 * rewound and decoding retried once more bytes arrive. Values and command errors are
 * passed downstream as {@link DecodeResult}s. Broken framing closes the channel
 * without a reply.
 * <p>
 * After an incomplete attempt the frame is not decoded again until at least as many
 * bytes as the codec reported missing have arrived, so a large bulk string received
 * in small chunks is parsed once rather than once per chunk.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private final RespCodec codec;
    // Readable bytes needed before the pending frame is worth decoding again
    private long awaitedBytes;

    public NettyRespDecoder() {
        this(new RespCodec());
    }

    public NettyRespDecoder(RespCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (in.readableBytes() < awaitedBytes) return;

        int start = in.readerIndex();
        int available = in.readableBytes();
        DecodeResult result = codec.decode(new ByteBufInputStream(in));

        switch (result.getOutcome()) {
            case VALUE:
            case COMMAND_ERROR:
                awaitedBytes = 0;
                out.add(result);
                return;
            case DISCONNECT:
                // Frame incomplete, wait for more data
                in.readerIndex(start);
                awaitedBytes = available + 1L;
                return;
            case PROTOCOL_ERROR:
                if (result.isTruncated()) {
                    in.readerIndex(start);
                    awaitedBytes = available + result.getMissingBytes();
                    return;
                }
                Log.warn("Closing " + ctx.channel().remoteAddress() + ": " + result.getMessage());
                in.skipBytes(in.readableBytes());
                ctx.close();
                return;
            default:
                throw new IllegalStateException("Unhandled outcome " + result.getOutcome());
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);
        if (in.isReadable()) {
            Log.debug("Connection " + ctx.channel().remoteAddress() + " closed mid-frame, dropping "
                    + in.readableBytes() + " bytes");
            in.skipBytes(in.readableBytes());
        }
    }
}
