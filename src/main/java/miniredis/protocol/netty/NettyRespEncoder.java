package miniredis.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import miniredis.protocol.RespCodec;
import miniredis.protocol.RespValue;

/**
 * Encodes {@link RespValue} replies. Each reply lands in a single outbound buffer.
 */
public class NettyRespEncoder extends MessageToByteEncoder<RespValue> {

    private final RespCodec codec;

    public NettyRespEncoder() {
        this(new RespCodec());
    }

    public NettyRespEncoder(RespCodec codec) {
        super(RespValue.class);
        this.codec = codec;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, RespValue msg, ByteBuf out) throws Exception {
        codec.encode(new ByteBufOutputStream(out), msg);
    }
}
