package miniredis.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import miniredis.protocol.BulkString;
import miniredis.protocol.RespArray;
import miniredis.protocol.RespError;
import miniredis.protocol.RespInteger;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class NettyRespEncoderTest {

    private static String readAll(EmbeddedChannel channel) {
        ByteBuf out = channel.readOutbound();
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    @Test
    public void testEncodeBulkString() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespEncoder());
        assertTrue(channel.writeOutbound(BulkString.of("PONG")));
        assertEquals("$4\r\nPONG\r\n", readAll(channel));
    }

    @Test
    public void testEncodeNestedArrays() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespEncoder());
        RespArray reply = RespArray.of(BulkString.of("foo"), RespInteger.of(123), RespArray.ofBulkStrings("nested"));

        assertTrue(channel.writeOutbound(reply));
        assertEquals("*3\r\n$3\r\nfoo\r\n:123\r\n*1\r\n$6\r\nnested\r\n", readAll(channel));
        assertNull(channel.readOutbound(), "one reply must produce one buffer");
    }

    @Test
    public void testEncodeNullBulkString() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespEncoder());
        assertTrue(channel.writeOutbound(BulkString.NULL));
        assertEquals("$-1\r\n", readAll(channel));
    }

    @Test
    public void testEncodeError() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespEncoder());
        assertTrue(channel.writeOutbound(new RespError("ERR Unknown command FOO")));
        assertEquals("-ERR Unknown command FOO\r\n", readAll(channel));
    }
}
