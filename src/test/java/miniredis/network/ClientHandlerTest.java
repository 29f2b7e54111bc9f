package miniredis.network;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import miniredis.commands.CommandDispatcher;
import miniredis.db.KeyValueStore;
import miniredis.protocol.netty.NettyRespDecoder;
import miniredis.protocol.netty.NettyRespEncoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ClientHandlerTest {

    private KeyValueStore store;
    private EmbeddedChannel channel;

    @BeforeEach
    public void setup() {
        store = new KeyValueStore();
        channel = newChannel(store);
    }

    private static EmbeddedChannel newChannel(KeyValueStore store) {
        return new EmbeddedChannel(
                new NettyRespDecoder(),
                new NettyRespEncoder(),
                new ClientHandler(new CommandDispatcher(store)));
    }

    private String send(String wire) {
        channel.writeInbound(Unpooled.copiedBuffer(wire, StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder();
        ByteBuf out;
        while ((out = channel.readOutbound()) != null) {
            sb.append(out.toString(StandardCharsets.UTF_8));
            out.release();
        }
        return sb.toString();
    }

    @Test
    public void testPing() {
        assertEquals("$4\r\nPONG\r\n", send("*1\r\n$4\r\nPING\r\n"));
    }

    @Test
    public void testSetGetDeleteRoundTrip() {
        assertEquals("$2\r\nOK\r\n", send("*3\r\n$3\r\nSET\r\n$4\r\nname\r\n$5\r\nAlice\r\n"));
        assertEquals("$5\r\nAlice\r\n", send("*2\r\n$3\r\nGET\r\n$4\r\nname\r\n"));
        assertEquals(":1\r\n", send("*2\r\n$6\r\nDELETE\r\n$4\r\nname\r\n"));
        assertEquals("$-1\r\n", send("*2\r\n$3\r\nGET\r\n$4\r\nname\r\n"));
        assertEquals(":0\r\n", send("*2\r\n$6\r\nDELETE\r\n$4\r\nname\r\n"));
    }

    @Test
    public void testCommandErrorKeepsConnectionOpen() {
        assertEquals("-ERR Unknown command FOO\r\n", send("*1\r\n$3\r\nFOO\r\n"));
        assertTrue(channel.isOpen());
        assertEquals("-ERR Wrong number of arguments for SET\r\n", send("*2\r\n$3\r\nSET\r\n$1\r\nk\r\n"));
        assertTrue(channel.isOpen());
        assertEquals("$4\r\nPONG\r\n", send("*1\r\n$4\r\nPING\r\n"));
    }

    @Test
    public void testVerbWithLineBreaksGetsSingleErrorLine() {
        assertEquals("-ERR Unknown command X  :1\r\n", send("*1\r\n$5\r\nX\r\n:1\r\n"));
        assertTrue(channel.isOpen());
        assertEquals("-ERR Unknown command A B\r\n", send("*1\r\n$3\r\nA\nB\r\n"));
        // Still in sync: the next request gets its own reply
        assertEquals("$4\r\nPONG\r\n", send("*1\r\n$4\r\nPING\r\n"));
    }

    @Test
    public void testInvalidArraySizeIsAnsweredNotFatal() {
        assertEquals("-Invalid Command\r\n", send("*-3\r\n"));
        assertTrue(channel.isOpen());
        assertEquals("$4\r\nPONG\r\n", send("*1\r\n$4\r\nPING\r\n"));
    }

    @Test
    public void testNonArrayRequestIsAnswered() {
        assertEquals("-ERR Invalid request\r\n", send("+PING\r\n"));
        assertEquals("-ERR Invalid request\r\n", send("*0\r\n"));
        assertTrue(channel.isOpen());
    }

    @Test
    public void testPipelinedRequestsAnsweredInOrder() {
        String replies = send("*3\r\n$3\r\nSET\r\n$1\r\na\r\n$1\r\n1\r\n"
                + "*2\r\n$3\r\nGET\r\n$1\r\na\r\n"
                + "*1\r\n$4\r\nping\r\n");
        assertEquals("$2\r\nOK\r\n$1\r\n1\r\n$4\r\nPONG\r\n", replies);
    }

    @Test
    public void testProtocolErrorClosesWithoutReply() {
        assertEquals("", send("*1\r\n$x\r\n"));
        assertFalse(channel.isOpen());
    }

    @Test
    public void testProtocolErrorDoesNotAffectOtherConnections() {
        EmbeddedChannel other = newChannel(store);
        other.writeInbound(Unpooled.copiedBuffer("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n", StandardCharsets.UTF_8));
        ((ByteBuf) other.readOutbound()).release();

        send("?garbage\r\n");
        assertFalse(channel.isOpen());

        other.writeInbound(Unpooled.copiedBuffer("*2\r\n$3\r\nGET\r\n$1\r\nk\r\n", StandardCharsets.UTF_8));
        ByteBuf reply = other.readOutbound();
        assertEquals("$1\r\nv\r\n", reply.toString(StandardCharsets.UTF_8));
        reply.release();
        assertTrue(other.isOpen());
    }
}
