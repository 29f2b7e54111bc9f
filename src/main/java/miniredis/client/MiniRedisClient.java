package miniredis.client;

import miniredis.Config;
import miniredis.protocol.DecodeResult;
import miniredis.protocol.RespArray;
import miniredis.protocol.RespCodec;
import miniredis.protocol.RespValue;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ProtocolException;
import java.net.Socket;

/**
 * Blocking client: one request, one reply, over a single socket.
 * Not thread-safe.
 */
public class MiniRedisClient implements Closeable {
    private final String host;
    private final int port;
    private final RespCodec codec = new RespCodec();

    private Socket socket;
    private InputStream in;
    private OutputStream out;

    public MiniRedisClient() {
        this(Config.DEFAULT_HOST, Config.DEFAULT_PORT);
    }

    public MiniRedisClient(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public void connect() throws IOException {
        if (socket != null) throw new IllegalStateException("Already connected");
        Socket s = new Socket();
        try {
            s.setTcpNoDelay(true);
            s.connect(new InetSocketAddress(host, port));
            in = new BufferedInputStream(s.getInputStream());
            out = new BufferedOutputStream(s.getOutputStream());
        } catch (IOException e) {
            s.close();
            throw e;
        }
        socket = s;
    }

    /**
     * Sends {@code [args...]} as an array of bulk strings and reads the reply.
     * Server errors come back as {@link miniredis.protocol.RespError} values.
     *
     * @throws EOFException if the server closed the connection
     * @throws ProtocolException if the reply is not valid RESP
     */
    public RespValue execute(String... args) throws IOException {
        if (socket == null) throw new IllegalStateException("Not connected");
        if (args.length == 0) throw new IllegalArgumentException("No command given");

        codec.encode(out, RespArray.ofBulkStrings(args));

        DecodeResult reply = codec.decode(in);
        switch (reply.getOutcome()) {
            case VALUE:
                return reply.getValue();
            case DISCONNECT:
                throw new EOFException("Connection closed by server");
            case COMMAND_ERROR:
            case PROTOCOL_ERROR:
            default:
                throw new ProtocolException(reply.getMessage());
        }
    }

    public boolean isConnected() {
        return socket != null && !socket.isClosed();
    }

    public void disconnect() throws IOException {
        close();
    }

    @Override
    public void close() throws IOException {
        Socket s = socket;
        socket = null;
        in = null;
        out = null;
        if (s != null) s.close();
    }
}
