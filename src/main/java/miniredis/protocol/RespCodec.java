package miniredis.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes and decodes RESP values over byte streams.
 * <p>
 * Decoding reads exactly one value per call and never reads past its end, so the
 * same stream can be decoded repeatedly. Encoding always emits bulk-string framing
 * for text; simple strings are never written.
 * <p>
 * Stateless and safe to share between threads.
 */
public class RespCodec {

    public static final String INVALID_COMMAND = "Invalid Command";

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final int MAX_PREALLOCATED_ELEMENTS = 1024;

    // --- DECODING ---

    /**
     * Decodes one value. Blocks only on stream reads.
     *
     * @throws IOException if the underlying stream fails (not for malformed input)
     */
    public DecodeResult decode(InputStream in) throws IOException {
        int prefix = in.read();
        if (prefix == -1) return DecodeResult.disconnect();
        return decodeValue(prefix, in);
    }

    private DecodeResult decodeValue(int prefix, InputStream in) throws IOException {
        RespType type = RespType.fromPrefix(prefix);
        if (type == null) {
            return DecodeResult.protocolError("Protocol error: unknown type prefix 0x" + Integer.toHexString(prefix));
        }

        switch (type) {
            case SIMPLE_STRING:
            case ERROR: {
                byte[] line = readLine(in);
                if (line == null) return DecodeResult.truncated("Protocol error: unterminated line");
                String text = utf8(line);
                if (text == null) return DecodeResult.protocolError("Protocol error: invalid UTF-8 in line");
                return DecodeResult.value(type == RespType.ERROR ? new RespError(text) : new SimpleString(text));
            }
            case INTEGER: {
                byte[] line = readLine(in);
                if (line == null) return DecodeResult.truncated("Protocol error: unterminated integer");
                Long n = parseInteger(line);
                if (n == null) return DecodeResult.protocolError("Protocol error: invalid integer '" + printable(line) + "'");
                return DecodeResult.value(RespInteger.of(n));
            }
            case BULK_STRING:
                return decodeBulkString(in);
            case ARRAY:
                return decodeArray(in);
            default:
                throw new IllegalStateException("Unhandled type " + type);
        }
    }

    private DecodeResult decodeBulkString(InputStream in) throws IOException {
        byte[] line = readLine(in);
        if (line == null) return DecodeResult.truncated("Protocol error: unterminated bulk length");
        Long length = parseInteger(line);
        if (length == null) return DecodeResult.protocolError("Protocol error: invalid bulk length '" + printable(line) + "'");
        if (length == -1) return DecodeResult.value(BulkString.NULL);
        if (length < 0 || length > Integer.MAX_VALUE) {
            return DecodeResult.protocolError("Protocol error: invalid bulk length " + length);
        }

        byte[] data = in.readNBytes(length.intValue());
        if (data.length < length) {
            return DecodeResult.truncated("Protocol error: expected " + length + " bytes, got " + data.length,
                    length - data.length + CRLF.length);
        }
        // The two terminator bytes are skipped without being checked.
        int terminator = in.readNBytes(CRLF.length).length;
        if (terminator < CRLF.length) {
            return DecodeResult.truncated("Protocol error: missing bulk string terminator", CRLF.length - terminator);
        }

        String text = utf8(data);
        if (text == null) return DecodeResult.protocolError("Protocol error: invalid UTF-8 in bulk string");
        return DecodeResult.value(BulkString.of(text));
    }

    private DecodeResult decodeArray(InputStream in) throws IOException {
        byte[] line = readLine(in);
        if (line == null) return DecodeResult.truncated("Protocol error: unterminated array size");
        Long count = parseInteger(line);
        if (count == null) return DecodeResult.protocolError("Protocol error: invalid array size '" + printable(line) + "'");
        if (count == -1) return DecodeResult.value(RespArray.NULL);
        if (count < -1) return DecodeResult.commandError(INVALID_COMMAND);
        if (count == 0) return DecodeResult.value(RespArray.EMPTY);

        List<RespValue> elements = new ArrayList<>((int) Math.min(count, MAX_PREALLOCATED_ELEMENTS));
        for (long i = 0; i < count; i++) {
            DecodeResult element = decode(in);
            if (!element.isValue()) return element;
            elements.add(element.getValue());
        }
        return DecodeResult.value(RespArray.of(elements));
    }

    /**
     * Reads up to CR LF. A CR followed by anything other than LF is kept as content,
     * together with the byte after it.
     *
     * @return the line without its terminator, or null if the stream ended first
     */
    private byte[] readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(32);
        while (true) {
            int b = in.read();
            if (b == -1) return null;
            if (b == '\r') {
                int next = in.read();
                if (next == -1) return null;
                if (next == '\n') return line.toByteArray();
                line.write(b);
                line.write(next);
            } else {
                line.write(b);
            }
        }
    }

    /**
     * Base-10 ASCII digits with an optional leading minus sign.
     *
     * @return the parsed value, or null if the line is not a valid 64-bit integer
     */
    static Long parseInteger(byte[] line) {
        int start = (line.length > 0 && line[0] == '-') ? 1 : 0;
        if (line.length == start) return null;
        for (int i = start; i < line.length; i++) {
            if (line[i] < '0' || line[i] > '9') return null;
        }
        try {
            return Long.parseLong(new String(line, StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            return null; // overflow
        }
    }

    private static String utf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static String printable(byte[] line) {
        String s = new String(line, StandardCharsets.UTF_8);
        return s.length() > 32 ? s.substring(0, 32) + "..." : s;
    }

    // --- ENCODING ---

    /**
     * Writes one value and flushes once.
     * A Java null is written as the null bulk string.
     *
     * @throws IllegalArgumentException for a value shape this codec cannot write
     */
    public void encode(OutputStream out, RespValue value) throws IOException {
        write(out, value);
        out.flush();
    }

    private void write(OutputStream out, RespValue value) throws IOException {
        if (value == null || value.isNull()) {
            out.write(NULL_BULK);
        } else if (value instanceof RespInteger) {
            writeAscii(out, ":" + ((RespInteger) value).getValue());
            out.write(CRLF);
        } else if (value.isText()) {
            byte[] bytes = value.asText().getBytes(StandardCharsets.UTF_8);
            writeAscii(out, "$" + bytes.length);
            out.write(CRLF);
            out.write(bytes);
            out.write(CRLF);
        } else if (value instanceof RespArray) {
            List<RespValue> elements = ((RespArray) value).getElements();
            writeAscii(out, "*" + elements.size());
            out.write(CRLF);
            for (RespValue element : elements) {
                write(out, element);
            }
        } else if (value instanceof RespError) {
            out.write('-');
            out.write(((RespError) value).getMessage().getBytes(StandardCharsets.UTF_8));
            out.write(CRLF);
        } else {
            throw new IllegalArgumentException("Cannot encode value of type " + value.getClass().getName());
        }
    }

    private static void writeAscii(OutputStream out, String s) throws IOException {
        out.write(s.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Convenience for callers that need the encoded frame as a byte array.
     */
    public byte[] encodeToBytes(RespValue value) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try {
            encode(bos, value);
        } catch (IOException e) {
            throw new IllegalStateException("In-memory stream failed", e);
        }
        return bos.toByteArray();
    }
}
