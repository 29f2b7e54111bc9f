package miniredis.protocol;

/**
 * Outcome of decoding one value from a stream.
 * <p>
 * Exactly one of: a value, a clean disconnect (stream ended before the first byte),
 * a command error (a well-framed but invalid value, the connection may continue),
 * or a protocol error (broken framing, the connection must be closed).
 */
public final class DecodeResult {

    public enum Outcome {
        VALUE,
        DISCONNECT,
        COMMAND_ERROR,
        PROTOCOL_ERROR
    }

    private static final DecodeResult DISCONNECT = new DecodeResult(Outcome.DISCONNECT, null, null, false, 0);

    private final Outcome outcome;
    private final RespValue value;
    private final String message;
    private final boolean truncated;
    private final long missingBytes;

    private DecodeResult(Outcome outcome, RespValue value, String message, boolean truncated, long missingBytes) {
        this.outcome = outcome;
        this.value = value;
        this.message = message;
        this.truncated = truncated;
        this.missingBytes = missingBytes;
    }

    public static DecodeResult value(RespValue value) {
        return new DecodeResult(Outcome.VALUE, value, null, false, 0);
    }

    public static DecodeResult disconnect() {
        return DISCONNECT;
    }

    public static DecodeResult commandError(String message) {
        return new DecodeResult(Outcome.COMMAND_ERROR, null, message, false, 0);
    }

    public static DecodeResult protocolError(String message) {
        return new DecodeResult(Outcome.PROTOCOL_ERROR, null, message, false, 0);
    }

    /**
     * Protocol error caused by the stream ending in the middle of a frame.
     */
    public static DecodeResult truncated(String message) {
        return truncated(message, 1);
    }

    /**
     * Truncated frame where at least {@code missingBytes} more bytes are known to be needed.
     */
    public static DecodeResult truncated(String message, long missingBytes) {
        return new DecodeResult(Outcome.PROTOCOL_ERROR, null, message, true, Math.max(1, missingBytes));
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isValue() {
        return outcome == Outcome.VALUE;
    }

    public boolean isDisconnect() {
        return outcome == Outcome.DISCONNECT;
    }

    public boolean isCommandError() {
        return outcome == Outcome.COMMAND_ERROR;
    }

    public boolean isProtocolError() {
        return outcome == Outcome.PROTOCOL_ERROR;
    }

    /**
     * Only meaningful for protocol errors.
     */
    public boolean isTruncated() {
        return truncated;
    }

    /**
     * Lower bound on the bytes still missing from a truncated frame; 0 for any other result.
     */
    public long getMissingBytes() {
        return missingBytes;
    }

    /**
     * @throws IllegalStateException if this result does not carry a value
     */
    public RespValue getValue() {
        if (outcome != Outcome.VALUE) throw new IllegalStateException("No value for outcome " + outcome);
        return value;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        switch (outcome) {
            case VALUE: return "VALUE " + value;
            case DISCONNECT: return "DISCONNECT";
            default: return outcome + (truncated ? " (truncated) " : " ") + message;
        }
    }
}
