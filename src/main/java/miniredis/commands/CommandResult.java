package miniredis.commands;

import miniredis.protocol.RespError;
import miniredis.protocol.RespValue;

import java.util.Objects;

/**
 * Either a reply value or a command error message.
 * Errors become wire values only through {@link #toReply()}.
 */
public final class CommandResult {
    private final RespValue value;
    private final String error;

    private CommandResult(RespValue value, String error) {
        this.value = value;
        this.error = error;
    }

    public static CommandResult ok(RespValue value) {
        return new CommandResult(Objects.requireNonNull(value, "value"), null);
    }

    public static CommandResult error(String message) {
        return new CommandResult(null, Objects.requireNonNull(message, "message"));
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this is an error result
     */
    public RespValue getValue() {
        if (error != null) throw new IllegalStateException("Command failed: " + error);
        return value;
    }

    public String getError() {
        return error;
    }

    public RespValue toReply() {
        return error != null ? new RespError(error) : value;
    }

    @Override
    public String toString() {
        return error != null ? "ERROR " + error : "OK " + value;
    }
}
