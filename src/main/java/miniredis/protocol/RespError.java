package miniredis.protocol;

import java.util.Objects;

/**
 * The wire error type ({@code -message}).
 */
public final class RespError extends RespValue {
    private final String message;

    public RespError(String message) {
        this.message = Objects.requireNonNull(message, "message");
    }

    @Override
    public RespType type() {
        return RespType.ERROR;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespError)) return false;
        return message.equals(((RespError) o).message);
    }

    @Override
    public int hashCode() {
        return message.hashCode();
    }

    @Override
    public String toString() {
        return "(error) " + message;
    }
}
