package miniredis.protocol;

import java.util.Objects;

public final class BulkString extends RespValue {
    public static final BulkString NULL = new BulkString(null);

    private final String text;

    private BulkString(String text) {
        this.text = text;
    }

    public static BulkString of(String text) {
        return text == null ? NULL : new BulkString(text);
    }

    @Override
    public RespType type() {
        return RespType.BULK_STRING;
    }

    @Override
    public boolean isNull() {
        return text == null;
    }

    @Override
    public boolean isText() {
        return text != null;
    }

    @Override
    public String asText() {
        if (text == null) throw new IllegalStateException("Null bulk string has no text");
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BulkString)) return false;
        return Objects.equals(text, ((BulkString) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(text);
    }

    @Override
    public String toString() {
        return text == null ? "(nil)" : "\"" + text + "\"";
    }
}
