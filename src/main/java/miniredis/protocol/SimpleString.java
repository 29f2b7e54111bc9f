package miniredis.protocol;

import java.util.Objects;

public final class SimpleString extends RespValue {
    private final String text;

    public SimpleString(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public RespType type() {
        return RespType.SIMPLE_STRING;
    }

    @Override
    public boolean isText() {
        return true;
    }

    @Override
    public String asText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleString)) return false;
        return text.equals(((SimpleString) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "+" + text;
    }
}
