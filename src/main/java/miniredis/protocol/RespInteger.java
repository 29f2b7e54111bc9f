package miniredis.protocol;

public final class RespInteger extends RespValue {
    public static final RespInteger ZERO = new RespInteger(0);
    public static final RespInteger ONE = new RespInteger(1);

    private final long value;

    public RespInteger(long value) {
        this.value = value;
    }

    public static RespInteger of(long value) {
        if (value == 0) return ZERO;
        if (value == 1) return ONE;
        return new RespInteger(value);
    }

    @Override
    public RespType type() {
        return RespType.INTEGER;
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespInteger)) return false;
        return value == ((RespInteger) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "(integer) " + value;
    }
}
