package miniredis.protocol;

/**
 * Wire type tags, keyed by their one-byte prefix.
 */
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*');

    private static final RespType[] BY_PREFIX = new RespType[128];

    static {
        for (RespType type : values()) {
            BY_PREFIX[type.prefix] = type;
        }
    }

    private final char prefix;

    RespType(char prefix) {
        this.prefix = prefix;
    }

    public char prefix() {
        return prefix;
    }

    /**
     * @return the type for a prefix byte, or null when the byte is not a known prefix
     */
    public static RespType fromPrefix(int b) {
        if (b < 0 || b >= BY_PREFIX.length) return null;
        return BY_PREFIX[b];
    }
}
