package miniredis.protocol;

/**
 * A decoded or to-be-encoded RESP value.
 * Both requests and responses are carried as RespValue trees.
 */
public abstract class RespValue {

    public abstract RespType type();

    /**
     * Null bulk strings and null arrays.
     */
    public boolean isNull() {
        return false;
    }

    /**
     * True for simple and bulk strings that carry text.
     */
    public boolean isText() {
        return false;
    }

    /**
     * @return the text of a simple or bulk string
     * @throws IllegalStateException for any other shape
     */
    public String asText() {
        throw new IllegalStateException("Not a text value: " + type());
    }
}
