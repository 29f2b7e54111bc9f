package miniredis.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class RespArray extends RespValue {
    public static final RespArray NULL = new RespArray(null);
    public static final RespArray EMPTY = new RespArray(Collections.emptyList());

    private final List<RespValue> elements;

    private RespArray(List<RespValue> elements) {
        this.elements = elements;
    }

    public static RespArray of(List<RespValue> elements) {
        if (elements == null) return NULL;
        if (elements.isEmpty()) return EMPTY;
        return new RespArray(Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static RespArray of(RespValue... elements) {
        return of(Arrays.asList(elements));
    }

    /**
     * Builds a request-shaped array: one bulk string per argument.
     */
    public static RespArray ofBulkStrings(String... args) {
        List<RespValue> list = new ArrayList<>(args.length);
        for (String arg : args) {
            list.add(BulkString.of(arg));
        }
        return of(list);
    }

    @Override
    public RespType type() {
        return RespType.ARRAY;
    }

    @Override
    public boolean isNull() {
        return elements == null;
    }

    /**
     * @return the elements, or null for the null array
     */
    public List<RespValue> getElements() {
        return elements;
    }

    public int size() {
        return elements == null ? -1 : elements.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespArray)) return false;
        return Objects.equals(elements, ((RespArray) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "(nil array)" : elements.toString();
    }
}
