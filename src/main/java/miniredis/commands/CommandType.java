package miniredis.commands;

import java.util.Locale;

/**
 * The fixed command table: verb and the exact number of arguments it takes (excluding the verb).
 */
public enum CommandType {
    PING(0),
    GET(1),
    SET(2),
    DELETE(1);

    private final int arity;

    CommandType(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    /**
     * Case-insensitive verb lookup.
     *
     * @return the command, or null for an unknown verb
     */
    public static CommandType fromVerb(String verb) {
        switch (verb.toUpperCase(Locale.ROOT)) {
            case "PING": return PING;
            case "GET": return GET;
            case "SET": return SET;
            case "DELETE": return DELETE;
            default: return null;
        }
    }
}
