package miniredis.commands;

import miniredis.db.KeyValueStore;
import miniredis.protocol.RespArray;
import miniredis.protocol.RespValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a decoded request ({@code [VERB, arg...]}) into a {@link CommandResult}.
 * <p>
 * Never throws for malformed or unknown requests; those come back as error results.
 * Thread-safe: the only shared state is the {@link KeyValueStore}, which does its own locking.
 */
public class CommandDispatcher {
    public static final String INVALID_REQUEST = "ERR Invalid request";

    private final KeyValueStore store;
    private final AtomicLong totalCommands = new AtomicLong(0);

    public CommandDispatcher(KeyValueStore store) {
        this.store = store;
    }

    public CommandResult execute(RespValue request) {
        List<String> args = toArgs(request);
        if (args == null) return CommandResult.error(INVALID_REQUEST);
        return execute(args);
    }

    public CommandResult execute(List<String> args) {
        if (args.isEmpty()) return CommandResult.error(INVALID_REQUEST);
        totalCommands.incrementAndGet();

        String verb = args.get(0).toUpperCase(Locale.ROOT);
        CommandType type = CommandType.fromVerb(verb);
        if (type == null) {
            return CommandResult.error("ERR Unknown command " + singleLine(verb));
        }
        if (args.size() - 1 != type.arity()) {
            return CommandResult.error("ERR Wrong number of arguments for " + singleLine(verb));
        }
        return CommandResult.ok(CommandRegistry.get(type).execute(store, args));
    }

    public KeyValueStore getStore() {
        return store;
    }

    public long getTotalCommands() {
        return totalCommands.get();
    }

    /**
     * Error replies are written as a single line, so CR and LF from the client become spaces.
     */
    private static String singleLine(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * @return the request as strings, or null if it is not a non-null array of text values
     */
    private static List<String> toArgs(RespValue request) {
        if (!(request instanceof RespArray) || request.isNull()) return null;
        List<RespValue> elements = ((RespArray) request).getElements();
        List<String> args = new ArrayList<>(elements.size());
        for (RespValue element : elements) {
            if (element == null || !element.isText()) return null;
            args.add(element.asText());
        }
        return args;
    }
}
