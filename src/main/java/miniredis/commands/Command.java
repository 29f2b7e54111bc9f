package miniredis.commands;

import miniredis.db.KeyValueStore;
import miniredis.protocol.RespValue;

import java.util.List;

public interface Command {
    // args.get(0) is the verb; arity has already been checked by the dispatcher.
    RespValue execute(KeyValueStore store, List<String> args);
}
