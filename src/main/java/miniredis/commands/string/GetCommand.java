package miniredis.commands.string;

import miniredis.commands.Command;
import miniredis.db.KeyValueStore;
import miniredis.protocol.BulkString;
import miniredis.protocol.RespValue;

import java.util.List;

public class GetCommand implements Command {
    @Override
    public RespValue execute(KeyValueStore store, List<String> args) {
        // Absent key -> null bulk string
        return BulkString.of(store.get(args.get(1)));
    }
}
