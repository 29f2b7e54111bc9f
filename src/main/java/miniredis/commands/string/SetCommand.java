package miniredis.commands.string;

import miniredis.commands.Command;
import miniredis.db.KeyValueStore;
import miniredis.protocol.BulkString;
import miniredis.protocol.RespValue;

import java.util.List;

public class SetCommand implements Command {
    private static final RespValue OK = BulkString.of("OK");

    @Override
    public RespValue execute(KeyValueStore store, List<String> args) {
        store.set(args.get(1), args.get(2));
        return OK;
    }
}
