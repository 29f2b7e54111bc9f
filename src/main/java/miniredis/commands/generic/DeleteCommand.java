package miniredis.commands.generic;

import miniredis.commands.Command;
import miniredis.db.KeyValueStore;
import miniredis.protocol.RespInteger;
import miniredis.protocol.RespValue;

import java.util.List;

public class DeleteCommand implements Command {
    @Override
    public RespValue execute(KeyValueStore store, List<String> args) {
        return store.delete(args.get(1)) ? RespInteger.ONE : RespInteger.ZERO;
    }
}
