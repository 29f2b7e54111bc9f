package miniredis.commands.connection;

import miniredis.commands.Command;
import miniredis.db.KeyValueStore;
import miniredis.protocol.BulkString;
import miniredis.protocol.RespValue;

import java.util.List;

public class PingCommand implements Command {
    private static final RespValue PONG = BulkString.of("PONG");

    @Override
    public RespValue execute(KeyValueStore store, List<String> args) {
        return PONG;
    }
}
