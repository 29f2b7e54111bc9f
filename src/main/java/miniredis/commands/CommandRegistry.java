package miniredis.commands;

import miniredis.commands.connection.PingCommand;
import miniredis.commands.generic.DeleteCommand;
import miniredis.commands.string.GetCommand;
import miniredis.commands.string.SetCommand;

import java.util.EnumMap;
import java.util.Map;

public class CommandRegistry {
    private static final Map<CommandType, Command> commands = new EnumMap<>(CommandType.class);

    static {
        // Connection
        register(CommandType.PING, new PingCommand());

        // String
        register(CommandType.GET, new GetCommand());
        register(CommandType.SET, new SetCommand());

        // Generic
        register(CommandType.DELETE, new DeleteCommand());
    }

    private static void register(CommandType type, Command command) {
        commands.put(type, command);
    }

    public static Command get(CommandType type) {
        Command command = commands.get(type);
        if (command == null) throw new IllegalStateException("No handler registered for " + type);
        return command;
    }
}
