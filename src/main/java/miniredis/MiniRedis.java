package miniredis;

import miniredis.commands.CommandDispatcher;
import miniredis.db.KeyValueStore;
import miniredis.server.ConnectionServer;
import miniredis.utils.Log;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Project: MiniRedis
 * A tiny RESP server: PING, GET, SET and DELETE over one shared in-memory map.
 */
public class MiniRedis {

    public static final String VERSION = "0.1.0";

    public static void printBanner() {
        Log.info("\n" +
                "           _       _              ___     \n" +
                "  _ __ ___ (_)_ __ (_)_ __ ___  __| (_)___ \n" +
                " | '_ ` _ \\| | '_ \\| | '__/ _ \\/ _` | / __|\n" +
                " | | | | | | | | | | | | |  __/ (_| | \\__ \\\n" +
                " |_| |_| |_|_|_| |_|_|_|  \\___|\\__,_|_|___/\n" +
                "                                           \n" +
                " :: MiniRedis ::    (v" + VERSION + ") \n" +
                " :: Engine ::       Java / Netty \n");
    }

    public static void main(String[] args) throws Exception {
        String configFile = args.length > 0 ? args[0] : Config.DEFAULT_FILE;
        Config config = Config.load(configFile);
        Log.setDebug(config.debug);

        KeyValueStore store = new KeyValueStore();
        CommandDispatcher dispatcher = new CommandDispatcher(store);
        ConnectionServer server = new ConnectionServer(config, dispatcher);

        printBanner();
        server.start();

        ScheduledExecutorService stats = startStatsLogger(config, server);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (stats != null) stats.shutdownNow();
            server.stop();
        }, "shutdown"));

        server.awaitTermination();
    }

    private static ScheduledExecutorService startStatsLogger(Config config, ConnectionServer server) {
        if (config.statsIntervalSeconds == 0) return null;

        ScheduledExecutorService monitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Stats");
            t.setDaemon(true);
            return t;
        });

        final long interval = config.statsIntervalSeconds;
        final long[] lastCount = {0};
        monitor.scheduleAtFixedRate(() -> {
            try {
                long currentCount = server.getDispatcher().getTotalCommands();
                long ops = (currentCount - lastCount[0]) / interval;
                lastCount[0] = currentCount;

                if (ops > 0 || server.getActiveConnections() > 0) {
                    Log.info(String.format("[STATS] Clients: %d | Keys: %d | OPS: %d cmd/s",
                            server.getActiveConnections(), server.getDispatcher().getStore().size(), ops));
                }
            } catch (RuntimeException e) {
                Log.error("[Stats] Failed to collect stats", e);
            }
        }, interval, interval, TimeUnit.SECONDS);
        return monitor;
    }
}
