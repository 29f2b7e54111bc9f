package miniredis.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Console logging for the server, one line per event:
 * {@code HH:mm:ss.SSS [LEVEL] [thread] message}, followed by the stack trace if any.
 */
public final class Log {
    private static final Logger logger = Logger.getLogger("MiniRedis");

    static {
        logger.setUseParentHandlers(false);
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(Level.ALL);
        console.setFormatter(new LineFormatter());
        logger.addHandler(console);
        logger.setLevel(Level.INFO);
    }

    private Log() {
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void setDebug(boolean enabled) {
        logger.setLevel(enabled ? Level.FINE : Level.INFO);
    }

    static final class LineFormatter extends Formatter {
        private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

        @Override
        public String format(LogRecord record) {
            StringBuilder line = new StringBuilder(128)
                    .append(LocalTime.now().format(TIME))
                    .append(" [").append(levelName(record.getLevel())).append("] [")
                    .append(Thread.currentThread().getName()).append("] ")
                    .append(record.getMessage())
                    .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                line.append(trace);
            }
            return line.toString();
        }

        static String levelName(Level level) {
            if (level == Level.SEVERE) return "ERROR";
            if (level == Level.WARNING) return "WARN";
            if (level == Level.INFO) return "INFO";
            return "DEBUG";
        }
    }
}
