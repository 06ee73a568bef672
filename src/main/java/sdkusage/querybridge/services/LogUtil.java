package sdkusage.querybridge.services;

import io.vertx.core.Vertx;
import sdkusage.querybridge.Driver;

/**
 * Log facade used across the bridge.
 *
 * <p>Every entry becomes a CSV line {@code message,level,component,operation,category} published on
 * the {@code log} address and written by {@link Logger}. Entries above {@link Driver#logLevel} are
 * dropped. Without a Vertx instance the line is parked in the driver's emergency buffer.</p>
 */
public final class LogUtil {

    public static final int ERROR = 0;
    public static final int INFO = 1;
    public static final int DETAIL = 2;
    public static final int DEBUG = 3;

    // Nested causes reported with an error; JDBC and HTTP failures rarely go deeper
    private static final int MAX_CAUSES = 3;

    private LogUtil() {
    }

    public static void logError(Vertx vertx, String message, String component, String operation, String category,
                                boolean showInConsole) {
        emit(vertx, ERROR, message, component, operation, category, showInConsole);
    }

    /**
     * Error with its cause chain; the stack of the outermost exception follows at debug level.
     */
    public static void logError(Vertx vertx, String message, Throwable throwable, String component, String operation,
                                String category, boolean showInConsole) {
        emit(vertx, ERROR, message + ": " + describe(throwable), component, operation, category, showInConsole);
        if (Driver.logLevel >= DEBUG) {
            StringBuilder stack = new StringBuilder("Stack trace:");
            for (StackTraceElement element : throwable.getStackTrace()) {
                stack.append(" at ").append(element);
            }
            emit(vertx, DEBUG, stack.toString(), component, operation, category, false);
        }
    }

    /**
     * Recoverable problem, written at info level so it survives the default configuration.
     */
    public static void logWarning(Vertx vertx, String message, String component, String operation, String category) {
        emit(vertx, INFO, "WARNING: " + message, component, operation, category, false);
    }

    public static void logInfo(Vertx vertx, String message, String component, String operation, String category,
                               boolean showInConsole) {
        emit(vertx, INFO, message, component, operation, category, showInConsole);
    }

    public static void logDetail(Vertx vertx, String message, String component, String operation, String category) {
        emit(vertx, DETAIL, message, component, operation, category, false);
    }

    public static void logDebug(Vertx vertx, String message, String component, String operation, String category) {
        emit(vertx, DEBUG, message, component, operation, category, false);
    }

    private static void emit(Vertx vertx, int level, String message, String component, String operation,
                             String category, boolean showInConsole) {
        if (level > Driver.logLevel) {
            return;
        }
        if (showInConsole) {
            (level == ERROR ? System.err : System.out).println("[" + component + "] " + message);
        }
        String line = formatLogMessage(message, level, component, operation, category);
        if (vertx != null) {
            vertx.eventBus().publish("log", line);
        } else {
            Driver.captureOrPublishLog(line);
        }
    }

    static String describe(Throwable throwable) {
        StringBuilder text = new StringBuilder(String.valueOf(throwable.getMessage()));
        Throwable cause = throwable.getCause();
        for (int depth = 0; cause != null && cause != throwable && depth < MAX_CAUSES; depth++) {
            text.append(" <- ").append(cause.getClass().getSimpleName()).append(": ").append(cause.getMessage());
            cause = cause.getCause();
        }
        return text.toString();
    }

    /**
     * CSV line for the log sink; commas and newlines in the message would break the columns.
     */
    static String formatLogMessage(String message, int level, String component, String operation, String category) {
        String clean = String.valueOf(message).replace(",", ";").replace("\r", " ").replace("\n", " ");
        return clean + "," + level + "," + component + "," + operation + "," + category;
    }
}
