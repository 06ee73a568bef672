package sdkusage.querybridge.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Event-bus log sink.
 *
 * <ul>
 *   <li>Lines published on {@code log} are stamped with a sequence number and receive time, then
 *       appended to {@code current.csv} on every flush tick (20 seconds by default).</li>
 *   <li>After a day the file is renamed after the time its block started and a new one begun;
 *       the newest 12 renamed files are kept.</li>
 *   <li>A message on {@code saveAllDataToFiles_OnTermination} flushes at once and is answered
 *       when the lines are on disk.</li>
 * </ul>
 */
public class Logger extends AbstractVerticle {

    static final String HEADER = "Message,Level,Component,Operation,Category,SequenceReceived,EpochTimeMillis\n";
    private static final long DEFAULT_FLUSH_INTERVAL_MS = 20_000;
    private static final long ROTATE_AFTER_MS = 86_400_000L;
    private static final int KEEP_ROTATED = 12;
    private static final DateTimeFormatter ROTATED_NAME =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneId.of("UTC"));

    private final String logsDir;
    private final String currentFile;
    private final long flushIntervalMs;
    private List<String> pending = new ArrayList<>();
    private long received;
    private long blockStartedAt;
    private long flushTimer = -1;

    public Logger(String logsDir) {
        this(logsDir, DEFAULT_FLUSH_INTERVAL_MS);
    }

    public Logger(String logsDir, long flushIntervalMs) {
        this.logsDir = logsDir;
        this.currentFile = logsDir + "/current.csv";
        this.flushIntervalMs = flushIntervalMs;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        vertx.fileSystem().mkdirs(logsDir)
            .compose(v -> startBlock(System.currentTimeMillis()))
            .onSuccess(v -> {
                vertx.eventBus().<String>consumer("log", msg -> {
                    received++;
                    pending.add(msg.body() + "," + received + "," + System.currentTimeMillis() + "\n");
                });
                vertx.eventBus().consumer("saveAllDataToFiles_OnTermination",
                    msg -> flush().onComplete(ar -> msg.reply(ar.succeeded())));
                flushTimer = vertx.setPeriodic(flushIntervalMs, id -> tick());
                vertx.eventBus().publish("logger.ready", "true");
                startPromise.complete();
            })
            .onFailure(err -> {
                System.err.println("Logger cannot write to " + logsDir + ": " + err.getMessage());
                startPromise.fail(err);
            });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (flushTimer >= 0) {
            vertx.cancelTimer(flushTimer);
        }
        flush().onComplete(ar -> stopPromise.complete());
    }

    private void tick() {
        long now = System.currentTimeMillis();
        Future<Void> flushed = flush();
        if (now - blockStartedAt >= ROTATE_AFTER_MS) {
            flushed.compose(v -> rotate(now))
                .onFailure(err -> System.err.println("Log rotation failed: " + err.getMessage()));
        }
    }

    /**
     * Appends everything received so far to the current file.
     */
    Future<Void> flush() {
        if (pending.isEmpty()) {
            return Future.succeededFuture();
        }
        String chunk = String.join("", pending);
        pending = new ArrayList<>();
        return vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true))
            .compose(file -> file.write(Buffer.buffer(chunk)).compose(
                v -> file.close(),
                err -> {
                    file.close();
                    return Future.failedFuture(err);
                }));
    }

    private Future<Void> startBlock(long startedAt) {
        blockStartedAt = startedAt;
        return vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER));
    }

    private Future<Void> rotate(long now) {
        String rotated = logsDir + "/" + ROTATED_NAME.format(Instant.ofEpochMilli(blockStartedAt)) + ".csv";
        return vertx.fileSystem().move(currentFile, rotated)
            .compose(v -> startBlock(now))
            .onSuccess(v -> pruneRotated());
    }

    private void pruneRotated() {
        vertx.fileSystem().readDir(logsDir, ".*\\.csv").onSuccess(files -> {
            List<String> rotated = files.stream()
                .filter(path -> !path.endsWith("current.csv"))
                .sorted()
                .collect(Collectors.toList());
            for (int i = 0; i < rotated.size() - KEEP_ROTATED; i++) {
                vertx.fileSystem().delete(rotated.get(i));
            }
        });
    }
}
