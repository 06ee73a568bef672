package sdkusage.querybridge.services;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
public class LoggingTest {

    @Test
    @DisplayName("Log lines are CSV with commas and newlines neutralised")
    void formatLogMessage() {
        assertEquals("a; b c,1,Comp,Op,Cat", LogUtil.formatLogMessage("a, b\nc", LogUtil.INFO, "Comp", "Op", "Cat"));
        assertEquals("null,0,Comp,Op,Cat", LogUtil.formatLogMessage(null, LogUtil.ERROR, "Comp", "Op", "Cat"));
    }

    @Test
    @DisplayName("Errors are described with their cause chain")
    void describeCauses() {
        Exception root = new java.sql.SQLException("Login failed for user");
        Exception wrapped = new IllegalStateException("Query failed", root);
        assertEquals("Query failed <- SQLException: Login failed for user", LogUtil.describe(wrapped));
        assertEquals("plain", LogUtil.describe(new RuntimeException("plain")));
    }

    @Test
    @DisplayName("Logger writes published lines to current.csv on a termination flush")
    void loggerFlushesOnRequest(Vertx vertx, VertxTestContext testContext, @TempDir Path logsDir) {
        vertx.deployVerticle(new Logger(logsDir.toString()))
            .compose(id -> {
                LogUtil.logInfo(vertx, "Translated question, quickly", "LoggingTest", "Flush", "Test", false);
                return vertx.eventBus().request("saveAllDataToFiles_OnTermination", "");
            })
            .compose(reply -> vertx.fileSystem().readFile(logsDir.resolve("current.csv").toString()))
            .onComplete(testContext.succeeding(content -> testContext.verify(() -> {
                String text = content.toString();
                assertTrue(text.startsWith("Message,Level,Component,Operation,Category,SequenceReceived,EpochTimeMillis"));
                assertTrue(text.contains("Translated question; quickly,1,LoggingTest,Flush,Test,1,"), text);
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Periodic flush appends lines without a termination request")
    void periodicFlush(Vertx vertx, VertxTestContext testContext, @TempDir Path logsDir) {
        String file = logsDir.resolve("current.csv").toString();
        vertx.deployVerticle(new Logger(logsDir.toString(), 50)).onComplete(testContext.succeeding(id -> {
            LogUtil.logWarning(vertx, "Fallback to management-api", "LoggingTest", "Tick", "Test");
            vertx.setTimer(500, t -> vertx.fileSystem().readFile(file)
                .onComplete(testContext.succeeding(content -> testContext.verify(() -> {
                    assertTrue(content.toString().contains("WARNING: Fallback to management-api,1,LoggingTest,Tick,Test,1,"));
                    testContext.completeNow();
                }))));
        }));
    }
}
