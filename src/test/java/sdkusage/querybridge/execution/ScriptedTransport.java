package sdkusage.querybridge.execution;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Transport that plays back scripted outcomes, one per call. The last outcome repeats.
 */
class ScriptedTransport implements QueryTransport {

    private final String name;
    private final String scope;
    private final Deque<Supplier<Future<JsonArray>>> outcomes = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private volatile String lastToken;

    ScriptedTransport(String name, String scope) {
        this.name = name;
        this.scope = scope;
    }

    static JsonArray rows() {
        return new JsonArray().add(new JsonObject().put("Product", "Go-SDK").put("RequestCount", 42L));
    }

    ScriptedTransport failing(ErrorCategory category, String message) {
        outcomes.add(() -> Future.failedFuture(new QueryExecutionException(category, message)));
        return this;
    }

    ScriptedTransport succeeding() {
        outcomes.add(() -> Future.succeededFuture(rows()));
        return this;
    }

    ScriptedTransport hanging() {
        outcomes.add(() -> Promise.<JsonArray>promise().future());
        return this;
    }

    int calls() {
        return calls.get();
    }

    int closes() {
        return closes.get();
    }

    String lastToken() {
        return lastToken;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String tokenScope() {
        return scope;
    }

    @Override
    public synchronized Future<JsonArray> execute(String sql, String accessToken, ExecutionTrace trace) {
        calls.incrementAndGet();
        lastToken = accessToken;
        trace.enter(ExecutionState.EXECUTING);
        Supplier<Future<JsonArray>> next = outcomes.size() > 1 ? outcomes.poll() : outcomes.peek();
        if (next == null) {
            return Future.failedFuture(new IllegalStateException("no scripted outcome"));
        }
        return next.get();
    }

    @Override
    public Future<Void> close() {
        closes.incrementAndGet();
        return Future.succeededFuture();
    }
}
