package sdkusage.querybridge.execution;

import io.vertx.core.json.JsonArray;

import java.util.ArrayList;
import java.util.List;

/**
 * State history of one execute() call. Transports running on worker threads record into it too.
 */
public class ExecutionTrace {

    private final List<ExecutionState> states = new ArrayList<>();

    public ExecutionTrace() {
        states.add(ExecutionState.IDLE);
    }

    /**
     * Record a transition. Ignored once the call has finished, since an abandoned attempt can still
     * report from its worker thread.
     */
    public synchronized boolean enter(ExecutionState state) {
        if (current().isTerminal()) {
            return false;
        }
        states.add(state);
        return true;
    }

    public synchronized ExecutionState current() {
        return states.get(states.size() - 1);
    }

    public synchronized List<ExecutionState> history() {
        return new ArrayList<>(states);
    }

    public synchronized JsonArray toJson() {
        JsonArray array = new JsonArray();
        states.forEach(s -> array.add(s.name()));
        return array;
    }
}
