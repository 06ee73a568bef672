package sdkusage.querybridge.execution;

/**
 * Stages of one execute() call.
 */
public enum ExecutionState {
    IDLE,
    AUTHENTICATING,
    CONNECTING,
    EXECUTING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
