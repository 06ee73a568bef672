package sdkusage.querybridge.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {

    @Test
    @DisplayName("Delay doubles after every failed attempt")
    void exponentialDelay() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(0, policy.delayBefore(1));
        assertEquals(1000, policy.delayBefore(2));
        assertEquals(2000, policy.delayBefore(3));
        assertEquals(4000, policy.delayBefore(4));
    }

    @Test
    @DisplayName("Only retryable failures are retried, up to the attempt bound")
    void retryBound() {
        RetryState state = new RetryPolicy(2, 50).newState();

        assertEquals(1, state.beginAttempt());
        state.recordFailure(new QueryExecutionException(ErrorCategory.TIMEOUT, "timed out"));
        assertTrue(state.canRetry());
        assertEquals(50, state.nextDelayMs());

        assertEquals(2, state.beginAttempt());
        state.recordFailure(new QueryExecutionException(ErrorCategory.TIMEOUT, "timed out"));
        assertFalse(state.canRetry());

        RetryState auth = RetryPolicy.defaults().newState();
        auth.beginAttempt();
        auth.recordFailure(new QueryExecutionException(ErrorCategory.AUTHENTICATION, "denied"));
        assertFalse(auth.canRetry());
        assertEquals("denied", auth.getLastMessage());
    }

    @Test
    @DisplayName("Invalid bounds are rejected")
    void invalidPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, -1));
    }

    @Test
    @DisplayName("Category flags drive retry and fallback")
    void categoryFlags() {
        assertTrue(ErrorCategory.TRANSIENT.isRetryable());
        assertFalse(ErrorCategory.SERVER_ERROR.isRetryable());
        assertTrue(ErrorCategory.SERVER_ERROR.isFallbackAllowed());
        assertFalse(ErrorCategory.AUTHENTICATION.isFallbackAllowed());
        assertFalse(ErrorCategory.MALFORMED_STATEMENT.isFallbackAllowed());
    }
}
