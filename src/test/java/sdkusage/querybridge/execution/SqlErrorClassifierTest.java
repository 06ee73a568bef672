package sdkusage.querybridge.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class SqlErrorClassifierTest {

    @Test
    @DisplayName("SQL Server error numbers")
    void errorCodes() {
        assertEquals(ErrorCategory.AUTHENTICATION,
            SqlErrorClassifier.classify(new SQLException("Login failed for user", "S0001", 18456)));
        assertEquals(ErrorCategory.TRANSIENT,
            SqlErrorClassifier.classify(new SQLException("Database is not currently available", "S0001", 40613)));
        assertEquals(ErrorCategory.MALFORMED_STATEMENT,
            SqlErrorClassifier.classify(new SQLException("Invalid column name 'Foo'", "S0001", 207)));
        assertEquals(ErrorCategory.TIMEOUT,
            SqlErrorClassifier.classify(new SQLTimeoutException("The query has timed out")));
    }

    @Test
    @DisplayName("Connection SQL states default to CONNECTION")
    void connectionStates() {
        assertEquals(ErrorCategory.CONNECTION,
            SqlErrorClassifier.classify(new SQLException("The TCP/IP link failed", "08S01", 0)));
        assertEquals(ErrorCategory.SERVER_ERROR,
            SqlErrorClassifier.classify(new SQLException("Something odd", "S0001", 50000)));
    }

    @Test
    @DisplayName("HTTP status codes")
    void statusCodes() {
        assertEquals(ErrorCategory.AUTHENTICATION, SqlErrorClassifier.classifyStatus(403));
        assertEquals(ErrorCategory.MALFORMED_STATEMENT, SqlErrorClassifier.classifyStatus(400));
        assertEquals(ErrorCategory.TIMEOUT, SqlErrorClassifier.classifyStatus(504));
        assertEquals(ErrorCategory.TRANSIENT, SqlErrorClassifier.classifyStatus(429));
        assertEquals(ErrorCategory.SERVER_ERROR, SqlErrorClassifier.classifyStatus(500));
    }

    @Test
    @DisplayName("Message keywords")
    void messages() {
        assertEquals(ErrorCategory.TIMEOUT, SqlErrorClassifier.classifyMessage("Read timed out"));
        assertEquals(ErrorCategory.CONNECTION, SqlErrorClassifier.classifyMessage("Connection refused: localhost"));
        assertEquals(ErrorCategory.SERVER_ERROR, SqlErrorClassifier.classifyMessage(null));
        assertEquals(ErrorCategory.CONNECTION,
            QueryExecutionException.from(new java.io.IOException("connection reset by peer")).getCategory());
    }
}
