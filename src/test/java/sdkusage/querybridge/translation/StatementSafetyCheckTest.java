package sdkusage.querybridge.translation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sdkusage.querybridge.TestCatalogs;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class StatementSafetyCheckTest {

    @Test
    @DisplayName("Plain SELECT statements pass in any case and with leading whitespace")
    void selectAllowed() {
        assertTrue(StatementSafetyCheck.isSafe("SELECT * FROM UsageByMonthProduct"));
        assertTrue(StatementSafetyCheck.isSafe("Select TOP 5 Product FROM UsageByMonthProduct"));
        assertTrue(StatementSafetyCheck.isSafe("   \n select 1"));
        assertEquals(Optional.empty(), StatementSafetyCheck.rejectionReason("SELECT Month FROM t WHERE 1=1"));
    }

    @Test
    @DisplayName("Statements not starting with SELECT are refused")
    void nonSelectRejected() {
        assertEquals(Optional.of("Only SELECT statements are allowed"),
            StatementSafetyCheck.rejectionReason("DELETE FROM UsageByMonthProduct"));
        assertFalse(StatementSafetyCheck.isSafe("WITH x AS (SELECT 1) SELECT * FROM x"));
    }

    @Test
    @DisplayName("A forbidden keyword anywhere in the text refuses the statement")
    void forbiddenKeywordAnywhere() {
        assertEquals(Optional.of("Statement contains forbidden keyword: DROP"),
            StatementSafetyCheck.rejectionReason("select * from t; DROP TABLE t"));
        assertFalse(StatementSafetyCheck.isSafe("SELECT * FROM t; exec sp_who"));
        // Substring semantics: identifiers containing a keyword are refused too
        assertFalse(StatementSafetyCheck.isSafe("SELECT UpdatedRows FROM t"));
    }

    @Test
    @DisplayName("A DELETE method filter makes a translated statement unexecutable")
    void deleteMethodFilterRefused() {
        String where = new PredicateBuilder(new AliasResolver(), TestCatalogs.august2025())
            .build("DELETE requests", TestCatalogs.table(TestCatalogs.GO_DAILY));
        assertTrue(where.contains("HttpMethod = 'DELETE'"), where);

        String sql = "SELECT * FROM " + TestCatalogs.GO_DAILY + " WHERE " + where;
        assertEquals(Optional.of("Statement contains forbidden keyword: DELETE"), StatementSafetyCheck.rejectionReason(sql));
    }

    @Test
    @DisplayName("Empty input is refused")
    void emptyRejected() {
        assertFalse(StatementSafetyCheck.isSafe(null));
        assertFalse(StatementSafetyCheck.isSafe(""));
        assertEquals(Optional.of("SQL statement is empty"), StatementSafetyCheck.rejectionReason("   "));
    }
}
