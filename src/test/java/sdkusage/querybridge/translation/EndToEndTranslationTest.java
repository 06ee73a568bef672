package sdkusage.querybridge.translation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sdkusage.querybridge.TestCatalogs;
import sdkusage.querybridge.schema.SchemaCatalog;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Question to SQL through the whole resolution chain.
 */
public class EndToEndTranslationTest {

    private QueryIntentResolver resolver;
    private final SqlQueryRenderer renderer = new SqlQueryRenderer();

    @BeforeEach
    void setUp() {
        resolver = new QueryIntentResolver(TestCatalogs.catalog(), TestCatalogs.august2025());
    }

    private String translate(String question) throws TranslationException {
        return renderer.render(resolver.resolve(question));
    }

    @Test
    @DisplayName("Product and current month")
    void productThisMonth() throws TranslationException {
        assertEquals("SELECT Month, Product, RequestCount, SubscriptionCount FROM UsageByMonthProduct "
                + "WHERE Month LIKE '2025-08%' AND Product = 'Go-SDK' ORDER BY RequestCount DESC",
            translate("Show me Go-SDK request counts this month"));
    }

    @Test
    @DisplayName("Ranking with a numeric threshold")
    void topWithThreshold() throws TranslationException {
        assertEquals("SELECT TOP 5 Month, Product, RequestCount, SubscriptionCount FROM UsageByMonthProduct "
                + "WHERE RequestCount > 1000 ORDER BY RequestCount DESC",
            translate("Top 5 products with more than 1000 requests"));
    }

    @Test
    @DisplayName("Aliases become an OR group")
    void aliasGroup() throws TranslationException {
        assertEquals("SELECT Month, Product, RequestCount, SubscriptionCount FROM UsageByMonthProduct "
                + "WHERE (Product = 'JavaScript' OR Product = 'JavaScript (Node.JS)' OR Product = 'JavaScript RLC') "
                + "ORDER BY RequestCount DESC",
            translate("js usage"));
    }

    @Test
    @DisplayName("Every generated statement passes the safety check")
    void generatedSqlIsSafe() throws TranslationException {
        for (String question : new String[]{"hello", "GET requests for microsoft.compute",
            "bottom 3 products by requests last month", "windows usage in 2024-05"}) {
            assertTrue(StatementSafetyCheck.isSafe(translate(question)), question);
        }
    }

    @Test
    @DisplayName("Empty questions and empty catalogs fail translation")
    void failures() throws Exception {
        assertThrows(TranslationException.class, () -> resolver.resolve("  "));

        SchemaCatalog empty = SchemaCatalog.load(null, "schemas/no_tables_schema.json");
        QueryIntentResolver emptyResolver = new QueryIntentResolver(empty, TestCatalogs.august2025());
        assertThrows(TranslationException.class, () -> emptyResolver.resolve("Go-SDK requests"));
    }
}
