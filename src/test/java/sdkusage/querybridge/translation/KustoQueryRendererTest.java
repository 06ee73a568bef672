package sdkusage.querybridge.translation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sdkusage.querybridge.TestCatalogs;
import sdkusage.querybridge.schema.SchemaCatalog;
import sdkusage.querybridge.schema.TableDescriptor;
import sdkusage.querybridge.translation.KustoQueryRenderer.QueryType;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class KustoQueryRendererTest {

    private static final Clock MARCH_2025 = Clock.fixed(Instant.parse("2025-03-10T08:00:00Z"), ZoneOffset.UTC);

    private QueryIntentResolver resolver;
    private TableDescriptor stream;
    private KustoQueryRenderer renderer;

    @BeforeEach
    void setUp() {
        SchemaCatalog catalog = TestCatalogs.catalog();
        AliasResolver aliases = new AliasResolver();
        resolver = new QueryIntentResolver(catalog, aliases, MARCH_2025);
        stream = KustoQueryRenderer.enrichedStream(catalog, aliases);
        renderer = new KustoQueryRenderer(MARCH_2025);
    }

    private String render(String question) throws TranslationException {
        return renderer.render(question, resolver.resolveAgainst(question, stream));
    }

    @Test
    @DisplayName("Ranking over last month with an OS filter")
    void rankingQuery() throws TranslationException {
        String kql = render("Top 5 products on Windows last month");

        assertTrue(kql.startsWith("// Generated KQL for: Top 5 products on Windows last month"));
        assertTrue(kql.contains("let startDateTime = datetime(2025-02-01T00:00:00Z);"));
        assertTrue(kql.contains("let endDateTime = datetime(2025-03-01T00:00:00Z);"));
        assertTrue(kql.contains("| where OS =~ \"Windows\""));
        assertTrue(kql.contains("| top 5 by RequestCount desc"));
        assertFalse(kql.contains("{{"));
    }

    @Test
    @DisplayName("No filters removes the placeholder line")
    void summaryWithoutFilters() throws TranslationException {
        String kql = render("overall summary");

        assertTrue(kql.contains("| where isnotempty(Product)\n| summarize RequestCount = count(), "
            + "SubscriptionCount = dcount(subscriptionId) by Product\n| order by RequestCount desc"), kql);
        assertTrue(kql.contains("datetime(2025-03-01T00:00:00Z)"));
        assertTrue(kql.contains("datetime(2025-04-01T00:00:00Z)"));
        assertFalse(kql.contains("{{"));
    }

    @Test
    @DisplayName("Percentage questions over an explicit month")
    void percentage() throws TranslationException {
        String kql = render("What percentage of requests come from Python in 2024-06");

        assertTrue(kql.contains("datetime(2024-06-01T00:00:00Z)"));
        assertTrue(kql.contains("datetime(2024-07-01T00:00:00Z)"));
        assertTrue(kql.contains("| where Product =~ \"Python-SDK\""));
        assertTrue(kql.contains("| extend Percentage = round("));
    }

    @Test
    @DisplayName("An api-version literal filters the version and leaves the time window alone")
    void apiVersionIsNotAMonth() throws TranslationException {
        String kql = render("Go-SDK requests with api-version 2021-04-01 this month");

        assertTrue(kql.contains("let startDateTime = datetime(2025-03-01T00:00:00Z);"), kql);
        assertTrue(kql.contains("let endDateTime = datetime(2025-04-01T00:00:00Z);"), kql);
        assertFalse(kql.contains("datetime(2021-04-01"), kql);
    }

    @Test
    @DisplayName("Alias groups use in~ and multi-line questions stay on the comment line")
    void aliasGroupAndHeader() throws TranslationException {
        String kql = render("js usage\nplease");

        assertTrue(kql.startsWith("// Generated KQL for: js usage please\n"));
        assertTrue(kql.contains("| where Product in~ (\"JavaScript\", \"JavaScript (Node.JS)\", \"JavaScript RLC\")"));
    }

    @Test
    @DisplayName("Count thresholds apply after aggregation")
    void measureFilterAfterSummarize() throws TranslationException {
        String kql = render("products with more than 1000 requests this month");

        int summarize = kql.indexOf("| summarize");
        int threshold = kql.indexOf("| where RequestCount > 1000");
        assertTrue(summarize > 0);
        assertTrue(threshold > summarize, kql);
    }

    @Test
    @DisplayName("Provider and HTTP method map onto the enriched columns")
    void enrichedColumns() throws TranslationException {
        String kql = render("PUT requests for microsoft.storage");

        assertTrue(kql.contains("| where Provider contains \"Microsoft.Storage\""));
        assertTrue(kql.contains("| where httpMethod =~ \"PUT\""));
    }

    @Test
    @DisplayName("Query type detection")
    void queryTypes() throws TranslationException {
        assertEquals(QueryType.TREND, type("daily requests trend"));
        assertEquals(QueryType.SUBSCRIPTION, type("which subscriptions call us"));
        assertEquals(QueryType.OS, type("usage by os"));
        assertEquals(QueryType.TRACK, type("track adoption"));
        assertEquals(QueryType.COUNT, type("how many calls"));
        assertEquals(QueryType.SUMMARY, type("overall summary"));
    }

    @Test
    @DisplayName("Kusto string literals are escaped")
    void literalEscaping() {
        assertEquals("\"a\\\"b\\\\c\"", KustoQueryRenderer.literal("a\"b\\c"));
    }

    private QueryType type(String question) throws TranslationException {
        return renderer.detectQueryType(question, resolver.resolveAgainst(question, stream));
    }
}
