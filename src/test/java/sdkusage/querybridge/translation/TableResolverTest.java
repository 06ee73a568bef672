package sdkusage.querybridge.translation;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sdkusage.querybridge.TestCatalogs;
import sdkusage.querybridge.schema.SchemaCatalog;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TableResolverTest {

    private TableResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TableResolver(TestCatalogs.catalog(), new AliasResolver());
    }

    @Test
    @DisplayName("A table named in the question wins, even when its name extends another table's")
    void directNameMatch() {
        assertEquals(Optional.of(TestCatalogs.MONTHLY_OS),
            resolver.resolve("select everything from usagebymonthproductos please"));
        assertEquals(Optional.of(TestCatalogs.MONTHLY),
            resolver.resolve("select everything from UsageByMonthProduct please"));
        assertEquals(Optional.of(TestCatalogs.GO_DAILY),
            resolver.resolve("What is in GoSDKReqCountByResourceHttpMethod?"));
    }

    @Test
    @DisplayName("Two unrelated table names: the earlier one in the catalog wins")
    void directNameMatchCatalogOrder() {
        assertEquals(Optional.of(TestCatalogs.MONTHLY),
            resolver.resolve("compare GoSDKReqCountByResourceHttpMethod with UsageByMonthProduct"));
    }

    @Test
    @DisplayName("Disabled tables are never chosen, even by name")
    void disabledTableIgnored() {
        Optional<String> table = resolver.resolve("RetiredCustomerDetails subscription counts");
        assertTrue(table.isPresent());
        assertNotEquals("RetiredCustomerDetails", table.get());
    }

    @Test
    @DisplayName("Keyword scoring prefers the table carrying the asked-for columns")
    void keywordScoring() {
        assertEquals(Optional.of(TestCatalogs.GO_DAILY),
            resolver.resolve("Go SDK requests by http method and provider"));
        assertEquals(Optional.of(TestCatalogs.MONTHLY),
            resolver.resolve("Show me Go-SDK request counts this month"));
    }

    @Test
    @DisplayName("Score details for a product question")
    void scoreWeights() {
        SchemaCatalog catalog = TestCatalogs.catalog();
        String text = "show me go-sdk request counts this month";
        assertEquals(5, resolver.score(text, catalog.getTable(TestCatalogs.MONTHLY).orElseThrow()));
        assertEquals(3, resolver.score(text, catalog.getTable(TestCatalogs.MONTHLY_OS).orElseThrow()));
        assertEquals(4, resolver.score(text, catalog.getTable(TestCatalogs.GO_DAILY).orElseThrow()));
    }

    @Test
    @DisplayName("Nothing recognisable falls back to the first enabled table")
    void fallback() {
        assertEquals(Optional.of(TestCatalogs.MONTHLY), resolver.resolve("hello world"));
    }

    @Test
    @DisplayName("A catalog without enabled tables resolves to nothing")
    void emptyCatalog() throws Exception {
        SchemaCatalog empty = SchemaCatalog.fromManifest(new JsonObject().put("Tables", new JsonArray()), null);
        assertTrue(new TableResolver(empty, new AliasResolver()).resolve("anything").isEmpty());
    }

    @Test
    @DisplayName("Resolution is deterministic")
    void deterministic() {
        String question = "python usage on linux";
        assertEquals(resolver.resolve(question), resolver.resolve(question));
        assertEquals(resolver.resolve(question),
            new TableResolver(TestCatalogs.catalog(), new AliasResolver()).resolve(question));
    }
}
