package sdkusage.querybridge.translation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sdkusage.querybridge.TestCatalogs;
import sdkusage.querybridge.schema.ColumnMetadata;
import sdkusage.querybridge.schema.TableDescriptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnSelectorTest {

    private final ColumnSelector selector = new ColumnSelector(new AliasResolver());

    @Test
    @DisplayName("Unknown table selects every column")
    void unknownTable() {
        assertEquals(List.of("*"), selector.select("anything", null));
    }

    @Test
    @DisplayName("A question that names nothing gets the priority columns")
    void priorityDefaults() {
        assertEquals(List.of("Month", "Product", "RequestCount", "SubscriptionCount"),
            selector.select("hello", TestCatalogs.table(TestCatalogs.MONTHLY)));
    }

    @Test
    @DisplayName("Enum values pull in their column together with time and measures")
    void enumMention() {
        assertEquals(List.of("Month", "OS", "RequestCount"),
            selector.select("windows usage", TestCatalogs.table(TestCatalogs.MONTHLY_OS)));
    }

    @Test
    @DisplayName("Intent keywords select their columns")
    void intentKeywords() {
        List<String> columns = selector.select("calls by http method",
            TestCatalogs.table(TestCatalogs.GO_DAILY));
        assertEquals(List.of("RequestsDate", "HttpMethod", "RequestCount"), columns);
    }

    @Test
    @DisplayName("Tables without priority columns take their first five")
    void plainTable() {
        TableDescriptor plain = new TableDescriptor("Plain", true, null, List.of(
            ColumnMetadata.plain("Alpha"), ColumnMetadata.plain("Bravo"), ColumnMetadata.plain("Charlie"),
            ColumnMetadata.plain("Delta"), ColumnMetadata.plain("Echo"), ColumnMetadata.plain("Foxtrot"),
            ColumnMetadata.plain("Golf")));

        assertEquals(List.of("Alpha", "Bravo", "Charlie", "Delta", "Echo"), selector.select("hello", plain));
    }
}
