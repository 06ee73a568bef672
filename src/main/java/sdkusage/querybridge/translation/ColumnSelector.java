package sdkusage.querybridge.translation;

import sdkusage.querybridge.schema.ColumnMetadata;
import sdkusage.querybridge.schema.TableDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chooses the output columns for a question.
 *
 * <p>Columns mentioned by name, title, description keyword or by one of their values come first. Intent
 * keywords (product, track, provider, resource, http method, os) then add their column, and once
 * anything is selected the temporal and measure columns join. A question that selects nothing gets the
 * fixed priority list, capped at five. The result follows table column order.</p>
 */
public class ColumnSelector {

    public static final List<String> ALL_COLUMNS = List.of("*");

    static final int MAX_DEFAULT_COLUMNS = 5;
    static final List<String> PRIORITY_COLUMNS =
        List.of("Month", "Product", "RequestCount", "SubscriptionCount", "TrackInfo");

    private static final Map<String, List<String>> INTENT_BUCKETS = new LinkedHashMap<>();

    static {
        INTENT_BUCKETS.put("Product", List.of("product", "sdk", "tool"));
        INTENT_BUCKETS.put("TrackInfo", List.of("track", "version"));
        INTENT_BUCKETS.put("Provider", List.of("provider", "service"));
        INTENT_BUCKETS.put("Resource", List.of("resource", "type"));
        INTENT_BUCKETS.put("HttpMethod", List.of("method", "http", "get", "post", "put", "delete"));
        INTENT_BUCKETS.put("OS", List.of("os", "operating", "system", "windows", "linux", "mac"));
    }

    private static final Set<String> STOP_WORDS = Set.of(
        "about", "after", "before", "being", "count", "counts", "number", "other", "their", "there",
        "these", "those", "which", "while", "with", "from", "that", "this", "such", "used", "show",
        "made", "each", "into", "over", "under", "than", "what", "when", "where", "the", "and", "for");

    private final AliasResolver aliasResolver;

    public ColumnSelector(AliasResolver aliasResolver) {
        this.aliasResolver = aliasResolver;
    }

    /**
     * Columns for {@code question}; {@code ["*"]} when {@code table} is null (unknown table).
     */
    public List<String> select(String question, TableDescriptor table) {
        if (table == null) {
            return ALL_COLUMNS;
        }
        String text = Terms.normalize(question);
        Set<String> questionTokens = new LinkedHashSet<>(Terms.tokens(text));
        Set<String> selected = new LinkedHashSet<>();

        for (String columnName : table.getColumnNames()) {
            if (isMentioned(text, questionTokens, table.getColumn(columnName))) {
                selected.add(columnName);
            }
        }

        for (Map.Entry<String, List<String>> bucket : INTENT_BUCKETS.entrySet()) {
            if (table.hasColumn(bucket.getKey()) && Terms.mentionsAny(text, bucket.getValue())) {
                selected.add(bucket.getKey());
            }
        }

        if (!selected.isEmpty()) {
            table.temporalColumn().ifPresent(selected::add);
            selected.addAll(table.measureColumns());
            return inTableOrder(table, selected);
        }

        List<String> defaults = new ArrayList<>();
        for (String columnName : PRIORITY_COLUMNS) {
            if (table.hasColumn(columnName) && defaults.size() < MAX_DEFAULT_COLUMNS) {
                defaults.add(columnName);
            }
        }
        if (defaults.isEmpty()) {
            List<String> names = table.getColumnNames();
            defaults.addAll(names.subList(0, Math.min(MAX_DEFAULT_COLUMNS, names.size())));
        }
        return defaults.isEmpty() ? ALL_COLUMNS : inTableOrder(table, defaults);
    }

    private boolean isMentioned(String text, Set<String> questionTokens, ColumnMetadata column) {
        if (Terms.mentions(text, column.getName())) {
            return true;
        }
        if (!column.getTitle().equalsIgnoreCase(column.getName()) && Terms.mentions(text, column.getTitle())) {
            return true;
        }
        for (String token : Terms.tokens(column.getDescription())) {
            if (token.length() >= 5 && !STOP_WORDS.contains(token) && questionTokens.contains(token)) {
                return true;
            }
        }
        return column.hasEnum() && !aliasResolver.resolve(text, column.getEnumValues()).isEmpty();
    }

    private static List<String> inTableOrder(TableDescriptor table, Iterable<String> columns) {
        Set<String> wanted = new LinkedHashSet<>();
        columns.forEach(wanted::add);
        List<String> ordered = new ArrayList<>();
        for (String columnName : table.getColumnNames()) {
            if (wanted.contains(columnName)) {
                ordered.add(columnName);
            }
        }
        return ordered;
    }
}
