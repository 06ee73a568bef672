package sdkusage.querybridge.translation;

import sdkusage.querybridge.schema.ColumnMetadata;
import sdkusage.querybridge.schema.SchemaCatalog;
import sdkusage.querybridge.schema.TableDescriptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the table a question is about.
 *
 * <ol>
 *   <li>A table whose name (or display name) appears in the question wins outright. When several names
 *       appear the first in catalog order is taken, unless a later one is longer and so contains it
 *       ({@code UsageByMonthProductOS} over {@code UsageByMonthProduct}).</li>
 *   <li>Otherwise every enabled table is scored with fixed keyword weights and the highest score wins,
 *       ties going to the earlier table.</li>
 *   <li>With no positive score the first enabled table is used.</li>
 * </ol>
 *
 * Same question and same catalog always give the same table.
 */
public class TableResolver {

    static final int STRONG_HINT = 3;
    static final int ENTITY_HINT = 2;
    static final int GENERIC_HINT = 1;
    static final int COLUMN_HINT = 1;

    private static final List<String> ENTITY_KEYWORDS = List.of("product", "customer", "subscription");
    private static final List<String> GENERIC_KEYWORDS =
        List.of("request", "count", "track", "api", "version", "language", "os", "provider");
    private static final Map<String, List<String>> COLUMN_KEYWORDS = Map.of(
        "Provider", List.of("provider"),
        "Resource", List.of("resource"),
        "HttpMethod", List.of("http", "method"),
        "OS", List.of("os"));

    private final SchemaCatalog catalog;
    private final AliasResolver aliasResolver;

    public TableResolver(SchemaCatalog catalog, AliasResolver aliasResolver) {
        this.catalog = catalog;
        this.aliasResolver = aliasResolver;
    }

    public Optional<String> resolve(String question) {
        List<TableDescriptor> enabled = catalog.getEnabledTables();
        if (enabled.isEmpty()) {
            return Optional.empty();
        }
        String text = Terms.normalize(question);

        TableDescriptor direct = null;
        for (TableDescriptor table : enabled) {
            if (text.contains(table.getKey()) || text.contains(table.getDisplayName())) {
                if (direct == null || (table.getKey().length() > direct.getKey().length()
                        && table.getKey().contains(direct.getKey()))) {
                    direct = table;
                }
            }
        }
        if (direct != null) {
            return Optional.of(direct.getName());
        }

        TableDescriptor best = null;
        int bestScore = 0;
        for (TableDescriptor table : enabled) {
            int score = score(text, table);
            if (score > bestScore) {
                best = table;
                bestScore = score;
            }
        }
        return Optional.of(best != null ? best.getName() : enabled.get(0).getName());
    }

    /**
     * Keyword score of {@code table} for an already lower-cased question.
     */
    int score(String text, TableDescriptor table) {
        String key = table.getKey();
        String description = Terms.normalize(table.getDescription());
        int score = 0;

        // Strong hints: the question targets data only this kind of table holds
        if ((Terms.containsTerm(text, "go") || Terms.containsTerm(text, "golang")) && key.contains("gosdk")) {
            score += STRONG_HINT;
        }
        ColumnMetadata product = table.getColumn("Product");
        if (product != null && product.hasEnum() && !aliasResolver.resolve(text, product.getEnumValues()).isEmpty()) {
            score += STRONG_HINT;
        }

        for (String keyword : ENTITY_KEYWORDS) {
            if (Terms.mentions(text, keyword) && key.contains(keyword)) {
                score += ENTITY_HINT;
            }
        }

        for (String keyword : GENERIC_KEYWORDS) {
            if (Terms.mentions(text, keyword) && (key.contains(keyword) || Terms.mentions(description, keyword))) {
                score += GENERIC_HINT;
            }
        }

        for (Map.Entry<String, List<String>> hint : COLUMN_KEYWORDS.entrySet()) {
            if (table.hasColumn(hint.getKey()) && Terms.mentionsAny(text, hint.getValue())) {
                score += COLUMN_HINT;
            }
        }
        return score;
    }
}
