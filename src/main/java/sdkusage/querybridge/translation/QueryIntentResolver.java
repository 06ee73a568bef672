package sdkusage.querybridge.translation;

import sdkusage.querybridge.schema.SchemaCatalog;
import sdkusage.querybridge.schema.TableDescriptor;

import java.time.Clock;
import java.util.List;

/**
 * Resolves a question into a {@link QueryIntent}. Shared by the SQL and Kusto renderers so both
 * backends see the same table, columns, filters and ordering.
 */
public class QueryIntentResolver {

    private final SchemaCatalog catalog;
    private final AliasResolver aliasResolver;
    private final TableResolver tableResolver;
    private final ColumnSelector columnSelector;
    private final PredicateBuilder predicateBuilder;
    private final OrderingDeriver orderingDeriver;

    public QueryIntentResolver(SchemaCatalog catalog, Clock clock) {
        this(catalog, new AliasResolver(), clock);
    }

    public QueryIntentResolver(SchemaCatalog catalog, AliasResolver aliasResolver, Clock clock) {
        this.catalog = catalog;
        this.aliasResolver = aliasResolver;
        this.tableResolver = new TableResolver(catalog, aliasResolver);
        this.columnSelector = new ColumnSelector(aliasResolver);
        this.predicateBuilder = new PredicateBuilder(aliasResolver, clock);
        this.orderingDeriver = new OrderingDeriver();
    }

    public QueryIntent resolve(String question) throws TranslationException {
        if (question == null || question.isBlank()) {
            throw new TranslationException("Question is empty");
        }
        String tableName = tableResolver.resolve(question)
            .orElseThrow(() -> new TranslationException("No enabled table in the schema catalog matches the question"));
        TableDescriptor table = catalog.getTable(tableName)
            .orElseThrow(() -> new TranslationException("Table " + tableName + " is not in the schema catalog"));
        return resolveAgainst(question, table);
    }

    /**
     * Resolve columns, filters and ordering against a table chosen by the caller.
     */
    public QueryIntent resolveAgainst(String question, TableDescriptor table) throws TranslationException {
        if (question == null || question.isBlank()) {
            throw new TranslationException("Question is empty");
        }
        List<String> columns = columnSelector.select(question, table);
        List<FilterClause> filters = predicateBuilder.buildClauses(question, table);
        OrderingDeriver.Ordering ordering = orderingDeriver.derive(question, table);

        return new QueryIntent(
            table.getName(),
            columns,
            filters,
            ordering.getLimit().isPresent() ? ordering.getLimit().getAsInt() : null,
            ordering.getOrderColumn().orElse(null),
            ordering.getDirection());
    }

    public SchemaCatalog getCatalog() {
        return catalog;
    }

    public AliasResolver getAliasResolver() {
        return aliasResolver;
    }

    public TableResolver getTableResolver() {
        return tableResolver;
    }
}
