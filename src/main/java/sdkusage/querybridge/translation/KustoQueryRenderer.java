package sdkusage.querybridge.translation;

import sdkusage.querybridge.schema.ColumnMetadata;
import sdkusage.querybridge.schema.SchemaCatalog;
import sdkusage.querybridge.schema.TableDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Produces a Kusto query by filling the fixed usage template: time window, enrichment filters taken
 * from the shared {@link QueryIntent}, and one aggregation stage picked from the question.
 */
public class KustoQueryRenderer {

    public static final String TEMPLATE_RESOURCE = "templates/usage_requests.kql";

    public enum QueryType {
        PERCENTAGE, RANKING, TREND, SUBSCRIPTION, API_VERSION, OS, TRACK, DETAIL, COUNT, SUMMARY
    }

    static final int DEFAULT_RANKING_SIZE = 10;

    /** Relational column to the column the template's enrichment stage produces. */
    private static final Map<String, String> KUSTO_COLUMNS = Map.of(
        "Product", "Product",
        "TrackInfo", "Track",
        "OS", "OS",
        "Provider", "Provider",
        "Resource", "Resource",
        "HttpMethod", "httpMethod",
        "ApiVersion", "apiVersion");

    /** Name of the enriched request stream the template produces. */
    public static final String STREAM_NAME = "UsageRequests";

    private static final String COUNTS = "RequestCount = count(), SubscriptionCount = dcount(subscriptionId)";

    private final String template;
    private final Clock clock;

    public KustoQueryRenderer(Clock clock) {
        this(loadTemplate(TEMPLATE_RESOURCE), clock);
    }

    public KustoQueryRenderer(String template, Clock clock) {
        this.template = template;
        this.clock = clock;
    }

    public String render(String question, QueryIntent intent) {
        KustoTimeRange range = KustoTimeRange.fromQuestion(question, clock);
        QueryType type = detectQueryType(question, intent);

        List<String> filters = new ArrayList<>();
        List<String> measureFilters = new ArrayList<>();
        for (FilterClause clause : intent.getFilters()) {
            if (clause.isNumeric()) {
                if ("RequestCount".equals(clause.getColumn()) || "SubscriptionCount".equals(clause.getColumn())) {
                    measureFilters.add("| where " + clause.getColumn() + " " + clause.getOperator().sql() + " " + clause.getValue());
                }
                continue;
            }
            String column = KUSTO_COLUMNS.get(clause.getColumn());
            if (column != null) {
                filters.add(filterStage(column, clause));
            }
        }

        String filterBlock = String.join("\n", filters);
        String query = template
            .replace("{{QUESTION}}", question.replaceAll("[\\r\\n]+", " "))
            .replace("{{START_TIME}}", range.startLiteral())
            .replace("{{END_TIME}}", range.endLiteral())
            .replace("{{AGGREGATION}}", aggregation(type, question, intent, measureFilters));
        query = filterBlock.isEmpty()
            ? query.replace("{{FILTERS}}\n", "")
            : query.replace("{{FILTERS}}", filterBlock);
        return query.trim();
    }

    /**
     * The enriched request stream as a table, so the shared resolver can derive filters for it.
     * Enum literals come from the catalog when it defines them.
     */
    public static TableDescriptor enrichedStream(SchemaCatalog catalog, AliasResolver aliasResolver) {
        Set<String> knownProducts = new LinkedHashSet<>();
        aliasResolver.allAliases().values().forEach(knownProducts::addAll);

        List<ColumnMetadata> columns = List.of(
            enumColumn("Product", catalog.getEnum("Product"), new ArrayList<>(knownProducts)),
            enumColumn("TrackInfo", catalog.getEnum("TrackInfo"), List.of("Track1", "Track2")),
            enumColumn("OS", catalog.getEnum("OS"), List.of("Windows", "Linux", "MacOS")),
            ColumnMetadata.plain("Provider"),
            ColumnMetadata.plain("Resource"),
            enumColumn("HttpMethod", catalog.getEnum("HttpMethod"), List.of("GET", "PUT", "POST", "DELETE", "PATCH")),
            ColumnMetadata.plain("ApiVersion"),
            new ColumnMetadata("RequestCount", "Request Count", "Number of successful requests", "integer",
                null, null, null, 0.0, null),
            new ColumnMetadata("SubscriptionCount", "Subscription Count", "Number of distinct subscriptions", "integer",
                null, null, null, 0.0, null));
        return new TableDescriptor(STREAM_NAME, true, "Successful management requests enriched with SDK details", columns);
    }

    private static ColumnMetadata enumColumn(String name, List<String> fromCatalog, List<String> fallback) {
        List<String> literals = fromCatalog.isEmpty() ? fallback : fromCatalog;
        return new ColumnMetadata(name, null, null, "string", literals, null, null, null, name);
    }

    public QueryType detectQueryType(String question, QueryIntent intent) {
        String text = Terms.normalize(question);
        if (Terms.mentionsAny(text, List.of("percent", "percentage", "share", "distribution", "breakdown"))) {
            return QueryType.PERCENTAGE;
        }
        if (intent.getLimit().isPresent() || Terms.mentionsAny(text, List.of("top", "ranking", "rank"))) {
            return QueryType.RANKING;
        }
        if (Terms.mentionsAny(text, List.of("trend", "over time", "daily", "per day", "by day"))) {
            return QueryType.TREND;
        }
        if (Terms.mentions(text, "subscription")) {
            return QueryType.SUBSCRIPTION;
        }
        if (Terms.mentionsAny(text, List.of("api version", "api-version", "apiversion"))) {
            return QueryType.API_VERSION;
        }
        if (Terms.mentionsAny(text, List.of("os", "operating system"))) {
            return QueryType.OS;
        }
        if (Terms.mentions(text, "track")) {
            return QueryType.TRACK;
        }
        if (Terms.mentionsAny(text, List.of("detail", "raw", "sample"))) {
            return QueryType.DETAIL;
        }
        if (Terms.mentionsAny(text, List.of("how many", "count", "total", "number of"))) {
            return QueryType.COUNT;
        }
        return QueryType.SUMMARY;
    }

    private String aggregation(QueryType type, String question, QueryIntent intent, List<String> measureFilters) {
        String text = Terms.normalize(question);
        String dimension = Terms.mentions(text, "provider") ? "Provider"
            : Terms.mentions(text, "resource") ? "Resource" : "Product";
        String post = measureFilters.isEmpty() ? "" : "\n" + String.join("\n", measureFilters);

        switch (type) {
            case PERCENTAGE:
                return "| summarize " + COUNTS + " by " + dimension + post
                    + "\n| as Grouped"
                    + "\n| extend Percentage = round(100.0 * RequestCount / toscalar(Grouped | summarize sum(RequestCount)), 2)"
                    + "\n| order by Percentage desc";
            case RANKING:
                int size = intent.getLimit().isPresent() ? intent.getLimit().getAsInt() : DEFAULT_RANKING_SIZE;
                String direction = intent.getDirection() == OrderingDeriver.Direction.ASC ? "asc" : "desc";
                return "| summarize " + COUNTS + " by " + dimension + post
                    + "\n| top " + size + " by RequestCount " + direction;
            case TREND:
                return "| summarize " + COUNTS + " by Day = bin(TIMESTAMP, 1d)" + post
                    + "\n| order by Day asc";
            case SUBSCRIPTION:
                return "| summarize " + COUNTS + " by subscriptionId, Product" + post
                    + "\n| order by RequestCount desc";
            case API_VERSION:
                return "| summarize " + COUNTS + " by Product, apiVersion, Provider" + post
                    + "\n| order by RequestCount desc";
            case OS:
                return "| summarize " + COUNTS + " by Product, OS" + post
                    + "\n| order by RequestCount desc";
            case TRACK:
                return "| summarize " + COUNTS + " by Product, Track" + post
                    + "\n| order by RequestCount desc";
            case DETAIL:
                return "| project TIMESTAMP, subscriptionId, Product, Track, OS, Provider, Resource, httpMethod, apiVersion"
                    + "\n| take 100";
            case COUNT:
                return "| summarize " + COUNTS + post;
            case SUMMARY:
            default:
                return "| summarize " + COUNTS + " by Product" + post
                    + "\n| order by RequestCount desc";
        }
    }

    private static String filterStage(String column, FilterClause clause) {
        switch (clause.getOperator()) {
            case ANY_OF:
                return "| where " + column + " in~ (" + clause.getValues().stream()
                    .map(KustoQueryRenderer::literal)
                    .collect(Collectors.joining(", ")) + ")";
            case PREFIX:
                return "| where " + column + " startswith " + literal(clause.getValue());
            case CONTAINS:
                return "| where " + column + " contains " + literal(clause.getValue());
            default:
                return "| where " + column + " =~ " + literal(clause.getValue());
        }
    }

    static String literal(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String loadTemplate(String resource) {
        try (InputStream in = KustoQueryRenderer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Kusto template not found on classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read Kusto template " + resource, e);
        }
    }
}
