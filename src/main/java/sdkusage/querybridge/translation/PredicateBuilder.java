package sdkusage.querybridge.translation;

import sdkusage.querybridge.schema.ColumnMetadata;
import sdkusage.querybridge.schema.TableDescriptor;

import java.time.Clock;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives WHERE clauses from a question.
 *
 * <p>Each detector looks for its own cue and emits at most one clause, in a fixed order:
 * date, product, track, provider, resource, API version, HTTP method, OS, numeric comparison.
 * Detectors never see each other's output; the only shared step is that an API version literal
 * is hidden from date detection.</p>
 */
public class PredicateBuilder {

    public static final String TAUTOLOGY = "1=1";

    private static final Pattern DATE_LITERAL =
        Pattern.compile("(?<![\\d-])(\\d{4})(?:-(\\d{2})-(\\d{2})|[-/](\\d{2}))(?![\\d/-])");
    private static final Pattern API_VERSION = Pattern.compile(
        "\\bapi[- ]?version(?:\\s*(?:=|:|of|is))?\\s*(\\d{4}-\\d{2}-\\d{2}(?:-preview)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRACK_NUMBER = Pattern.compile("\\btrack\\s*([12])\\b", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> PROVIDER_NAMESPACES = List.of(
        Pattern.compile("\\bmicrosoft\\.(\\w+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bmicrosoft\\s+(\\w+)", Pattern.CASE_INSENSITIVE));
    private static final List<String> PROVIDER_KEYWORDS = List.of(
        "compute", "storage", "network", "web", "sql", "keyvault", "resources", "container", "documentdb", "authorization");
    private static final List<String> DEFAULT_HTTP_METHODS = List.of("GET", "PUT", "POST", "DELETE", "PATCH");

    private static final Map<List<String>, String> RESOURCE_KEYWORDS = new LinkedHashMap<>();
    private static final Map<Pattern, FilterClause.Operator> COMPARISONS = new LinkedHashMap<>();

    static {
        RESOURCE_KEYWORDS.put(List.of("virtual machine", "vms", "vm"), "virtualMachines");
        RESOURCE_KEYWORDS.put(List.of("storage"), "storageAccounts");
        RESOURCE_KEYWORDS.put(List.of("virtual network", "vnet", "network"), "virtualNetworks");
        RESOURCE_KEYWORDS.put(List.of("web app", "webapp"), "webApps");
        RESOURCE_KEYWORDS.put(List.of("sql"), "sqlServers");
        RESOURCE_KEYWORDS.put(List.of("key vault", "keyvault"), "keyVaults");
        RESOURCE_KEYWORDS.put(List.of("resource group"), "resourceGroups");
        RESOURCE_KEYWORDS.put(List.of("kubernetes", "aks"), "kubernetesClusters");
        RESOURCE_KEYWORDS.put(List.of("cosmos"), "cosmosDbAccounts");
        RESOURCE_KEYWORDS.put(List.of("role assignment"), "roleAssignments");

        String number = "\\s+(\\d[\\d,]*)(?:\\s+([a-z]+))?";
        COMPARISONS.put(Pattern.compile("\\b(?:more than|greater than|above)" + number), FilterClause.Operator.GT);
        COMPARISONS.put(Pattern.compile("\\b(?:less than|below|under)" + number), FilterClause.Operator.LT);
        COMPARISONS.put(Pattern.compile("\\b(?:at least|minimum of)" + number), FilterClause.Operator.GTE);
        COMPARISONS.put(Pattern.compile("\\b(?:at most|maximum of)" + number), FilterClause.Operator.LTE);
        COMPARISONS.put(Pattern.compile("\\b(?:exactly|equal to)" + number), FilterClause.Operator.EQUALS);
    }

    private final AliasResolver aliasResolver;
    private final Clock clock;

    public PredicateBuilder(AliasResolver aliasResolver, Clock clock) {
        this.aliasResolver = aliasResolver;
        this.clock = clock;
    }

    /**
     * Predicate text for {@code question}, {@value #TAUTOLOGY} when no clause applies.
     */
    public String build(String question, TableDescriptor table) {
        return render(buildClauses(question, table));
    }

    public static String render(List<FilterClause> clauses) {
        if (clauses.isEmpty()) {
            return TAUTOLOGY;
        }
        return clauses.stream().map(FilterClause::toSql).collect(Collectors.joining(" AND "));
    }

    public List<FilterClause> buildClauses(String question, TableDescriptor table) {
        List<FilterClause> clauses = new ArrayList<>();
        if (table == null || question == null || question.isBlank()) {
            return clauses;
        }
        String original = question;
        String text = Terms.normalize(question);

        Matcher apiVersion = API_VERSION.matcher(text);
        boolean hasApiVersion = apiVersion.find();

        dateClause(withoutApiVersion(text), table).ifPresent(clauses::add);
        productClause(text, table).ifPresent(clauses::add);
        trackClause(text, table).ifPresent(clauses::add);
        providerClause(text, table).ifPresent(clauses::add);
        resourceClause(text, table).ifPresent(clauses::add);
        if (hasApiVersion && table.hasColumn("ApiVersion")) {
            clauses.add(FilterClause.equalTo("ApiVersion", apiVersion.group(1), FilterClause.Origin.API_VERSION));
        }
        httpMethodClause(original, text, table).ifPresent(clauses::add);
        osClause(text, table).ifPresent(clauses::add);
        numericClause(text, table).ifPresent(clauses::add);
        return clauses;
    }

    /**
     * Blanks out an {@code api-version YYYY-MM-DD} literal so it is not read as a date.
     */
    static String withoutApiVersion(String text) {
        Matcher apiVersion = API_VERSION.matcher(text);
        if (!apiVersion.find()) {
            return text;
        }
        return text.substring(0, apiVersion.start()) + " " + text.substring(apiVersion.end());
    }

    Optional<FilterClause> dateClause(String text, TableDescriptor table) {
        Optional<String> temporal = table.temporalColumn();
        if (temporal.isEmpty()) {
            return Optional.empty();
        }
        String column = temporal.get();

        Matcher date = DATE_LITERAL.matcher(text);
        if (date.find()) {
            if (date.group(3) != null) {
                String day = date.group(1) + "-" + date.group(2) + "-" + date.group(3);
                return Optional.of(FilterClause.equalTo(column, day, FilterClause.Origin.DATE));
            }
            String month = date.group(1) + "-" + date.group(4);
            return Optional.of(FilterClause.prefix(column, month, FilterClause.Origin.DATE));
        }

        YearMonth current = YearMonth.now(clock);
        if (Terms.containsTerm(text, "this month") || Terms.containsTerm(text, "current month")) {
            return Optional.of(FilterClause.prefix(column, current.toString(), FilterClause.Origin.DATE));
        }
        if (Terms.containsTerm(text, "last month") || Terms.containsTerm(text, "previous month")) {
            return Optional.of(FilterClause.prefix(column, current.minusMonths(1).toString(), FilterClause.Origin.DATE));
        }
        return Optional.empty();
    }

    Optional<FilterClause> productClause(String text, TableDescriptor table) {
        ColumnMetadata product = table.getColumn("Product");
        if (product == null || !product.hasEnum()) {
            return Optional.empty();
        }
        Set<String> products = aliasResolver.resolve(text, product.getEnumValues());
        if (products.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(FilterClause.anyOf("Product", new ArrayList<>(products), FilterClause.Origin.PRODUCT));
    }

    Optional<FilterClause> trackClause(String text, TableDescriptor table) {
        ColumnMetadata track = table.getColumn("TrackInfo");
        if (track == null) {
            return Optional.empty();
        }
        Optional<String> literal = firstLiteral(text, track.getEnumValues());
        if (literal.isPresent()) {
            return Optional.of(FilterClause.equalTo("TrackInfo", literal.get(), FilterClause.Origin.TRACK));
        }
        Matcher number = TRACK_NUMBER.matcher(text);
        if (!number.find()) {
            return Optional.empty();
        }
        String wanted = "Track" + number.group(1);
        if (!track.hasEnum()) {
            return Optional.of(FilterClause.equalTo("TrackInfo", wanted, FilterClause.Origin.TRACK));
        }
        return track.getEnumValues().stream()
            .filter(wanted::equalsIgnoreCase)
            .findFirst()
            .map(value -> FilterClause.equalTo("TrackInfo", value, FilterClause.Origin.TRACK));
    }

    Optional<FilterClause> providerClause(String text, TableDescriptor table) {
        if (!table.hasColumn("Provider")) {
            return Optional.empty();
        }
        for (Pattern namespace : PROVIDER_NAMESPACES) {
            Matcher matcher = namespace.matcher(text);
            if (matcher.find()) {
                String service = matcher.group(1);
                String provider = "Microsoft." + service.substring(0, 1).toUpperCase(Locale.ROOT) + service.substring(1);
                return Optional.of(FilterClause.contains("Provider", provider, FilterClause.Origin.PROVIDER));
            }
        }
        for (String keyword : PROVIDER_KEYWORDS) {
            if (Terms.containsTerm(text, keyword)) {
                return Optional.of(FilterClause.contains("Provider", keyword, FilterClause.Origin.PROVIDER));
            }
        }
        return Optional.empty();
    }

    Optional<FilterClause> resourceClause(String text, TableDescriptor table) {
        if (!table.hasColumn("Resource")) {
            return Optional.empty();
        }
        for (Map.Entry<List<String>, String> entry : RESOURCE_KEYWORDS.entrySet()) {
            if (Terms.mentionsAny(text, entry.getKey())) {
                return Optional.of(FilterClause.contains("Resource", entry.getValue(), FilterClause.Origin.RESOURCE));
            }
        }
        return Optional.empty();
    }

    /**
     * HTTP verbs are common English words, so a lower-case verb only counts when it qualifies
     * requests, calls, methods or operations. Upper-case verbs always count.
     */
    Optional<FilterClause> httpMethodClause(String original, String text, TableDescriptor table) {
        ColumnMetadata method = table.getColumn("HttpMethod");
        if (method == null) {
            return Optional.empty();
        }
        List<String> methods = method.hasEnum() ? method.getEnumValues() : DEFAULT_HTTP_METHODS;
        for (String literal : methods) {
            String lower = literal.toLowerCase(Locale.ROOT);
            Pattern qualified = Pattern.compile("\\b" + Pattern.quote(lower) + "\\s+(?:requests?|calls?|methods?|operations?)\\b");
            if (Terms.containsExactTerm(original, literal) || qualified.matcher(text).find()) {
                return Optional.of(FilterClause.equalTo("HttpMethod", literal, FilterClause.Origin.HTTP_METHOD));
            }
        }
        return Optional.empty();
    }

    Optional<FilterClause> osClause(String text, TableDescriptor table) {
        ColumnMetadata os = table.getColumn("OS");
        if (os == null) {
            return Optional.empty();
        }
        return firstLiteral(text, os.getEnumValues())
            .map(value -> FilterClause.equalTo("OS", value, FilterClause.Origin.OS));
    }

    Optional<FilterClause> numericClause(String text, TableDescriptor table) {
        List<String> measures = table.measureColumns();
        if (measures.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<Pattern, FilterClause.Operator> comparison : COMPARISONS.entrySet()) {
            Matcher matcher = comparison.getKey().matcher(text);
            if (!matcher.find()) {
                continue;
            }
            long value;
            try {
                value = Long.parseLong(matcher.group(1).replace(",", ""));
            } catch (NumberFormatException e) {
                continue;
            }
            String column = measureNamedBy(matcher.group(2), table)
                .or(() -> measureMentioned(text, table))
                .orElse(measures.get(0));
            return Optional.of(FilterClause.compare(column, comparison.getValue(), value));
        }
        return Optional.empty();
    }

    private static Optional<String> measureNamedBy(String word, TableDescriptor table) {
        if (word == null) {
            return Optional.empty();
        }
        if (word.startsWith("request")) {
            return table.hasColumn("RequestCount") ? Optional.of("RequestCount")
                : table.hasColumn("RequestCounts") ? Optional.of("RequestCounts") : Optional.empty();
        }
        if (word.startsWith("subscription") && table.hasColumn("SubscriptionCount")) {
            return Optional.of("SubscriptionCount");
        }
        if (word.startsWith("ccid") && table.hasColumn("CCIDCount")) {
            return Optional.of("CCIDCount");
        }
        return Optional.empty();
    }

    private static Optional<String> measureMentioned(String text, TableDescriptor table) {
        for (String token : Terms.tokens(text)) {
            Optional<String> column = measureNamedBy(token, table);
            if (column.isPresent()) {
                return column;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstLiteral(String text, List<String> literals) {
        for (String literal : literals) {
            if (Terms.containsTerm(text, literal)) {
                return Optional.of(literal);
            }
        }
        return Optional.empty();
    }
}
