package sdkusage.querybridge.translation;

import sdkusage.querybridge.schema.TableDescriptor;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives TOP-N and ORDER BY from a question.
 *
 * <p>Direction defaults to descending. When both ascending and descending cues are present, the
 * cue that appears first in the question decides. Comparison phrases such as "at least 100" are not
 * direction cues.</p>
 */
public class OrderingDeriver {

    public enum Direction { ASC, DESC }

    /** Result of {@link #derive(String, TableDescriptor)}. */
    public static final class Ordering {

        private static final Ordering NONE = new Ordering(null, null, Direction.DESC);

        private final Integer limit;
        private final String orderColumn;
        private final Direction direction;

        public Ordering(Integer limit, String orderColumn, Direction direction) {
            this.limit = limit;
            this.orderColumn = orderColumn;
            this.direction = direction;
        }

        public static Ordering none() {
            return NONE;
        }

        public OptionalInt getLimit() {
            return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
        }

        public Optional<String> getOrderColumn() {
            return Optional.ofNullable(orderColumn);
        }

        public Direction getDirection() {
            return direction;
        }
    }

    private static final Pattern TOP_N = Pattern.compile("\\btop\\s+(\\d+)\\b");
    private static final Pattern BOTTOM_N = Pattern.compile("\\bbottom\\s+(\\d+)\\b");
    private static final Pattern COMPARISON_PHRASES =
        Pattern.compile("\\b(?:at least|at most|minimum of|maximum of)\\b");

    private static final List<String> ASCENDING_CUES = List.of("lowest", "least", "minimum", "oldest", "asc", "ascending");
    private static final List<String> DESCENDING_CUES = List.of("highest", "most", "maximum", "newest", "latest", "desc", "descending");
    private static final List<String> MEASURE_CUES = List.of("count", "request", "usage");
    private static final List<String> TEMPORAL_CUES = List.of("date", "time", "trend", "chronological");

    public Ordering derive(String question, TableDescriptor table) {
        if (question == null || table == null) {
            return Ordering.none();
        }
        String text = Terms.normalize(question);

        Integer limit = null;
        boolean bottom = false;
        Matcher top = TOP_N.matcher(text);
        Matcher bottomN = BOTTOM_N.matcher(text);
        if (top.find()) {
            limit = parseLimit(top.group(1));
        } else if (bottomN.find()) {
            limit = parseLimit(bottomN.group(1));
            bottom = limit != null;
        }

        String orderColumn = null;
        List<String> measures = table.measureColumns();
        if (Terms.mentionsAny(text, MEASURE_CUES) && !measures.isEmpty()) {
            orderColumn = preferredMeasure(text, table, measures);
        } else if (Terms.mentionsAny(text, TEMPORAL_CUES)) {
            orderColumn = table.temporalColumn().orElse(null);
        }

        Direction direction = bottom ? Direction.ASC : direction(text);
        return new Ordering(limit, orderColumn, direction);
    }

    Direction direction(String text) {
        String cues = COMPARISON_PHRASES.matcher(text).replaceAll(" ");
        int ascending = firstIndex(cues, ASCENDING_CUES);
        int descending = firstIndex(cues, DESCENDING_CUES);
        if (ascending >= 0 && (descending < 0 || ascending < descending)) {
            return Direction.ASC;
        }
        return Direction.DESC;
    }

    private static String preferredMeasure(String text, TableDescriptor table, List<String> measures) {
        boolean requests = Terms.mentions(text, "request") || Terms.mentions(text, "usage");
        if (!requests && Terms.mentions(text, "subscription") && table.hasColumn("SubscriptionCount")) {
            return "SubscriptionCount";
        }
        return measures.get(0);
    }

    private static int firstIndex(String text, List<String> cues) {
        int first = -1;
        for (String cue : cues) {
            int index = Terms.indexOfTerm(text, cue);
            if (index >= 0 && (first < 0 || index < first)) {
                first = index;
            }
        }
        return first;
    }

    private static Integer parseLimit(String digits) {
        try {
            int value = Integer.parseInt(digits);
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
