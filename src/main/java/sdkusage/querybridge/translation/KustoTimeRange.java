package sdkusage.querybridge.translation;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Half-open UTC time window [start, end) named by a question. A full date selects that day, a
 * year-month that month. Defaults to the current month.
 */
public final class KustoTimeRange {

    private static final DateTimeFormatter KQL_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");
    private static final Pattern EXPLICIT_DAY = Pattern.compile("(?<![\\d-])(\\d{4})-(\\d{2})-(\\d{2})(?![\\d/-])");
    private static final Pattern EXPLICIT_MONTH = Pattern.compile("(?<![\\d-])(\\d{4})[-/](\\d{2})(?![\\d/-])");
    private static final Pattern LAST_N_DAYS = Pattern.compile("\\b(?:last|past)\\s+(\\d{1,3})\\s+days?\\b");

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final String label;

    private KustoTimeRange(LocalDate start, LocalDate end, String label) {
        this.start = start.atStartOfDay();
        this.end = end.atStartOfDay();
        this.label = label;
    }

    public static KustoTimeRange fromQuestion(String question, Clock clock) {
        String text = PredicateBuilder.withoutApiVersion(Terms.normalize(question));
        LocalDate today = LocalDate.now(clock);
        YearMonth thisMonth = YearMonth.from(today);

        Matcher day = EXPLICIT_DAY.matcher(text);
        if (day.find()) {
            int month = Integer.parseInt(day.group(2));
            int dayOfMonth = Integer.parseInt(day.group(3));
            if (month >= 1 && month <= 12
                && YearMonth.of(Integer.parseInt(day.group(1)), month).isValidDay(dayOfMonth)) {
                LocalDate named = LocalDate.of(Integer.parseInt(day.group(1)), month, dayOfMonth);
                return new KustoTimeRange(named, named.plusDays(1), named.toString());
            }
        }
        Matcher explicit = EXPLICIT_MONTH.matcher(text);
        if (explicit.find()) {
            int month = Integer.parseInt(explicit.group(2));
            if (month >= 1 && month <= 12) {
                YearMonth named = YearMonth.of(Integer.parseInt(explicit.group(1)), month);
                return ofMonth(named, named.toString());
            }
        }
        Matcher lastDays = LAST_N_DAYS.matcher(text);
        if (lastDays.find()) {
            int days = Integer.parseInt(lastDays.group(1));
            return new KustoTimeRange(today.minusDays(days), today.plusDays(1), "last " + days + " days");
        }
        if (Terms.containsTerm(text, "today")) {
            return new KustoTimeRange(today, today.plusDays(1), "today");
        }
        if (Terms.containsTerm(text, "yesterday")) {
            return new KustoTimeRange(today.minusDays(1), today, "yesterday");
        }
        if (Terms.containsTerm(text, "last month") || Terms.containsTerm(text, "previous month")) {
            return ofMonth(thisMonth.minusMonths(1), "last month");
        }
        if (Terms.containsTerm(text, "this year")) {
            LocalDate january = LocalDate.of(today.getYear(), 1, 1);
            return new KustoTimeRange(january, january.plusYears(1), "this year");
        }
        if (Terms.containsTerm(text, "last year")) {
            LocalDate january = LocalDate.of(today.getYear() - 1, 1, 1);
            return new KustoTimeRange(january, january.plusYears(1), "last year");
        }
        return ofMonth(thisMonth, "this month");
    }

    private static KustoTimeRange ofMonth(YearMonth month, String label) {
        return new KustoTimeRange(month.atDay(1), month.plusMonths(1).atDay(1), label);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public String getLabel() {
        return label;
    }

    public String startLiteral() {
        return KQL_DATETIME.format(start);
    }

    public String endLiteral() {
        return KQL_DATETIME.format(end);
    }
}
