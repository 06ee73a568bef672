package sdkusage.querybridge.translation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Word-bounded text matching used by every resolution step.
 *
 * <p>A term is found only when the characters on either side of the occurrence are not letters or
 * digits, so {@code go} does not match inside {@code ago} and {@code java} not inside {@code javascript}.
 * Keyword mentions of four or more characters are stems: only the leading boundary is required, so
 * {@code request} also finds {@code requests}.</p>
 */
public final class Terms {

    private Terms() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * True when {@code term} occurs in {@code text} with word boundaries on both sides. Case-insensitive.
     */
    public static boolean containsTerm(String text, String term) {
        return indexOfTerm(text, term) >= 0;
    }

    /**
     * Position of the first word-bounded occurrence of {@code term}, or -1.
     */
    public static int indexOfTerm(String text, String term) {
        return find(normalize(text), normalize(term), true);
    }

    /**
     * Case-sensitive variant of {@link #containsTerm(String, String)}.
     */
    public static boolean containsExactTerm(String text, String term) {
        return text != null && term != null && find(text, term, true) >= 0;
    }

    /**
     * Keyword mention: exact term for short keywords, stem match for longer ones.
     */
    public static boolean mentions(String text, String keyword) {
        String lowerText = normalize(text);
        String lowerKeyword = normalize(keyword);
        return find(lowerText, lowerKeyword, lowerKeyword.length() < 4) >= 0;
    }

    public static boolean mentionsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (mentions(text, keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lower-cased alphanumeric tokens of {@code text}.
     */
    public static List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        for (String token : normalize(text).split("[^a-z0-9]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static int find(String text, String term, boolean trailingBoundary) {
        if (term.isEmpty()) {
            return -1;
        }
        int from = 0;
        while (true) {
            int index = text.indexOf(term, from);
            if (index < 0) {
                return -1;
            }
            int end = index + term.length();
            boolean leading = index == 0 || !isWordChar(text.charAt(index - 1)) || !isWordChar(term.charAt(0));
            boolean trailing = !trailingBoundary || end == text.length()
                || !isWordChar(text.charAt(end)) || !isWordChar(term.charAt(term.length() - 1));
            if (leading && trailing) {
                return index;
            }
            from = index + 1;
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c);
    }
}
