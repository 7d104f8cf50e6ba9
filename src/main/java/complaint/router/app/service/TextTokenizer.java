package complaint.router.app.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans mail text and splits it into case-folded word tokens.
 */
public final class TextTokenizer {
    private static final Pattern HTML_TAG = Pattern.compile("<[^<]+?>");
    private static final Pattern HTML_ENTITY = Pattern.compile("&(nbsp|amp|lt|gt|quot|#39);");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // apostrophes stay inside words so "don't" remains one token
    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}']+");

    private TextTokenizer() {
    }

    /**
     * Strips HTML tags, collapses whitespace and lower-cases the text.
     */
    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = HTML_TAG.matcher(text).replaceAll(" ");
        stripped = HTML_ENTITY.matcher(stripped).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    public static List<String> tokenize(String text) {
        String cleaned = clean(text).replace('’', '\'');
        List<String> tokens = new ArrayList<>();
        if (cleaned.isEmpty()) {
            return tokens;
        }
        for (String raw : SEPARATOR.split(cleaned)) {
            String token = trimApostrophes(raw);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Normalizes a keyword-list entry to the same form the tokenizer produces, tokens joined by one space.
     */
    public static String normalizeTerm(String term) {
        return String.join(" ", tokenize(term));
    }

    private static String trimApostrophes(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '\'') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '\'') {
            end--;
        }
        return token.substring(start, end);
    }
}
