package fr.lapetina.chat.recovery.infrastructure.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts personal data from text before it is persisted.
 *
 * <p>Rules run in a fixed order: filesystem paths, emails, user identifiers, long digit runs.
 * Every placeholder is bracketed, no rule matches inside a placeholder and a path right
 * after a placeholder is left alone, so {@code sanitize(sanitize(x)).equals(sanitize(x))}
 * holds for any input.
 */
public final class Sanitizer {

    public static final String PATH = "[PATH]";
    public static final String EMAIL = "[EMAIL]";
    public static final String USER_ID = "[USER_ID]";
    public static final String LARGE_NUMBER = "[LARGE_NUMBER]";

    private static final String PATH_SEGMENT = "[^/\\s'\"(){}\\[\\],;|]+";

    private static final String AFTER_PLACEHOLDER = "(?<!\\[(?:PATH|EMAIL|USER_ID|LARGE_NUMBER)\\])";

    private static final List<Rule> RULES = List.of(
            // absolute, home-relative or URL path, at least two components
            new Rule(Pattern.compile(
                    AFTER_PLACEHOLDER + "~?/+" + PATH_SEGMENT + "(?:/+" + PATH_SEGMENT + ")+/?"), PATH),
            new Rule(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), EMAIL),
            new Rule(Pattern.compile("\\buser_\\w+"), USER_ID),
            new Rule(Pattern.compile("\\b\\d{10,}\\b"), LARGE_NUMBER)
    );

    private Sanitizer() {
    }

    /**
     * Returns the redacted text; null gives an empty string.
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String sanitized = text;
        for (Rule rule : RULES) {
            sanitized = rule.pattern().matcher(sanitized).replaceAll(rule.replacement());
        }
        return sanitized;
    }

    private record Rule(Pattern pattern, String replacement) {
        private Rule {
            replacement = Matcher.quoteReplacement(replacement);
        }
    }
}
