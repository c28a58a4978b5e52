package im.arun.docoutline.heading;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Casing and shape predicates shared by the heading rules.
 */
public final class TextShapes {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextShapes() {}

    /**
     * True when the text has at least one cased character and none of them is lowercase.
     */
    public static boolean isUpper(String text) {
        boolean cased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLowerCase(c) || Character.isTitleCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                cased = true;
            }
        }
        return cased;
    }

    /**
     * True when every word starts with an uppercase letter followed only by lowercase
     * letters. Any uncased character (digit, space, punctuation) starts a new word.
     */
    public static boolean isTitle(String text) {
        boolean previousCased = false;
        boolean cased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                if (previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else if (Character.isLowerCase(c)) {
                if (!previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else {
                previousCased = false;
            }
        }
        return cased;
    }

    public static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    public static String[] words(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
    }

    public static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String normalizeKey(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean startsWithAny(String text, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (text.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public static boolean endsWithAny(String text, List<String> suffixes) {
        for (String suffix : suffixes) {
            if (text.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsAny(String text, List<String> fragments) {
        for (String fragment : fragments) {
            if (text.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Anchored-at-start match, the pattern need not consume the whole text.
     */
    public static boolean startsWithPattern(Pattern pattern, String text) {
        return pattern.matcher(text).lookingAt();
    }

    public static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
