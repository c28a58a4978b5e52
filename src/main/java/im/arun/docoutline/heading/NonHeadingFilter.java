package im.arun.docoutline.heading;

import im.arun.docoutline.config.OutlineConfig;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static im.arun.docoutline.heading.HeadingVocabulary.*;
import static im.arun.docoutline.heading.TextShapes.*;

/**
 * Hard rejection of lines that are never headings: dates, contact details, numeric data,
 * sentences and fragments of running text.
 */
public class NonHeadingFilter {

    private final List<TextRule> rules;

    public NonHeadingFilter(OutlineConfig.Scoring config) {
        int minLength = config.getMinTextLength();
        int maxLength = config.getMaxTextLength();
        this.rules = List.of(
            TextRule.of("too-short", t -> t.length() < minLength),
            TextRule.of("too-long", t -> t.length() > maxLength),
            TextRule.of("date", t -> startsWithPattern(DATE, t)),
            TextRule.of("email", t -> t.contains("@") && t.contains(".")),
            TextRule.of("url", t -> startsWithAny(t, List.of("http://", "https://", "www."))),
            TextRule.of("sentence", t -> t.endsWith(".") && t.length() > 40 && t.contains(" ")),
            TextRule.of("numeric-data", t -> NUMERIC_DATA.matcher(t).matches()),
            TextRule.of("short-single-word", t -> wordCount(t) == 1 && t.length() < 8),
            TextRule.of("leading-connective", t -> startsWithAny(t, LEADING_FRAGMENT_WORDS)),
            TextRule.of("trailing-connective", t -> endsWithAny(t, TRAILING_FRAGMENT_WORDS)),
            TextRule.of("timeline-entry", t -> TIMELINE_ENTRY.matcher(t).lookingAt()
                || t.toLowerCase(Locale.ROOT).contains("timeline:")),
            TextRule.of("connective-phrase", t -> containsAny(t.toLowerCase(Locale.ROOT), CONNECTIVE_PHRASES)),
            TextRule.of("too-few-words", t -> wordCount(t) < 2 && !t.endsWith(":") && !isUpper(t)),
            TextRule.of("multiple-sentences", t -> count(t, '.') > 1 && t.length() > 60)
        );
    }

    /**
     * @return the name of the first rejecting rule, or empty if the line may be a heading
     */
    public Optional<String> rejectionReason(String text) {
        return TextRule.firstMatch(rules, text);
    }
}
