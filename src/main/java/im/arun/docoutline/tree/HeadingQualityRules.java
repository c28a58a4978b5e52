package im.arun.docoutline.tree;

import im.arun.docoutline.heading.TextRule;
import im.arun.docoutline.model.OutlineItem;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import static im.arun.docoutline.heading.HeadingVocabulary.*;
import static im.arun.docoutline.heading.TextShapes.*;

/**
 * Whole-document checks applied to candidates in reading order. They are stricter than the
 * page-level scorer about fragments and page furniture, but explicitly allow well-known
 * section names that page scoring would treat as too short.
 */
public class HeadingQualityRules {

    private static final List<String> URL_PREFIXES = List.of("http://", "https://", "www.");

    private final double overlapRatio;
    private final int duplicateWindow;

    private final List<TextRule> fragmentExemptions;
    private final List<TextRule> fragmentFlags;
    private final List<TextRule> pathBreakers;
    private final List<TextRule> meaninglessShapes;
    private final List<TextRule> meaningfulShapes;
    private final List<TextRule> lastResortShapes;

    public HeadingQualityRules(double overlapRatio, int duplicateWindow) {
        this.overlapRatio = overlapRatio;
        this.duplicateWindow = duplicateWindow;

        this.fragmentExemptions = List.of(
            TextRule.of("structural-single", t -> STRUCTURAL_SINGLES.contains(normalizeKey(t))),
            TextRule.of("document-header", t -> containsAny(lower(t), DOCUMENT_HEADERS)),
            TextRule.of("numbered", HeadingQualityRules::isNumbered)
        );

        this.fragmentFlags = List.of(
            TextRule.of("lowercase-start", t -> !t.isEmpty() && Character.isLowerCase(t.charAt(0))
                && !containsAny(lower(t), TECHNICAL_TERMS)),
            TextRule.of("connective-phrase", t -> containsAny(lower(t), CONNECTIVE_PHRASES)),
            TextRule.of("dangling-ending", t -> endsWithAny(t, DANGLING_ENDINGS)),
            TextRule.of("too-few-words", t -> wordCount(t) < 2 && !t.endsWith(":") && !isUpper(t))
        );

        this.pathBreakers = List.of(
            TextRule.of("timeline-entry", t -> startsWithPattern(YEAR_PREFIX, t) || lower(t).contains("timeline:")),
            TextRule.of("financial-data", t -> FINANCIAL_DATA.matcher(t).matches()),
            TextRule.of("page-furniture", t -> t.length() < 10
                && (isDigits(t) || startsWithPattern(PAGE_LABEL, lower(t))))
        );

        this.meaninglessShapes = List.of(
            TextRule.of("too-short", t -> t.trim().length() < 2),
            TextRule.of("numbers-and-symbols", t -> NUMBERS_AND_SYMBOLS.matcher(t).matches()),
            TextRule.of("contact-detail", t -> t.contains("@") || startsWithAny(t, URL_PREFIXES))
        );

        this.meaningfulShapes = List.of(
            TextRule.of("document-header", t -> containsAny(lower(t), DOCUMENT_HEADERS)),
            TextRule.of("colon-label", t -> t.endsWith(":")),
            TextRule.of("question", t -> startsWithAny(t, EXTENDED_QUESTION_OPENERS) && t.endsWith("?")),
            TextRule.of("numbered", HeadingQualityRules::isNumbered),
            TextRule.of("appendix", t -> startsWithPattern(APPENDIX, t)),
            TextRule.of("section-name", HeadingQualityRules::matchesSectionName),
            TextRule.of("subsection-opener", t -> startsWithAny(t, List.of("For each ", "For the "))),
            TextRule.of("business-term", t -> containsAny(lower(t), BUSINESS_TERMS) && t.length() < 120),
            TextRule.of("structural-single", t -> STRUCTURAL_SINGLES.contains(normalizeKey(t)))
        );

        this.lastResortShapes = List.of(
            TextRule.of("title-case", t -> isTitle(t) && t.length() >= 2 && t.length() <= 80),
            TextRule.of("all-caps", t -> isUpper(t) && t.length() >= 2 && t.length() <= 60)
        );
    }

    public boolean isSentenceFragment(String text) {
        if (TextRule.anyMatch(fragmentExemptions, text)) {
            return false;
        }
        return TextRule.anyMatch(fragmentFlags, text);
    }

    public boolean breaksPath(String text) {
        return TextRule.anyMatch(pathBreakers, text);
    }

    /**
     * Ordered decision: explicit rejections, then explicit acceptances, then a rejection of
     * article-led text, then generic title-case or all-caps shapes.
     */
    public boolean isMeaningful(String text) {
        if (TextRule.anyMatch(meaninglessShapes, text)) {
            return false;
        }
        if (TextRule.anyMatch(meaningfulShapes, text)) {
            return true;
        }
        if (startsWithAny(lower(text), BARE_OPENERS)) {
            return false;
        }
        return TextRule.anyMatch(lastResortShapes, text);
    }

    /**
     * True if the text repeats one of the most recently accepted headings, either exactly
     * or with nearly the same words.
     */
    public boolean isContextualDuplicate(String text, List<OutlineItem> accepted) {
        int from = Math.max(0, accepted.size() - duplicateWindow);
        String key = normalizeKey(text);
        Set<String> words = wordSet(text);
        for (OutlineItem recent : accepted.subList(from, accepted.size())) {
            if (key.equals(normalizeKey(recent.getText()))) {
                return true;
            }
            Set<String> recentWords = wordSet(recent.getText());
            if (!words.isEmpty() && !recentWords.isEmpty()) {
                Set<String> overlap = new HashSet<>(words);
                overlap.retainAll(recentWords);
                double ratio = (double) overlap.size() / Math.min(words.size(), recentWords.size());
                if (ratio > overlapRatio) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isNumbered(String text) {
        return startsWithPattern(NUMBERED_SECTION_ANY_CASE, text) || startsWithPattern(NUMBERED_SUBSECTION_ANY_CASE, text);
    }

    private static boolean matchesSectionName(String text) {
        for (Pattern pattern : MEANINGFUL_SECTIONS) {
            if (pattern.matcher(text).lookingAt()) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> wordSet(String text) {
        return new HashSet<>(Arrays.asList(words(lower(text))));
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
