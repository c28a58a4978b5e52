package im.arun.docoutline.heading;

import im.arun.docoutline.model.HeadingLevel;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static im.arun.docoutline.heading.HeadingVocabulary.*;
import static im.arun.docoutline.heading.TextShapes.*;

/**
 * Ordered table of textual heading patterns plus the well-formed and incomplete shape checks
 * used by the candidate scorer. The first matching pattern wins.
 */
public class HeadingPatternCatalog {

    private final List<PatternRule> patterns;
    private final List<TextRule> wellFormed;
    private final List<TextRule> incomplete;

    public HeadingPatternCatalog() {
        this.patterns = List.of(
            new PatternRule("document-structure", t -> containsAny(lower(t), DOCUMENT_STRUCTURE), 0.9, HeadingLevel.H1),
            new PatternRule("numbered-section", t -> startsWithPattern(NUMBERED_SECTION, t), 0.9, HeadingLevel.H1),
            new PatternRule("numbered-subsection", t -> startsWithPattern(NUMBERED_SUBSECTION, t), 0.8, HeadingLevel.H2),
            new PatternRule("appendix", t -> startsWithPattern(APPENDIX, t), 0.8, HeadingLevel.H2),
            new PatternRule("phase", t -> startsWithPattern(PHASE, t), 0.7, HeadingLevel.H3),
            new PatternRule("major-section", t -> MAJOR_SECTIONS.contains(lower(t).trim()), 0.8, HeadingLevel.H2),
            new PatternRule("audience-section", t -> containsAny(lower(t), AUDIENCE_SECTIONS), 0.8, HeadingLevel.H2),
            new PatternRule("audience-subsection",
                t -> startsWithAny(t, SUBSECTION_OPENERS) && containsAny(lower(t), AUDIENCE_NOUNS), 0.6, HeadingLevel.H4),
            new PatternRule("subsection-opener", t -> startsWithAny(t, SUBSECTION_OPENERS), 0.6, HeadingLevel.H3),
            new PatternRule("business-structure", t -> containsAny(lower(t), BUSINESS_STRUCTURE), 0.7, HeadingLevel.H2),
            new PatternRule("structural-single", t -> STRUCTURAL_SINGLES.contains(lower(t).trim()), 0.8, HeadingLevel.H1),
            new PatternRule("governance-label",
                t -> isColonLabel(t) && containsAny(lower(t), GOVERNANCE_TERMS), 0.6, HeadingLevel.H3),
            new PatternRule("colon-label", HeadingPatternCatalog::isColonLabel, 0.5, HeadingLevel.H3),
            new PatternRule("all-caps", t -> isUpper(t) && t.length() > 3 && t.length() < 60, 0.6, HeadingLevel.H2),
            new PatternRule("question", t -> startsWithAny(t, QUESTION_OPENERS) && t.endsWith("?"), 0.3, null)
        );

        this.wellFormed = List.of(
            TextRule.of("question", t -> startsWithAny(t, QUESTION_OPENERS) && t.endsWith("?")),
            TextRule.of("section-shape", HeadingPatternCatalog::matchesWellFormedSection),
            TextRule.of("subsection-label", t -> startsWithAny(t, List.of("For each ", "For the ")) && t.endsWith(":"))
        );

        this.incomplete = List.of(
            TextRule.of("dangling-ending", t -> endsWithAny(t, INCOMPLETE_ENDINGS)),
            TextRule.of("dangling-opening", t -> startsWithAny(t, INCOMPLETE_OPENINGS)),
            TextRule.of("ellipsis", t -> t.contains("...")),
            TextRule.of("run-on", t -> count(t, ' ') > 12)
        );
    }

    public PatternMatch analyze(String text) {
        for (PatternRule rule : patterns) {
            if (rule.matches(text)) {
                return rule.toMatch();
            }
        }
        return PatternMatch.NONE;
    }

    public boolean isWellFormed(String text) {
        return TextRule.anyMatch(wellFormed, text);
    }

    public boolean isIncomplete(String text) {
        return TextRule.anyMatch(incomplete, text);
    }

    private static boolean isColonLabel(String text) {
        return text.endsWith(":") && text.length() > 3 && text.length() < 80;
    }

    private static boolean matchesWellFormedSection(String text) {
        for (Pattern pattern : WELL_FORMED_SECTIONS) {
            if (pattern.matcher(text).lookingAt()) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
