package im.arun.docoutline.heading;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Word lists and textual shapes the heading rules are built from. All lists are lowercase
 * unless they are matched against the original casing (prefix and suffix lists).
 */
public final class HeadingVocabulary {

    private HeadingVocabulary() {}

    public static final List<String> DOCUMENT_STRUCTURE = List.of(
        "revision history", "table of contents", "acknowledgements",
        "references", "introduction to the foundation", "overview of the foundation");

    public static final List<String> DOCUMENT_HEADERS = List.of(
        "revision history", "table of contents", "acknowledgements",
        "references", "trademarks", "documents and web sites");

    public static final List<String> MAJOR_SECTIONS = List.of(
        "summary", "background", "introduction", "overview",
        "methodology", "conclusion", "timeline", "milestones");

    public static final List<String> AUDIENCE_SECTIONS = List.of(
        "intended audience", "career paths", "learning objectives", "entry requirements",
        "structure and course", "keeping it current", "business outcomes", "content",
        "trademarks", "documents and web");

    public static final List<String> BUSINESS_STRUCTURE = List.of(
        "business plan", "approach and specific", "evaluation and awarding",
        "milestones", "requirements", "terms of reference");

    public static final List<String> STRUCTURAL_SINGLES = List.of(
        "summary", "background", "timeline", "milestones", "preamble", "membership",
        "chair", "term", "meetings", "acknowledgements", "references", "content", "trademarks");

    public static final List<String> TECHNICAL_TERMS = List.of(
        "intended audience", "career paths", "learning objectives");

    public static final List<String> BUSINESS_TERMS = List.of(
        "business plan", "requirements", "evaluation", "approach",
        "implementation", "methodology", "milestones", "funding",
        "terms of reference", "accountability", "communication",
        "intended audience", "career paths", "learning objectives",
        "entry requirements", "structure and course", "keeping it current",
        "business outcomes", "documents and web sites");

    public static final List<String> GOVERNANCE_TERMS = List.of(
        "funding", "governance", "decision-making", "access", "support", "training");

    public static final List<String> AUDIENCE_NOUNS = List.of(
        "citizen", "student", "library", "government");

    public static final List<String> SUBSECTION_OPENERS = List.of(
        "What could", "For each", "For the");

    public static final List<String> QUESTION_OPENERS = List.of("What ", "How ", "Why ");

    public static final List<String> EXTENDED_QUESTION_OPENERS = List.of(
        "What ", "How ", "Why ", "When ", "Where ");

    public static final List<String> LEADING_FRAGMENT_WORDS = List.of(
        "and ", "or ", "but ", "the ", "a ", "an ", "of ", "in ", "to ", "for ");

    public static final List<String> TRAILING_FRAGMENT_WORDS = List.of(
        " and", " or", " of", " in", " to", " for", " the", " a");

    public static final List<String> INCOMPLETE_ENDINGS = List.of(
        " to", " and", " or", " of", " in", " for", " the", " a", " an");

    public static final List<String> INCOMPLETE_OPENINGS = List.of(
        "to ", "and ", "or ", "of ", "in ", "for ");

    public static final List<String> DANGLING_ENDINGS = List.of(
        " to", " and", " or", " of", " in", " for", " the", " a", " an", " that", " which");

    public static final List<String> BARE_OPENERS = List.of(
        "the ", "a ", "an ", "and ", "or ", "but ", "to ", "of ", "in ", "for ");

    public static final List<String> CONNECTIVE_PHRASES = List.of(
        " is to ", " are to ", " will be ", " has been ", " have been ",
        " can be ", " should be ", " must be ", " to be ", " that ",
        " which ", " where ", " when ", " while ", " during ");

    public static final Pattern NUMBERED_SECTION = Pattern.compile("^\\d+\\.\\s+[A-Z][a-z]");
    public static final Pattern NUMBERED_SUBSECTION = Pattern.compile("^\\d+\\.\\d+\\s+[A-Z][a-z]");
    public static final Pattern NUMBERED_SECTION_ANY_CASE = Pattern.compile("^\\d+\\.\\s+[A-Za-z]");
    public static final Pattern NUMBERED_SUBSECTION_ANY_CASE = Pattern.compile("^\\d+\\.\\d+\\s+[A-Za-z]");
    public static final Pattern APPENDIX = Pattern.compile("^appendix [a-z]:", Pattern.CASE_INSENSITIVE);
    public static final Pattern PHASE = Pattern.compile("^phase [ivx]+:", Pattern.CASE_INSENSITIVE);
    public static final Pattern NUMERIC_DATA = Pattern.compile("^[\\d$,.\\s%\\-]+$");
    public static final Pattern FINANCIAL_DATA = Pattern.compile("^[\\d$,.\\s%\\-()]+$");
    public static final Pattern NUMBERS_AND_SYMBOLS = Pattern.compile("^[\\d\\s\\-.()]+$");
    public static final Pattern YEAR_PREFIX = Pattern.compile("^\\d{4}[\\s\\-]");
    public static final Pattern PAGE_LABEL = Pattern.compile("^page \\d+");
    public static final Pattern LEADING_DIGITS = Pattern.compile("^\\d+");
    public static final Pattern DATE = Pattern.compile(
        "^\\w+\\s+\\d{1,2},?\\s+\\d{4}", Pattern.UNICODE_CHARACTER_CLASS);
    public static final Pattern TIMELINE_ENTRY = Pattern.compile(
        "^\\w+ \\d{4}\\s*-?\\s*$", Pattern.UNICODE_CHARACTER_CLASS);

    public static final Pattern[] WELL_FORMED_SECTIONS = {
        Pattern.compile("^(Summary|Background|Introduction|Overview|Conclusion)$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Appendix [A-Z]:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Phase [IVX]+:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^[A-Z][a-z]+(\\s+[A-Z][a-z]*)*:$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^\\d+\\.\\s+[A-Z][a-z]+", Pattern.CASE_INSENSITIVE)
    };

    public static final Pattern[] MEANINGFUL_SECTIONS = {
        Pattern.compile("^(Summary|Background|Introduction|Overview|Conclusion|Timeline|Milestones|Acknowledgements|References)$",
            Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Appendix [A-Z]:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^Phase [IVX]+:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^[A-Z][a-z]+(\\s+[A-Z][a-z]*)*:$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^\\d+\\.\\s+[A-Z][a-z]+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^(Chair|Term|Meetings|Membership|Preamble|Content|Audience|Duration|Outcomes|Trademarks)$",
            Pattern.CASE_INSENSITIVE)
    };

    public static final Pattern MONTH_START = Pattern.compile(
        "^(january|february|march|april|may|june|july|august|september|october|november|december)\\b",
        Pattern.CASE_INSENSITIVE);
}
