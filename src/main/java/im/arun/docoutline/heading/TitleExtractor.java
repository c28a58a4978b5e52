package im.arun.docoutline.heading;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.DocumentOutline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static im.arun.docoutline.heading.HeadingVocabulary.LEADING_DIGITS;
import static im.arun.docoutline.heading.HeadingVocabulary.MONTH_START;
import static im.arun.docoutline.heading.TextShapes.collapseWhitespace;
import static im.arun.docoutline.heading.TextShapes.containsAny;
import static im.arun.docoutline.heading.TextShapes.startsWithPattern;

/**
 * Reconstructs a document title from the first page's text lines. Title pages often split
 * the title across several lines, so each strategy stitches neighbouring lines together.
 * Strategies run in priority order and the first one producing candidates wins.
 */
public class TitleExtractor {

    private final OutlineConfig.Title config;

    public TitleExtractor(OutlineConfig.Title config) {
        this.config = config;
    }

    /**
     * @param firstPageText extracted text of page 1, or null when the page carries no characters
     */
    public String extract(String firstPageText) {
        if (firstPageText == null) {
            return DocumentOutline.UNTITLED;
        }
        List<String> lines = Arrays.stream(firstPageText.split("\n"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());

        List<String> candidates = fromRequestForProposal(lines);
        if (candidates.isEmpty()) {
            candidates = fromProposalOpener(lines);
        }
        if (candidates.isEmpty()) {
            candidates = fromBusinessPlan(lines);
        }
        if (candidates.isEmpty()) {
            candidates = composeFromParts(lines);
        }

        if (!candidates.isEmpty()) {
            return selectBest(candidates);
        }

        for (String line : head(lines, 8)) {
            if (line.length() > 15 && containsAny(lower(line), config.getDomainKeywords())
                && !startsWithPattern(LEADING_DIGITS, line)) {
                return line;
            }
        }
        return lines.isEmpty() ? DocumentOutline.UNTITLED : lines.get(0);
    }

    private List<String> fromRequestForProposal(List<String> lines) {
        List<String> candidates = new ArrayList<>();
        List<String> scanned = head(lines, config.getScanLines());
        for (int i = 0; i < scanned.size(); i++) {
            if (!isRequestForProposal(lower(scanned.get(i)))) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (int j = Math.max(0, i - 3); j <= i; j++) {
                String line = lines.get(j);
                if (line.length() > 5 && !startsWithPattern(LEADING_DIGITS, line) && !isDateLine(line)) {
                    parts.add(line);
                }
            }
            for (int j = i + 1; j < Math.min(i + 8, lines.size()); j++) {
                String next = lines.get(j);
                if (isDateLine(next)) {
                    break;
                }
                if (next.length() > 5 && containsAny(lower(next), config.getContinuationKeywords())) {
                    parts.add(next);
                } else if (next.length() < 80 && !next.endsWith(".")) {
                    parts.add(next);
                } else {
                    break;
                }
            }
            if (!parts.isEmpty()) {
                String title = collapseWhitespace(String.join(" ", parts));
                if (title.length() > 20) {
                    candidates.add(title);
                }
            }
        }
        return candidates;
    }

    private List<String> fromProposalOpener(List<String> lines) {
        List<String> candidates = new ArrayList<>();
        List<String> scanned = head(lines, 15);
        for (int i = 0; i < scanned.size(); i++) {
            if (!isProposalOpener(lower(scanned.get(i)))) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            parts.add(scanned.get(i));
            for (int j = i + 1; j < Math.min(i + 5, lines.size()); j++) {
                String next = lines.get(j);
                if (containsAny(lower(next), config.getContinuationKeywords())) {
                    parts.add(next);
                } else {
                    break;
                }
            }
            if (parts.size() > 1) {
                candidates.add(String.join(" ", parts));
            }
        }
        return candidates;
    }

    private List<String> fromBusinessPlan(List<String> lines) {
        List<String> candidates = new ArrayList<>();
        for (String line : head(lines, 10)) {
            if (line.length() > 20 && isBusinessPlanLine(lower(line))) {
                candidates.add(line);
            }
        }
        return candidates;
    }

    private List<String> composeFromParts(List<String> lines) {
        String rfpLine = null;
        String proposalLine = null;
        String businessLine = null;
        for (String line : head(lines, 10)) {
            String lower = lower(line);
            if (lower.contains("rfp") || lower.contains("request for proposal")) {
                rfpLine = line;
            } else if (isProposalOpener(lower)) {
                proposalLine = line;
            } else if (isBusinessPlanLine(lower)) {
                businessLine = line;
            }
        }
        if (rfpLine == null || (proposalLine == null && businessLine == null)) {
            return List.of();
        }
        List<String> components = new ArrayList<>();
        components.add(rfpLine);
        if (proposalLine != null) {
            components.add(proposalLine);
        }
        if (businessLine != null) {
            components.add(businessLine);
        }
        return List.of(String.join(" ", components));
    }

    private String selectBest(List<String> candidates) {
        String best = candidates.get(0);
        for (String candidate : candidates) {
            if (candidate.length() > best.length()) {
                best = candidate;
            }
        }
        best = collapseWhitespace(best);
        if (best.length() > config.getMaxTitleLength()) {
            int period = best.indexOf('.');
            if (period > 30) {
                best = best.substring(0, period).trim();
            }
        }
        return best;
    }

    private boolean isBusinessPlanLine(String lower) {
        return lower.contains("business plan") && containsAny(lower, config.getDomainKeywords());
    }

    private static boolean isRequestForProposal(String lower) {
        return (lower.contains("rfp") && lower.contains("request")) || lower.contains("request for proposal");
    }

    private static boolean isProposalOpener(String lower) {
        return lower.contains("to present") && lower.contains("proposal");
    }

    private static boolean isDateLine(String line) {
        return startsWithPattern(MONTH_START, line);
    }

    private static List<String> head(List<String> lines, int n) {
        return lines.subList(0, Math.min(n, lines.size()));
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
