package im.arun.docoutline.heading;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.FontThresholds;
import im.arun.docoutline.model.HeadingCandidate;
import im.arun.docoutline.model.HeadingLevel;
import im.arun.docoutline.model.TextLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores each text line of a page as a potential heading. Confidence is built additively from
 * the font band, textual patterns, boldness, alignment, brevity and heading shape, then clamped
 * to [0, 1]. Lines above the acceptance threshold become page-level candidates.
 */
public class CandidateScorer {
    private static final Logger logger = LoggerFactory.getLogger(CandidateScorer.class);

    private static final Map<HeadingLevel, Double> BAND_WEIGHTS = new EnumMap<>(Map.of(
        HeadingLevel.H1, 0.4,
        HeadingLevel.H2, 0.3,
        HeadingLevel.H3, 0.2,
        HeadingLevel.H4, 0.1));

    private static final double BOLD_BONUS = 0.2;
    private static final double LEFT_ALIGNED_BONUS = 0.1;
    private static final double SHORT_BONUS = 0.1;
    private static final double VERY_SHORT_BONUS = 0.1;
    private static final double WELL_FORMED_BONUS = 0.2;
    private static final double INCOMPLETE_PENALTY = 0.3;

    private final OutlineConfig.Scoring config;
    private final NonHeadingFilter filter;
    private final HeadingPatternCatalog catalog;

    public CandidateScorer(OutlineConfig.Scoring config) {
        this(config, new NonHeadingFilter(config), new HeadingPatternCatalog());
    }

    public CandidateScorer(OutlineConfig.Scoring config, NonHeadingFilter filter, HeadingPatternCatalog catalog) {
        this.config = config;
        this.filter = filter;
        this.catalog = catalog;
    }

    public List<HeadingCandidate> score(List<TextLine> lines, FontThresholds thresholds) {
        List<HeadingCandidate> candidates = new ArrayList<>();
        for (TextLine line : lines) {
            evaluate(line, thresholds).ifPresent(candidates::add);
        }
        return candidates;
    }

    public Optional<HeadingCandidate> evaluate(TextLine line, FontThresholds thresholds) {
        String text = line.getText().trim();

        Optional<String> rejection = filter.rejectionReason(text);
        if (rejection.isPresent()) {
            logger.trace("Page {}: '{}' rejected ({})", line.getPage(), text, rejection.get());
            return Optional.empty();
        }

        HeadingLevel level = thresholds.bandOf(line.getAvgFontSize());
        double confidence = BAND_WEIGHTS.get(level);

        PatternMatch pattern = catalog.analyze(text);
        confidence += pattern.getBoost();
        if (pattern.getLevel() != null && pattern.getBoost() > config.getPatternOverrideCutoff()) {
            level = pattern.getLevel();
        }

        if (line.isBold()) {
            confidence += BOLD_BONUS;
        }
        if (line.getLeftMargin() < config.getLeftMarginThreshold()) {
            confidence += LEFT_ALIGNED_BONUS;
        }
        if (text.length() < 100) {
            confidence += SHORT_BONUS;
        }
        if (text.length() < 50) {
            confidence += VERY_SHORT_BONUS;
        }
        if (catalog.isWellFormed(text)) {
            confidence += WELL_FORMED_BONUS;
        }
        if (catalog.isIncomplete(text)) {
            confidence -= INCOMPLETE_PENALTY;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        if (confidence <= config.getAcceptanceThreshold()) {
            logger.trace("Page {}: '{}' below threshold ({})", line.getPage(), text, confidence);
            return Optional.empty();
        }
        return Optional.of(new HeadingCandidate(text, level, line.getPage(), confidence,
            line.getAvgFontSize(), line.getYPosition(), HeadingCandidate.Source.LAYOUT));
    }
}
