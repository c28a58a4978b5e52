package im.arun.docoutline.heading;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.FontThresholds;
import im.arun.docoutline.model.HeadingCandidate;
import im.arun.docoutline.model.HeadingLevel;
import im.arun.docoutline.model.TextLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/** Unit tests for {@link CandidateScorer}. */
class CandidateScorerTest {

    private static final FontThresholds THRESHOLDS = new FontThresholds(18f, 14f, 12f);

    private final CandidateScorer scorer = new CandidateScorer(new OutlineConfig.Scoring());

    @Test
    @DisplayName("A numbered, large, bold line scores full confidence at H1")
    void shouldScoreNumberedSection() {
        HeadingCandidate candidate = scorer.evaluate(line("1. Introduction", 18f, true, 72f, 90f), THRESHOLDS).orElseThrow();

        assertThat(candidate.getLevel()).isEqualTo(HeadingLevel.H1);
        assertThat(candidate.getConfidence()).isEqualTo(1.0);
        assertThat(candidate.getPosition()).isEqualTo(90f);
        assertThat(candidate.getPage()).isEqualTo(1);
        assertThat(candidate.getSource()).isEqualTo(HeadingCandidate.Source.LAYOUT);
    }

    @Test
    @DisplayName("A strong pattern overrides the font band level")
    void shouldOverrideBandLevel_withStrongPattern() {
        HeadingCandidate candidate = scorer.evaluate(line("2.1 Intended Audience", 18f, false, 72f, 100f), THRESHOLDS)
            .orElseThrow();

        assertThat(candidate.getLevel()).isEqualTo(HeadingLevel.H2);
    }

    @Test
    @DisplayName("A weak pattern keeps the font band level")
    void shouldKeepBandLevel_withWeakPattern() {
        HeadingCandidate candidate = scorer.evaluate(line("What is the plan?", 14f, false, 72f, 100f), THRESHOLDS)
            .orElseThrow();

        assertThat(candidate.getLevel()).isEqualTo(HeadingLevel.H2);
    }

    @Test
    @DisplayName("Hard rejections win over any layout evidence")
    void shouldReject_contactDetails() {
        assertThat(scorer.evaluate(line("Email: info@x.com", 24f, true, 72f, 100f), THRESHOLDS)).isEmpty();
    }

    @Test
    @DisplayName("Boldness lifts a short title-case line over the acceptance threshold")
    void shouldAccept_onlyWhenBold() {
        assertThat(scorer.evaluate(line("Project Goals", 12f, false, 72f, 100f), THRESHOLDS)).isEmpty();

        HeadingCandidate bold = scorer.evaluate(line("Project Goals", 12f, true, 72f, 100f), THRESHOLDS).orElseThrow();
        assertThat(bold.getLevel()).isEqualTo(HeadingLevel.H3);
        assertThat(bold.getConfidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    @DisplayName("Incomplete shapes are penalized")
    void shouldPenalizeIncompleteShapes() {
        double complete = scorer.evaluate(line("Wait for it now", 18f, true, 72f, 100f), THRESHOLDS)
            .orElseThrow().getConfidence();
        double incomplete = scorer.evaluate(line("Wait for it...", 18f, true, 72f, 100f), THRESHOLDS)
            .orElseThrow().getConfidence();

        assertThat(complete - incomplete).isCloseTo(0.3, within(1e-9));
    }

    @Test
    @DisplayName("Body text stays below the threshold")
    void shouldSkipBodyText() {
        List<TextLine> lines = List.of(
            line("1. Introduction", 18f, true, 72f, 90f),
            line("Our team reviewed the proposal in detail", 11f, false, 72f, 120f),
            line("Project Goals", 12f, false, 72f, 150f));

        assertThat(scorer.score(lines, THRESHOLDS))
            .extracting(HeadingCandidate::getText)
            .containsExactly("1. Introduction");
    }

    private static TextLine line(String text, float size, boolean bold, float left, float y) {
        return new TextLine(text, size, size, left, bold, y, 1);
    }
}
