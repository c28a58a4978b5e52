package im.arun.docoutline.heading;

import im.arun.docoutline.config.OutlineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link NonHeadingFilter}. */
class NonHeadingFilterTest {

    private final NonHeadingFilter filter = new NonHeadingFilter(new OutlineConfig.Scoring());

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "xy|too-short",
        "March 21, 2003|date",
        "Email: info@x.com|email",
        "www.example.org/plan|url",
        "https://example|url",
        "The board approved the plan after a long public consultation.|sentence",
        "$1,250,000|numeric-data",
        "Results|short-single-word",
        "and the remaining items|leading-connective",
        "Plans for the|trailing-connective",
        "April 2003 -|timeline-entry",
        "Project Timeline: Key Dates|timeline-entry",
        "Funding that supports libraries|connective-phrase",
        "Commitments|too-few-words"
    })
    @DisplayName("Non-heading shapes are rejected with the matching rule")
    void shouldReject(String text, String rule) {
        assertThat(filter.rejectionReason(text)).contains(rule);
    }

    @Test
    @DisplayName("Overlong text is rejected")
    void shouldRejectOverlongText() {
        assertThat(filter.rejectionReason("Word ".repeat(45))).contains("too-long");
    }

    @Test
    @DisplayName("Several sentences on one long line are rejected")
    void shouldRejectMultipleSentences() {
        String text = "Phase one ends in May. Phase two starts in June. Final report in December";
        assertThat(filter.rejectionReason(text)).contains("multiple-sentences");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "1. Introduction",
        "Revision History",
        "APPENDIX",
        "Summary:",
        "Business Outcomes",
        "Appendix A: ODL Envisioned Phases",
        "Phase I: Business Planning",
        "What could the ODL really mean?"
    })
    @DisplayName("Heading-shaped text passes the filter")
    void shouldAccept(String text) {
        assertThat(filter.rejectionReason(text)).isEmpty();
    }
}
