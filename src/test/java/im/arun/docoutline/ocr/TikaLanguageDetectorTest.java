package im.arun.docoutline.ocr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link TikaLanguageDetector}. */
class TikaLanguageDetectorTest {

    private final TikaLanguageDetector detector = new TikaLanguageDetector();

    @Test
    @DisplayName("Latin-script samples resolve to their language code")
    void shouldDetectLatinLanguages() {
        assertThat(detector.detect("The library board reviewed the business plan and approved the budget "
            + "for the next three years of the digital service.")).contains("en");
        assertThat(detector.detect("Le conseil de la bibliothèque a examiné le plan d'affaires et approuvé "
            + "le budget pour les trois prochaines années du service numérique.")).contains("fr");
        assertThat(detector.detect("Der Vorstand der Bibliothek hat den Geschäftsplan geprüft und das Budget "
            + "für die nächsten drei Jahre des digitalen Dienstes genehmigt.")).contains("de");
    }

    @Test
    @DisplayName("Japanese text with kana resolves to ja")
    void shouldDetectJapanese() {
        assertThat(detector.detect("図書館の理事会は事業計画を検討し、今後三年間のデジタルサービスの予算を承認しました。"))
            .contains("ja");
    }

    @Test
    @DisplayName("Nothing is detected for blank samples or samples without letters")
    void shouldDetectNothing_forBlankOrLetterlessSamples() {
        assertThat(detector.detect("   ")).isEmpty();
        assertThat(detector.detect(null)).isEmpty();
        assertThat(detector.detect("12345 67890")).isEmpty();
    }
}
