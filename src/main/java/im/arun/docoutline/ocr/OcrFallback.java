package im.arun.docoutline.ocr;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.HeadingCandidate;
import im.arun.docoutline.model.HeadingLevel;
import im.arun.docoutline.model.OcrToken;
import im.arun.docoutline.pdf.PdfDocumentHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Produces low-confidence H3 candidates for pages without character geometry. Failures in
 * language detection fall back to the default language; failures in rendering or recognition
 * yield no candidates for the page.
 */
public class OcrFallback {
    private static final Logger logger = LoggerFactory.getLogger(OcrFallback.class);

    private static final Map<String, String> TESSERACT_LANGUAGES = Map.of(
        "ja", "jpn",
        "zh", "chi_sim",
        "zh-cn", "chi_sim",
        "fr", "fra",
        "de", "deu",
        "en", "eng");

    private final OutlineConfig.Ocr config;
    private final OcrEngine engine;
    private final LanguageDetector languageDetector;

    public OcrFallback(OutlineConfig.Ocr config) {
        this(config, new TesseractOcrEngine(config.getTessdataPath()), new TikaLanguageDetector());
    }

    public OcrFallback(OutlineConfig.Ocr config, OcrEngine engine, LanguageDetector languageDetector) {
        this.config = config;
        this.engine = engine;
        this.languageDetector = languageDetector;
    }

    public List<HeadingCandidate> candidatesFor(PdfDocumentHandle document, int pageNumber) {
        if (!config.isEnabled()) {
            logger.debug("OCR disabled, skipping page {} of {}", pageNumber, document.getName());
            return Collections.emptyList();
        }

        BufferedImage image;
        try {
            image = document.renderPage(pageNumber, config.getDpi());
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not render page {} of {} for OCR: {}", pageNumber, document.getName(), e.getMessage());
            return Collections.emptyList();
        }

        String language = detectLanguage(image);
        List<OcrToken> tokens;
        try {
            tokens = engine.recognizeTokens(image, language);
        } catch (OcrException e) {
            logger.warn("OCR failed on page {} of {}: {}", pageNumber, document.getName(), e.getMessage());
            return Collections.emptyList();
        }

        float pointsPerPixel = 72f / config.getDpi();
        List<HeadingCandidate> candidates = new ArrayList<>();
        for (OcrToken token : tokens) {
            String text = token.getText() == null ? "" : token.getText().trim();
            if (token.getConfidence() <= config.getMinConfidence() || text.isEmpty()) {
                continue;
            }
            double confidence = Math.min(config.getMaxCandidateConfidence(), token.getConfidence() / 100.0);
            candidates.add(new HeadingCandidate(text, HeadingLevel.H3, pageNumber, confidence,
                0f, token.getTop() * pointsPerPixel, HeadingCandidate.Source.OCR));
        }
        logger.debug("OCR produced {} candidates on page {} ({})", candidates.size(), pageNumber, language);
        return candidates;
    }

    String detectLanguage(BufferedImage image) {
        try {
            String text = engine.recognizeText(image, config.getDefaultLanguage());
            String sample = text.length() > config.getLanguageSampleLength()
                ? text.substring(0, config.getLanguageSampleLength())
                : text;
            Optional<String> detected = sample.isBlank() ? Optional.empty() : languageDetector.detect(sample);
            return detected.map(code -> TESSERACT_LANGUAGES.getOrDefault(code, config.getDefaultLanguage()))
                .orElse(config.getDefaultLanguage());
        } catch (OcrException | RuntimeException e) {
            logger.debug("Language detection failed, using {}: {}", config.getDefaultLanguage(), e.getMessage());
            return config.getDefaultLanguage();
        }
    }
}
