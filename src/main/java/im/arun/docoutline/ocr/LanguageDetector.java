package im.arun.docoutline.ocr;

import java.util.Optional;

/**
 * Guesses the natural language of a short text sample.
 */
public interface LanguageDetector {

    /**
     * @return an ISO 639-1 code such as "en" or "zh-cn", or empty when the sample is inconclusive
     */
    Optional<String> detect(String sample);
}
