package im.arun.docoutline.ocr;

import org.apache.tika.langdetect.optimaize.OptimaizeLangDetector;
import org.apache.tika.language.detect.LanguageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Language detection backed by Tika's n-gram profiles. The profiles are loaded on first use;
 * Tika detectors keep per-call state, so calls are serialized.
 */
public class TikaLanguageDetector implements LanguageDetector {
    private static final Logger logger = LoggerFactory.getLogger(TikaLanguageDetector.class);

    private OptimaizeLangDetector detector;

    @Override
    public synchronized Optional<String> detect(String sample) {
        if (sample == null || sample.isBlank()) {
            return Optional.empty();
        }
        LanguageResult result = detector().detect(sample);
        if (result.isUnknown()) {
            return Optional.empty();
        }
        logger.debug("Detected language {} ({})", result.getLanguage(), result.getRawScore());
        return Optional.of(result.getLanguage().toLowerCase(Locale.ROOT));
    }

    private OptimaizeLangDetector detector() {
        if (detector == null) {
            OptimaizeLangDetector loaded = new OptimaizeLangDetector();
            loaded.loadModels();
            detector = loaded;
        }
        return detector;
    }
}
