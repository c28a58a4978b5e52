package im.arun.docoutline.ocr;

import im.arun.docoutline.model.OcrToken;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Tess4J-backed OCR engine. The Tesseract instance is created on first use so that
 * documents without scanned pages never load the native library. Calls are serialized
 * because a Tesseract handle is not thread-safe.
 */
public class TesseractOcrEngine implements OcrEngine {
    private static final Logger logger = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final String datapath;
    private Tesseract tesseract;

    public TesseractOcrEngine(String configuredDatapath) {
        this.datapath = resolveDatapath(configuredDatapath);
    }

    @Override
    public synchronized String recognizeText(BufferedImage image, String language) throws OcrException {
        Tesseract engine = engine(language);
        try {
            return engine.doOCR(image);
        } catch (TesseractException e) {
            throw new OcrException("Text recognition failed for language " + language, e);
        } catch (LinkageError e) {
            throw new OcrException("Tesseract native library unavailable", e);
        }
    }

    @Override
    public synchronized List<OcrToken> recognizeTokens(BufferedImage image, String language) throws OcrException {
        Tesseract engine = engine(language);
        List<Word> words;
        try {
            words = engine.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        } catch (LinkageError e) {
            throw new OcrException("Tesseract native library unavailable", e);
        } catch (RuntimeException e) {
            throw new OcrException("Word recognition failed for language " + language, e);
        }

        List<OcrToken> tokens = new ArrayList<>(words.size());
        for (Word word : words) {
            Rectangle box = word.getBoundingBox();
            tokens.add(new OcrToken(word.getText(), word.getConfidence(), box.y, box.height));
        }
        return tokens;
    }

    private Tesseract engine(String language) throws OcrException {
        if (tesseract == null) {
            try {
                tesseract = new Tesseract();
                tesseract.setDatapath(datapath);
                logger.info("Initialized Tesseract with data path {}", datapath);
            } catch (LinkageError e) {
                throw new OcrException("Tesseract native library unavailable", e);
            }
        }
        tesseract.setLanguage(language);
        return tesseract;
    }

    private static String resolveDatapath(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String fromEnv = System.getenv("TESSDATA_PREFIX");
        if (fromEnv != null) {
            return fromEnv;
        }
        File local = new File("tessdata");
        return local.exists() ? local.getAbsolutePath() : "tessdata";
    }
}
