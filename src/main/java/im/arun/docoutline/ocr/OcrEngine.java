package im.arun.docoutline.ocr;

import im.arun.docoutline.model.OcrToken;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Optical character recognition over a rendered page image.
 */
public interface OcrEngine {

    String recognizeText(BufferedImage image, String language) throws OcrException;

    /**
     * Word-level tokens with confidence on a 0-100 scale and pixel geometry.
     */
    List<OcrToken> recognizeTokens(BufferedImage image, String language) throws OcrException;
}
