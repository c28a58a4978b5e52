package im.arun.docoutline.ocr;

/**
 * Raised when the OCR engine cannot recognize an image, usually because the native
 * library or the language data is missing.
 */
public class OcrException extends Exception {

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
