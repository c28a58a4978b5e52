package im.arun.docoutline.model;

import lombok.Value;

/**
 * A word recognized by the OCR engine. Confidence is on a 0-100 scale and
 * geometry is in image pixels.
 */
@Value
public class OcrToken {
    String text;
    float confidence;
    int top;
    int height;
}
