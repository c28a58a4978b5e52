package im.arun.docoutline.model;

import lombok.Value;

/**
 * One visual text line on a page with aggregated font and position attributes.
 */
@Value
public class TextLine {
    String text;
    float avgFontSize;
    float maxFontSize;
    float leftMargin;
    boolean bold;
    float yPosition;
    int page;
}
