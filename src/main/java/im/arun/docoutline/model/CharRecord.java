package im.arun.docoutline.model;

import lombok.Value;

/**
 * A single glyph reported by the page geometry provider.
 * Coordinates are in PDF points, measured from the top-left corner of the page.
 */
@Value
public class CharRecord {
    String text;
    float x0;
    float y0;
    float width;
    float size;
    String fontName;
}
