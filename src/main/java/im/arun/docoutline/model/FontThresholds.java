package im.arun.docoutline.model;

import lombok.Value;

/**
 * Per-page font size thresholds separating H1, H2 and H3. Anything below the
 * H3 threshold falls in the H4 band.
 */
@Value
public class FontThresholds {
    float h1;
    float h2;
    float h3;

    public HeadingLevel bandOf(float fontSize) {
        if (fontSize >= h1) {
            return HeadingLevel.H1;
        }
        if (fontSize >= h2) {
            return HeadingLevel.H2;
        }
        if (fontSize >= h3) {
            return HeadingLevel.H3;
        }
        return HeadingLevel.H4;
    }
}
