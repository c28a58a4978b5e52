package im.arun.docoutline.model;

import lombok.Value;

/**
 * A line provisionally classified as a heading, before whole-document checks.
 */
@Value
public class HeadingCandidate {

    public enum Source {
        LAYOUT,
        OCR
    }

    String text;
    HeadingLevel level;
    int page;
    double confidence;
    float fontSize;
    float position;
    Source source;
}
