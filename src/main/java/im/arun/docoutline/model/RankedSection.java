package im.arun.docoutline.model;

import lombok.Value;

/**
 * A heading from one document of a collection, scored against a query.
 */
@Value
public class RankedSection {
    String document;
    OutlineItem heading;
    double relevanceScore;
}
