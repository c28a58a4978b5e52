package im.arun.docoutline.model;

import lombok.Value;

/**
 * A heading tagged with the collection document it belongs to.
 */
@Value
public class DocumentHeading {
    String document;
    OutlineItem heading;
}
