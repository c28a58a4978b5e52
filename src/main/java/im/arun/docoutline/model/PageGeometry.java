package im.arun.docoutline.model;

import lombok.Value;

import java.util.List;

/**
 * Character geometry of one page. Image-only pages carry an empty character list.
 */
@Value
public class PageGeometry {
    int pageNumber;
    float width;
    float height;
    List<CharRecord> characters;

    public boolean hasCharacters() {
        return characters != null && !characters.isEmpty();
    }
}
