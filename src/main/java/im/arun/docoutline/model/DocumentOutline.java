package im.arun.docoutline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * Title plus ordered outline of one document, in reading order.
 */
@Value
@JsonPropertyOrder({"title", "outline"})
public class DocumentOutline {

    public static final String UNTITLED = "Untitled";

    @JsonProperty("title")
    String title;

    @JsonProperty("outline")
    List<OutlineItem> outline;

    public DocumentOutline(String title, List<OutlineItem> outline) {
        this.title = title;
        this.outline = List.copyOf(outline);
    }

    public static DocumentOutline empty() {
        return new DocumentOutline(UNTITLED, List.of());
    }
}
