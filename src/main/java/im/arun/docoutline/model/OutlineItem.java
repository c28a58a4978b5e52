package im.arun.docoutline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * An accepted heading of the document outline.
 * The vertical position is kept for section boundary extraction but is not serialized.
 */
@Value
@JsonPropertyOrder({"level", "text", "page"})
public class OutlineItem {

    @JsonProperty("level")
    HeadingLevel level;

    @JsonProperty("text")
    String text;

    @JsonProperty("page")
    int page;

    @JsonIgnore
    float position;
}
