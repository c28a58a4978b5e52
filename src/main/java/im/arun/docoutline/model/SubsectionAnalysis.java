package im.arun.docoutline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"document", "refined_text", "page_number"})
public class SubsectionAnalysis {

    @JsonProperty("document")
    private String document;

    @JsonProperty("refined_text")
    private String refinedText;

    @JsonProperty("page_number")
    private int pageNumber;
}
