package im.arun.docoutline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"document", "section_title", "importance_rank", "page_number"})
public class ExtractedSection {

    @JsonProperty("document")
    private String document;

    @JsonProperty("section_title")
    private String sectionTitle;

    @JsonProperty("importance_rank")
    private int importanceRank;

    @JsonProperty("page_number")
    private int pageNumber;
}
