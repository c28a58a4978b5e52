package im.arun.docoutline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Output of a collection ranking pass.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"metadata", "extracted_sections", "subsection_analysis"})
public class CollectionResult {

    @JsonProperty("metadata")
    private CollectionMetadata metadata;

    @JsonProperty("extracted_sections")
    private List<ExtractedSection> extractedSections;

    @JsonProperty("subsection_analysis")
    private List<SubsectionAnalysis> subsectionAnalysis;
}
