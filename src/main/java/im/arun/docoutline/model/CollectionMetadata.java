package im.arun.docoutline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionMetadata {

    @JsonProperty("input_documents")
    private List<String> inputDocuments;

    @JsonProperty("persona")
    private String persona;

    @JsonProperty("job_to_be_done")
    private String jobToBeDone;

    @JsonProperty("processing_timestamp")
    private String processingTimestamp;
}
