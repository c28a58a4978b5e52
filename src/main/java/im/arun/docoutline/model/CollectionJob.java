package im.arun.docoutline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A collection ranking request: who is asking, what they need, and which documents to search.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionJob {
    private String persona;
    private String jobToBeDone;
    private List<String> documents;
}
