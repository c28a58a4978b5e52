package im.arun.docoutline.tree;

import com.fasterxml.jackson.annotation.JsonInclude;
import im.arun.docoutline.model.HeadingLevel;
import lombok.Value;

import java.util.List;

/**
 * Why a single candidate was accepted into or rejected from the outline.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HierarchyDecision {

    public enum Outcome {
        ACCEPTED,
        SEEN,
        LOW_CONFIDENCE,
        SENTENCE_FRAGMENT,
        BREAKS_PATH,
        NOT_MEANINGFUL,
        DUPLICATE,
        LIMIT_REACHED
    }

    String text;
    HeadingLevel level;
    int page;
    float position;
    double confidence;
    Outcome outcome;
    /** Open heading path after acceptance, null for rejections. */
    List<String> path;

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
