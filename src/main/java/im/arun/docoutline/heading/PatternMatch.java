package im.arun.docoutline.heading;

import im.arun.docoutline.model.HeadingLevel;
import lombok.Value;

/**
 * Result of matching a line against the heading pattern table. The level is null when the
 * matched pattern only boosts confidence without suggesting a level.
 */
@Value
public class PatternMatch {
    public static final PatternMatch NONE = new PatternMatch(null, 0.0, null);

    String ruleName;
    double boost;
    HeadingLevel level;
}
