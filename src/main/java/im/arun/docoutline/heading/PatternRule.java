package im.arun.docoutline.heading;

import im.arun.docoutline.model.HeadingLevel;
import lombok.Value;

import java.util.function.Predicate;

/**
 * A heading pattern with the confidence boost and level it suggests.
 */
@Value
public class PatternRule {
    String name;
    Predicate<String> predicate;
    double boost;
    HeadingLevel level;

    public boolean matches(String text) {
        return predicate.test(text);
    }

    public PatternMatch toMatch() {
        return new PatternMatch(name, boost, level);
    }
}
