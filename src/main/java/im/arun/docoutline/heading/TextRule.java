package im.arun.docoutline.heading;

import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A named predicate over heading text. Ordered lists of rules are evaluated first-match-wins.
 */
@Value
public class TextRule {
    String name;
    Predicate<String> predicate;

    public static TextRule of(String name, Predicate<String> predicate) {
        return new TextRule(name, predicate);
    }

    public boolean matches(String text) {
        return predicate.test(text);
    }

    public static Optional<String> firstMatch(List<TextRule> rules, String text) {
        for (TextRule rule : rules) {
            if (rule.matches(text)) {
                return Optional.of(rule.getName());
            }
        }
        return Optional.empty();
    }

    public static boolean anyMatch(List<TextRule> rules, String text) {
        return firstMatch(rules, text).isPresent();
    }
}
