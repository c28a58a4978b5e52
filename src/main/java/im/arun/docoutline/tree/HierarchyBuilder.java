package im.arun.docoutline.tree;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.HeadingCandidate;
import im.arun.docoutline.model.OutlineItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static im.arun.docoutline.heading.TextShapes.normalizeKey;

/**
 * Turns page-level heading candidates into the final outline with a single sequential pass in
 * reading order. The pass is stateful (seen texts, open heading path, recently accepted items)
 * and must not be split across threads.
 */
public class HierarchyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyBuilder.class);

    private static final Comparator<HeadingCandidate> READING_ORDER =
        Comparator.comparingInt(HeadingCandidate::getPage).thenComparingDouble(HeadingCandidate::getPosition);

    private final OutlineConfig.Hierarchy config;
    private final HeadingQualityRules rules;

    public HierarchyBuilder(OutlineConfig.Hierarchy config) {
        this(config, new HeadingQualityRules(config.getDuplicateOverlapRatio(), config.getDuplicateWindow()));
    }

    public HierarchyBuilder(OutlineConfig.Hierarchy config, HeadingQualityRules rules) {
        this.config = config;
        this.rules = rules;
    }

    public HierarchyResult build(List<HeadingCandidate> candidates) {
        List<HeadingCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(READING_ORDER);

        List<OutlineItem> accepted = new ArrayList<>();
        List<HierarchyDecision> decisions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        HierarchyPath path = new HierarchyPath(config.getPathLabelLength());

        for (HeadingCandidate candidate : ordered) {
            String text = candidate.getText();
            String key = normalizeKey(text);

            HierarchyDecision.Outcome outcome;
            if (accepted.size() >= config.getMaxOutlineItems()) {
                outcome = HierarchyDecision.Outcome.LIMIT_REACHED;
            } else if (seen.contains(key)) {
                outcome = HierarchyDecision.Outcome.SEEN;
            } else {
                outcome = check(candidate, accepted);
            }

            if (outcome != HierarchyDecision.Outcome.ACCEPTED) {
                logger.debug("Rejected '{}' on page {}: {}", text, candidate.getPage(), outcome);
                decisions.add(decisionFor(candidate, outcome, null));
                continue;
            }

            path.descend(candidate.getLevel(), text);
            seen.add(key);
            accepted.add(new OutlineItem(candidate.getLevel(), text, candidate.getPage(), candidate.getPosition()));
            decisions.add(decisionFor(candidate, outcome, path.labels()));
        }

        logger.debug("Accepted {} of {} candidates", accepted.size(), ordered.size());
        return new HierarchyResult(List.copyOf(accepted), List.copyOf(decisions));
    }

    private HierarchyDecision.Outcome check(HeadingCandidate candidate, List<OutlineItem> accepted) {
        String text = candidate.getText();
        if (candidate.getConfidence() < config.getAcceptanceThreshold()) {
            return HierarchyDecision.Outcome.LOW_CONFIDENCE;
        }
        if (rules.isSentenceFragment(text)) {
            return HierarchyDecision.Outcome.SENTENCE_FRAGMENT;
        }
        if (rules.breaksPath(text)) {
            return HierarchyDecision.Outcome.BREAKS_PATH;
        }
        if (!rules.isMeaningful(text)) {
            return HierarchyDecision.Outcome.NOT_MEANINGFUL;
        }
        if (rules.isContextualDuplicate(text, accepted)) {
            return HierarchyDecision.Outcome.DUPLICATE;
        }
        return HierarchyDecision.Outcome.ACCEPTED;
    }

    private static HierarchyDecision decisionFor(HeadingCandidate candidate, HierarchyDecision.Outcome outcome,
                                                 List<String> path) {
        return new HierarchyDecision(candidate.getText(), candidate.getLevel(), candidate.getPage(),
            candidate.getPosition(), candidate.getConfidence(), outcome, path);
    }
}
