package im.arun.docoutline.layout;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.FontThresholds;
import im.arun.docoutline.model.TextLine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Derives the H1/H2/H3 font size thresholds of one page from how each size is used.
 *
 * <p>A size is a heading size when its lines are short on average or when at least one of
 * its lines carries a structural keyword. The three largest heading sizes become the H1, H2
 * and H3 thresholds, repeating the smallest one when fewer exist. A page without any heading
 * size falls back to its three largest sizes.
 */
public class ThresholdCalibrator {

    static final List<String> STRUCTURAL_KEYWORDS = List.of(
        "summary", "background", "appendix", "phase", "section");

    private final OutlineConfig.Calibration config;

    public ThresholdCalibrator(OutlineConfig.Calibration config) {
        this.config = config;
    }

    /**
     * @return thresholds, or empty when no line has a usable font size
     */
    public Optional<FontThresholds> calibrate(List<TextLine> lines) {
        Map<Float, SizeUsage> usageBySize = new LinkedHashMap<>();
        for (TextLine line : lines) {
            if (line.getAvgFontSize() <= 0) {
                continue;
            }
            usageBySize.computeIfAbsent(line.getAvgFontSize(), size -> new SizeUsage()).add(line.getText());
        }
        if (usageBySize.isEmpty()) {
            return Optional.empty();
        }

        List<Float> uniqueSizes = new ArrayList<>(usageBySize.keySet());
        uniqueSizes.sort(Comparator.reverseOrder());

        List<Float> headingSizes = new ArrayList<>();
        for (Float size : uniqueSizes) {
            SizeUsage usage = usageBySize.get(size);
            if (usage.averageLength() < config.getShortLineLength() || usage.keywordHits > 0) {
                headingSizes.add(size);
            }
        }

        switch (headingSizes.size()) {
            case 0:
                float fallback = config.getDefaultFontSize();
                return Optional.of(new FontThresholds(
                    uniqueSizes.get(0),
                    uniqueSizes.size() > 1 ? uniqueSizes.get(1) : fallback,
                    uniqueSizes.size() > 2 ? uniqueSizes.get(2) : fallback));
            case 1:
                return Optional.of(new FontThresholds(headingSizes.get(0), headingSizes.get(0), headingSizes.get(0)));
            case 2:
                return Optional.of(new FontThresholds(headingSizes.get(0), headingSizes.get(1), headingSizes.get(1)));
            default:
                return Optional.of(new FontThresholds(headingSizes.get(0), headingSizes.get(1), headingSizes.get(2)));
        }
    }

    private static final class SizeUsage {
        int count;
        int totalChars;
        int keywordHits;

        void add(String text) {
            count++;
            totalChars += text.length();
            String lower = text.toLowerCase(Locale.ROOT);
            if (STRUCTURAL_KEYWORDS.stream().anyMatch(lower::contains)) {
                keywordHits++;
            }
        }

        double averageLength() {
            return (double) totalChars / Math.max(count, 1);
        }
    }
}
