package im.arun.docoutline.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning knobs for outline inference, section extraction and ranking.
 * The score thresholds are empirically tuned; changing them is a tuning decision.
 */
@Data
public class OutlineConfig {
    private Calibration calibration = new Calibration();
    private Scoring scoring = new Scoring();
    private Hierarchy hierarchy = new Hierarchy();
    private Title title = new Title();
    private Ocr ocr = new Ocr();
    private Ranking ranking = new Ranking();
    private Trace trace = new Trace();

    @Data
    public static class Calibration {
        /** Font sizes whose lines average fewer characters than this count as heading sizes. */
        private int shortLineLength = 60;
        /** Threshold used for a missing band when a page has fewer than three font sizes. */
        private float defaultFontSize = 12f;
    }

    @Data
    public static class Scoring {
        private int minTextLength = 3;
        private int maxTextLength = 200;
        /** A line becomes a page candidate only above this confidence. */
        private double acceptanceThreshold = 0.55;
        /** A pattern's level suggestion replaces the font band level only above this boost. */
        private double patternOverrideCutoff = 0.3;
        private float leftMarginThreshold = 80f;
    }

    @Data
    public static class Hierarchy {
        /** Whole-document confidence floor, stricter than the page floor. */
        private double acceptanceThreshold = 0.6;
        /** Word overlap ratio above which a heading duplicates a recent one. */
        private double duplicateOverlapRatio = 0.8;
        private int duplicateWindow = 3;
        private int maxOutlineItems = 40;
        private int pathLabelLength = 50;
    }

    @Data
    public static class Title {
        private int scanLines = 20;
        private int maxTitleLength = 150;
        private List<String> continuationKeywords = new ArrayList<>(List.of(
            "proposal", "developing", "business", "plan", "ontario", "digital", "library"));
        private List<String> domainKeywords = new ArrayList<>(List.of(
            "ontario", "digital", "library"));
    }

    @Data
    public static class Ocr {
        private boolean enabled = true;
        private float dpi = 150f;
        /** OCR words at or below this confidence (0-100) are dropped. */
        private float minConfidence = 30f;
        private double maxCandidateConfidence = 0.8;
        private int languageSampleLength = 200;
        private String defaultLanguage = "eng";
        private String tessdataPath;
    }

    @Data
    public static class Ranking {
        private String embeddingUrl = "https://api.openai.com/v1/embeddings";
        private String embeddingModel = "text-embedding-3-small";
        private String apiKey;
        private int maxInputTokens = 8000;
        private int topSections = 10;
    }

    @Data
    public static class Trace {
        private boolean enabled = false;
        private String directory = "./logs";
    }
}
