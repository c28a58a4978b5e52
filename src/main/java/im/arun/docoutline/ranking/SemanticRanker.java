package im.arun.docoutline.ranking;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.DocumentHeading;
import im.arun.docoutline.model.RankedSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Orders headings by cosine similarity to a persona/task query. An instance without an
 * embedding client is "unavailable" and ranks nothing; callers must handle an empty result.
 */
public class SemanticRanker {
    private static final Logger logger = LoggerFactory.getLogger(SemanticRanker.class);

    private final EmbeddingClient client;

    public SemanticRanker(EmbeddingClient client) {
        this.client = client;
    }

    public static SemanticRanker unavailable() {
        return new SemanticRanker(null);
    }

    /**
     * Builds a ranker over the configured embedding endpoint, degrading to an unavailable
     * ranker if the client cannot be constructed.
     */
    public static SemanticRanker create(OutlineConfig.Ranking config) {
        try {
            return new SemanticRanker(new OpenAIEmbeddingClient(config));
        } catch (RuntimeException e) {
            logger.warn("Embedding model unavailable, ranking disabled: {}", e.getMessage());
            return unavailable();
        }
    }

    public boolean isAvailable() {
        return client != null;
    }

    static String buildQuery(String persona, String job) {
        return String.format("User profile: %s. Task to be completed: %s", persona, job);
    }

    public List<RankedSection> rank(String persona, String job, List<DocumentHeading> sections) {
        if (client == null || sections.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> texts = new ArrayList<>(sections.size() + 1);
        texts.add(buildQuery(persona, job));
        for (DocumentHeading section : sections) {
            texts.add(section.getHeading().getText());
        }

        List<double[]> vectors;
        try {
            logger.info("Embedding {} section headings for relevance ranking", sections.size());
            vectors = client.embed(texts);
        } catch (EmbeddingException | RuntimeException e) {
            logger.warn("Ranking unavailable: {}", e.getMessage());
            return Collections.emptyList();
        }
        if (vectors.size() != texts.size()) {
            logger.warn("Embedding count mismatch: expected {}, got {}", texts.size(), vectors.size());
            return Collections.emptyList();
        }

        double[] query = vectors.get(0);
        List<RankedSection> ranked = new ArrayList<>(sections.size());
        for (int i = 0; i < sections.size(); i++) {
            DocumentHeading section = sections.get(i);
            ranked.add(new RankedSection(section.getDocument(), section.getHeading(),
                cosineSimilarity(query, vectors.get(i + 1))));
        }
        // stable: ties keep input order
        ranked.sort(Comparator.comparingDouble(RankedSection::getRelevanceScore).reversed());
        return ranked;
    }

    static double cosineSimilarity(double[] a, double[] b) {
        int length = Math.min(a.length, b.length);
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
