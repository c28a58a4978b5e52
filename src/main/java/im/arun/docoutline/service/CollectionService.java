package im.arun.docoutline.service;

import im.arun.docoutline.model.CollectionJob;
import im.arun.docoutline.model.CollectionMetadata;
import im.arun.docoutline.model.CollectionResult;
import im.arun.docoutline.model.DocumentHeading;
import im.arun.docoutline.model.DocumentOutline;
import im.arun.docoutline.model.ExtractedSection;
import im.arun.docoutline.model.HeadingLevel;
import im.arun.docoutline.model.OutlineItem;
import im.arun.docoutline.model.RankedSection;
import im.arun.docoutline.model.SubsectionAnalysis;
import im.arun.docoutline.ranking.SemanticRanker;
import im.arun.docoutline.util.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persona-driven section selection over a document collection: outline every document, rank
 * all headings against the persona and task, then extract the body of the top sections.
 */
public class CollectionService {
    private static final Logger logger = LoggerFactory.getLogger(CollectionService.class);

    private final OutlineService outlineService;
    private final SemanticRanker ranker;
    private final int topSections;
    private final Clock clock;

    public CollectionService(OutlineService outlineService, SemanticRanker ranker, int topSections) {
        this(outlineService, ranker, topSections, Clock.systemUTC());
    }

    public CollectionService(OutlineService outlineService, SemanticRanker ranker, int topSections, Clock clock) {
        this.outlineService = outlineService;
        this.ranker = ranker;
        this.topSections = topSections;
        this.clock = clock;
    }

    public CollectionResult process(CollectionJob job, Path inputDir) {
        Map<String, List<OutlineItem>> outlines = new LinkedHashMap<>();
        List<DocumentHeading> headings = new ArrayList<>();

        for (String document : job.getDocuments()) {
            Path pdfPath = inputDir.resolve(document);
            if (!Files.exists(pdfPath)) {
                logger.warn("Document {} not found, skipping", document);
                continue;
            }
            DocumentOutline outline;
            try {
                outline = outlineService.extractOutline(pdfPath);
            } catch (IOException | RuntimeException e) {
                logger.warn("Could not read {}, skipping: {}", document, e.getMessage());
                continue;
            }

            List<OutlineItem> items = outline.getOutline();
            if (items.isEmpty()) {
                items = List.of(overviewHeading(pdfPath));
                logger.info("{} has no headings, using '{}'", document, items.get(0).getText());
            }
            outlines.put(document, items);
            for (OutlineItem item : items) {
                headings.add(new DocumentHeading(document, item));
            }
        }

        List<RankedSection> ranked = ranker.rank(job.getPersona(), job.getJobToBeDone(), headings);
        if (ranked.isEmpty() && !headings.isEmpty()) {
            logger.warn("No ranking available for {} headings", headings.size());
        }

        List<ExtractedSection> sections = new ArrayList<>();
        List<SubsectionAnalysis> analyses = new ArrayList<>();
        int limit = Math.min(topSections, ranked.size());
        for (int i = 0; i < limit; i++) {
            RankedSection section = ranked.get(i);
            OutlineItem heading = section.getHeading();
            logger.info("Extracting content for '{}' from {}", heading.getText(), section.getDocument());
            String refined = outlineService.extractSectionContent(
                inputDir.resolve(section.getDocument()), heading, outlines.get(section.getDocument()));

            sections.add(new ExtractedSection(section.getDocument(), heading.getText(), i + 1, heading.getPage()));
            analyses.add(new SubsectionAnalysis(section.getDocument(), refined, heading.getPage()));
        }

        CollectionMetadata metadata = new CollectionMetadata(List.copyOf(job.getDocuments()),
            job.getPersona(), job.getJobToBeDone(), OffsetDateTime.now(clock).toString());
        return new CollectionResult(metadata, sections, analyses);
    }

    static OutlineItem overviewHeading(Path pdfPath) {
        return new OutlineItem(HeadingLevel.H1, "Overview of " + JsonFiles.baseName(pdfPath), 1, 0f);
    }
}
