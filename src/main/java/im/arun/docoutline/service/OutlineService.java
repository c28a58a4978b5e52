package im.arun.docoutline.service;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.content.SectionContentExtractor;
import im.arun.docoutline.heading.CandidateScorer;
import im.arun.docoutline.heading.TitleExtractor;
import im.arun.docoutline.layout.LayoutLineBuilder;
import im.arun.docoutline.layout.ThresholdCalibrator;
import im.arun.docoutline.model.DocumentOutline;
import im.arun.docoutline.model.FontThresholds;
import im.arun.docoutline.model.HeadingCandidate;
import im.arun.docoutline.model.OutlineItem;
import im.arun.docoutline.model.PageGeometry;
import im.arun.docoutline.model.TextLine;
import im.arun.docoutline.ocr.OcrFallback;
import im.arun.docoutline.pdf.PdfBoxDocumentReader;
import im.arun.docoutline.pdf.PdfDocumentHandle;
import im.arun.docoutline.pdf.PdfDocumentReader;
import im.arun.docoutline.tree.HierarchyBuilder;
import im.arun.docoutline.tree.HierarchyResult;
import im.arun.docoutline.util.TraceWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outline inference pipeline for a single document: per-page line building, font calibration
 * and candidate scoring (or OCR for scanned pages), then one sequential hierarchy pass over
 * the whole document. Also exposes section content extraction against a computed outline.
 *
 * <p>Instances hold no per-document state and may be shared across threads.
 */
public class OutlineService {
    private static final Logger logger = LoggerFactory.getLogger(OutlineService.class);

    private final OutlineConfig config;
    private final PdfDocumentReader reader;
    private final LayoutLineBuilder lineBuilder;
    private final ThresholdCalibrator calibrator;
    private final CandidateScorer scorer;
    private final OcrFallback ocrFallback;
    private final HierarchyBuilder hierarchyBuilder;
    private final TitleExtractor titleExtractor;
    private final SectionContentExtractor contentExtractor;

    public OutlineService(OutlineConfig config) {
        this(config, new PdfBoxDocumentReader());
    }

    public OutlineService(OutlineConfig config, PdfDocumentReader reader) {
        this(config, reader, new OcrFallback(config.getOcr()));
    }

    public OutlineService(OutlineConfig config, PdfDocumentReader reader, OcrFallback ocrFallback) {
        this.config = config;
        this.reader = reader;
        this.lineBuilder = new LayoutLineBuilder();
        this.calibrator = new ThresholdCalibrator(config.getCalibration());
        this.scorer = new CandidateScorer(config.getScoring());
        this.ocrFallback = ocrFallback;
        this.hierarchyBuilder = new HierarchyBuilder(config.getHierarchy());
        this.titleExtractor = new TitleExtractor(config.getTitle());
        this.contentExtractor = new SectionContentExtractor(reader);
    }

    /**
     * @throws IOException if the document cannot be opened at all; page-level failures only
     *                     drop that page's candidates
     */
    public DocumentOutline extractOutline(Path pdfPath) throws IOException {
        TraceWriter trace = new TraceWriter(pdfPath, config.getTrace());
        try (PdfDocumentHandle document = reader.open(pdfPath)) {
            int pageCount = document.getPageCount();
            logger.info("Extracting outline from {} ({} pages)", document.getName(), pageCount);

            List<HeadingCandidate> candidates = new ArrayList<>();
            boolean firstPageHasText = false;
            for (int page = 1; page <= pageCount; page++) {
                Optional<PageGeometry> geometry = geometry(document, page);
                if (geometry.isEmpty()) {
                    continue;
                }
                if (page == 1) {
                    firstPageHasText = geometry.get().hasCharacters();
                }
                candidates.addAll(candidatesFor(document, geometry.get(), trace));
            }

            String title = firstPageHasText ? extractTitle(document) : DocumentOutline.UNTITLED;
            HierarchyResult hierarchy = hierarchyBuilder.build(candidates);
            trace.record("title", title);
            trace.record("hierarchy", hierarchy.getDecisions());

            logger.info("{}: {} candidates, {} outline items", document.getName(),
                candidates.size(), hierarchy.getItems().size());
            return new DocumentOutline(title, hierarchy.getItems());
        } finally {
            trace.flush();
        }
    }

    /**
     * Body text of the section opened by {@code heading}; never empty.
     */
    public String extractSectionContent(Path pdfPath, OutlineItem heading, List<OutlineItem> headings) {
        return contentExtractor.extract(pdfPath, heading, headings);
    }

    private List<HeadingCandidate> candidatesFor(PdfDocumentHandle document, PageGeometry geometry, TraceWriter trace) {
        int page = geometry.getPageNumber();
        if (!geometry.hasCharacters()) {
            logger.debug("Page {} of {} has no text layer, using OCR", page, document.getName());
            List<HeadingCandidate> ocrCandidates = ocrFallback.candidatesFor(document, page);
            trace.record("ocr", page, ocrCandidates);
            return ocrCandidates;
        }

        List<TextLine> lines = lineBuilder.buildLines(geometry);
        Optional<FontThresholds> thresholds = calibrator.calibrate(lines);
        if (thresholds.isEmpty()) {
            return Collections.emptyList();
        }
        List<HeadingCandidate> pageCandidates = scorer.score(lines, thresholds.get());

        Map<String, Object> pageTrace = new LinkedHashMap<>();
        pageTrace.put("thresholds", thresholds.get());
        pageTrace.put("lines", lines.size());
        pageTrace.put("candidates", pageCandidates);
        trace.record("page", page, pageTrace);
        return pageCandidates;
    }

    private Optional<PageGeometry> geometry(PdfDocumentHandle document, int page) {
        try {
            return Optional.of(document.getGeometry(page));
        } catch (IOException | RuntimeException e) {
            logger.warn("Skipping page {} of {}: {}", page, document.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private String extractTitle(PdfDocumentHandle document) {
        try {
            return titleExtractor.extract(document.getPageText(1));
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not read first page of {} for title: {}", document.getName(), e.getMessage());
            return DocumentOutline.UNTITLED;
        }
    }
}
