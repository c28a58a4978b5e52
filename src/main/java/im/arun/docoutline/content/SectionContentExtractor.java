package im.arun.docoutline.content;

import im.arun.docoutline.model.OutlineItem;
import im.arun.docoutline.pdf.PdfDocumentHandle;
import im.arun.docoutline.pdf.PdfDocumentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static im.arun.docoutline.heading.TextShapes.collapseWhitespace;

/**
 * Extracts the body text between a heading and the next heading of the same document.
 * The first page is cropped below the heading, the last page above the next heading, and
 * interior pages are taken whole. Any miss is resolved through {@link FallbackExtractor}.
 */
public class SectionContentExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SectionContentExtractor.class);

    private final PdfDocumentReader reader;
    private final FallbackExtractor fallback;

    public SectionContentExtractor(PdfDocumentReader reader) {
        this(reader, new FallbackExtractor(reader));
    }

    public SectionContentExtractor(PdfDocumentReader reader, FallbackExtractor fallback) {
        this.reader = reader;
        this.fallback = fallback;
    }

    /**
     * @param heading  the section's heading, matched by value against {@code headings}
     * @param headings all headings of the document in reading order
     * @return non-empty section text
     */
    public String extract(Path pdfPath, OutlineItem heading, List<OutlineItem> headings) {
        int index = headings.indexOf(heading);
        if (index < 0) {
            logger.debug("Heading '{}' not in outline of {}, using fallback", heading.getText(), pdfPath.getFileName());
            return fallback.extract(pdfPath, heading);
        }
        OutlineItem next = index + 1 < headings.size() ? headings.get(index + 1) : null;

        List<String> content = new ArrayList<>();
        try (PdfDocumentHandle document = reader.open(pdfPath)) {
            int pageCount = document.getPageCount();
            int lastPage = next != null ? Math.min(next.getPage(), pageCount) : pageCount;

            for (int page = heading.getPage(); page <= lastPage; page++) {
                float height = document.getPageHeight(page);
                float top = page == heading.getPage() ? Math.max(0f, heading.getPosition()) : 0f;
                float bottom = next != null && page == next.getPage() ? Math.min(height, next.getPosition()) : height;

                if (bottom <= top) {
                    Optional<String> excerpt = fallback.tryExtract(document, heading);
                    if (excerpt.isPresent()) {
                        return excerpt.get();
                    }
                    continue;
                }

                String text = pageText(document, page, top, bottom, height);
                if (text != null && !text.isBlank()) {
                    content.add(text.trim());
                }
            }
        } catch (IOException | RuntimeException e) {
            logger.warn("Section extraction failed for '{}' in {}: {}", heading.getText(), pdfPath.getFileName(), e.getMessage());
            return fallback.extract(pdfPath, heading);
        }

        String joined = collapseWhitespace(String.join(" ", content));
        if (joined.isEmpty()) {
            return fallback.extract(pdfPath, heading);
        }
        return joined;
    }

    private static String pageText(PdfDocumentHandle document, int page, float top, float bottom, float height) {
        try {
            if (top > 0 || bottom < height) {
                return document.getRegionText(page, top, bottom);
            }
            return document.getPageText(page);
        } catch (IOException | RuntimeException e) {
            logger.debug("Crop failed on page {} of {}, using full page: {}", page, document.getName(), e.getMessage());
            try {
                return document.getPageText(page);
            } catch (IOException | RuntimeException inner) {
                logger.debug("Page {} of {} unreadable: {}", page, document.getName(), inner.getMessage());
                return null;
            }
        }
    }
}
