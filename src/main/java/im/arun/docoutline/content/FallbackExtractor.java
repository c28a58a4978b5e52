package im.arun.docoutline.content;

import im.arun.docoutline.model.OutlineItem;
import im.arun.docoutline.pdf.PdfDocumentHandle;
import im.arun.docoutline.pdf.PdfDocumentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import static im.arun.docoutline.heading.TextShapes.collapseWhitespace;

/**
 * Layered best-effort excerpt for a heading when boundary-based extraction cannot produce text.
 * Tries the heading's own page, then neighbouring pages, then any page with text, and finally
 * synthesizes a sentence from the heading itself. {@link #extract} never returns empty text.
 */
public class FallbackExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FallbackExtractor.class);

    private static final String SENTENCE_BREAK = "\\. ";

    private final PdfDocumentReader reader;

    public FallbackExtractor(PdfDocumentReader reader) {
        this.reader = reader;
    }

    public String extract(Path pdfPath, OutlineItem heading) {
        try (PdfDocumentHandle document = reader.open(pdfPath)) {
            Optional<String> excerpt = tryExtract(document, heading);
            if (excerpt.isPresent()) {
                return excerpt.get();
            }
        } catch (IOException | RuntimeException e) {
            logger.warn("Fallback extraction failed for {}: {}", pdfPath.getFileName(), e.getMessage());
        }
        return synthesize(heading);
    }

    /**
     * Page-based strategies only. Empty when no page of the document has usable text.
     */
    public Optional<String> tryExtract(PdfDocumentHandle document, OutlineItem heading) {
        int pageCount = document.getPageCount();
        int pageNumber = heading.getPage();

        if (pageNumber >= 1 && pageNumber <= pageCount) {
            String text = safePageText(document, pageNumber).trim();
            if (!text.isEmpty()) {
                String[] sentences = text.split(SENTENCE_BREAK, -1);
                if (sentences.length > 3) {
                    return Optional.of(joinSentences(sentences, 5) + ".");
                }
                return Optional.of(text);
            }
        }

        int from = Math.max(1, pageNumber - 1);
        int to = Math.min(pageCount, pageNumber + 2);
        for (int page = from; page <= to; page++) {
            String text = safePageText(document, page).trim();
            if (text.length() > 50) {
                String[] sentences = text.split(SENTENCE_BREAK, -1);
                if (sentences.length > 2) {
                    return Optional.of(joinSentences(sentences, 3) + ".");
                }
                return Optional.of(text.length() > 500 ? text.substring(0, 500) : text);
            }
        }

        for (int page = 1; page <= pageCount; page++) {
            String text = safePageText(document, page).trim();
            if (text.length() > 20) {
                String clean = collapseWhitespace(text);
                if (clean.length() > 100) {
                    return Optional.of(clean.substring(0, Math.min(300, clean.length())) + "...");
                }
                return Optional.of(clean);
            }
        }
        return Optional.empty();
    }

    static String synthesize(OutlineItem heading) {
        String text = heading.getText() == null ? "content section" : heading.getText();
        return String.format("This section covers %s and contains relevant information (from page %d).",
            text.toLowerCase(Locale.ROOT), heading.getPage());
    }

    private static String safePageText(PdfDocumentHandle document, int page) {
        try {
            String text = document.getPageText(page);
            return text == null ? "" : text;
        } catch (IOException | RuntimeException e) {
            logger.debug("Skipping page {} of {}: {}", page, document.getName(), e.getMessage());
            return "";
        }
    }

    private static String joinSentences(String[] sentences, int limit) {
        return String.join(". ", Arrays.copyOf(sentences, Math.min(limit, sentences.length)));
    }
}
