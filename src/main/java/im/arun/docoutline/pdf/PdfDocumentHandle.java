package im.arun.docoutline.pdf;

import im.arun.docoutline.model.PageGeometry;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * An open PDF document. Page numbers are 1-indexed; vertical coordinates are
 * measured from the top of the page.
 */
public interface PdfDocumentHandle extends AutoCloseable {

    String getName();

    int getPageCount();

    float getPageHeight(int pageNumber);

    /**
     * Character geometry and dimensions of a page. Image-only pages return no characters.
     */
    PageGeometry getGeometry(int pageNumber) throws IOException;

    /**
     * Plain text of the whole page in reading order.
     */
    String getPageText(int pageNumber) throws IOException;

    /**
     * Text of the horizontal band of a page between {@code top} (inclusive) and
     * {@code bottom} (exclusive).
     */
    String getRegionText(int pageNumber, float top, float bottom) throws IOException;

    BufferedImage renderPage(int pageNumber, float dpi) throws IOException;

    @Override
    void close() throws IOException;
}
