package im.arun.docoutline.pdf;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens PDF documents for geometry and text access.
 */
public interface PdfDocumentReader {

    /**
     * Open a document. The caller owns the returned handle and must close it.
     *
     * @param pdfPath path to the PDF file
     * @return an open document handle
     * @throws IOException if the file cannot be opened or parsed at all
     */
    PdfDocumentHandle open(Path pdfPath) throws IOException;
}
