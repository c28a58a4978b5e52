package im.arun.docoutline.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * {@link PdfDocumentReader} backed by Apache PDFBox.
 */
public class PdfBoxDocumentReader implements PdfDocumentReader {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoxDocumentReader.class);

    @Override
    public PdfDocumentHandle open(Path pdfPath) throws IOException {
        PDDocument document = Loader.loadPDF(pdfPath.toFile());
        logger.debug("Opened {} ({} pages)", pdfPath.getFileName(), document.getNumberOfPages());
        try {
            return new PdfBoxDocumentHandle(pdfPath.getFileName().toString(), document);
        } catch (IOException e) {
            document.close();
            throw e;
        }
    }
}
