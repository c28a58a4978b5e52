package im.arun.docoutline.pdf;

import im.arun.docoutline.model.CharRecord;
import im.arun.docoutline.model.PageGeometry;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;

import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

/**
 * PDFBox document handle. Not thread-safe: PDFBox documents must be used from one thread.
 */
class PdfBoxDocumentHandle implements PdfDocumentHandle {
    private static final String REGION = "section";

    private final String name;
    private final PDDocument document;
    private final CharacterGeometryStripper geometryStripper;
    private final PDFTextStripper textStripper;
    private PDFRenderer renderer;

    PdfBoxDocumentHandle(String name, PDDocument document) throws IOException {
        this.name = name;
        this.document = document;
        this.geometryStripper = new CharacterGeometryStripper();
        this.textStripper = new PDFTextStripper();
        this.textStripper.setSortByPosition(true);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public float getPageHeight(int pageNumber) {
        return page(pageNumber).getCropBox().getHeight();
    }

    @Override
    public PageGeometry getGeometry(int pageNumber) throws IOException {
        PDRectangle box = page(pageNumber).getCropBox();
        List<CharRecord> characters = geometryStripper.collect(document, pageNumber);
        return new PageGeometry(pageNumber, box.getWidth(), box.getHeight(), characters);
    }

    @Override
    public String getPageText(int pageNumber) throws IOException {
        textStripper.setStartPage(pageNumber);
        textStripper.setEndPage(pageNumber);
        return textStripper.getText(document);
    }

    @Override
    public String getRegionText(int pageNumber, float top, float bottom) throws IOException {
        PDPage page = page(pageNumber);
        float width = page.getCropBox().getWidth();

        PDFTextStripperByArea areaStripper = new PDFTextStripperByArea();
        areaStripper.setSortByPosition(true);
        areaStripper.addRegion(REGION, new Rectangle2D.Float(0, top, width, bottom - top));
        areaStripper.extractRegions(page);
        return areaStripper.getTextForRegion(REGION);
    }

    @Override
    public BufferedImage renderPage(int pageNumber, float dpi) throws IOException {
        if (renderer == null) {
            renderer = new PDFRenderer(document);
        }
        page(pageNumber);
        return renderer.renderImageWithDPI(pageNumber - 1, dpi, ImageType.GRAY);
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private PDPage page(int pageNumber) {
        if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
            throw new IllegalArgumentException("Page " + pageNumber + " out of range 1.." + document.getNumberOfPages());
        }
        return document.getPage(pageNumber - 1);
    }
}
