package im.arun.docoutline.pdf;

import im.arun.docoutline.model.CharRecord;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects one {@link CharRecord} per rendered glyph instead of producing text.
 */
class CharacterGeometryStripper extends PDFTextStripper {
    private final List<CharRecord> characters = new ArrayList<>();

    CharacterGeometryStripper() throws IOException {
        super();
    }

    List<CharRecord> collect(PDDocument document, int pageNumber) throws IOException {
        characters.clear();
        setStartPage(pageNumber);
        setEndPage(pageNumber);
        getText(document);
        return new ArrayList<>(characters);
    }

    @Override
    protected void processTextPosition(TextPosition text) {
        String unicode = text.getUnicode();
        if (unicode == null || unicode.isEmpty()) {
            return;
        }
        String fontName = text.getFont() != null ? text.getFont().getName() : "";
        characters.add(new CharRecord(
            unicode,
            text.getXDirAdj(),
            text.getYDirAdj(),
            text.getWidthDirAdj(),
            text.getFontSizeInPt(),
            fontName != null ? fontName : ""));
    }
}
