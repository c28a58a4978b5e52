package im.arun.docoutline.service;

import im.arun.docoutline.config.OutlineConfig;
import im.arun.docoutline.model.DocumentOutline;
import im.arun.docoutline.model.HeadingLevel;
import im.arun.docoutline.model.OcrToken;
import im.arun.docoutline.model.OutlineItem;
import im.arun.docoutline.ocr.LanguageDetector;
import im.arun.docoutline.ocr.OcrEngine;
import im.arun.docoutline.ocr.OcrFallback;
import im.arun.docoutline.pdf.FakeDocument;
import im.arun.docoutline.pdf.FakeDocumentReader;
import im.arun.docoutline.pdf.PdfBoxDocumentReader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/** Unit tests for {@link OutlineService}. */
class OutlineServiceTest {

    private static final String BODY_ONE =
        "The committee reviewed every submission received during the consultation period.";
    private static final String BODY_TWO =
        "Responses were grouped by theme and summarized for the steering group in March.";
    private static final String BUDGET_BODY =
        "Funding requests were reconciled against the approved budget ceiling for the year.";

    private OutlineConfig config;
    private OcrEngine ocrEngine;
    private LanguageDetector languageDetector;

    @BeforeEach
    void setUp() {
        config = new OutlineConfig();
        ocrEngine = mock(OcrEngine.class);
        languageDetector = mock(LanguageDetector.class);
        when(languageDetector.detect(anyString())).thenReturn(Optional.empty());
    }

    @Test
    @DisplayName("A large numbered line above body text becomes the only H1")
    void shouldExtractNumberedHeading() throws IOException {
        OutlineService service = serviceFor(new FakeDocument("report.pdf").page(reportPage()));

        DocumentOutline outline = service.extractOutline(Path.of("report.pdf"));

        assertThat(outline.getOutline()).containsExactly(new OutlineItem(HeadingLevel.H1, "1. Introduction", 1, 90f));
        assertThat(outline.getTitle()).isNotBlank();
    }

    @Test
    @DisplayName("Outlining the same document twice gives the same result")
    void shouldBeIdempotent() throws IOException {
        OutlineService service = serviceFor(new FakeDocument("report.pdf").page(reportPage()).page(reportPage()));

        DocumentOutline first = service.extractOutline(Path.of("report.pdf"));
        DocumentOutline second = service.extractOutline(Path.of("report.pdf"));

        assertThat(second).isEqualTo(first);
        // the heading repeats on page 2 and is suppressed there
        assertThat(first.getOutline()).hasSize(1);
    }

    @Test
    @DisplayName("A scanned page with only faint OCR words yields an empty untitled outline")
    void shouldReturnEmptyOutline_forFaintScan() throws Exception {
        when(ocrEngine.recognizeText(any(BufferedImage.class), anyString())).thenReturn("");
        when(ocrEngine.recognizeTokens(any(BufferedImage.class), anyString())).thenReturn(List.of(
            new OcrToken("Introduction", 21f, 100, 30),
            new OcrToken("Budget", 12f, 400, 30)));
        OutlineService service = serviceFor(new FakeDocument("scan.pdf")
            .page(new FakeDocument.Page().text(100f, "Introduction")));

        DocumentOutline outline = service.extractOutline(Path.of("scan.pdf"));

        assertThat(outline.getOutline()).isEmpty();
        assertThat(outline.getTitle()).isEqualTo(DocumentOutline.UNTITLED);
    }

    @Test
    @DisplayName("A document that cannot be opened is an I/O error")
    void shouldFail_whenDocumentUnreadable() {
        OutlineService service = serviceFor(new FakeDocument("report.pdf").page(reportPage()));

        assertThatThrownBy(() -> service.extractOutline(Path.of("corrupt.pdf")))
            .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("An enabled trace leaves a decision file behind")
    void shouldWriteTrace_whenEnabled(@TempDir Path dir) throws IOException {
        config.getTrace().setEnabled(true);
        config.getTrace().setDirectory(dir.toString());
        OutlineService service = serviceFor(new FakeDocument("report.pdf").page(reportPage()));

        service.extractOutline(Path.of("report.pdf"));

        try (Stream<Path> files = Files.list(dir)) {
            List<String> names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
            assertThat(names).singleElement().asString().startsWith("report_").endsWith("_trace.json");
        }
    }

    @Test
    @DisplayName("A real PDF goes through PDFBox geometry to the same outline")
    void shouldOutlineGeneratedPdf(@TempDir Path dir) throws IOException {
        Path pdf = dir.resolve("generated.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                writeLine(content, new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD), 18, 700, "1. Introduction");
                PDType1Font body = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
                writeLine(content, body, 11, 670, BODY_ONE);
                writeLine(content, body, 11, 655, BODY_TWO);
            }
            document.save(pdf.toFile());
        }
        config.getOcr().setEnabled(false);
        OutlineService service = new OutlineService(config, new PdfBoxDocumentReader());

        DocumentOutline outline = service.extractOutline(pdf);

        assertThat(outline.getOutline()).extracting(OutlineItem::getLevel, OutlineItem::getText, OutlineItem::getPage)
            .containsExactly(tuple(HeadingLevel.H1, "1. Introduction", 1));
        String content = service.extractSectionContent(pdf, outline.getOutline().get(0), outline.getOutline());
        assertThat(content).contains("committee reviewed");
    }

    @Test
    @DisplayName("Sections of a real PDF split exactly at headings drawn on fractional baselines")
    void shouldSplitSections_whenHeadingsSitOnFractionalBaselines(@TempDir Path dir) throws IOException {
        Path pdf = dir.resolve("fractional.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
                PDType1Font body = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
                writeLine(content, bold, 18, 700.4f, "1. Introduction");
                writeLine(content, body, 11, 670, BODY_ONE);
                writeLine(content, body, 11, 655, BODY_TWO);
                writeLine(content, bold, 18, 500.4f, "2. Budget Plan");
                writeLine(content, body, 11, 470, BUDGET_BODY);
            }
            document.save(pdf.toFile());
        }
        config.getOcr().setEnabled(false);
        OutlineService service = new OutlineService(config, new PdfBoxDocumentReader());

        List<OutlineItem> headings = service.extractOutline(pdf).getOutline();

        assertThat(headings).extracting(OutlineItem::getText).containsExactly("1. Introduction", "2. Budget Plan");
        String introduction = service.extractSectionContent(pdf, headings.get(0), headings);
        assertThat(introduction).startsWith("1. Introduction").contains("committee reviewed")
            .doesNotContain("Budget Plan");
        String budget = service.extractSectionContent(pdf, headings.get(1), headings);
        assertThat(budget).startsWith("2. Budget Plan").contains("Funding requests");
    }

    private OutlineService serviceFor(FakeDocument document) {
        OcrFallback ocr = new OcrFallback(config.getOcr(), ocrEngine, languageDetector);
        return new OutlineService(config, new FakeDocumentReader().with(document), ocr);
    }

    private static FakeDocument.Page reportPage() {
        return new FakeDocument.Page()
            .styled(90f, "1. Introduction", 18f, "Helvetica-Bold")
            .styled(130f, BODY_ONE, 11f, "Helvetica")
            .styled(150f, BODY_TWO, 11f, "Helvetica");
    }

    private static void writeLine(PDPageContentStream content, PDType1Font font, float size, float y, String text)
        throws IOException {
        content.beginText();
        content.setFont(font, size);
        content.newLineAtOffset(72, y);
        content.showText(text);
        content.endText();
    }
}
