package im.arun.docoutline.content;

import im.arun.docoutline.model.HeadingLevel;
import im.arun.docoutline.model.OutlineItem;
import im.arun.docoutline.pdf.FakeDocument;
import im.arun.docoutline.pdf.FakeDocumentReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link SectionContentExtractor}. */
class SectionContentExtractorTest {

    private static final Path REPORT = Path.of("input", "report.pdf");

    private final OutlineItem introduction = new OutlineItem(HeadingLevel.H1, "Introduction", 1, 100f);
    private final OutlineItem budget = new OutlineItem(HeadingLevel.H1, "Budget", 3, 300f);
    private final OutlineItem appendix = new OutlineItem(HeadingLevel.H2, "Appendix", 5, 200f);
    private final List<OutlineItem> headings = List.of(introduction, budget, appendix);

    private FakeDocument report;
    private FakeDocumentReader reader;
    private SectionContentExtractor extractor;

    @BeforeEach
    void setUp() {
        report = new FakeDocument("report.pdf")
            .page(new FakeDocument.Page()
                .text(40f, "Quarterly Report")
                .text(100f, "Introduction")
                .text(150f, "Intro body line one.")
                .text(200f, "Intro body line two."))
            .page(new FakeDocument.Page().text(100f, "Page two body."))
            .page(new FakeDocument.Page()
                .text(50f, "Tail of intro section.")
                .text(300f, "Budget")
                .text(350f, "Budget body."))
            .page(new FakeDocument.Page().text(100f, "Page four budget text."))
            .page(new FakeDocument.Page()
                .text(200f, "Appendix")
                .text(250f, "Appendix body."));
        reader = new FakeDocumentReader().with(report);
        extractor = new SectionContentExtractor(reader);
    }

    @Test
    @DisplayName("A section runs from its heading to the next heading across pages")
    void shouldSliceBetweenHeadings() {
        assertThat(extractor.extract(REPORT, introduction, headings)).isEqualTo(
            "Introduction Intro body line one. Intro body line two. Page two body. Tail of intro section.");
        assertThat(extractor.extract(REPORT, budget, headings)).isEqualTo(
            "Budget Budget body. Page four budget text.");
    }

    @Test
    @DisplayName("The last section runs to the end of the document")
    void shouldRunLastSectionToDocumentEnd() {
        assertThat(extractor.extract(REPORT, appendix, headings)).isEqualTo("Appendix Appendix body.");
        assertThat(report.isClosed()).isTrue();
    }

    @Test
    @DisplayName("A heading missing from the outline is served by the fallback")
    void shouldUseFallback_whenHeadingNotInOutline() {
        OutlineItem stray = new OutlineItem(HeadingLevel.H2, "Stray", 2, 10f);

        assertThat(extractor.extract(REPORT, stray, headings)).isEqualTo("Page two body.");
    }

    @Test
    @DisplayName("A next heading at the very top of the following page triggers the page fallback")
    void shouldUseFallback_whenRegionIsDegenerate() {
        FakeDocument notes = new FakeDocument("notes.pdf")
            .page(new FakeDocument.Page()
                .text(50f, "Running header.")
                .text(120f, "Scope")
                .text(160f, "Scope details here."))
            .page(new FakeDocument.Page().text(0f, "Schedule"));
        OutlineItem scope = new OutlineItem(HeadingLevel.H2, "Scope", 1, 120f);
        OutlineItem schedule = new OutlineItem(HeadingLevel.H2, "Schedule", 2, 0f);
        SectionContentExtractor notesExtractor = new SectionContentExtractor(new FakeDocumentReader().with(notes));

        String content = notesExtractor.extract(Path.of("notes.pdf"), scope, List.of(scope, schedule));

        assertThat(content).startsWith("Running header.").contains("Scope details here.");
    }

    @Test
    @DisplayName("An unreadable document still yields a synthesized excerpt")
    void shouldSynthesize_whenDocumentCannotBeOpened() {
        String content = extractor.extract(Path.of("missing.pdf"), budget, headings);

        assertThat(content).isEqualTo("This section covers budget and contains relevant information (from page 3).");
    }

    @Test
    @DisplayName("Sections of a document without text are never empty")
    void shouldNeverReturnEmpty_forBlankDocument() {
        FakeDocument blank = new FakeDocument("blank.pdf")
            .page(new FakeDocument.Page())
            .page(new FakeDocument.Page());
        OutlineItem first = new OutlineItem(HeadingLevel.H1, "Overview", 1, 50f);
        SectionContentExtractor blankExtractor = new SectionContentExtractor(new FakeDocumentReader().with(blank));

        String content = blankExtractor.extract(Path.of("blank.pdf"), first, List.of(first));

        assertThat(content).isNotBlank()
            .isEqualTo("This section covers overview and contains relevant information (from page 1).");
    }
}
