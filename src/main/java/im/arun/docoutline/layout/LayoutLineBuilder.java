package im.arun.docoutline.layout;

import im.arun.docoutline.model.CharRecord;
import im.arun.docoutline.model.PageGeometry;
import im.arun.docoutline.model.TextLine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups the glyphs of a page into visual lines.
 *
 * <p>Glyphs whose vertical coordinate rounds to the same value form one line; a line's
 * glyphs are joined left to right. Lines come out top of page first. A line's position is
 * the highest raw baseline among its glyphs, so a crop starting there keeps the whole line
 * and a crop ending there drops it. Glyphs on slightly
 * different baselines end up on separate lines, which occasionally splits a visual line.
 */
public class LayoutLineBuilder {

    /** Horizontal gap, as a fraction of the font size, that reads as a word break. */
    static final float WORD_GAP_RATIO = 0.25f;

    public List<TextLine> buildLines(PageGeometry geometry) {
        List<TextLine> lines = new ArrayList<>();
        if (!geometry.hasCharacters()) {
            return lines;
        }

        Map<Integer, List<CharRecord>> rows = new TreeMap<>();
        for (CharRecord ch : geometry.getCharacters()) {
            rows.computeIfAbsent(Math.round(ch.getY0()), y -> new ArrayList<>()).add(ch);
        }

        for (Map.Entry<Integer, List<CharRecord>> row : rows.entrySet()) {
            List<CharRecord> chars = row.getValue();
            chars.sort(Comparator.comparingDouble(CharRecord::getX0));

            String text = joinGlyphs(chars).trim();
            if (text.isEmpty()) {
                continue;
            }

            float sizeSum = 0f;
            float maxSize = 0f;
            float leftMargin = Float.MAX_VALUE;
            float baseline = Float.MAX_VALUE;
            boolean bold = false;
            for (CharRecord ch : chars) {
                baseline = Math.min(baseline, ch.getY0());
                sizeSum += ch.getSize();
                maxSize = Math.max(maxSize, ch.getSize());
                leftMargin = Math.min(leftMargin, ch.getX0());
                if (ch.getFontName() != null && ch.getFontName().toLowerCase(Locale.ROOT).contains("bold")) {
                    bold = true;
                }
            }

            lines.add(new TextLine(
                text,
                sizeSum / chars.size(),
                maxSize,
                leftMargin,
                bold,
                baseline,
                geometry.getPageNumber()));
        }
        return lines;
    }

    private String joinGlyphs(List<CharRecord> chars) {
        StringBuilder text = new StringBuilder();
        CharRecord previous = null;
        for (CharRecord ch : chars) {
            if (previous != null && needsSpace(previous, ch, text)) {
                text.append(' ');
            }
            text.append(ch.getText());
            previous = ch;
        }
        return text.toString();
    }

    private boolean needsSpace(CharRecord previous, CharRecord current, StringBuilder text) {
        if (text.length() == 0 || Character.isWhitespace(text.charAt(text.length() - 1))) {
            return false;
        }
        if (current.getText().isBlank()) {
            return false;
        }
        float gap = current.getX0() - (previous.getX0() + previous.getWidth());
        return gap > WORD_GAP_RATIO * Math.max(current.getSize(), 1f);
    }
}
