package com.equipinspect.app.modules.report.infrastructure.pdf;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

/**
 * Top-to-bottom text layout on A4 pages. Keeps a cursor on the current page and opens a new
 * page when the next block does not fit.
 */
public class PdfPageWriter implements Closeable {

    private static final float MARGIN = 50f;
    private static final float LABEL_WIDTH = 140f;

    private static final PDFont REGULAR = PDType1Font.HELVETICA;
    private static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;

    private final PDDocument document;
    private PDPageContentStream content;
    private float cursorY;

    public PdfPageWriter(PDDocument document) {
        this.document = document;
    }

    public void startPage() throws IOException {
        closeContent();
        PDPage page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        content = new PDPageContentStream(document, page);
        cursorY = page.getMediaBox().getHeight() - MARGIN;
    }

    public void title(String text) throws IOException {
        writeLine(BOLD, 16f, MARGIN, text, 24f);
    }

    public void heading(String text) throws IOException {
        gap(6f);
        writeLine(BOLD, 12f, MARGIN, text, 18f);
    }

    public void text(String text) throws IOException {
        writeLine(REGULAR, 10f, MARGIN, text, 14f);
    }

    public void small(String text) throws IOException {
        writeLine(REGULAR, 8f, MARGIN, text, 12f);
    }

    /**
     * Wrapped paragraph; line breaks in the text start new lines.
     */
    public void paragraph(String text) throws IOException {
        for (String line : wrap(REGULAR, 10f, text, contentWidth())) {
            text(line);
        }
    }

    /**
     * Label and value on one row; a value wider than its column continues on following lines.
     */
    public void field(String label, String value) throws IOException {
        List<String> lines = wrap(REGULAR, 10f, value == null ? "-" : value, contentWidth() - LABEL_WIDTH);
        for (int i = 0; i < lines.size(); i++) {
            ensureSpace(14f);
            float baseline = cursorY - 10f;
            if (i == 0) {
                showText(BOLD, 10f, MARGIN, baseline, fit(BOLD, 10f, label, LABEL_WIDTH - 4f));
            }
            showText(REGULAR, 10f, MARGIN + LABEL_WIDTH, baseline, lines.get(i));
            cursorY -= 14f;
        }
    }

    /**
     * One table row; {@code widths} are the column widths in points.
     */
    public void row(List<String> cells, float[] widths, boolean header) throws IOException {
        ensureSpace(14f);
        PDFont font = header ? BOLD : REGULAR;
        float baseline = cursorY - 10f;
        float x = MARGIN;
        for (int i = 0; i < cells.size() && i < widths.length; i++) {
            showText(font, 9f, x, baseline, fit(font, 9f, cells.get(i), widths[i] - 4f));
            x += widths[i];
        }
        cursorY -= 14f;
    }

    /**
     * Draws the image scaled down to fit the box, keeping its aspect ratio.
     */
    public void image(PDImageXObject image, float maxWidth, float maxHeight) throws IOException {
        float scale = Math.min(1f, Math.min(maxWidth / image.getWidth(), maxHeight / image.getHeight()));
        float width = image.getWidth() * scale;
        float height = image.getHeight() * scale;
        ensureSpace(height + 6f);
        content.drawImage(image, MARGIN, cursorY - height, width, height);
        cursorY -= height + 6f;
    }

    public void gap(float height) {
        cursorY -= height;
    }

    public float contentWidth() {
        return PDRectangle.A4.getWidth() - 2 * MARGIN;
    }

    @Override
    public void close() throws IOException {
        closeContent();
    }

    private void writeLine(PDFont font, float size, float x, String text, float leading) throws IOException {
        ensureSpace(leading);
        showText(font, size, x, cursorY - size, text);
        cursorY -= leading;
    }

    private void ensureSpace(float height) throws IOException {
        if (content == null || cursorY - height < MARGIN) {
            startPage();
        }
    }

    private void showText(PDFont font, float size, float x, float y, String text) throws IOException {
        content.beginText();
        content.setFont(font, size);
        content.newLineAtOffset(x, y);
        content.showText(sanitize(font, text));
        content.endText();
    }

    private void closeContent() throws IOException {
        if (content != null) {
            content.close();
            content = null;
        }
    }

    /**
     * Replaces characters the standard fonts cannot encode with '?'; control characters become spaces.
     */
    static String sanitize(PDFont font, String text) {
        if (text == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String character = Character.isISOControl(codePoint) ? " " : new String(Character.toChars(codePoint));
            try {
                font.encode(character);
                builder.append(character);
            } catch (IllegalArgumentException | IOException ex) {
                builder.append('?');
            }
        });
        return builder.toString();
    }

    /**
     * Breaks text into lines no wider than {@code width}; a word wider than a whole line is split.
     */
    static List<String> wrap(PDFont font, float size, String text, float width) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String rawLine : text.split("\\R", -1)) {
            StringBuilder current = new StringBuilder();
            for (String word : rawLine.split(" ")) {
                for (String piece : splitWord(font, size, word, width)) {
                    String candidate = current.length() == 0 ? piece : current + " " + piece;
                    if (current.length() > 0 && textWidth(font, size, candidate) > width) {
                        lines.add(current.toString());
                        current = new StringBuilder(piece);
                    } else {
                        current = new StringBuilder(candidate);
                    }
                }
            }
            lines.add(current.toString());
        }
        return lines;
    }

    private static List<String> splitWord(PDFont font, float size, String word, float width) throws IOException {
        List<String> pieces = new ArrayList<>();
        String rest = word;
        while (rest.length() > 1 && textWidth(font, size, rest) > width) {
            int end = rest.length() - 1;
            while (end > 1 && textWidth(font, size, rest.substring(0, end)) > width) {
                end--;
            }
            if (end > 1 && Character.isHighSurrogate(rest.charAt(end - 1))) {
                end--;
            }
            pieces.add(rest.substring(0, end));
            rest = rest.substring(end);
        }
        pieces.add(rest);
        return pieces;
    }

    private static String fit(PDFont font, float size, String text, float width) throws IOException {
        String value = text == null ? "-" : text;
        if (textWidth(font, size, value) <= width) {
            return value;
        }
        String shortened = value;
        while (!shortened.isEmpty() && textWidth(font, size, shortened + "...") > width) {
            shortened = shortened.substring(0, shortened.length() - 1);
        }
        return shortened + "...";
    }

    static float textWidth(PDFont font, float size, String text) throws IOException {
        return font.getStringWidth(sanitize(font, text)) / 1000f * size;
    }
}
