/*
 * PDF-Auto-Redact - PDF Structure Analysis and Redaction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autoredact.document;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.io.image.ImageDataFactory;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import net.boyechko.pdf.autoredact.PdfTestBase;
import org.junit.jupiter.api.Test;

public class ITextDocumentEngineTest extends PdfTestBase {
    private static final double TOLERANCE = 0.5;

    private final DocumentEngine engine = new ITextDocumentEngine();

    // ── Fixtures ───────────────────────────────────────────────────

    private Path createParagraphPdf() throws Exception {
        return createCanvasPdf(
                testOutputPath("paragraphs.pdf"),
                1,
                (canvas, regular, bold, i) -> {
                    drawText(canvas, bold, 14, 72, 720, "Introduction");
                    drawText(canvas, regular, 12, 72, 600, "First line of the paragraph");
                    drawText(canvas, regular, 12, 72, 586, "second line of the paragraph");
                });
    }

    private Path createImagePdf() throws Exception {
        byte[] png = pngBytes(200, 150);
        return createCanvasPdf(
                testOutputPath("image.pdf"),
                1,
                (canvas, regular, bold, i) -> {
                    drawText(canvas, regular, 12, 72, 700, "A figure follows");
                    canvas.addImageFittedIntoRectangle(
                            ImageDataFactory.create(png), new Rectangle(100, 400, 200, 150), false);
                });
    }

    private Path createSecretPdf() throws Exception {
        return createCanvasPdf(
                testOutputPath("secret.pdf"),
                1,
                (canvas, regular, bold, i) -> {
                    drawText(canvas, regular, 12, 72, 700, "TOP SECRET");
                    drawText(canvas, regular, 12, 72, 500, "Public text");
                });
    }

    private static String textOf(LayoutBlock block) {
        List<String> parts = new ArrayList<>();
        for (TextLine line : block.lines()) {
            for (TextSpan span : line.spans()) {
                parts.add(span.text());
            }
        }
        return String.join(" ", parts);
    }

    // ── Reading ────────────────────────────────────────────────────

    @Test
    void reportsPageCountAndDimensions() throws Exception {
        Path pdf = createNumberedPdf(testOutputPath("numbered.pdf"), 3);
        try (EngineDocument doc = engine.open(pdf)) {
            assertEquals(3, doc.pageCount());
            PageDimensions dims = doc.pageDimensions(0);
            assertEquals(612, dims.width(), TOLERANCE);
            assertEquals(792, dims.height(), TOLERANCE);
        }
    }

    @Test
    void pageOutsideDocumentIsRejected() throws Exception {
        Path pdf = createNumberedPdf(testOutputPath("numbered.pdf"), 2);
        try (EngineDocument doc = engine.open(pdf)) {
            assertThrows(IndexOutOfBoundsException.class, () -> doc.extractFragments(2));
            assertThrows(IndexOutOfBoundsException.class, () -> doc.pageDimensions(-1));
        }
    }

    @Test
    void missingFileFailsToOpen() {
        IOException e =
                assertThrows(
                        IOException.class, () -> engine.open(testOutputPath("does-not-exist.pdf")));
        assertTrue(e.getMessage().contains("does-not-exist.pdf"));
    }

    @Test
    void adjacentLinesFormOneFragment() throws Exception {
        try (EngineDocument doc = engine.open(createParagraphPdf())) {
            List<LayoutBlock> fragments = doc.extractFragments(0);

            assertEquals(2, fragments.size());
            LayoutBlock heading = fragments.get(0);
            LayoutBlock paragraph = fragments.get(1);

            assertFalse(heading.isImage());
            assertEquals("Introduction", textOf(heading).trim());
            assertEquals(2, paragraph.lines().size());
            assertTrue(textOf(paragraph).contains("First line of the paragraph"));
            assertTrue(textOf(paragraph).contains("second line of the paragraph"));
        }
    }

    @Test
    void fragmentsUseTopLeftCoordinates() throws Exception {
        try (EngineDocument doc = engine.open(createParagraphPdf())) {
            LayoutBlock heading = doc.extractFragments(0).get(0);
            Box box = heading.bbox();

            assertEquals(72, box.x0(), 1.0);
            assertTrue(box.y0() > 55 && box.y0() < 75, "heading top at " + box.y0());
            assertTrue(box.y1() > box.y0());
        }
    }

    @Test
    void spansCarryFontNameAndSize() throws Exception {
        try (EngineDocument doc = engine.open(createParagraphPdf())) {
            List<LayoutBlock> fragments = doc.extractFragments(0);
            TextSpan heading = fragments.get(0).lines().get(0).spans().get(0);
            TextSpan body = fragments.get(1).lines().get(0).spans().get(0);

            assertEquals(14, heading.size(), 0.1);
            assertTrue(heading.fontName().contains("Bold"), heading.fontName());
            assertEquals(12, body.size(), 0.1);
            assertEquals("Helvetica", body.fontName());
        }
    }

    @Test
    void spanFlagsFollowFontAndTextRise() throws Exception {
        Path pdf =
                createCanvasPdf(
                        testOutputPath("styles.pdf"),
                        1,
                        (canvas, regular, bold, i) -> {
                            PdfFont oblique =
                                    PdfFontFactory.createFont(StandardFonts.HELVETICA_OBLIQUE);
                            drawText(canvas, bold, 12, 72, 700, "Bold words");
                            drawText(canvas, oblique, 12, 72, 600, "Slanted words");
                            drawText(canvas, regular, 12, 72, 500, "Plain words");
                            canvas.beginText()
                                    .setFontAndSize(regular, 8)
                                    .setTextRise(4)
                                    .moveText(72, 400)
                                    .showText("12")
                                    .endText();
                        });

        try (EngineDocument doc = engine.open(pdf)) {
            List<TextSpan> spans = new ArrayList<>();
            for (LayoutBlock block : doc.extractFragments(0)) {
                for (TextLine line : block.lines()) {
                    spans.addAll(line.spans());
                }
            }

            assertEquals(TextSpan.BOLD, spanWithText(spans, "Bold words").flags());
            assertEquals(TextSpan.ITALIC, spanWithText(spans, "Slanted words").flags());
            assertEquals(0, spanWithText(spans, "Plain words").flags());
            assertEquals(TextSpan.SUPERSCRIPT, spanWithText(spans, "12").flags());
        }
    }

    private static TextSpan spanWithText(List<TextSpan> spans, String text) {
        return spans.stream()
                .filter(span -> span.text().trim().equals(text))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no span '" + text + "' in " + spans));
    }

    @Test
    void imageBoxesAreReported() throws Exception {
        try (EngineDocument doc = engine.open(createImagePdf())) {
            List<Box> images = doc.extractImageBoxes(0);

            assertEquals(1, images.size());
            Box box = images.get(0);
            assertEquals(100, box.x0(), TOLERANCE);
            assertEquals(242, box.y0(), TOLERANCE);
            assertEquals(300, box.x1(), TOLERANCE);
            assertEquals(392, box.y1(), TOLERANCE);

            long imageFragments =
                    doc.extractFragments(0).stream().filter(LayoutBlock::isImage).count();
            assertEquals(1, imageFragments);
        }
    }

    @Test
    void searchFindsLiteralText() throws Exception {
        try (EngineDocument doc = engine.open(createSecretPdf())) {
            List<Box> matches = doc.searchText(0, "TOP SECRET");

            assertEquals(1, matches.size());
            Box match = matches.get(0);
            assertTrue(match.intersects(Box.of(60, 75, 200, 30)), "match at " + match);
            assertTrue(doc.searchText(0, "absent").isEmpty());
            assertTrue(doc.searchText(0, "").isEmpty());
        }
    }

    @Test
    void searchTreatsPatternCharactersLiterally() throws Exception {
        Path pdf =
                createCanvasPdf(
                        testOutputPath("literal.pdf"),
                        1,
                        (canvas, regular, bold, i) ->
                                drawText(canvas, regular, 12, 72, 700, "Cost (approx.) $5"));
        try (EngineDocument doc = engine.open(pdf)) {
            assertEquals(1, doc.searchText(0, "(approx.) $5").size());
            assertTrue(doc.searchText(0, "C.st").isEmpty());
        }
    }

    // ── Modification ───────────────────────────────────────────────

    @Test
    void redactionRemovesTextInsideTheBox() throws Exception {
        Path output = testOutputPath("secret_redacted.pdf");
        try (EngineDocument doc = engine.openForModification(createSecretPdf(), output)) {
            doc.markRedaction(0, Box.of(60, 75, 200, 30));
            doc.applyRedactions(0);
        }

        String text = pageTexts(output).get(0);
        assertFalse(text.contains("SECRET"), text);
        assertTrue(text.contains("Public text"), text);
    }

    @Test
    void redactionRemovesImagesInsideTheBox() throws Exception {
        Path output = testOutputPath("image_redacted.pdf");
        try (EngineDocument doc = engine.openForModification(createImagePdf(), output)) {
            doc.markRedaction(0, Box.of(90, 230, 220, 175));
            doc.applyRedactions(0);
        }

        try (EngineDocument doc = engine.open(output)) {
            assertTrue(doc.extractImageBoxes(0).isEmpty());
        }
        assertTrue(pageTexts(output).get(0).contains("A figure follows"));
    }

    @Test
    void applyingWithoutMarksChangesNothing() throws Exception {
        Path output = testOutputPath("untouched.pdf");
        try (EngineDocument doc = engine.openForModification(createSecretPdf(), output)) {
            doc.applyRedactions(0);
        }
        assertTrue(pageTexts(output).get(0).contains("TOP SECRET"));
    }

    @Test
    void deletedPagesAreGoneFromOutput() throws Exception {
        Path input = createNumberedPdf(testOutputPath("numbered.pdf"), 5);
        Path output = testOutputPath("numbered_deleted.pdf");
        try (EngineDocument doc = engine.openForModification(input, output)) {
            doc.deletePage(3);
            doc.deletePage(1);
            assertEquals(3, doc.pageCount());
        }

        assertEquals(List.of("Page 0", "Page 2", "Page 4"), pageTexts(output));
    }

    @Test
    void layoutIsReadAgainAfterPagesChange() throws Exception {
        Path input = createNumberedPdf(testOutputPath("numbered.pdf"), 3);
        Path output = testOutputPath("numbered_relaid.pdf");
        try (EngineDocument doc = engine.openForModification(input, output)) {
            assertEquals("Page 1", textOf(doc.extractFragments(1).get(0)).trim());
            assertTrue(doc.extractImageBoxes(1).isEmpty());

            doc.deletePage(1);

            assertEquals("Page 2", textOf(doc.extractFragments(1).get(0)).trim());
        }
    }

    @Test
    void layoutIsReadAgainAfterRedaction() throws Exception {
        Path output = testOutputPath("image_relaid.pdf");
        try (EngineDocument doc = engine.openForModification(createImagePdf(), output)) {
            assertEquals(1, doc.extractImageBoxes(0).size());

            doc.markRedaction(0, Box.of(90, 230, 220, 175));
            doc.applyRedactions(0);

            assertTrue(doc.extractImageBoxes(0).isEmpty());
        }
    }

    @Test
    void documentWithoutOutlinesHasEmptyToc() throws Exception {
        Path pdf = createNumberedPdf(testOutputPath("numbered.pdf"), 2);
        try (EngineDocument doc = engine.open(pdf)) {
            assertTrue(doc.getToc().isEmpty());
        }
    }

    @Test
    void tocIsWrittenAndReadBack() throws Exception {
        Path input = createNumberedPdf(testOutputPath("numbered.pdf"), 10);
        Path output = testOutputPath("numbered_toc.pdf");
        List<TocEntry> toc =
                List.of(
                        new TocEntry(1, "Chapter 1", 1),
                        new TocEntry(2, "Section 1.1", 2),
                        new TocEntry(3, "Detail", 3),
                        new TocEntry(1, "Chapter 2", 6));
        try (EngineDocument doc = engine.openForModification(input, output)) {
            doc.setToc(toc);
        }

        try (EngineDocument doc = engine.open(output)) {
            assertEquals(toc, doc.getToc());
        }
    }

    @Test
    void settingTocReplacesExistingOutlines() throws Exception {
        Path input = createNumberedPdf(testOutputPath("numbered.pdf"), 4);
        Path first = testOutputPath("first_toc.pdf");
        Path second = testOutputPath("second_toc.pdf");
        try (EngineDocument doc = engine.openForModification(input, first)) {
            doc.setToc(List.of(new TocEntry(1, "Old", 1), new TocEntry(1, "Older", 2)));
        }
        try (EngineDocument doc = engine.openForModification(first, second)) {
            doc.setToc(List.of(new TocEntry(1, "New", 4)));
        }

        try (EngineDocument doc = engine.open(second)) {
            assertEquals(List.of(new TocEntry(1, "New", 4)), doc.getToc());
        }
    }

    @Test
    void rasterizeProducesPngAtScale() throws Exception {
        Path pdf = createNumberedPdf(testOutputPath("numbered.pdf"), 2);
        byte[] png;
        try (EngineDocument doc = engine.open(pdf)) {
            png = doc.rasterize(1, 1.0f);
        }

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertNotNull(image);
        assertEquals(612, image.getWidth(), 1);
        assertEquals(792, image.getHeight(), 1);
    }

    @Test
    void rasterizeRejectsBadArguments() throws Exception {
        Path pdf = createNumberedPdf(testOutputPath("numbered.pdf"), 1);
        try (EngineDocument doc = engine.open(pdf)) {
            assertThrows(IllegalArgumentException.class, () -> doc.rasterize(3, 1.0f));
            assertThrows(IllegalArgumentException.class, () -> doc.rasterize(0, 0f));
        }
    }
}
