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
package net.boyechko.pdf.autoredact.analysis;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.autoredact.document.Box;
import net.boyechko.pdf.autoredact.document.LayoutBlock;
import net.boyechko.pdf.autoredact.document.TextLine;
import net.boyechko.pdf.autoredact.document.TextSpan;
import org.junit.jupiter.api.Test;

public class BlockExtractorTest {
    private static final double PAGE_HEIGHT = 800;

    private final BlockExtractor extractor = new BlockExtractor();

    private static TextSpan span(String text, float size, String font) {
        return new TextSpan(text, size, font, 0);
    }

    private static TextLine line(Box box, TextSpan... spans) {
        return new TextLine(box, List.of(spans));
    }

    private static LayoutBlock textBlock(Box box, TextLine... lines) {
        return LayoutBlock.text(box, List.of(lines));
    }

    private List<Block> extract(List<Box> images, List<LayoutBlock> layout) {
        return extractor.extractPage(0, PAGE_HEIGHT, images, layout);
    }

    @Test
    void spansAndLinesAreJoinedWithSpaces() {
        Box box = Box.of(72, 300, 300, 30);
        LayoutBlock fragment =
                textBlock(
                        box,
                        line(Box.of(72, 300, 300, 14), span("Hello", 10, "Times-Roman")),
                        line(Box.of(72, 316, 300, 14), span("world", 10, "Times-Roman")));

        List<Block> blocks = extract(List.of(), List.of(fragment));

        assertEquals(1, blocks.size());
        Block block = blocks.get(0);
        assertEquals("Hello world", block.text());
        assertEquals(11, block.charCount());
        assertEquals(2, block.lineCount());
        assertEquals(10.0, block.fontSize());
        assertEquals("Times-Roman", block.fontName());
        assertEquals(72, block.x());
        assertEquals(300, block.y());
        assertEquals(300, block.width());
        assertEquals(30, block.height());
        assertEquals(Region.BODY, block.region());
        assertFalse(block.isImage());
        assertFalse(block.isCategorized());
    }

    @Test
    void textBlockIdHashesPageIndexAndText() {
        Box box = Box.of(72, 300, 300, 14);
        LayoutBlock fragment = textBlock(box, line(box, span("Hello world", 10, "Helvetica")));

        Block block = extractor.extractPage(2, PAGE_HEIGHT, List.of(), List.of(fragment)).get(0);

        assertEquals("d2729c8cd4d2", block.id());
        assertEquals(2, block.page());
    }

    @Test
    void blankSpansAndBlankBlocksAreDropped() {
        Box box = Box.of(72, 300, 300, 14);
        LayoutBlock blank = textBlock(box, line(box, span("   ", 10, "Helvetica")));
        LayoutBlock mixed =
                textBlock(
                        Box.of(72, 330, 300, 14),
                        line(
                                Box.of(72, 330, 300, 14),
                                span("Text", 10, "Helvetica"),
                                span(" ", 10, "Helvetica"),
                                span("here", 10, "Helvetica")));

        List<Block> blocks = extract(List.of(), List.of(blank, mixed));

        assertEquals(1, blocks.size());
        assertEquals("Text here", blocks.get(0).text());
    }

    @Test
    void dominantFontIsDecidedByCharacters() {
        Box box = Box.of(72, 300, 300, 14);
        LayoutBlock fragment =
                textBlock(
                        box,
                        line(
                                box,
                                span("Short", 14, "Helvetica-Bold"),
                                span("a much longer run of text", 9, "Helvetica")));

        Block block = extract(List.of(), List.of(fragment)).get(0);

        assertEquals(9.0, block.fontSize());
        assertEquals("Helvetica", block.fontName());
        assertFalse(block.isBold());
    }

    @Test
    void styleNeedsMoreThanHalfTheCharacters() {
        Box box = Box.of(72, 300, 300, 14);
        LayoutBlock mostlyBold =
                textBlock(
                        box,
                        line(
                                box,
                                span("Bold heading", 12, "Helvetica-Bold"),
                                span("tail", 12, "Helvetica")));
        LayoutBlock halfItalic =
                textBlock(
                        Box.of(72, 400, 300, 14),
                        line(
                                Box.of(72, 400, 300, 14),
                                span("abcd", 10, "Times-Italic"),
                                span("efgh", 10, "Times-Roman")));

        List<Block> blocks = extract(List.of(), List.of(mostlyBold, halfItalic));

        assertTrue(blocks.get(0).isBold());
        assertFalse(blocks.get(1).isItalic());
    }

    @Test
    void styleFlagsCountAsStyle() {
        Box box = Box.of(72, 300, 20, 8);
        LayoutBlock fragment =
                textBlock(
                        box,
                        line(
                                box,
                                new TextSpan(
                                        "12", 6, "CustomFont", TextSpan.SUPERSCRIPT | TextSpan.BOLD)));

        Block block = extract(List.of(), List.of(fragment)).get(0);

        assertTrue(block.isSuperscript());
        assertTrue(block.isBold());
        assertFalse(block.isItalic());
    }

    @Test
    void obliqueFontNameCountsAsItalic() {
        Box box = Box.of(72, 300, 300, 14);
        LayoutBlock fragment =
                textBlock(box, line(box, span("slanted words", 10, "Helvetica-Oblique")));

        assertTrue(extract(List.of(), List.of(fragment)).get(0).isItalic());
    }

    @Test
    void regionIsTakenFromPosition() {
        Box top = Box.of(72, 20, 300, 12);
        Box bottom = Box.of(280, 760, 40, 12);
        List<Block> blocks =
                extract(
                        List.of(),
                        List.of(
                                textBlock(top, line(top, span("Journal of Things", 9, "Helvetica"))),
                                textBlock(bottom, line(bottom, span("17", 9, "Helvetica")))));

        assertEquals(Region.HEADER, blocks.get(0).region());
        assertEquals(Region.FOOTER, blocks.get(1).region());
    }

    @Test
    void imagesBecomeImageBlocks() {
        Block image = extract(List.of(Box.of(100, 200, 150.6, 80.2)), List.of()).get(0);

        assertTrue(image.isImage());
        assertEquals("89926b1c90f2", image.id());
        assertEquals("[Image 150x80]", image.text());
        assertEquals(0, image.charCount());
        assertEquals(0.0, image.fontSize());
        assertEquals("image", image.fontName());
        assertEquals(Region.BODY, image.region());
    }

    @Test
    void decorativeImagesAreSkipped() {
        List<Block> blocks =
                extract(
                        List.of(Box.of(10, 10, 19, 300), Box.of(10, 400, 300, 5)),
                        List.of(LayoutBlock.image(Box.of(50, 50, 10, 10))));
        assertTrue(blocks.isEmpty());
    }

    @Test
    void imageOnBothPathsIsReportedOnce() {
        Box listed = Box.of(100, 200, 150, 80);
        Box nearlySame = Box.of(100.2, 199.9, 150, 80);
        Box other = Box.of(300, 400, 60, 60);

        List<Block> blocks =
                extract(
                        List.of(listed),
                        List.of(LayoutBlock.image(nearlySame), LayoutBlock.image(other)));

        assertEquals(2, blocks.size());
        assertEquals("89926b1c90f2", blocks.get(0).id());
        assertEquals("66672de40fb6", blocks.get(1).id());
    }

    @Test
    void imagesPrecedeTextInOutput() {
        Box box = Box.of(72, 300, 300, 14);
        List<Block> blocks =
                extract(
                        List.of(Box.of(100, 200, 150, 80)),
                        List.of(textBlock(box, line(box, span("Caption", 10, "Helvetica")))));

        assertTrue(blocks.get(0).isImage());
        assertEquals("Caption", blocks.get(1).text());
    }
}
