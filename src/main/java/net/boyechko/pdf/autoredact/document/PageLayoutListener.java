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

import com.itextpdf.io.font.FontNames;
import com.itextpdf.io.font.FontProgram;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.data.IEventData;
import com.itextpdf.kernel.pdf.canvas.parser.data.ImageRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects text and image render events of one page and groups them into layout blocks.
 *
 * <p>Chunks in the same font, size and style merge into spans; chunks that overlap vertically
 * and advance to the right form a line; consecutive lines separated by a small vertical gap and
 * overlapping horizontally form a block. Images become image blocks in content order.
 */
final class PageLayoutListener implements IEventListener {
    private static final double MIN_LINE_OVERLAP = 0.5;
    private static final double MAX_BLOCK_GAP = 0.5;
    private static final double BACKTRACK_TOLERANCE = 0.5;

    private final Rectangle pageBox;
    private final List<Object> events = new ArrayList<>();
    private final List<Box> imageBoxes = new ArrayList<>();

    /** One text render event in page coordinates. */
    private record Chunk(
            Box box, String text, float size, String fontName, int flags, float spaceWidth) {
        boolean sameStyle(Chunk other) {
            return fontName.equals(other.fontName)
                    && Math.abs(size - other.size) < 0.05f
                    && flags == other.flags;
        }
    }

    PageLayoutListener(Rectangle pageBox) {
        this.pageBox = pageBox;
    }

    @Override
    public void eventOccurred(IEventData data, EventType type) {
        if (type == EventType.RENDER_TEXT) {
            Chunk chunk = toChunk((TextRenderInfo) data);
            if (chunk != null) {
                events.add(chunk);
            }
        } else if (type == EventType.RENDER_IMAGE) {
            Rectangle rect = Geometry.rectFromImage((ImageRenderInfo) data);
            if (rect != null) {
                Box box = Geometry.toTopLeft(rect, pageBox);
                imageBoxes.add(box);
                events.add(box);
            }
        }
    }

    @Override
    public Set<EventType> getSupportedEvents() {
        return Set.of(EventType.RENDER_TEXT, EventType.RENDER_IMAGE);
    }

    List<Box> imageBoxes() {
        return List.copyOf(imageBoxes);
    }

    /** Groups the collected events into layout blocks, preserving content order. */
    List<LayoutBlock> layoutBlocks() {
        List<LayoutBlock> blocks = new ArrayList<>();
        List<TextLine> pendingLines = new ArrayList<>();
        LineBuilder line = null;

        for (Object event : events) {
            if (event instanceof Box imageBox) {
                if (line != null) {
                    appendLine(blocks, pendingLines, line.build());
                    line = null;
                }
                flushBlock(blocks, pendingLines);
                blocks.add(LayoutBlock.image(imageBox));
                continue;
            }
            Chunk chunk = (Chunk) event;
            if (line != null && line.accepts(chunk)) {
                line.add(chunk);
            } else {
                if (line != null) {
                    appendLine(blocks, pendingLines, line.build());
                }
                line = new LineBuilder(chunk);
            }
        }
        if (line != null) {
            appendLine(blocks, pendingLines, line.build());
        }
        flushBlock(blocks, pendingLines);
        return blocks;
    }

    private static void appendLine(
            List<LayoutBlock> blocks, List<TextLine> pending, TextLine line) {
        if (!pending.isEmpty()) {
            TextLine previous = pending.get(pending.size() - 1);
            Box blockBox = blockBox(pending);
            double gap = line.bbox().y0() - previous.bbox().y1();
            double lineHeight = Math.max(1.0, line.bbox().height());
            boolean continues =
                    gap <= MAX_BLOCK_GAP * lineHeight
                            && gap >= -MAX_BLOCK_GAP * lineHeight
                            && line.bbox().overlapsHorizontally(blockBox);
            if (!continues) {
                flushBlock(blocks, pending);
            }
        }
        pending.add(line);
    }

    private static void flushBlock(List<LayoutBlock> blocks, List<TextLine> pending) {
        if (pending.isEmpty()) {
            return;
        }
        blocks.add(LayoutBlock.text(blockBox(pending), pending));
        pending.clear();
    }

    private static Box blockBox(List<TextLine> lines) {
        Box box = null;
        for (TextLine line : lines) {
            box = Box.union(box, line.bbox());
        }
        return box;
    }

    private Chunk toChunk(TextRenderInfo info) {
        String text = info.getText();
        if (text == null || text.isEmpty()) {
            return null;
        }
        Rectangle rect = Geometry.rectFromText(info);
        if (rect == null) {
            return null;
        }
        float size = Math.round(Geometry.effectiveFontSize(info) * 100f) / 100f;
        PdfFont font = info.getFont();
        String fontName = "unknown";
        int flags = 0;
        if (font != null && font.getFontProgram() != null) {
            FontProgram program = font.getFontProgram();
            FontNames names = program.getFontNames();
            if (names != null && names.getFontName() != null) {
                fontName = names.getFontName();
            }
            flags |= styleFlags(program, names);
        }
        if (info.getRise() > 0) {
            flags |= TextSpan.SUPERSCRIPT;
        }
        return new Chunk(
                Geometry.toTopLeft(rect, pageBox),
                text,
                size,
                fontName,
                flags,
                info.getSingleSpaceWidth());
    }

    private static int styleFlags(FontProgram program, FontNames names) {
        int flags = 0;
        if (names != null && (names.isBold() || names.getFontWeight() >= 700)) {
            flags |= TextSpan.BOLD;
        }
        boolean slanted =
                program.getFontMetrics() != null && program.getFontMetrics().getItalicAngle() != 0;
        if ((names != null && names.isItalic()) || slanted) {
            flags |= TextSpan.ITALIC;
        }
        return flags;
    }

    /** Accumulates chunks of one line, merging runs of identical style into spans. */
    private static final class LineBuilder {
        private final List<TextSpan> spans = new ArrayList<>();
        private Box box;
        private Chunk last;
        private StringBuilder spanText;

        LineBuilder(Chunk first) {
            box = first.box();
            last = first;
            spanText = new StringBuilder(first.text());
        }

        boolean accepts(Chunk chunk) {
            double overlap =
                    Math.min(box.y1(), chunk.box().y1()) - Math.max(box.y0(), chunk.box().y0());
            double smaller = Math.max(0.1, Math.min(box.height(), chunk.box().height()));
            boolean advances =
                    chunk.box().x0() >= last.box().x1() - BACKTRACK_TOLERANCE * chunk.size();
            return overlap / smaller >= MIN_LINE_OVERLAP && advances;
        }

        void add(Chunk chunk) {
            if (chunk.sameStyle(last)) {
                if (needsSpace(chunk)) {
                    spanText.append(' ');
                }
                spanText.append(chunk.text());
            } else {
                closeSpan();
                spanText = new StringBuilder(chunk.text());
            }
            box = Box.union(box, chunk.box());
            last = chunk;
        }

        private boolean needsSpace(Chunk chunk) {
            double gap = chunk.box().x0() - last.box().x1();
            double threshold = Math.max(1.0, last.spaceWidth() * 0.5);
            return gap > threshold
                    && !endsWithWhitespace(spanText)
                    && !Character.isWhitespace(chunk.text().charAt(0));
        }

        private void closeSpan() {
            spans.add(new TextSpan(spanText.toString(), last.size(), last.fontName(), last.flags()));
        }

        TextLine build() {
            closeSpan();
            return new TextLine(box, spans);
        }

        private static boolean endsWithWhitespace(StringBuilder sb) {
            return sb.length() > 0 && Character.isWhitespace(sb.charAt(sb.length() - 1));
        }
    }
}
