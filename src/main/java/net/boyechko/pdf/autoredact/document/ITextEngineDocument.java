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

import com.itextpdf.kernel.colors.ColorConstants;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfOutline;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.canvas.parser.PdfCanvasProcessor;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IPdfTextLocation;
import com.itextpdf.kernel.pdf.canvas.parser.listener.RegexBasedLocationExtractionStrategy;
import com.itextpdf.kernel.pdf.navigation.PdfDestination;
import com.itextpdf.kernel.pdf.navigation.PdfExplicitDestination;
import com.itextpdf.pdfcleanup.PdfCleanUpLocation;
import com.itextpdf.pdfcleanup.PdfCleaner;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An iText {@link PdfDocument} behind the {@link EngineDocument} boundary. Converts 0-based page
 * indices to iText's 1-based page numbers and top-left boxes to user-space rectangles.
 */
final class ITextEngineDocument implements EngineDocument {
    private static final Logger logger = LoggerFactory.getLogger(ITextEngineDocument.class);

    private final PdfDocument doc;
    private final Path source;
    private final Map<Integer, List<Rectangle>> pendingRedactions = new HashMap<>();
    private final Map<Integer, PageLayoutListener> layoutCache = new HashMap<>();

    ITextEngineDocument(PdfDocument doc, Path source) {
        this.doc = doc;
        this.source = source;
    }

    @Override
    public int pageCount() {
        return doc.getNumberOfPages();
    }

    @Override
    public PageDimensions pageDimensions(int page) {
        Rectangle box = pageBox(page);
        return new PageDimensions(box.getWidth(), box.getHeight());
    }

    @Override
    public List<LayoutBlock> extractFragments(int page) {
        return runLayout(page).layoutBlocks();
    }

    @Override
    public List<Box> extractImageBoxes(int page) {
        return runLayout(page).imageBoxes();
    }

    @Override
    public List<Box> searchText(int page, String literal) {
        if (literal == null || literal.isEmpty()) {
            return List.of();
        }
        RegexBasedLocationExtractionStrategy strategy =
                new RegexBasedLocationExtractionStrategy(Pattern.compile(Pattern.quote(literal)));
        new PdfCanvasProcessor(strategy).processPageContent(pdfPage(page));

        Rectangle pageBox = pageBox(page);
        List<Box> matches = new ArrayList<>();
        for (IPdfTextLocation location : strategy.getResultantLocations()) {
            matches.add(Geometry.toTopLeft(location.getRectangle(), pageBox));
        }
        logger.debug("Found {} matches for '{}' on page {}", matches.size(), literal, page);
        return matches;
    }

    @Override
    public void markRedaction(int page, Box box) {
        Rectangle rect = Geometry.toUserSpace(box, pageBox(page));
        pendingRedactions.computeIfAbsent(page, p -> new ArrayList<>()).add(rect);
    }

    @Override
    public void applyRedactions(int page) throws IOException {
        List<Rectangle> marked = pendingRedactions.remove(page);
        if (marked == null || marked.isEmpty()) {
            return;
        }
        List<PdfCleanUpLocation> locations = new ArrayList<>();
        for (Rectangle rect : marked) {
            locations.add(new PdfCleanUpLocation(page + 1, rect, ColorConstants.WHITE));
        }
        PdfCleaner.cleanUp(doc, locations);
        layoutCache.remove(page);
        logger.debug("Applied {} redactions on page {}", locations.size(), page);
    }

    @Override
    public void deletePage(int page) {
        doc.removePage(page + 1);
        layoutCache.clear();
    }

    @Override
    public List<TocEntry> getToc() {
        PdfOutline root = doc.getOutlines(false);
        List<TocEntry> entries = new ArrayList<>();
        if (root != null) {
            collectToc(root.getAllChildren(), 1, entries);
        }
        return entries;
    }

    private void collectToc(List<PdfOutline> outlines, int level, List<TocEntry> entries) {
        for (PdfOutline outline : outlines) {
            entries.add(new TocEntry(level, outline.getTitle(), destinationPage(outline)));
            collectToc(outline.getAllChildren(), level + 1, entries);
        }
    }

    /** Returns the 1-based page an outline points to, or 0 when it has no explicit page. */
    private int destinationPage(PdfOutline outline) {
        PdfObject target = outline.getContent().get(PdfName.Dest);
        PdfDestination destination = outline.getDestination();
        if (target == null && destination != null) {
            target = destination.getPdfObject();
        }
        if (target instanceof PdfArray array
                && !array.isEmpty()
                && array.get(0) instanceof PdfDictionary pageDict) {
            return doc.getPageNumber(pageDict);
        }
        return 0;
    }

    @Override
    public void setToc(List<TocEntry> entries) {
        doc.getCatalog().getPdfObject().remove(PdfName.Outlines);
        PdfOutline root = doc.getOutlines(true);

        Map<Integer, PdfOutline> byLevel = new HashMap<>();
        byLevel.put(0, root);
        for (TocEntry entry : entries) {
            int level = Math.max(1, entry.level());
            PdfOutline parent = root;
            for (int l = level - 1; l >= 0; l--) {
                if (byLevel.containsKey(l)) {
                    parent = byLevel.get(l);
                    break;
                }
            }
            PdfOutline outline = parent.addOutline(entry.title());
            outline.addDestination(PdfExplicitDestination.createFit(doc.getPage(entry.page())));

            byLevel.put(level, outline);
            byLevel.keySet().removeIf(k -> k > level);
        }
    }

    @Override
    public byte[] rasterize(int page, float scale) throws IOException {
        return PageRasterizer.renderPng(source, page, scale);
    }

    @Override
    public void close() throws IOException {
        if (!pendingRedactions.isEmpty()) {
            logger.warn(
                    "Closing with unapplied redactions on pages {}", pendingRedactions.keySet());
        }
        doc.close();
    }

    private PdfPage pdfPage(int page) {
        if (page < 0 || page >= doc.getNumberOfPages()) {
            throw new IndexOutOfBoundsException(
                    "Page " + page + " out of range for document with "
                            + doc.getNumberOfPages() + " pages");
        }
        return doc.getPage(page + 1);
    }

    private Rectangle pageBox(int page) {
        return pdfPage(page).getCropBox();
    }

    /** Parses a page's content stream once; fragments and image boxes share the result. */
    private PageLayoutListener runLayout(int page) {
        PageLayoutListener cached = layoutCache.get(page);
        if (cached != null) {
            return cached;
        }
        PageLayoutListener listener = new PageLayoutListener(pageBox(page));
        new PdfCanvasProcessor(listener).processPageContent(pdfPage(page));
        layoutCache.put(page, listener);
        return listener;
    }
}
