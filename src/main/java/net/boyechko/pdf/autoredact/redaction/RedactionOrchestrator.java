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
package net.boyechko.pdf.autoredact.redaction;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import net.boyechko.pdf.autoredact.document.Box;
import net.boyechko.pdf.autoredact.document.DocumentEngine;
import net.boyechko.pdf.autoredact.document.EngineDocument;
import net.boyechko.pdf.autoredact.document.TocEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes regions and pages from a document and rewrites its bookmarks.
 *
 * <p>Regions are grouped by page and applied one page at a time. Regions carrying text are
 * located by searching for that text; when no match overlaps the requested rectangle, the
 * rectangle itself is removed. Pages are deleted from the highest index down so that indices not
 * yet processed stay valid. Page indices outside the document are skipped.
 */
public class RedactionOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RedactionOrchestrator.class);

    private final DocumentEngine engine;

    public RedactionOrchestrator(DocumentEngine engine) {
        this.engine = engine;
    }

    /**
     * Runs the full pipeline on {@code input}, writing the compacted result to {@code output}.
     *
     * <p>The document is written to a staging file beside {@code output} and moved into place only
     * after every step has succeeded, so {@code output} may name the input itself. On failure the
     * staging file is removed and {@code output} is left as it was.
     */
    public RedactionSummary redact(Path input, Path output, RedactionRequest request)
            throws IOException {
        logger.info(
                "Redacting {}: {} regions, {} page deletions, {} bookmarks",
                input.getFileName(),
                request.regions().size(),
                request.deletedPages().size(),
                request.bookmarks().size());
        Path target = output.toAbsolutePath();
        Path staging = createStagingFile(target);
        boolean committed = false;
        try {
            RedactionSummary summary;
            try (EngineDocument doc = engine.openForModification(input, staging)) {
                summary = apply(doc, request);
            }
            Files.move(
                    staging,
                    target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            committed = true;
            return summary;
        } finally {
            if (!committed) {
                discardStagingFile(staging);
            }
        }
    }

    private static Path createStagingFile(Path target) throws IOException {
        Path dir = target.getParent();
        Files.createDirectories(dir);
        return Files.createTempFile(dir, "." + target.getFileName(), ".part");
    }

    private static void discardStagingFile(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            logger.warn("Could not remove staging file {}: {}", staging, e.getMessage());
        }
    }

    /** Removes regions only and returns the compacted document bytes. */
    public byte[] exportPdf(Path input, List<RedactionRegion> regions) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (EngineDocument doc = engine.openForModification(input, bytes)) {
            apply(doc, RedactionRequest.regionsOnly(regions));
        }
        return bytes.toByteArray();
    }

    /** Applies a request to a document that is open for modification. */
    public RedactionSummary apply(EngineDocument doc, RedactionRequest request)
            throws IOException {
        int pageCount = doc.pageCount();
        NavigableSet<Integer> deleted = new TreeSet<>(request.deletedPages());

        Tally tally = new Tally();
        for (Map.Entry<Integer, List<RedactionRegion>> entry :
                groupByPage(request.regions()).entrySet()) {
            int page = entry.getKey();
            if (page < 0 || page >= pageCount) {
                logger.warn(
                        "Skipping {} regions on page {}: document has {} pages",
                        entry.getValue().size(),
                        page,
                        pageCount);
                continue;
            }
            if (deleted.contains(page)) {
                logger.debug("Page {} is being deleted; not redacting it", page);
                continue;
            }
            redactPage(doc, page, entry.getValue(), tally);
        }

        int pagesDeleted = deletePages(doc, deleted.descendingSet());
        int bookmarksWritten = writeBookmarks(doc, request.bookmarks());

        RedactionSummary summary =
                new RedactionSummary(
                        tally.pages,
                        tally.regions,
                        tally.textMatches,
                        tally.fallbacks,
                        pagesDeleted,
                        bookmarksWritten);
        logger.info("Redaction complete: {}", summary);
        return summary;
    }

    private void redactPage(
            EngineDocument doc, int page, List<RedactionRegion> regions, Tally tally)
            throws IOException {
        for (RedactionRegion region : regions) {
            Box requested = region.box();
            if (region.searchable()) {
                Box match = firstOverlapping(doc.searchText(page, region.text()), requested);
                if (match != null) {
                    doc.markRedaction(page, match);
                    tally.textMatches++;
                } else {
                    logger.debug(
                            "No match for '{}' inside the region on page {}; using coordinates",
                            region.text(),
                            page);
                    doc.markRedaction(page, requested);
                    tally.fallbacks++;
                }
            } else {
                doc.markRedaction(page, requested);
            }
            tally.regions++;
        }
        doc.applyRedactions(page);
        tally.pages++;
        logger.debug("Applied {} redactions on page {}", regions.size(), page);
    }

    private static Box firstOverlapping(List<Box> matches, Box requested) {
        for (Box match : matches) {
            if (match.intersects(requested)) {
                return match;
            }
        }
        return null;
    }

    /** Deletes pages in the given (descending) order, skipping indices outside the document. */
    private int deletePages(EngineDocument doc, NavigableSet<Integer> descending) {
        int deleted = 0;
        for (int page : descending) {
            if (page < 0 || page >= doc.pageCount()) {
                logger.warn(
                        "Skipping deletion of page {}: document has {} pages",
                        page,
                        doc.pageCount());
                continue;
            }
            doc.deletePage(page);
            deleted++;
        }
        if (deleted > 0) {
            logger.info("Deleted {} pages; {} remain", deleted, doc.pageCount());
        }
        return deleted;
    }

    /** Replaces the table of contents when bookmarks are given; leaves it alone otherwise. */
    private int writeBookmarks(EngineDocument doc, List<Bookmark> bookmarks) {
        if (bookmarks.isEmpty()) {
            return 0;
        }
        int pageCount = doc.pageCount();
        List<TocEntry> toc = new ArrayList<>();
        for (Bookmark bookmark : bookmarks) {
            if (bookmark.page() < 0 || bookmark.page() >= pageCount) {
                logger.warn(
                        "Skipping bookmark '{}' on page {}: document has {} pages",
                        bookmark.title(),
                        bookmark.page(),
                        pageCount);
                continue;
            }
            toc.add(new TocEntry(bookmark.level(), bookmark.title(), bookmark.page() + 1));
        }
        doc.setToc(Collections.unmodifiableList(toc));
        logger.info("Wrote {} bookmarks", toc.size());
        return toc.size();
    }

    private static Map<Integer, List<RedactionRegion>> groupByPage(List<RedactionRegion> regions) {
        Map<Integer, List<RedactionRegion>> byPage = new TreeMap<>();
        for (RedactionRegion region : regions) {
            byPage.computeIfAbsent(region.page(), p -> new ArrayList<>()).add(region);
        }
        return byPage;
    }

    private static final class Tally {
        int pages;
        int regions;
        int textMatches;
        int fallbacks;
    }
}
