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
package net.boyechko.pdf.autoredact.core;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import net.boyechko.pdf.autoredact.analysis.AnalysisResult;
import net.boyechko.pdf.autoredact.analysis.BlockQueries;
import net.boyechko.pdf.autoredact.analysis.BlockQueries.ExportResult;
import net.boyechko.pdf.autoredact.analysis.BlockQueries.SimilarBlocks;

/**
 * The most recent analysis of a request channel. Queries and path-less rendering refer to it; a
 * new analysis replaces it and a failed one clears it.
 */
public class AnalysisSession {
    private final ProcessingService service;
    private AnalysisResult current;
    private Path currentPath;

    public AnalysisSession(ProcessingService service) {
        this.service = service;
    }

    public AnalysisResult analyze(Path path, int maxPages) throws IOException {
        clear();
        AnalysisResult result = service.analyze(path, maxPages);
        current = result;
        currentPath = path;
        return result;
    }

    /** Exports the text of enabled categories; empty when nothing has been analyzed. */
    public ExportResult export(Collection<String> enabledCategoryIds) {
        if (current == null) {
            return new ExportResult("", 0);
        }
        return queries().exportText(enabledCategoryIds);
    }

    public SimilarBlocks findSimilar(String blockId) {
        if (current == null) {
            return SimilarBlocks.none();
        }
        return queries().findSimilar(blockId);
    }

    /**
     * Renders a page of {@code path}, or of the analyzed document when {@code path} is null.
     *
     * @throws IllegalStateException when no path is given and nothing has been analyzed
     */
    public byte[] renderPage(int page, float scale, Path path) throws IOException {
        Path target = path != null ? path : currentPath;
        if (target == null) {
            throw new IllegalStateException("No PDF loaded");
        }
        return service.renderPage(target, page, scale);
    }

    public boolean hasDocument() {
        return current != null;
    }

    public AnalysisResult current() {
        return current;
    }

    public Path currentPath() {
        return currentPath;
    }

    public ProcessingService service() {
        return service;
    }

    public void clear() {
        current = null;
        currentPath = null;
    }

    private BlockQueries queries() {
        return current.queries();
    }
}
