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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.autoredact.analysis.AnalysisResult;
import net.boyechko.pdf.autoredact.analysis.Block;
import net.boyechko.pdf.autoredact.analysis.BlockExtractor;
import net.boyechko.pdf.autoredact.analysis.Category;
import net.boyechko.pdf.autoredact.analysis.CategoryCatalog;
import net.boyechko.pdf.autoredact.analysis.CategoryClassifier;
import net.boyechko.pdf.autoredact.analysis.CategorySynthesizer;
import net.boyechko.pdf.autoredact.analysis.RegionClassifier;
import net.boyechko.pdf.autoredact.document.DocumentEngine;
import net.boyechko.pdf.autoredact.document.EngineDocument;
import net.boyechko.pdf.autoredact.document.PageDimensions;
import net.boyechko.pdf.autoredact.redaction.RedactionOrchestrator;
import net.boyechko.pdf.autoredact.redaction.RedactionRegion;
import net.boyechko.pdf.autoredact.redaction.RedactionRequest;
import net.boyechko.pdf.autoredact.redaction.RedactionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs analysis, redaction and rendering against one {@link DocumentEngine}. Each call opens its
 * document and closes it before returning, on every path. The service keeps no document state
 * between calls; see {@link AnalysisSession} for that.
 */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    private final DocumentEngine engine;
    private final ProcessingListener listener;
    private final EngineSettings settings;
    private final BlockExtractor extractor;
    private final CategorySynthesizer synthesizer;
    private final RedactionOrchestrator orchestrator;

    public static class ProcessingServiceBuilder {
        private DocumentEngine engine;
        private ProcessingListener listener;
        private EngineSettings settings;
        private CategoryCatalog catalog;

        public ProcessingServiceBuilder withEngine(DocumentEngine engine) {
            this.engine = engine;
            return this;
        }

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public ProcessingServiceBuilder withSettings(EngineSettings settings) {
            this.settings = settings;
            return this;
        }

        public ProcessingServiceBuilder withCatalog(CategoryCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public ProcessingService build() {
            if (engine == null) {
                throw new IllegalStateException(
                        "DocumentEngine must be provided via withEngine(...) before building ProcessingService");
            }
            if (listener == null) {
                throw new IllegalStateException(
                        "ProcessingListener must be provided via withListener(...) before building ProcessingService");
            }
            return new ProcessingService(this);
        }
    }

    private ProcessingService(ProcessingServiceBuilder builder) {
        this.engine = builder.engine;
        this.listener = builder.listener;
        this.settings = builder.settings != null ? builder.settings : EngineSettings.defaults();
        CategoryCatalog catalog =
                builder.catalog != null ? builder.catalog : CategoryCatalog.loadDefault();
        this.extractor = new BlockExtractor(new RegionClassifier());
        this.synthesizer = new CategorySynthesizer(new CategoryClassifier(), catalog);
        this.orchestrator = new RedactionOrchestrator(engine);
    }

    public EngineSettings settings() {
        return settings;
    }

    /**
     * Extracts and categorizes the blocks of the first {@code maxPages} pages.
     *
     * @param maxPages page limit; 0 or less uses the configured default (0 there means all)
     */
    public AnalysisResult analyze(Path path, int maxPages) throws IOException {
        int limit = maxPages > 0 ? maxPages : settings.maxPages();
        listener.onPhaseStart("Analyzing " + path.getFileName());
        try (EngineDocument doc = engine.open(path)) {
            int pageCount = doc.pageCount();
            if (limit > 0) {
                pageCount = Math.min(pageCount, limit);
            }

            List<PageDimensions> dimensions = new ArrayList<>();
            for (int page = 0; page < pageCount; page++) {
                dimensions.add(doc.pageDimensions(page));
            }

            List<Block> blocks = new ArrayList<>();
            for (int page = 0; page < pageCount; page++) {
                List<Block> pageBlocks = extractor.extractPage(doc, page);
                blocks.addAll(pageBlocks);
                listener.onPageAnalyzed(page, pageBlocks.size());
            }

            Map<String, Category> categories = synthesizer.categorize(blocks);
            logger.info(
                    "Analyzed {} pages of {}: {} blocks in {} categories",
                    pageCount,
                    path.getFileName(),
                    blocks.size(),
                    categories.size());
            listener.onSuccess(
                    "Found " + blocks.size() + " blocks on " + pageCount + " pages");
            listener.onCategories(categories.values());

            String docName = path.getFileName() != null ? path.getFileName().toString() : "";
            return new AnalysisResult(blocks, categories, pageCount, dimensions, docName);
        }
    }

    public RedactionSummary redact(Path input, Path output, RedactionRequest request)
            throws IOException {
        listener.onPhaseStart("Redacting " + input.getFileName());
        RedactionSummary summary = orchestrator.redact(input, output, request);
        listener.onRedactionSummary(summary);
        listener.onSuccess("Output saved to " + output);
        return summary;
    }

    /** Removes regions (no page deletion, no bookmarks) and returns the resulting bytes. */
    public byte[] exportPdf(Path input, List<RedactionRegion> regions) throws IOException {
        logger.info("Exporting {} with {} regions removed", input.getFileName(), regions.size());
        return orchestrator.exportPdf(input, regions);
    }

    /**
     * Renders a 0-based page as PNG.
     *
     * @param scale rendering scale; 0 or less uses the configured default
     */
    public byte[] renderPage(Path path, int page, float scale) throws IOException {
        float effectiveScale = scale > 0 ? scale : settings.renderScale();
        try (EngineDocument doc = engine.open(path)) {
            if (page < 0 || page >= doc.pageCount()) {
                throw new IllegalArgumentException(
                        "Page " + page + " out of range for document with "
                                + doc.pageCount() + " pages");
            }
            return doc.rasterize(page, effectiveScale);
        }
    }
}
