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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.autoredact.document.PageDimensions;

/**
 * Outcome of one analysis pass over a document.
 *
 * @param blocks every block of the analyzed pages, in extraction order
 * @param categories categories keyed by id, largest first
 * @param pageCount number of pages analyzed
 * @param pageDimensions size of each analyzed page
 * @param docName file name of the analyzed document
 */
public record AnalysisResult(
        List<Block> blocks,
        Map<String, Category> categories,
        int pageCount,
        List<PageDimensions> pageDimensions,
        String docName) {

    public AnalysisResult {
        blocks = List.copyOf(blocks);
        categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
        pageDimensions = List.copyOf(pageDimensions);
    }

    public Category categoryOf(Block block) {
        return categories.get(block.categoryId());
    }

    public BlockQueries queries() {
        return new BlockQueries(blocks);
    }
}
