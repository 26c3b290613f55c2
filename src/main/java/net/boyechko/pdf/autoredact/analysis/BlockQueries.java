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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Read-only queries over the categorized blocks of one analysis pass. */
public final class BlockQueries {
    private static final Comparator<Block> READING_ORDER =
            Comparator.comparingInt(Block::page)
                    .thenComparingDouble(Block::y)
                    .thenComparingDouble(Block::x);

    private final List<Block> blocks;

    public record ExportResult(String text, int charCount) {}

    public record SimilarBlocks(List<String> similarIds, int count) {
        public static SimilarBlocks none() {
            return new SimilarBlocks(List.of(), 0);
        }
    }

    public BlockQueries(List<Block> blocks) {
        this.blocks = List.copyOf(blocks);
    }

    /**
     * Joins the text of blocks in the enabled categories in (page, y, x) order, one block per
     * line, with an empty line between pages.
     */
    public ExportResult exportText(Collection<String> enabledCategoryIds) {
        Set<String> enabled = new HashSet<>(enabledCategoryIds);
        List<Block> ordered = new ArrayList<>(blocks);
        ordered.sort(READING_ORDER);

        List<String> lines = new ArrayList<>();
        int currentPage = -1;
        for (Block block : ordered) {
            if (!enabled.contains(block.categoryId())) {
                continue;
            }
            if (block.page() != currentPage) {
                if (currentPage >= 0) {
                    lines.add("");
                }
                currentPage = block.page();
            }
            lines.add(block.text());
        }
        String text = String.join("\n", lines);
        return new ExportResult(text, text.length());
    }

    /** Ids of every block sharing the given block's category, in extraction order. */
    public SimilarBlocks findSimilar(String blockId) {
        Block target = find(blockId);
        if (target == null) {
            return SimilarBlocks.none();
        }
        List<String> ids = new ArrayList<>();
        for (Block block : blocks) {
            if (block.categoryId().equals(target.categoryId())) {
                ids.add(block.id());
            }
        }
        return new SimilarBlocks(ids, ids.size());
    }

    public Block find(String blockId) {
        if (blockId == null) {
            return null;
        }
        for (Block block : blocks) {
            if (block.id().equals(blockId)) {
                return block;
            }
        }
        return null;
    }
}
