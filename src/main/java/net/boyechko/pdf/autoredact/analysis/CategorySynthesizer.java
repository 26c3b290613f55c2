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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the category map of one analysis pass: classifies every block, groups blocks by type,
 * computes each group's aggregates and display metadata, and assigns each block its category id.
 */
public final class CategorySynthesizer {
    private static final Logger logger = LoggerFactory.getLogger(CategorySynthesizer.class);

    private static final int SAMPLE_LENGTH = 100;

    private final CategoryClassifier classifier;
    private final CategoryCatalog catalog;

    public CategorySynthesizer(CategoryClassifier classifier, CategoryCatalog catalog) {
        this.classifier = classifier;
        this.catalog = catalog;
    }

    public CategorySynthesizer() {
        this(new CategoryClassifier(), CategoryCatalog.loadDefault());
    }

    /** Category id for a type; depends on the type name only. */
    public static String categoryId(String type) {
        return Hashes.md5Prefix(type, 8);
    }

    /**
     * Classifies and groups the blocks, returning categories keyed by id in descending order of
     * character count.
     */
    public Map<String, Category> categorize(List<Block> blocks) {
        double baseline = classifier.baseline(blocks);
        logger.debug("Body font size baseline: {}", baseline);

        Map<String, List<Block>> groups = new LinkedHashMap<>();
        for (Block block : blocks) {
            String type = classifier.classify(block, baseline);
            groups.computeIfAbsent(type, t -> new ArrayList<>()).add(block);
        }
        return synthesize(groups);
    }

    /**
     * Builds one category per group. Unknown types take fallback colors in the order they appear
     * after sorting by descending character count, ties broken by type name.
     */
    public Map<String, Category> synthesize(Map<String, List<Block>> groups) {
        List<Map.Entry<String, List<Block>>> sorted = new ArrayList<>(groups.entrySet());
        sorted.sort(
                Comparator.comparingInt(
                                (Map.Entry<String, List<Block>> e) -> -totalChars(e.getValue()))
                        .thenComparing(Map.Entry::getKey));

        Map<String, Category> categories = new LinkedHashMap<>();
        int fallbackIndex = 0;
        for (Map.Entry<String, List<Block>> group : sorted) {
            String type = group.getKey();
            List<Block> members = group.getValue();
            if (members.isEmpty()) {
                continue;
            }

            String color = catalog.colorFor(type);
            if (color == null) {
                color = catalog.fallbackColor(fallbackIndex++);
            }
            Category category = buildCategory(type, members, color);
            categories.put(category.id(), category);
            for (Block block : members) {
                block.assignCategory(category.id());
            }
            logger.debug(
                    "Category {} ({}): {} blocks, {} chars",
                    category.name(),
                    category.id(),
                    category.blockCount(),
                    category.charCount());
        }
        return categories;
    }

    private Category buildCategory(String type, List<Block> members, String color) {
        double sizeSum = 0;
        for (Block block : members) {
            sizeSum += block.fontSize();
        }
        Block first = members.get(0);
        String sample =
                first.text().length() > SAMPLE_LENGTH
                        ? first.text().substring(0, SAMPLE_LENGTH)
                        : first.text();
        return new Category(
                categoryId(type),
                type,
                catalog.nameFor(type),
                catalog.descriptionFor(type, members.size()),
                color,
                members.size(),
                totalChars(members),
                Hashes.round1(sizeSum / members.size()),
                first.region(),
                sample,
                true);
    }

    private static int totalChars(List<Block> blocks) {
        int total = 0;
        for (Block block : blocks) {
            total += block.charCount();
        }
        return total;
    }
}
