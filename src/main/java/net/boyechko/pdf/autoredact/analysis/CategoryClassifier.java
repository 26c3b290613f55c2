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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns each block a semantic category type relative to the document's body font size.
 *
 * <p>The rules form an ordered decision table: the first rule whose predicate holds decides the
 * type, and blocks no rule matches are body text. Every block therefore maps to exactly one type.
 */
public final class CategoryClassifier {
    private static final Logger logger = LoggerFactory.getLogger(CategoryClassifier.class);

    public static final double DEFAULT_BASELINE = 10.0;

    /** Predicate over a block and the document's baseline font size. */
    @FunctionalInterface
    public interface Condition {
        boolean test(Block block, double baseline);
    }

    /** One row of the decision table. */
    public record Rule(String name, Condition when, String type) {}

    private static final List<Rule> RULES =
            List.of(
                    new Rule("image", (b, base) -> b.isImage(), CategoryTypes.IMAGE),
                    new Rule(
                            "superscript",
                            (b, base) -> b.isSuperscript(),
                            CategoryTypes.FOOTNOTE_REF),
                    new Rule(
                            "tiny short text",
                            (b, base) -> b.fontSize() < base * 0.7 && b.charCount() < 5,
                            CategoryTypes.FOOTNOTE_REF),
                    new Rule(
                            "header region",
                            (b, base) -> b.region() == Region.HEADER,
                            CategoryTypes.HEADER),
                    new Rule(
                            "footer region",
                            (b, base) -> b.region() == Region.FOOTER,
                            CategoryTypes.FOOTER),
                    new Rule(
                            "small text in lower region",
                            (b, base) -> b.region() == Region.LOWER && b.fontSize() < base * 0.95,
                            CategoryTypes.FOOTNOTE),
                    new Rule(
                            "small text outside lower region",
                            (b, base) -> b.fontSize() < base * 0.85 && b.region() != Region.LOWER,
                            CategoryTypes.CAPTION),
                    new Rule(
                            "large text",
                            (b, base) -> b.fontSize() > base * 1.4,
                            CategoryTypes.TITLE),
                    new Rule(
                            "bold larger text",
                            (b, base) -> b.isBold() && b.fontSize() > base * 1.1,
                            CategoryTypes.HEADING),
                    new Rule(
                            "short bold text",
                            (b, base) -> b.isBold() && b.lineCount() <= 2 && b.charCount() < 200,
                            CategoryTypes.SUBHEADING),
                    new Rule(
                            "multi-line italic text",
                            (b, base) -> b.isItalic() && b.lineCount() > 2,
                            CategoryTypes.QUOTE));

    public List<Rule> rules() {
        return RULES;
    }

    /**
     * Returns the font size carrying the most characters among non-bold body-region blocks. Ties
     * go to the size seen first. Falls back to {@link #DEFAULT_BASELINE} when there is no such
     * block.
     */
    public double baseline(List<Block> blocks) {
        Map<Double, Integer> charsBySize = new LinkedHashMap<>();
        for (Block block : blocks) {
            if (block.region() == Region.BODY && !block.isBold()) {
                charsBySize.merge(block.fontSize(), block.charCount(), Integer::sum);
            }
        }
        double best = 0;
        int bestChars = -1;
        for (Map.Entry<Double, Integer> entry : charsBySize.entrySet()) {
            if (entry.getValue() > bestChars) {
                best = entry.getKey();
                bestChars = entry.getValue();
            }
        }
        if (best <= 0) {
            logger.debug("No usable body text size; using baseline {}", DEFAULT_BASELINE);
            return DEFAULT_BASELINE;
        }
        return best;
    }

    public String classify(Block block, double baseline) {
        for (Rule rule : RULES) {
            if (rule.when().test(block, baseline)) {
                return rule.type();
            }
        }
        return CategoryTypes.BODY;
    }
}
