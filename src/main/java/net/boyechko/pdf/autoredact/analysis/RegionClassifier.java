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

import java.util.List;
import java.util.function.Predicate;

/**
 * Places a text block in a coarse page region from its vertical position and length. Short text
 * near the top is a running header; long text there is an ordinary first paragraph.
 *
 * <p>Rules are evaluated in order and the first match wins; a block no rule matches is body text.
 */
public final class RegionClassifier {

    /** The attributes a region rule looks at. */
    public record Placement(double yPct, int textLength, int lineCount) {}

    /** One row of the decision table. */
    public record Rule(String name, Predicate<Placement> when, Region region) {}

    private static final List<Rule> RULES =
            List.of(
                    new Rule(
                            "short text in top 5%",
                            p -> p.yPct() < 0.05 && p.textLength() < 150 && p.lineCount() <= 3,
                            Region.HEADER),
                    new Rule(
                            "very short text in top 8%",
                            p -> p.yPct() < 0.08 && p.textLength() < 80 && p.lineCount() <= 2,
                            Region.HEADER),
                    new Rule(
                            "bottom 8%, or short text in bottom 12%",
                            p -> p.yPct() > 0.92 || (p.yPct() > 0.88 && p.textLength() < 50),
                            Region.FOOTER),
                    new Rule("bottom 30%", p -> p.yPct() > 0.70, Region.LOWER));

    public List<Rule> rules() {
        return RULES;
    }

    public Region classify(double y, int textLength, int lineCount, double pageHeight) {
        if (pageHeight <= 0) {
            throw new IllegalArgumentException("Page height must be positive: " + pageHeight);
        }
        return classify(new Placement(y / pageHeight, textLength, lineCount));
    }

    public Region classify(Placement placement) {
        for (Rule rule : RULES) {
            if (rule.when().test(placement)) {
                return rule.region();
            }
        }
        return Region.BODY;
    }
}
