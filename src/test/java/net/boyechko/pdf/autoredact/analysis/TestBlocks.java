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

import java.util.concurrent.atomic.AtomicInteger;

/** Compact block construction for classifier and query tests. */
final class TestBlocks {
    private static final AtomicInteger COUNTER = new AtomicInteger();

    private TestBlocks() {}

    static Block.Builder text(String text, double fontSize) {
        return Block.builder("b" + COUNTER.incrementAndGet())
                .text(text)
                .font(fontSize, "Helvetica")
                .lineCount(1)
                .region(Region.BODY)
                .bounds(72, 300, 400, 14);
    }

    static Block body(String text, double fontSize) {
        return text(text, fontSize).build();
    }

    static Block at(String id, int page, double x, double y, String text) {
        return Block.builder(id)
                .page(page)
                .bounds(x, y, 100, 12)
                .text(text)
                .font(10, "Helvetica")
                .lineCount(1)
                .build();
    }

    static Block image(double width, double height) {
        return Block.builder("img" + COUNTER.incrementAndGet())
                .bounds(100, 100, width, height)
                .text("[Image " + (int) width + "x" + (int) height + "]")
                .charCount(0)
                .font(0, "image")
                .image(true)
                .build();
    }
}
