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

import java.util.List;

/**
 * A raw layout fragment as reported by the document engine: either a group of text lines or an
 * image, with its bounding box in top-left page coordinates.
 */
public record LayoutBlock(Box bbox, boolean image, List<TextLine> lines) {
    public LayoutBlock {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static LayoutBlock text(Box bbox, List<TextLine> lines) {
        return new LayoutBlock(bbox, false, lines);
    }

    public static LayoutBlock image(Box bbox) {
        return new LayoutBlock(bbox, true, List.of());
    }

    /** Image fragments and fragments without text lines are treated alike. */
    public boolean isImage() {
        return image || lines.isEmpty();
    }
}
