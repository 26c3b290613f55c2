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

import net.boyechko.pdf.autoredact.document.Box;

/**
 * A rectangle to remove from a page, in top-left page coordinates.
 *
 * @param text literal text expected inside the rectangle, or null
 * @param image true when the rectangle covers an image; image regions are never text-searched
 */
public record RedactionRegion(
        int page, double x, double y, double width, double height, String text, boolean image) {

    public static RedactionRegion of(int page, double x, double y, double width, double height) {
        return new RedactionRegion(page, x, y, width, height, null, false);
    }

    public Box box() {
        return Box.of(x, y, width, height);
    }

    /** True when the region should be located by searching for its text. */
    public boolean searchable() {
        return !image && text != null && !text.isEmpty();
    }
}
