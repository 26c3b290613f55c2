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

/**
 * Axis-aligned box in top-left-origin page coordinates: {@code (x0, y0)} is the upper left
 * corner, {@code (x1, y1)} the lower right, and y grows downward.
 */
public record Box(double x0, double y0, double x1, double y1) {

    public static Box of(double x, double y, double width, double height) {
        return new Box(x, y, x + width, y + height);
    }

    public double width() {
        return x1 - x0;
    }

    public double height() {
        return y1 - y0;
    }

    /** Returns true when the two boxes share an area larger than zero. */
    public boolean intersects(Box other) {
        if (other == null) return false;
        return x0 < other.x1 && other.x0 < x1 && y0 < other.y1 && other.y0 < y1;
    }

    /** Returns true when the horizontal extents of the two boxes overlap. */
    public boolean overlapsHorizontally(Box other) {
        return x0 < other.x1 && other.x0 < x1;
    }

    /** Returns the smallest box containing both boxes, handling nulls. */
    public static Box union(Box a, Box b) {
        if (a == null) return b;
        if (b == null) return a;
        return new Box(
                Math.min(a.x0, b.x0),
                Math.min(a.y0, b.y0),
                Math.max(a.x1, b.x1),
                Math.max(a.y1, b.y1));
    }

    /** Returns a copy with each coordinate rounded to the nearest integer. */
    public Box rounded() {
        return new Box(Math.round(x0), Math.round(y0), Math.round(x1), Math.round(y1));
    }
}
