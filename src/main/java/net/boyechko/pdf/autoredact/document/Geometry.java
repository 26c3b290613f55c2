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

import com.itextpdf.kernel.geom.LineSegment;
import com.itextpdf.kernel.geom.Matrix;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.geom.Vector;
import com.itextpdf.kernel.pdf.canvas.parser.data.ImageRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;

/**
 * Geometry utilities for converting between PDF user space (bottom-left origin) and the
 * top-left-origin {@link Box} coordinates used everywhere outside the engine.
 */
public final class Geometry {
    private Geometry() {}

    /** Converts a user-space rectangle to a top-left box relative to the given page box. */
    public static Box toTopLeft(Rectangle rect, Rectangle pageBox) {
        double x0 = rect.getLeft() - pageBox.getLeft();
        double x1 = rect.getRight() - pageBox.getLeft();
        double y0 = pageBox.getTop() - rect.getTop();
        double y1 = pageBox.getTop() - rect.getBottom();
        return new Box(x0, y0, x1, y1);
    }

    /** Converts a top-left box back to a user-space rectangle on the given page box. */
    public static Rectangle toUserSpace(Box box, Rectangle pageBox) {
        float left = (float) (pageBox.getLeft() + box.x0());
        float bottom = (float) (pageBox.getTop() - box.y1());
        return new Rectangle(left, bottom, (float) box.width(), (float) box.height());
    }

    /** Bounding rectangle of a text chunk from its ascent and descent lines. */
    public static Rectangle rectFromText(TextRenderInfo info) {
        LineSegment ascent = info.getAscentLine();
        LineSegment descent = info.getDescentLine();
        return rectFromPoints(
                ascent.getStartPoint(),
                ascent.getEndPoint(),
                descent.getStartPoint(),
                descent.getEndPoint());
    }

    /** Bounding rectangle of an image: the unit square mapped through the image CTM. */
    public static Rectangle rectFromImage(ImageRenderInfo info) {
        Matrix ctm = info.getImageCtm();
        if (ctm == null) {
            return null;
        }
        Vector p0 = new Vector(0, 0, 1).cross(ctm);
        Vector p1 = new Vector(1, 0, 1).cross(ctm);
        Vector p2 = new Vector(1, 1, 1).cross(ctm);
        Vector p3 = new Vector(0, 1, 1).cross(ctm);
        return rectFromPoints(p0, p1, p2, p3);
    }

    /**
     * Font size as rendered on the page: the nominal size scaled by the text matrix and the
     * current transformation matrix.
     */
    public static float effectiveFontSize(TextRenderInfo info) {
        Matrix textToUser = info.getTextMatrix().multiply(info.getGraphicsState().getCtm());
        Vector scaled = new Vector(0, info.getFontSize(), 0).cross(textToUser);
        return scaled.length();
    }

    static Rectangle rectFromPoints(Vector... points) {
        float minX = Float.MAX_VALUE;
        float minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float maxY = -Float.MAX_VALUE;

        for (Vector point : points) {
            if (point == null) {
                continue;
            }
            float x = point.get(Vector.I1);
            float y = point.get(Vector.I2);
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }

        if (minX == Float.MAX_VALUE || minY == Float.MAX_VALUE) {
            return null;
        }

        return new Rectangle(minX, minY, maxX - minX, maxY - minY);
    }
}
