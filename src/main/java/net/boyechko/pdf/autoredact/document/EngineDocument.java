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

import java.io.IOException;
import java.util.List;

/**
 * An open document. Page indices are 0-based and boxes use top-left-origin coordinates;
 * implementations convert to their native conventions internally.
 */
public interface EngineDocument extends AutoCloseable {

    int pageCount();

    PageDimensions pageDimensions(int page);

    /** Text and image layout fragments of a page, in content order. */
    List<LayoutBlock> extractFragments(int page);

    /** Bounding boxes of the images drawn on a page. */
    List<Box> extractImageBoxes(int page);

    /** Boxes of every occurrence of {@code literal} on a page. */
    List<Box> searchText(int page, String literal);

    /** Marks a box for removal; nothing changes until {@link #applyRedactions(int)}. */
    void markRedaction(int page, Box box);

    /**
     * Removes text, vector graphics and image content intersecting the boxes marked on a page.
     */
    void applyRedactions(int page) throws IOException;

    void deletePage(int page);

    List<TocEntry> getToc();

    /** Replaces the whole table of contents. */
    void setToc(List<TocEntry> entries);

    /** Renders a page as PNG bytes; a scale of 1.0 renders at 72 dpi. */
    byte[] rasterize(int page, float scale) throws IOException;

    /** Closes the document, persisting modifications when it was opened for modification. */
    @Override
    void close() throws IOException;
}
