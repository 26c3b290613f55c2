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

import java.util.List;

/**
 * Regions to remove, whole pages to delete and the bookmarks to write. Page indices are 0-based
 * and refer to the input document; bookmark pages refer to the document after deletion.
 */
public record RedactionRequest(
        List<RedactionRegion> regions, List<Integer> deletedPages, List<Bookmark> bookmarks) {

    public RedactionRequest {
        regions = regions == null ? List.of() : List.copyOf(regions);
        deletedPages = deletedPages == null ? List.of() : List.copyOf(deletedPages);
        bookmarks = bookmarks == null ? List.of() : List.copyOf(bookmarks);
    }

    public static RedactionRequest regionsOnly(List<RedactionRegion> regions) {
        return new RedactionRequest(regions, List.of(), List.of());
    }
}
