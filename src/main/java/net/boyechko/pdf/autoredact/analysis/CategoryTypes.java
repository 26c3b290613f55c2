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

/** Semantic category type names produced by {@link CategoryClassifier}. */
public final class CategoryTypes {
    public static final String BODY = "body";
    public static final String FOOTNOTE = "footnote";
    public static final String FOOTNOTE_REF = "footnote_ref";
    public static final String HEADING = "heading";
    public static final String SUBHEADING = "subheading";
    public static final String TITLE = "title";
    public static final String HEADER = "header";
    public static final String FOOTER = "footer";
    public static final String CAPTION = "caption";
    public static final String QUOTE = "quote";
    public static final String IMAGE = "image";

    private CategoryTypes() {}
}
