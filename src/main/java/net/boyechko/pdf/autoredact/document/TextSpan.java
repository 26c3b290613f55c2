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
 * A run of text in one font, size and style within a line.
 *
 * @param text the text as drawn, whitespace included
 * @param size rendered font size in points
 * @param fontName the font's PostScript name, or {@code "unknown"}
 * @param flags style bits: {@link #SUPERSCRIPT}, {@link #ITALIC}, {@link #BOLD}
 */
public record TextSpan(String text, float size, String fontName, int flags) {
    public static final int SUPERSCRIPT = 1;
    public static final int ITALIC = 1 << 1;
    public static final int BOLD = 1 << 4;

    public TextSpan {
        if (text == null) text = "";
        if (fontName == null) fontName = "unknown";
    }

    public boolean hasFlag(int flag) {
        return (flags & flag) != 0;
    }
}
