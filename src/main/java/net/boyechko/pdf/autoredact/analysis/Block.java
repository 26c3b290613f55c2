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

import java.util.Objects;

/**
 * One visually coherent unit of page content: a merged text block or an image. Geometry is in
 * top-left page coordinates and pages are 0-based.
 *
 * <p>Everything except the category id is fixed at construction. The category id is assigned
 * exactly once, by {@link CategorySynthesizer}.
 */
public final class Block {
    private final String id;
    private final int page;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final String text;
    private final double fontSize;
    private final String fontName;
    private final int charCount;
    private final int lineCount;
    private final Region region;
    private final boolean bold;
    private final boolean italic;
    private final boolean superscript;
    private final boolean image;
    private String categoryId = "";

    private Block(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.page = builder.page;
        this.x = builder.x;
        this.y = builder.y;
        this.width = builder.width;
        this.height = builder.height;
        this.text = builder.text == null ? "" : builder.text;
        this.fontSize = builder.fontSize;
        this.fontName = builder.fontName == null ? "unknown" : builder.fontName;
        this.charCount = builder.charCount;
        this.lineCount = builder.lineCount;
        this.region = builder.region == null ? Region.BODY : builder.region;
        this.bold = builder.bold;
        this.italic = builder.italic;
        this.superscript = builder.superscript;
        this.image = builder.image;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    public int page() {
        return page;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public String text() {
        return text;
    }

    public double fontSize() {
        return fontSize;
    }

    public String fontName() {
        return fontName;
    }

    public int charCount() {
        return charCount;
    }

    public int lineCount() {
        return lineCount;
    }

    public Region region() {
        return region;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public boolean isSuperscript() {
        return superscript;
    }

    public boolean isImage() {
        return image;
    }

    /** Empty until categorization has run. */
    public String categoryId() {
        return categoryId;
    }

    public boolean isCategorized() {
        return !categoryId.isEmpty();
    }

    void assignCategory(String categoryId) {
        if (categoryId == null || categoryId.isEmpty()) {
            throw new IllegalArgumentException("Category id must not be empty");
        }
        if (isCategorized()) {
            throw new IllegalStateException(
                    "Block " + id + " already belongs to category " + this.categoryId);
        }
        this.categoryId = categoryId;
    }

    @Override
    public String toString() {
        return "Block[" + id + " p" + page + " " + region + " '" + abbreviate(text, 40) + "']";
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    /** Accumulates block attributes; {@link BlockExtractor} and tests build blocks with it. */
    public static final class Builder {
        private final String id;
        private int page;
        private double x;
        private double y;
        private double width;
        private double height;
        private String text;
        private double fontSize;
        private String fontName;
        private int charCount;
        private int lineCount;
        private Region region;
        private boolean bold;
        private boolean italic;
        private boolean superscript;
        private boolean image;

        private Builder(String id) {
            this.id = id;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder bounds(double x, double y, double width, double height) {
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
            return this;
        }

        /** Sets the text and derives the character count from it. */
        public Builder text(String text) {
            this.text = text;
            this.charCount = text == null ? 0 : text.length();
            return this;
        }

        public Builder font(double size, String name) {
            this.fontSize = size;
            this.fontName = name;
            return this;
        }

        public Builder charCount(int charCount) {
            this.charCount = charCount;
            return this;
        }

        public Builder lineCount(int lineCount) {
            this.lineCount = lineCount;
            return this;
        }

        public Builder region(Region region) {
            this.region = region;
            return this;
        }

        public Builder bold(boolean bold) {
            this.bold = bold;
            return this;
        }

        public Builder italic(boolean italic) {
            this.italic = italic;
            return this;
        }

        public Builder superscript(boolean superscript) {
            this.superscript = superscript;
            return this;
        }

        public Builder image(boolean image) {
            this.image = image;
            return this;
        }

        public Block build() {
            return new Block(this);
        }
    }
}
