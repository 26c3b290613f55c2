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

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Renders single pages to PNG with PDFBox. */
public final class PageRasterizer {
    private static final Logger logger = LoggerFactory.getLogger(PageRasterizer.class);

    private PageRasterizer() {}

    /**
     * Renders a 0-based page of the PDF at {@code path}.
     *
     * @param scale 1.0 renders at 72 dpi
     */
    public static byte[] renderPng(Path path, int page, float scale) throws IOException {
        if (scale <= 0) {
            throw new IllegalArgumentException("Scale must be positive: " + scale);
        }
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            int pageCount = document.getNumberOfPages();
            if (page < 0 || page >= pageCount) {
                throw new IllegalArgumentException(
                        "Page " + page + " out of range for document with " + pageCount + " pages");
            }
            long start = System.currentTimeMillis();
            PDFRenderer renderer = new PDFRenderer(document);
            BufferedImage image = renderer.renderImage(page, scale, ImageType.RGB);

            ByteArrayOutputStream png = new ByteArrayOutputStream();
            ImageIO.write(image, "png", png);
            logger.debug(
                    "Rendered page {} of {} at scale {} in {} ms ({}x{})",
                    page,
                    path.getFileName(),
                    scale,
                    System.currentTimeMillis() - start,
                    image.getWidth(),
                    image.getHeight());
            return png.toByteArray();
        }
    }
}
