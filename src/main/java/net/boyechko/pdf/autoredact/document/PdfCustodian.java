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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.WriterProperties;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Factory for opening PDF documents for reading or for compacting modification. */
public final class PdfCustodian {
    private static final Logger logger = LoggerFactory.getLogger(PdfCustodian.class);

    private final Path inputPath;

    public PdfCustodian(Path inputPath) {
        if (inputPath == null) {
            throw new IllegalArgumentException("Input path is required");
        }
        this.inputPath = inputPath;
    }

    public PdfDocument openForReading() throws IOException {
        requireReadable();
        PdfReader pdfReader = new PdfReader(inputPath.toString());
        return new PdfDocument(pdfReader);
    }

    /**
     * Opens the input for modification, writing to {@code outputPath} on close. The output must not
     * be the input file: the writer would truncate it while the reader still depends on it.
     */
    public PdfDocument openForModification(Path outputPath) throws IOException {
        requireReadable();
        if (Files.exists(outputPath) && Files.isSameFile(inputPath, outputPath)) {
            throw new IOException("Output would overwrite the input being read: " + outputPath);
        }
        Path outputParent = outputPath.toAbsolutePath().getParent();
        if (outputParent != null) {
            Files.createDirectories(outputParent);
        }
        logger.debug("Opening {} for modification, writing to {}", inputPath, outputPath);
        PdfReader pdfReader = new PdfReader(inputPath.toString());
        PdfWriter pdfWriter = new PdfWriter(outputPath.toString(), compactingWriterProperties());
        return new PdfDocument(pdfReader, pdfWriter);
    }

    public PdfDocument openForModification(OutputStream output) throws IOException {
        requireReadable();
        logger.debug("Opening {} for in-memory modification", inputPath);
        PdfReader pdfReader = new PdfReader(inputPath.toString());
        PdfWriter pdfWriter = new PdfWriter(output, compactingWriterProperties());
        return new PdfDocument(pdfReader, pdfWriter);
    }

    /**
     * Writer settings for output that must not carry removed content: compressed object streams
     * and deduplicated objects. Objects no longer reachable from the catalog are not written.
     */
    static WriterProperties compactingWriterProperties() {
        return new WriterProperties().setFullCompressionMode(true).useSmartMode();
    }

    private void requireReadable() throws IOException {
        if (!Files.isRegularFile(inputPath)) {
            throw new IOException("File not found: " + inputPath);
        }
    }
}
