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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.autoredact.PdfTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test suite for PdfCustodian open modes. */
public class PdfCustodianTest extends PdfTestBase {

    private Path clearPdf;

    @BeforeEach
    void createFixtures() throws Exception {
        clearPdf =
                createTestPdf(
                        testOutputPath("fixture_clear.pdf"),
                        (pdfDoc, layoutDoc) -> {
                            layoutDoc.add(
                                    new com.itextpdf.layout.element.Paragraph("Clear fixture"));
                        });
    }

    @Test
    void nullPathIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PdfCustodian(null));
    }

    @Test
    void openForReadingFailsForMissingFile() {
        PdfCustodian custodian = new PdfCustodian(testOutputPath("missing.pdf"));
        IOException e = assertThrows(IOException.class, custodian::openForReading);
        assertTrue(e.getMessage().startsWith("File not found"));
    }

    @Test
    void openForModificationCreatesOutputDirectories() throws Exception {
        Path output = testOutputDir().resolve("nested").resolve("deeper").resolve("out.pdf");
        try (PdfDocument doc = new PdfCustodian(clearPdf).openForModification(output)) {
            // close writes the output
        }

        assertTrue(Files.isRegularFile(output));
        assertTrue(pageTexts(output).get(0).contains("Clear fixture"));
    }

    @Test
    void openForModificationRefusesToWriteOverItsInput() throws Exception {
        long size = Files.size(clearPdf);
        PdfCustodian custodian = new PdfCustodian(clearPdf);

        IOException e =
                assertThrows(IOException.class, () -> custodian.openForModification(clearPdf));
        assertTrue(e.getMessage().startsWith("Output would overwrite"));
        assertEquals(size, Files.size(clearPdf));
        assertTrue(pageTexts(clearPdf).get(0).contains("Clear fixture"));
    }

    @Test
    void openForModificationToStreamWritesOnClose() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PdfDocument doc = new PdfCustodian(clearPdf).openForModification(bytes)) {
            assertEquals(1, doc.getNumberOfPages());
        }

        try (PdfDocument result =
                new PdfDocument(new PdfReader(new ByteArrayInputStream(bytes.toByteArray())))) {
            assertEquals(1, result.getNumberOfPages());
        }
    }

    @Test
    void modifiedOutputUsesCompressedObjectStreams() throws Exception {
        Path output = testOutputPath("compact.pdf");
        try (PdfDocument doc = new PdfCustodian(clearPdf).openForModification(output)) {
            // close writes the output
        }

        String raw = new String(Files.readAllBytes(output), StandardCharsets.ISO_8859_1);
        assertTrue(raw.contains("/ObjStm"), "expected object streams in compacted output");
    }
}
