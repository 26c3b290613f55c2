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
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/** {@link DocumentEngine} backed by iText, pdfSweep for redaction and PDFBox for rendering. */
public final class ITextDocumentEngine implements DocumentEngine {

    @Override
    public EngineDocument open(Path path) throws IOException {
        PdfDocument doc = new PdfCustodian(path).openForReading();
        return new ITextEngineDocument(doc, path);
    }

    @Override
    public EngineDocument openForModification(Path input, Path output) throws IOException {
        PdfDocument doc = new PdfCustodian(input).openForModification(output);
        return new ITextEngineDocument(doc, input);
    }

    @Override
    public EngineDocument openForModification(Path input, OutputStream output)
            throws IOException {
        PdfDocument doc = new PdfCustodian(input).openForModification(output);
        return new ITextEngineDocument(doc, input);
    }
}
