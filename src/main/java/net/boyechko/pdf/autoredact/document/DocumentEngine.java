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
import java.io.OutputStream;
import java.nio.file.Path;

/** Opens paginated documents. Every opened document must be closed by the caller. */
public interface DocumentEngine {

    /** Opens a document for reading. */
    EngineDocument open(Path path) throws IOException;

    /**
     * Opens a document whose modifications are written, compacted, to {@code output} when the
     * returned document is closed.
     */
    EngineDocument openForModification(Path input, Path output) throws IOException;

    /** Like {@link #openForModification(Path, Path)}, writing to a stream instead of a file. */
    EngineDocument openForModification(Path input, OutputStream output) throws IOException;
}
