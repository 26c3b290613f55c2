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
package net.boyechko.pdf.autoredact.core;

import java.util.Collection;
import net.boyechko.pdf.autoredact.analysis.Category;
import net.boyechko.pdf.autoredact.redaction.RedactionSummary;

/** Interface for reporting progress and results of analysis and redaction. */
public interface ProcessingListener {
    void onPhaseStart(String phaseName);

    void onSuccess(String message);

    void onWarning(String message);

    void onCategories(Collection<Category> categories);

    void onRedactionSummary(RedactionSummary summary);

    default void onError(String message) {}

    default void onInfo(String message) {}

    default void onVerboseOutput(String message) {}

    default void onSubsection(String header) {}

    default void onPageAnalyzed(int page, int blockCount) {
        onVerboseOutput("Page " + (page + 1) + ": " + blockCount + " blocks");
    }
}
