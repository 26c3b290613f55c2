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
package net.boyechko.pdf.autoredact.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import net.boyechko.pdf.autoredact.analysis.Category;
import net.boyechko.pdf.autoredact.core.ProcessingListener;
import net.boyechko.pdf.autoredact.core.VerbosityLevel;
import net.boyechko.pdf.autoredact.redaction.RedactionSummary;
import org.slf4j.LoggerFactory;

/** Prints progress and results as boxed sections on a console stream. */
public class ProcessingReporter implements ProcessingListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "️✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final String SUBSECTION_MARK = "🞙︎";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;
    private static final int SAMPLE_WIDTH = 48;

    private boolean phaseOpen = false;
    private boolean subsectionOpen = false;
    private final ListAppender<ILoggingEvent> logBuffer;

    public ProcessingReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        Logger appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.pdf.autoredact");
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onSubsection(String header) {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            if (subsectionOpen) {
                printEmptyLine();
            }
            printLine(header, SUBSECTION_MARK);
            subsectionOpen = true;
        }
    }

    @Override
    public void onCategories(Collection<Category> categories) {
        if (!verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            return;
        }
        closePhaseBoxIfOpen();
        printBoxHeader("Categories");
        if (categories.isEmpty()) {
            printLine("No content found", WARNING);
        }
        for (Category category : categories) {
            printLine(
                    String.format(
                            Locale.ROOT,
                            "%s [%s]: %d blocks, %d chars, %.1fpt, %s",
                            category.name(),
                            category.id(),
                            category.blockCount(),
                            category.charCount(),
                            category.fontSize(),
                            category.color()),
                    INFO);
            if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
                printLine("  " + category.description(), null, VerbosityLevel.VERBOSE);
                printLine(
                        "  \"" + abbreviate(category.sampleText(), SAMPLE_WIDTH) + "\"",
                        null,
                        VerbosityLevel.VERBOSE);
            }
        }
        printBoxFooter();
    }

    @Override
    public void onRedactionSummary(RedactionSummary summary) {
        if (!verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            return;
        }
        closePhaseBoxIfOpen();
        printBoxHeader("Summary");
        printLine(
                "Redacted "
                        + summary.regionsRedacted()
                        + " regions on "
                        + summary.pagesRedacted()
                        + " pages",
                SUCCESS);
        if (summary.textMatches() > 0 || summary.coordinateFallbacks() > 0) {
            printLine(
                    summary.textMatches()
                            + " located by text, "
                            + summary.coordinateFallbacks()
                            + " by coordinates",
                    INFO);
        }
        if (summary.pagesDeleted() > 0) {
            printLine("Deleted " + summary.pagesDeleted() + " pages", SUCCESS);
        }
        if (summary.bookmarksWritten() > 0) {
            printLine("Wrote " + summary.bookmarksWritten() + " bookmarks", SUCCESS);
        }
        printBoxFooter();
    }

    @Override
    public void onSuccess(String message) {
        printLine(message, SUCCESS);
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onWarning(String message) {
        printLine(message, WARNING);
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO);
    }

    @Override
    public void onVerboseOutput(String message) {
        printLine(message, INFO, VerbosityLevel.VERBOSE);
    }

    public boolean shouldShow(VerbosityLevel level) {
        return verbosity.shouldShow(level);
    }

    /** Closes the open section, if any, flushing captured log events into it. */
    public void finish() {
        closePhaseBoxIfOpen();
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen && verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            printBoxFooter();
            phaseOpen = false;
            subsectionOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
            output.println("│");
        }
    }

    private void printBoxFooter() {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            drainLogBuffer();
            output.println("│");
            output.println("└─╯");
        }
    }

    /** Flushes log events captured since the last drain into the open box. */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        printEmptyLine();
        for (ILoggingEvent event : events) {
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            String levelString = event.getLevel().toString().toUpperCase(Locale.ROOT);
            String origin = event.getLoggerName();
            int dot = origin.lastIndexOf('.');
            if (dot >= 0) {
                origin = origin.substring(dot + 1);
            }
            printLine("[" + levelString + "] " + origin + ": " + event.getFormattedMessage(), icon);
        }
    }

    /**
     * Prints an indented line with the given message and icon, word-wrapping long messages to stay
     * within the box width.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) {
            return;
        }
        String prefix = icon == null ? INDENT : INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix);
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    private void printEmptyLine() {
        printLine("", "", VerbosityLevel.QUIET);
    }

    private static String abbreviate(String text, int max) {
        String flat = text.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 1) + "…";
    }

    /** Word-wraps text at word boundaries to fit within maxWidth characters per line. */
    private static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();
        for (String word : text.split(" ")) {
            if (currentLine.isEmpty()) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (!currentLine.isEmpty()) {
            lines.add(currentLine.toString());
        }
        return lines;
    }
}
