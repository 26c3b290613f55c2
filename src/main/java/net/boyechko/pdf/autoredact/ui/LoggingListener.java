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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.Collection;
import net.boyechko.pdf.autoredact.analysis.Category;
import net.boyechko.pdf.autoredact.core.ProcessingListener;
import net.boyechko.pdf.autoredact.redaction.RedactionSummary;
import org.slf4j.LoggerFactory;

/** A {@link ProcessingListener} that routes all events through SLF4J. */
public class LoggingListener implements ProcessingListener {

    private static final String CONSOLE_APPENDER_NAME = "AUTOREDACT_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.pdf.autoredact.processing");

    /**
     * Creates a {@link LoggingListener} and makes sure log events reach stderr, leaving stdout
     * free for responses.
     */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null
                || root.iteratorForAppenders().hasNext()) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-30logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setTarget("System.err");
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onWarning(String message) {
        logger.warn("{}", message);
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }

    @Override
    public void onCategories(Collection<Category> categories) {
        for (Category category : categories) {
            logger.info(
                    "CATEGORY {} {} blocks={} chars={}",
                    category.type(),
                    category.id(),
                    category.blockCount(),
                    category.charCount());
        }
    }

    @Override
    public void onRedactionSummary(RedactionSummary summary) {
        logger.info(
                "SUMMARY pages={} regions={} textMatches={} fallbacks={} deleted={} bookmarks={}",
                summary.pagesRedacted(),
                summary.regionsRedacted(),
                summary.textMatches(),
                summary.coordinateFallbacks(),
                summary.pagesDeleted(),
                summary.bookmarksWritten());
    }
}
