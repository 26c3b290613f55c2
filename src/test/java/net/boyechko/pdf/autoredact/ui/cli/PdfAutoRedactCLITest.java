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
package net.boyechko.pdf.autoredact.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.autoredact.PdfTestBase;
import net.boyechko.pdf.autoredact.api.RequestDispatcher;
import net.boyechko.pdf.autoredact.core.NoOpProcessingListener;
import net.boyechko.pdf.autoredact.core.ProcessingService;
import net.boyechko.pdf.autoredact.core.VerbosityLevel;
import net.boyechko.pdf.autoredact.document.ITextDocumentEngine;
import net.boyechko.pdf.autoredact.ui.cli.PdfAutoRedactCLI.CLIConfig;
import net.boyechko.pdf.autoredact.ui.cli.PdfAutoRedactCLI.CLIException;
import net.boyechko.pdf.autoredact.ui.cli.PdfAutoRedactCLI.Mode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PdfAutoRedactCLITest extends PdfTestBase {

    private Path input;

    @BeforeEach
    void createInput() throws Exception {
        input = createNumberedPdf(testOutputPath("book.pdf"), 3);
    }

    private static CLIConfig parse(String... args) throws CLIException {
        return PdfAutoRedactCLI.parseArguments(args);
    }

    // ── Argument parsing ───────────────────────────────────────────

    @Test
    void plainInputMeansAnalyze() throws Exception {
        CLIConfig config = parse(input.toString());

        assertEquals(Mode.ANALYZE, config.mode());
        assertEquals(input, config.inputPath());
        assertNull(config.exportPath());
        assertEquals(VerbosityLevel.NORMAL, config.verbosity());
        assertEquals(0, config.maxPages());
    }

    @Test
    void verbosityFlags() throws Exception {
        assertEquals(VerbosityLevel.QUIET, parse("-q", input.toString()).verbosity());
        assertEquals(VerbosityLevel.VERBOSE, parse("-v", input.toString()).verbosity());
        assertEquals(VerbosityLevel.DEBUG, parse("-vv", input.toString()).verbosity());
    }

    @Test
    void pageLimitForms() throws Exception {
        assertEquals(5, parse("-m", "5", input.toString()).maxPages());
        assertEquals(7, parse("--max-pages=7", input.toString()).maxPages());
        assertThrows(CLIException.class, () -> parse(input.toString(), "-m"));
        assertThrows(CLIException.class, () -> parse("-m", "few", input.toString()));
        assertThrows(CLIException.class, () -> parse("-m", "-2", input.toString()));
    }

    @Test
    void exportPathDefaultsNextToInput() throws Exception {
        CLIConfig config = parse("-e", input.toString());
        assertEquals(input.resolveSibling("book_export.txt"), config.exportPath());
    }

    @Test
    void exportIntoDirectoryUsesDefaultName() throws Exception {
        Path dir = Files.createDirectories(testOutputDir().resolve("exports"));
        CLIConfig config = parse("--export=" + dir, input.toString());
        assertEquals(dir.resolve("book_export.txt"), config.exportPath());
    }

    @Test
    void categoriesNeedExport() throws Exception {
        CLIConfig config = parse("-e", "-c", "body, heading", input.toString());
        assertEquals(Set.of("body", "heading"), config.categoryTypes());

        CLIException e =
                assertThrows(
                        CLIException.class, () -> parse("--categories=body", input.toString()));
        assertTrue(e.getMessage().contains("-e"));
    }

    @Test
    void redactNeedsPayloadAndOutput() throws Exception {
        Path payload = Files.writeString(testOutputPath("cuts.json"), "{}");
        Path output = testOutputPath("book_clean.pdf");

        CLIConfig config = parse("--redact=" + payload, input.toString(), output.toString());
        assertEquals(Mode.REDACT, config.mode());
        assertEquals(payload, config.payloadPath());
        assertEquals(output, config.outputPath());

        assertThrows(CLIException.class, () -> parse("--redact=" + payload, input.toString()));
        assertThrows(
                CLIException.class,
                () -> parse("--redact=" + testOutputPath("none.json"), input.toString(), "o.pdf"));
    }

    @Test
    void renderTakesPageAndScale() throws Exception {
        String png = testOutputPath("p.png").toString();
        CLIConfig config = parse("--render=2", "--scale=1.5", input.toString(), png);
        assertEquals(Mode.RENDER, config.mode());
        assertEquals(2, config.page());
        assertEquals(1.5f, config.scale());

        assertThrows(
                CLIException.class,
                () -> parse("--render=2", "--scale=0", input.toString(), png));
        assertThrows(CLIException.class, () -> parse("--render=x", input.toString(), png));
    }

    @Test
    void negativeRenderPageIsRejected() {
        String png = testOutputPath("neg.png").toString();
        CLIException e =
                assertThrows(
                        CLIException.class, () -> parse("--render=-1", input.toString(), png));
        assertTrue(e.getMessage().contains("-1"));
    }

    @Test
    void badInvocationsAreRejected() {
        assertThrows(CLIException.class, () -> parse());
        assertThrows(CLIException.class, () -> parse("--frobnicate", input.toString()));
        assertThrows(CLIException.class, () -> parse(testOutputPath("absent.pdf").toString()));
        assertThrows(CLIException.class, () -> parse(input.toString(), "second.pdf"));
        assertThrows(CLIException.class, () -> parse("--serve", input.toString()));
    }

    @Test
    void serveNeedsNoInput() throws Exception {
        assertEquals(Mode.SERVE, parse("--serve").mode());
    }

    // ── Running ────────────────────────────────────────────────────

    @Test
    void analyzeWithExportWritesSelectedText() throws Exception {
        Path export = testOutputPath("book.txt");
        CLIConfig config = parse("-q", "--export=" + export, "-c", "body", input.toString());

        assertTrue(PdfAutoRedactCLI.run(config));
        assertEquals("Page 0\n\nPage 1\n\nPage 2", Files.readString(export));
    }

    @Test
    void runReportsFailure() throws Exception {
        Path payload = Files.writeString(testOutputPath("broken.json"), "{\"regions\": 3}");
        CLIConfig config =
                parse(
                        "-q",
                        "--redact=" + payload,
                        input.toString(),
                        testOutputPath("out.pdf").toString());

        assertFalse(PdfAutoRedactCLI.run(config));
    }

    @Test
    void serveAnswersOneLinePerRequest() {
        RequestDispatcher dispatcher =
                new RequestDispatcher(
                        new ProcessingService.ProcessingServiceBuilder()
                                .withEngine(new ITextDocumentEngine())
                                .withListener(new NoOpProcessingListener())
                                .build());
        String requests =
                "{\"method\": \"find_similar\", \"args\": [\"x\"]}\n"
                        + "\n"
                        + "not json\n"
                        + "{\"method\": \"analyze\", \"args\": [\""
                        + input.toString().replace("\\", "\\\\")
                        + "\"]}\n";
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        PdfAutoRedactCLI.serve(
                dispatcher,
                new ByteArrayInputStream(requests.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8));

        List<String> responses = out.toString(StandardCharsets.UTF_8).lines().toList();
        assertEquals(3, responses.size());
        assertEquals("{\"similar_ids\":[],\"count\":0}", responses.get(0));
        assertTrue(responses.get(1).startsWith("{\"error\":\"Malformed JSON"));
        assertTrue(responses.get(2).contains("\"page_count\":3"));
    }
}
