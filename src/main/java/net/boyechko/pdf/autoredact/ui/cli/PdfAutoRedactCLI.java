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

import ch.qos.logback.classic.Level;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.pdf.autoredact.analysis.AnalysisResult;
import net.boyechko.pdf.autoredact.analysis.BlockQueries.ExportResult;
import net.boyechko.pdf.autoredact.analysis.Category;
import net.boyechko.pdf.autoredact.api.JsonCodec;
import net.boyechko.pdf.autoredact.api.RequestDispatcher;
import net.boyechko.pdf.autoredact.api.RequestException;
import net.boyechko.pdf.autoredact.core.EngineSettings;
import net.boyechko.pdf.autoredact.core.ProcessingListener;
import net.boyechko.pdf.autoredact.core.ProcessingService;
import net.boyechko.pdf.autoredact.core.VerbosityLevel;
import net.boyechko.pdf.autoredact.document.ITextDocumentEngine;
import net.boyechko.pdf.autoredact.redaction.RedactionRequest;
import net.boyechko.pdf.autoredact.ui.LoggingListener;
import net.boyechko.pdf.autoredact.ui.ProcessingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfAutoRedactCLI {
    private static final String DEFAULT_EXPORT_SUFFIX = "_export";
    private static final String APP_LOGGER = "net.boyechko.pdf.autoredact";

    private static Logger logger;

    public enum Mode {
        ANALYZE,
        REDACT,
        RENDER,
        SERVE
    }

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Mode mode,
            Path inputPath,
            Path outputPath,
            Path payloadPath,
            int page,
            float scale,
            int maxPages,
            Path exportPath,
            Set<String> categoryTypes,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (mode == null) {
                throw new IllegalArgumentException("Mode is required");
            }
            if (mode != Mode.SERVE && inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if ((mode == Mode.REDACT || mode == Mode.RENDER) && outputPath == null) {
                throw new IllegalArgumentException("Output path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Mode mode = Mode.ANALYZE;
        Path inputPath;
        Path outputPath;
        Path payloadPath;
        int page = -1;
        float scale;
        int maxPages;
        boolean export;
        Path exportPath;
        Set<String> categoryTypes = Set.of();
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (mode == Mode.SERVE) {
                if (inputPath != null) {
                    throw new CLIException("--serve takes no input file");
                }
                return new CLIConfig(
                        mode, null, null, null, 0, scale, maxPages, null, Set.of(), verbosity);
            }
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (mode == Mode.REDACT) {
                if (!Files.exists(payloadPath)) {
                    throw new CLIException("Payload file not found: " + payloadPath);
                }
                if (outputPath == null) {
                    throw new CLIException("No output file specified for --redact");
                }
            }
            if (mode == Mode.RENDER && outputPath == null) {
                throw new CLIException("No output file specified for --render");
            }
            if (mode == Mode.ANALYZE && outputPath != null) {
                throw new CLIException("Multiple input files specified");
            }
            if (!categoryTypes.isEmpty() && !export) {
                throw new CLIException("-c selects categories for export; use it with -e");
            }
            resolveExportPath();

            return new CLIConfig(
                    mode,
                    inputPath,
                    outputPath,
                    payloadPath,
                    page,
                    scale,
                    maxPages,
                    exportPath,
                    categoryTypes,
                    verbosity);
        }

        private void resolveExportPath() {
            if (!export) {
                return;
            }
            String baseName = inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
            String exportFilename = baseName + DEFAULT_EXPORT_SUFFIX + ".txt";
            if (exportPath == null) {
                exportPath = inputPath.resolveSibling(exportFilename);
            } else if (Files.isDirectory(exportPath)) {
                exportPath = exportPath.resolve(exportFilename);
            }
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity(), config.mode() != Mode.SERVE);
            logger().info("Starting {} with verbosity level {}", config.mode(), config.verbosity());
            if (!run(config)) {
                System.exit(1);
            }
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--redact=")) {
                b.mode = Mode.REDACT;
                b.payloadPath = Paths.get(arg.substring("--redact=".length()));
            } else if (arg.startsWith("--render=")) {
                b.mode = Mode.RENDER;
                b.page = parseInt(arg.substring("--render=".length()), "--render");
            } else if (arg.startsWith("--scale=")) {
                b.scale = parseScale(arg.substring("--scale=".length()));
            } else if (arg.startsWith("--max-pages=")) {
                b.maxPages = parseInt(arg.substring("--max-pages=".length()), "--max-pages");
            } else if (arg.startsWith("--export=")) {
                b.export = true;
                b.exportPath = Paths.get(arg.substring("--export=".length()));
            } else if (arg.startsWith("-e=")) {
                b.export = true;
                b.exportPath = Paths.get(arg.substring("-e=".length()));
            } else if (arg.startsWith("--categories=")) {
                b.categoryTypes = parseCommaSeparated(arg.substring("--categories=".length()));
            } else {
                switch (arg) {
                    case "-m", "--max-pages" -> {
                        if (i + 1 < args.length) {
                            b.maxPages = parseInt(args[++i], arg);
                        } else {
                            throw new CLIException("Page count not specified after " + arg);
                        }
                    }
                    case "-c", "--categories" -> {
                        if (i + 1 < args.length) {
                            b.categoryTypes = parseCommaSeparated(args[++i]);
                        } else {
                            throw new CLIException("Category types not specified after " + arg);
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-e", "--export" -> b.export = true;
                    case "--serve" -> b.mode = Mode.SERVE;
                    default -> {
                        if (arg.startsWith("-") && arg.length() > 1) {
                            throw new CLIException("Unknown option: " + arg);
                        } else if (b.inputPath == null) {
                            b.inputPath = Paths.get(arg);
                        } else if (b.outputPath == null) {
                            b.outputPath = Paths.get(arg);
                        } else {
                            throw new CLIException("Too many file arguments: " + arg);
                        }
                    }
                }
            }
        }

        if (b.maxPages < 0) {
            throw new CLIException("Page count must not be negative");
        }
        if (b.mode == Mode.RENDER && b.page < 0) {
            throw new CLIException("Page index must not be negative: " + b.page);
        }
        return b.build();
    }

    /** Sets the application log level; report modes keep log events inside the report boxes. */
    private static void configureLogging(VerbosityLevel verbosity, boolean captureInReport) {
        ch.qos.logback.classic.Logger appLogger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(APP_LOGGER);
        appLogger.setLevel(Level.toLevel(verbosity.logLevel(), Level.WARN));
        appLogger.setAdditive(!captureInReport);
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfAutoRedactCLI.class);
        }
        return logger;
    }

    /** Runs the configured mode; returns false when processing failed. */
    static boolean run(CLIConfig config) {
        if (config.mode() == Mode.SERVE) {
            ProcessingService service = newService(LoggingListener.withConsoleOutput());
            serve(new RequestDispatcher(service), System.in, System.out);
            return true;
        }

        ProcessingReporter reporter = new ProcessingReporter(System.out, config.verbosity());
        ProcessingService service = newService(reporter);
        try {
            switch (config.mode()) {
                case ANALYZE -> analyze(service, config, reporter);
                case REDACT -> redact(service, config);
                case RENDER -> render(service, config, reporter);
                default -> throw new IllegalStateException("Unhandled mode " + config.mode());
            }
            reporter.finish();
            return true;
        } catch (Exception e) {
            reporter.finish();
            logger().debug("Processing failed", e);
            System.err.println("✗ Processing failed: " + e.getMessage());
            return false;
        }
    }

    private static ProcessingService newService(ProcessingListener listener) {
        return new ProcessingService.ProcessingServiceBuilder()
                .withEngine(new ITextDocumentEngine())
                .withListener(listener)
                .withSettings(EngineSettings.fromEnvironment())
                .build();
    }

    private static void analyze(
            ProcessingService service, CLIConfig config, ProcessingReporter reporter)
            throws IOException {
        AnalysisResult result = service.analyze(config.inputPath(), config.maxPages());
        if (config.exportPath() == null) {
            return;
        }

        List<String> enabled = new ArrayList<>();
        for (Category category : result.categories().values()) {
            if (config.categoryTypes().isEmpty()
                    || config.categoryTypes().contains(category.type())) {
                enabled.add(category.id());
            }
        }
        if (enabled.isEmpty()) {
            reporter.onWarning("No categories match " + config.categoryTypes());
        }
        ExportResult export = result.queries().exportText(enabled);
        Path exportParent = config.exportPath().toAbsolutePath().getParent();
        if (exportParent != null) {
            Files.createDirectories(exportParent);
        }
        Files.writeString(config.exportPath(), export.text(), StandardCharsets.UTF_8);
        reporter.onSuccess(
                "Exported " + export.charCount() + " characters to " + config.exportPath());
    }

    private static void redact(ProcessingService service, CLIConfig config)
            throws IOException, RequestException {
        JsonCodec codec = new JsonCodec();
        String payload = Files.readString(config.payloadPath(), StandardCharsets.UTF_8);
        RedactionRequest request = codec.toRedactionRequest(codec.read(payload));
        service.redact(config.inputPath(), config.outputPath(), request);
    }

    private static void render(
            ProcessingService service, CLIConfig config, ProcessingReporter reporter)
            throws IOException {
        int page = config.page();
        byte[] png = service.renderPage(config.inputPath(), page, config.scale());
        Path outputParent = config.outputPath().toAbsolutePath().getParent();
        if (outputParent != null) {
            Files.createDirectories(outputParent);
        }
        Files.write(config.outputPath(), png);
        reporter.onSuccess("Rendered page " + page + " to " + config.outputPath());
    }

    /** Answers one JSON request per input line until the input ends. */
    static void serve(RequestDispatcher dispatcher, InputStream in, PrintStream out) {
        logger().info("Serving requests on stdin");
        try (BufferedReader reader =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                out.println(dispatcher.handleLine(line));
                out.flush();
            }
        } catch (IOException e) {
            logger().error("Request channel failed", e);
        }
        logger().info("Input closed; stopping");
    }

    private static int parseInt(String value, String option) throws CLIException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CLIException("Expected a number for " + option + ": " + value);
        }
    }

    private static float parseScale(String value) throws CLIException {
        try {
            float scale = Float.parseFloat(value.trim());
            if (scale <= 0) {
                throw new CLIException("Scale must be positive: " + value);
            }
            return scale;
        } catch (NumberFormatException e) {
            throw new CLIException("Expected a number for --scale: " + value);
        }
    }

    private static Set<String> parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java PdfAutoRedactCLI [-q|-v|-vv] [-m pages] [-e[=file]] [-c types] <input.pdf>\n"
                + "       java PdfAutoRedactCLI --redact=<payload.json> <input.pdf> <output.pdf>\n"
                + "       java PdfAutoRedactCLI --render=<page> [--scale=S] <input.pdf> <output.png>\n"
                + "       java PdfAutoRedactCLI --serve\n"
                + "  -h, --help          Show this help message\n"
                + "  -q, --quiet         Only show errors\n"
                + "  -v, --verbose       Show per-page progress and category samples\n"
                + "  -vv, --debug        Show all debug information\n"
                + "  -m, --max-pages     Analyze only the first N pages\n"
                + "  -e, --export        Export text of the selected categories (auto-named)\n"
                + "                      Use -e=<file> or --export=<file> for a custom path\n"
                + "  -c, --categories    Category types to export, comma-separated (default: all)\n"
                + "  --redact=<payload>  Remove regions/pages and write bookmarks from a JSON payload\n"
                + "  --render=<page>     Render a 0-based page to PNG\n"
                + "  --scale=<S>         Rendering scale, 1.0 = 72 dpi (default 2.0)\n"
                + "  --serve             Answer JSON requests, one per line, on stdin/stdout\n"
                + "Examples:\n"
                + "  java PdfAutoRedactCLI -v book.pdf\n"
                + "  java PdfAutoRedactCLI -e -c body,heading book.pdf\n"
                + "  java PdfAutoRedactCLI --redact=cuts.json book.pdf book_clean.pdf\n"
                + "  java PdfAutoRedactCLI --render=0 --scale=1.5 book.pdf page1.png";
    }
}
