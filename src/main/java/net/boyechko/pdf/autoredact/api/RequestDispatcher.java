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
package net.boyechko.pdf.autoredact.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import net.boyechko.pdf.autoredact.core.AnalysisSession;
import net.boyechko.pdf.autoredact.core.ProcessingService;
import net.boyechko.pdf.autoredact.redaction.RedactionRegion;
import net.boyechko.pdf.autoredact.redaction.RedactionRequest;
import net.boyechko.pdf.autoredact.redaction.RedactionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves requests of the form {@code {"method": ..., "args": [...]}}. Each request is handled on
 * its own: a failure becomes an {@code {"error": ...}} response and leaves the dispatcher ready
 * for the next one.
 *
 * <p>Methods and positional arguments:
 *
 * <ul>
 *   <li>{@code analyze [path, max_pages?]}
 *   <li>{@code export [category_ids]}
 *   <li>{@code find_similar [block_id]}
 *   <li>{@code render_page [page?, scale?, path?]}
 *   <li>{@code export_pdf [path, regions]}
 *   <li>{@code redact [input_path, output_path, payload]}
 * </ul>
 */
public class RequestDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

    private final AnalysisSession session;
    private final JsonCodec codec;

    public RequestDispatcher(AnalysisSession session, JsonCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    public RequestDispatcher(ProcessingService service) {
        this(new AnalysisSession(service), new JsonCodec());
    }

    /** Parses and handles one request line, returning the response line. */
    public String handleLine(String line) {
        JsonNode request;
        try {
            request = codec.read(line);
        } catch (RequestException e) {
            logger.warn("Rejected request: {}", e.getMessage());
            return codec.write(codec.error(e.getMessage()));
        }
        return codec.write(handle(request));
    }

    public ObjectNode handle(JsonNode request) {
        String method = request != null ? request.path("method").asText(null) : null;
        try {
            if (request == null || !request.isObject()) {
                throw new RequestException("Request must be a JSON object");
            }
            JsonNode args = request.path("args");
            logger.debug("Handling {}", method);
            return dispatch(method, args);
        } catch (RequestException e) {
            logger.warn("Rejected {} request: {}", method, e.getMessage());
            return codec.error(e.getMessage());
        } catch (IOException | RuntimeException e) {
            logger.error("Request {} failed", method, e);
            return codec.error(messageOf(e));
        }
    }

    private ObjectNode dispatch(String method, JsonNode args)
            throws RequestException, IOException {
        if (method == null) {
            throw new RequestException("Unknown method: " + method);
        }
        return switch (method) {
            case "analyze" -> analyze(args);
            case "export" -> export(args);
            case "find_similar" -> findSimilar(args);
            case "render_page" -> renderPage(args);
            case "export_pdf" -> exportPdf(args);
            case "redact" -> redact(args);
            default -> throw new RequestException("Unknown method: " + method);
        };
    }

    private ObjectNode analyze(JsonNode args) throws RequestException, IOException {
        Path path = requiredPath(args, 0, "path");
        int maxPages = args.path(1).asInt(0);
        return codec.toJson(session.analyze(path, maxPages));
    }

    private ObjectNode export(JsonNode args) throws RequestException {
        JsonNode idsNode = args.path(0);
        List<String> ids = new ArrayList<>();
        if (!idsNode.isMissingNode() && !idsNode.isNull()) {
            if (!idsNode.isArray()) {
                throw new RequestException("export expects an array of category ids");
            }
            idsNode.forEach(id -> ids.add(id.asText()));
        }
        return codec.toJson(session.export(ids));
    }

    private ObjectNode findSimilar(JsonNode args) {
        return codec.toJson(session.findSimilar(args.path(0).asText(null)));
    }

    private ObjectNode renderPage(JsonNode args) throws IOException {
        int page = args.path(0).asInt(0);
        float scale = (float) args.path(1).asDouble(0);
        String path = args.path(2).asText(null);
        byte[] png = session.renderPage(page, scale, path != null ? Path.of(path) : null);
        ObjectNode node = codec.mapper().createObjectNode();
        node.put("image", Base64.getEncoder().encodeToString(png));
        return node;
    }

    private ObjectNode exportPdf(JsonNode args) throws RequestException, IOException {
        Path path = requiredPath(args, 0, "path");
        List<RedactionRegion> regions = codec.toRegions(args.get(1));
        byte[] pdf = session.service().exportPdf(path, regions);
        ObjectNode node = codec.mapper().createObjectNode();
        node.put("pdf_base64", Base64.getEncoder().encodeToString(pdf));
        return node;
    }

    private ObjectNode redact(JsonNode args) throws RequestException, IOException {
        Path input = requiredPath(args, 0, "input_path");
        Path output = requiredPath(args, 1, "output_path");
        RedactionRequest request = codec.toRedactionRequest(args.get(2));
        RedactionSummary summary = session.service().redact(input, output, request);
        return codec.toJson(summary);
    }

    private static Path requiredPath(JsonNode args, int index, String name)
            throws RequestException {
        JsonNode value = args.path(index);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new RequestException("Missing argument '" + name + "'");
        }
        return Path.of(value.asText());
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
