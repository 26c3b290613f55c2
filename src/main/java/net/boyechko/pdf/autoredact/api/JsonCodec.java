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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autoredact.analysis.AnalysisResult;
import net.boyechko.pdf.autoredact.analysis.Block;
import net.boyechko.pdf.autoredact.analysis.BlockQueries.ExportResult;
import net.boyechko.pdf.autoredact.analysis.BlockQueries.SimilarBlocks;
import net.boyechko.pdf.autoredact.analysis.Category;
import net.boyechko.pdf.autoredact.document.PageDimensions;
import net.boyechko.pdf.autoredact.redaction.Bookmark;
import net.boyechko.pdf.autoredact.redaction.RedactionRegion;
import net.boyechko.pdf.autoredact.redaction.RedactionRequest;
import net.boyechko.pdf.autoredact.redaction.RedactionSummary;

/** Converts between the wire format (snake_case JSON) and the engine's types. */
public final class JsonCodec {
    private final ObjectMapper mapper;

    public JsonCodec() {
        this(new ObjectMapper());
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode read(String json) throws RequestException {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RequestException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize response", e);
        }
    }

    public ObjectNode error(String message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", message);
        return node;
    }

    // ── Analysis results ────────────────────────────────────────────

    public ObjectNode toJson(AnalysisResult result) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode blocks = node.putArray("blocks");
        for (Block block : result.blocks()) {
            blocks.add(toJson(block));
        }
        ObjectNode categories = node.putObject("categories");
        for (Category category : result.categories().values()) {
            categories.set(category.id(), toJson(category));
        }
        node.put("page_count", result.pageCount());
        ArrayNode dimensions = node.putArray("page_dimensions");
        for (PageDimensions dims : result.pageDimensions()) {
            ObjectNode d = dimensions.addObject();
            d.put("width", dims.width());
            d.put("height", dims.height());
        }
        node.put("doc_name", result.docName());
        return node;
    }

    public ObjectNode toJson(Block block) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", block.id());
        node.put("page", block.page());
        node.put("x", block.x());
        node.put("y", block.y());
        node.put("width", block.width());
        node.put("height", block.height());
        node.put("text", block.text());
        node.put("font_size", block.fontSize());
        node.put("font_name", block.fontName());
        node.put("char_count", block.charCount());
        node.put("region", block.region().wireName());
        node.put("category_id", block.categoryId());
        node.put("is_bold", block.isBold());
        node.put("is_italic", block.isItalic());
        node.put("is_superscript", block.isSuperscript());
        node.put("is_image", block.isImage());
        node.put("line_count", block.lineCount());
        return node;
    }

    public ObjectNode toJson(Category category) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", category.id());
        node.put("type", category.type());
        node.put("name", category.name());
        node.put("description", category.description());
        node.put("color", category.color());
        node.put("block_count", category.blockCount());
        node.put("char_count", category.charCount());
        node.put("font_size", category.fontSize());
        node.put("region", category.region().wireName());
        node.put("sample_text", category.sampleText());
        node.put("enabled", category.enabled());
        return node;
    }

    public ObjectNode toJson(ExportResult export) {
        ObjectNode node = mapper.createObjectNode();
        node.put("text", export.text());
        node.put("char_count", export.charCount());
        return node;
    }

    public ObjectNode toJson(SimilarBlocks similar) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode ids = node.putArray("similar_ids");
        similar.similarIds().forEach(ids::add);
        node.put("count", similar.count());
        return node;
    }

    public ObjectNode toJson(RedactionSummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("success", true);
        node.put("pages_redacted", summary.pagesRedacted());
        node.put("regions_redacted", summary.regionsRedacted());
        node.put("text_matches", summary.textMatches());
        node.put("coordinate_fallbacks", summary.coordinateFallbacks());
        node.put("pages_deleted", summary.pagesDeleted());
        node.put("bookmarks_written", summary.bookmarksWritten());
        return node;
    }

    // ── Redaction payloads ──────────────────────────────────────────

    /**
     * Reads {@code {regions, deleted_pages, bookmarks}}. {@code deletedPages} is accepted for
     * {@code deleted_pages}; every field is optional.
     */
    public RedactionRequest toRedactionRequest(JsonNode payload) throws RequestException {
        if (payload == null || payload.isNull()) {
            return new RedactionRequest(List.of(), List.of(), List.of());
        }
        if (!payload.isObject()) {
            throw new RequestException("Redaction payload must be an object");
        }
        List<RedactionRegion> regions = toRegions(payload.get("regions"));

        JsonNode deletedNode = firstPresent(payload, "deleted_pages", "deletedPages");
        List<Integer> deletedPages = new ArrayList<>();
        if (deletedNode != null) {
            requireArray(deletedNode, "deleted_pages");
            for (JsonNode page : deletedNode) {
                if (!page.canConvertToInt()) {
                    throw new RequestException("Deleted page index must be an integer: " + page);
                }
                deletedPages.add(page.asInt());
            }
        }

        List<Bookmark> bookmarks = new ArrayList<>();
        JsonNode bookmarksNode = payload.get("bookmarks");
        if (bookmarksNode != null && !bookmarksNode.isNull()) {
            requireArray(bookmarksNode, "bookmarks");
            for (JsonNode bm : bookmarksNode) {
                bookmarks.add(
                        new Bookmark(
                                bm.path("title").asText(Bookmark.DEFAULT_TITLE),
                                bm.path("page").asInt(0),
                                bm.path("level").asInt(1)));
            }
        }
        return new RedactionRequest(regions, deletedPages, bookmarks);
    }

    /** Reads a list of regions; {@code isImage} is accepted for {@code is_image}. */
    public List<RedactionRegion> toRegions(JsonNode node) throws RequestException {
        List<RedactionRegion> regions = new ArrayList<>();
        if (node == null || node.isNull()) {
            return regions;
        }
        requireArray(node, "regions");
        int index = 0;
        for (JsonNode region : node) {
            if (!region.isObject()) {
                throw new RequestException("Region " + index + " must be an object");
            }
            JsonNode text = region.get("text");
            JsonNode image = firstPresent(region, "is_image", "isImage");
            regions.add(
                    new RedactionRegion(
                            requiredInt(region, "page", index),
                            requiredNumber(region, "x", index),
                            requiredNumber(region, "y", index),
                            requiredNumber(region, "width", index),
                            requiredNumber(region, "height", index),
                            text == null || text.isNull() ? null : text.asText(),
                            image != null && image.asBoolean(false)));
            index++;
        }
        return regions;
    }

    private static JsonNode firstPresent(JsonNode node, String name, String alias) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            value = node.get(alias);
        }
        return value == null || value.isNull() ? null : value;
    }

    private static void requireArray(JsonNode node, String field) throws RequestException {
        if (!node.isArray()) {
            throw new RequestException("'" + field + "' must be an array");
        }
    }

    private static int requiredInt(JsonNode node, String field, int index)
            throws RequestException {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new RequestException("Region " + index + " needs an integer '" + field + "'");
        }
        return value.asInt();
    }

    private static double requiredNumber(JsonNode node, String field, int index)
            throws RequestException {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new RequestException("Region " + index + " needs a numeric '" + field + "'");
        }
        return value.asDouble();
    }
}
