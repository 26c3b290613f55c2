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
package net.boyechko.pdf.autoredact.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Display names, descriptions and colors for category types, loaded from YAML.
 *
 * <p>Descriptions may contain {@code {count}} (number of member blocks); the fallback name may
 * contain {@code {type}}.
 */
public final class CategoryCatalog {
    private static final String DEFAULT_CATALOG_RESOURCE = "/category-catalog.yaml";
    private static final Logger logger = LoggerFactory.getLogger(CategoryCatalog.class);

    public Map<String, Entry> types;
    public String fallback_name;
    public String fallback_description;
    public List<String> fallback_colors;

    public static final class Entry {
        public String name;
        public String description;
        public String color;
    }

    public CategoryCatalog() {
        this.types = new LinkedHashMap<>();
        this.fallback_colors = new ArrayList<>();
    }

    /**
     * Loads a catalog from a classpath resource.
     *
     * @param resourcePath path starting with "/" for an absolute resource path
     */
    public static CategoryCatalog fromResource(String resourcePath) {
        try (var inputStream = CategoryCatalog.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            var yaml = new Yaml(new Constructor(CategoryCatalog.class, new LoaderOptions()));
            CategoryCatalog catalog = yaml.load(inputStream);
            catalog.validate(resourcePath);
            logger.debug(
                    "Loaded {} category types and {} fallback colors from {}",
                    catalog.types.size(),
                    catalog.fallback_colors.size(),
                    resourcePath);
            return catalog;
        } catch (Exception e) {
            logger.error(
                    "Failed to load category catalog from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load category catalog from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    public static CategoryCatalog loadDefault() {
        return fromResource(DEFAULT_CATALOG_RESOURCE);
    }

    private void validate(String source) {
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("No category types defined in " + source);
        }
        if (fallback_colors == null || fallback_colors.isEmpty()) {
            throw new IllegalArgumentException("No fallback colors defined in " + source);
        }
        if (fallback_name == null) {
            fallback_name = "Other ({type})";
        }
        if (fallback_description == null) {
            fallback_description = "Other text style";
        }
        for (Map.Entry<String, Entry> e : types.entrySet()) {
            if (e.getValue() == null || e.getValue().name == null || e.getValue().color == null) {
                throw new IllegalArgumentException(
                        "Category type '" + e.getKey() + "' needs a name and a color in " + source);
            }
        }
    }

    public boolean isKnown(String type) {
        return types.containsKey(type);
    }

    public String nameFor(String type) {
        Entry entry = types.get(type);
        return entry != null ? entry.name : fallback_name.replace("{type}", type);
    }

    public String descriptionFor(String type, int blockCount) {
        Entry entry = types.get(type);
        String template =
                entry != null && entry.description != null
                        ? entry.description
                        : fallback_description;
        return template.replace("{count}", Integer.toString(blockCount)).replace("{type}", type);
    }

    /** Returns the semantic color of a known type, or null for unknown types. */
    public String colorFor(String type) {
        Entry entry = types.get(type);
        return entry != null ? entry.color : null;
    }

    /** Returns the n-th fallback color, cycling through the palette. */
    public String fallbackColor(int index) {
        return fallback_colors.get(index % fallback_colors.size());
    }

    public List<String> getFallbackColors() {
        return fallback_colors;
    }
}
