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

import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime defaults, each resolved from a JVM system property, then an environment variable, then
 * a built-in value.
 *
 * @param renderScale page rendering scale when a request gives none (1.0 = 72 dpi)
 * @param maxPages analysis page limit when a request gives none; 0 analyzes every page
 */
public record EngineSettings(float renderScale, int maxPages) {
    private static final Logger logger = LoggerFactory.getLogger(EngineSettings.class);

    public static final float DEFAULT_RENDER_SCALE = 2.0f;
    public static final int DEFAULT_MAX_PAGES = 0;

    public EngineSettings {
        if (renderScale <= 0) {
            throw new IllegalArgumentException("Render scale must be positive: " + renderScale);
        }
        if (maxPages < 0) {
            throw new IllegalArgumentException("Page limit must not be negative: " + maxPages);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_RENDER_SCALE, DEFAULT_MAX_PAGES);
    }

    public static EngineSettings fromEnvironment() {
        return resolve(System::getProperty, System::getenv);
    }

    static EngineSettings resolve(
            UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
        String scale =
                lookup(
                        systemProperties,
                        environment,
                        "autoredact.render.scale",
                        "AUTOREDACT_RENDER_SCALE");
        String pages =
                lookup(systemProperties, environment, "autoredact.max.pages", "AUTOREDACT_MAX_PAGES");
        return new EngineSettings(
                scale != null ? Float.parseFloat(scale.trim()) : DEFAULT_RENDER_SCALE,
                pages != null ? Integer.parseInt(pages.trim()) : DEFAULT_MAX_PAGES);
    }

    private static String lookup(
            UnaryOperator<String> systemProperties,
            UnaryOperator<String> environment,
            String property,
            String variable) {
        // 1. Explicit JVM flag, e.g. -Dautoredact.render.scale=1.5
        String value = systemProperties.apply(property);
        if (value != null) {
            logger.debug("{} set by system property: {}", property, value);
            return value;
        }
        // 2. Environment variable, e.g. AUTOREDACT_RENDER_SCALE=1.5
        value = environment.apply(variable);
        if (value != null) {
            logger.debug("{} set by environment: {}", variable, value);
        }
        return value;
    }
}
