////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.pycoffee.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link RendererOptions} from a JSON object such as
 * <pre>
 * { "indentSize": 2, "strictOperators": true, "receiverName": "this",
 *   "receiverSigil": "@", "logLevel": "DEBUG" }
 * </pre>
 * Unknown keys are ignored. Values of the wrong shape keep the default
 * and log a warning.
 */
public final class RendererOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(RendererOptionsParser.class);

    private static final String INDENT_SIZE_OPTION = "indentSize";
    private static final String INDENT_UNIT_OPTION = "indentUnit";
    private static final String STRICT_OPERATORS_OPTION = "strictOperators";
    private static final String RECEIVER_NAME_OPTION = "receiverName";
    private static final String RECEIVER_SIGIL_OPTION = "receiverSigil";
    private static final String LOG_LEVEL_OPTION = "logLevel";

    /**
     * Parse options from JSON text.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static RendererOptions parse(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Renderer options are not valid JSON: " + e.getMessage(), e);
        }
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("Renderer options must be a JSON object");
        }
        return parse(element.getAsJsonObject());
    }

    /**
     * Parse options and apply the {@code logLevel} side effect.
     *
     * @return the defaults overridden by every well-formed option present
     */
    public static RendererOptions parse(JsonObject opts) {
        RendererOptions options = RendererOptions.defaults();
        if (opts == null) {
            return options;
        }
        applyLogLevelOption(opts);
        options = parseIndentOption(opts, options);
        if (isPrimitive(opts, STRICT_OPERATORS_OPTION)) {
            boolean strict = opts.get(STRICT_OPERATORS_OPTION).getAsBoolean();
            logger.debug("Strict operators: {}", strict);
            options = options.withStrictOperators(strict);
        }
        String receiverName = parseNonBlankString(opts, RECEIVER_NAME_OPTION);
        if (receiverName != null) {
            options = options.withReceiverName(receiverName);
        }
        String receiverSigil = parseNonBlankString(opts, RECEIVER_SIGIL_OPTION);
        if (receiverSigil != null) {
            options = options.withReceiverSigil(receiverSigil);
        }
        return options;
    }

    private static RendererOptions parseIndentOption(JsonObject opts, RendererOptions options) {
        if (isPrimitive(opts, INDENT_UNIT_OPTION)) {
            String unit = opts.get(INDENT_UNIT_OPTION).getAsString();
            if (!unit.isBlank() || unit.isEmpty()) {
                logger.warn("Ignoring indentUnit '{}': it must be non-empty whitespace", unit);
                return options;
            }
            return options.withIndentUnit(unit);
        }
        if (isPrimitive(opts, INDENT_SIZE_OPTION)) {
            int size;
            try {
                size = opts.get(INDENT_SIZE_OPTION).getAsInt();
            } catch (NumberFormatException e) {
                logger.warn("Ignoring indentSize '{}': {}", opts.get(INDENT_SIZE_OPTION), e.getMessage());
                return options;
            }
            if (size < 1) {
                logger.warn("Ignoring indentSize {}: it must be at least 1", size);
                return options;
            }
            return options.withIndentUnit(" ".repeat(size));
        }
        return options;
    }

    private static String parseNonBlankString(JsonObject opts, String key) {
        if (!isPrimitive(opts, key)) {
            return null;
        }
        String value = opts.get(key).getAsString().trim();
        if (value.isEmpty()) {
            logger.warn("Ignoring blank {}", key);
            return null;
        }
        return value;
    }

    private static boolean isPrimitive(JsonObject opts, String key) {
        return opts.has(key) && opts.get(key).isJsonPrimitive();
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (isPrimitive(opts, LOG_LEVEL_OPTION)) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Set the Logback root logger level. Accepted values (case-insensitive):
     * ERROR, WARN, INFO, DEBUG, TRACE. Unknown values keep the current level.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Root logger is not a Logback logger, cannot set level '{}'", levelName);
            return;
        }
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
        ch.qos.logback.classic.Level previous = root.getLevel();
        root.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private RendererOptionsParser() {
        // utility class
    }
}
