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
package com.tomaszrup.asttokens;

import java.io.Reader;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tomaszrup.asttokens.text.ColumnEncoding;

/**
 * Options for marking, usually read from a JSON object such as
 * <pre>
 * { "bracketIndex": true, "columnEncoding": "codepoint", "logLevel": "DEBUG" }
 * </pre>
 * Every key is optional.
 */
public final class MarkOptions {
	private static final Logger logger = LoggerFactory.getLogger(MarkOptions.class);

	private static final String BRACKET_INDEX_OPTION = "bracketIndex";
	private static final String COLUMN_ENCODING_OPTION = "columnEncoding";
	private static final String LOG_LEVEL_OPTION = "logLevel";

	public static final MarkOptions DEFAULTS = new MarkOptions(false, null, null);

	private final boolean bracketIndex;
	private final ColumnEncoding columnEncoding;
	private final String logLevel;

	/**
	 * @param bracketIndex   resolve unclosed brackets with a
	 *                       {@link com.tomaszrup.asttokens.tokens.BracketIntervalIndex}
	 * @param columnEncoding how anchor columns are counted, or {@code null} to
	 *                       use the tree dialect's own encoding
	 * @param logLevel       Logback root level to apply, or {@code null}
	 */
	public MarkOptions(boolean bracketIndex, ColumnEncoding columnEncoding, String logLevel) {
		this.bracketIndex = bracketIndex;
		this.columnEncoding = columnEncoding;
		this.logLevel = logLevel;
	}

	public boolean isBracketIndex() {
		return bracketIndex;
	}

	public ColumnEncoding getColumnEncoding() {
		return columnEncoding;
	}

	public String getLogLevel() {
		return logLevel;
	}

	public MarkOptions withBracketIndex(boolean enabled) {
		return new MarkOptions(enabled, columnEncoding, logLevel);
	}

	public MarkOptions withColumnEncoding(ColumnEncoding encoding) {
		return new MarkOptions(bracketIndex, encoding, logLevel);
	}

	/**
	 * Parses options from a JSON element. {@code null} and JSON null give the
	 * defaults.
	 *
	 * @throws IllegalArgumentException if the element is not an object or an
	 *                                  option has an unusable value
	 */
	public static MarkOptions parse(JsonElement element) {
		if (element == null || element.isJsonNull()) {
			return DEFAULTS;
		}
		if (!element.isJsonObject()) {
			throw new IllegalArgumentException("Mark options must be a JSON object, got: " + element);
		}
		JsonObject opts = element.getAsJsonObject();
		boolean bracketIndex = parseBracketIndexOption(opts);
		ColumnEncoding columnEncoding = parseColumnEncodingOption(opts);
		String logLevel = null;
		if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
			logLevel = opts.get(LOG_LEVEL_OPTION).getAsString();
			applyLogLevel(logLevel);
		}
		return new MarkOptions(bracketIndex, columnEncoding, logLevel);
	}

	/**
	 * Reads and parses a JSON options document.
	 *
	 * @throws IllegalArgumentException if the document is not valid JSON or
	 *                                  holds unusable options
	 */
	public static MarkOptions load(Reader reader) {
		try {
			return parse(JsonParser.parseReader(reader));
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Malformed mark options: " + e.getMessage(), e);
		}
	}

	private static boolean parseBracketIndexOption(JsonObject opts) {
		if (!opts.has(BRACKET_INDEX_OPTION)) {
			return false;
		}
		JsonElement value = opts.get(BRACKET_INDEX_OPTION);
		if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
			throw new IllegalArgumentException("Option '" + BRACKET_INDEX_OPTION + "' must be a boolean, got: " + value);
		}
		boolean enabled = value.getAsBoolean();
		if (enabled) {
			logger.info("Bracket interval index enabled");
		}
		return enabled;
	}

	private static ColumnEncoding parseColumnEncodingOption(JsonObject opts) {
		if (!opts.has(COLUMN_ENCODING_OPTION) || opts.get(COLUMN_ENCODING_OPTION).isJsonNull()) {
			return null;
		}
		JsonElement element = opts.get(COLUMN_ENCODING_OPTION);
		if (!element.isJsonPrimitive()) {
			throw new IllegalArgumentException("Option '" + COLUMN_ENCODING_OPTION + "' must be a string, got: " + element);
		}
		String value = element.getAsString().toLowerCase(Locale.ROOT);
		switch (value) {
			case "utf8":
			case "utf-8":
				return ColumnEncoding.UTF8;
			case "codepoint":
			case "code_point":
				return ColumnEncoding.CODE_POINT;
			default:
				throw new IllegalArgumentException("Unknown column encoding '" + value + "'");
		}
	}

	/**
	 * Sets the Logback root logger level. Accepted values (case-insensitive):
	 * ERROR, WARN, INFO, DEBUG, TRACE. Unknown values are ignored with a
	 * warning.
	 */
	static void applyLogLevel(String levelName) {
		ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
		if (level == null) {
			logger.warn("Unknown log level '{}', keeping current level", levelName);
			return;
		}
		org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		if (!(root instanceof ch.qos.logback.classic.Logger)) {
			logger.warn("Cannot set log level '{}': logging backend is not Logback", levelName);
			return;
		}
		ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;
		ch.qos.logback.classic.Level previous = logbackRoot.getLevel();
		logbackRoot.setLevel(level);
		logger.info("Log level changed from {} to {}", previous, level);
	}

	@Override
	public String toString() {
		return "MarkOptions{bracketIndex=" + bracketIndex + ", columnEncoding=" + columnEncoding + ", logLevel="
				+ logLevel + "}";
	}
}
