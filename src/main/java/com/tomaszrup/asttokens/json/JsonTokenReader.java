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
package com.tomaszrup.asttokens.json;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.tomaszrup.asttokens.text.SourcePosition;
import com.tomaszrup.asttokens.tokens.TokenInfo;
import com.tomaszrup.asttokens.tokens.TokenType;

/**
 * Reads a token stream exported as a JSON array. Each entry is either an
 * object
 * <pre>
 * { "type": "NAME", "string": "foo", "start": [1, 0], "end": [1, 3] }
 * </pre>
 * or an array laid out like a tokenizer tuple, {@code ["NAME", "foo", [1, 0],
 * [1, 3], "line"]}. Exact operator type names ({@code LPAR}, {@code COMMA},
 * ...) are read as {@link TokenType#OP}. {@code ENCODING} entries are skipped.
 */
public final class JsonTokenReader {
	private static final String ENCODING = "ENCODING";

	private static final Set<String> EXACT_OPERATOR_TYPES = Set.of("LPAR", "RPAR", "LSQB", "RSQB", "COLON",
			"COMMA", "SEMI", "PLUS", "MINUS", "STAR", "SLASH", "VBAR", "AMPER", "LESS", "GREATER", "EQUAL", "DOT",
			"PERCENT", "LBRACE", "RBRACE", "EQEQUAL", "NOTEQUAL", "LESSEQUAL", "GREATEREQUAL", "TILDE",
			"CIRCUMFLEX", "LEFTSHIFT", "RIGHTSHIFT", "DOUBLESTAR", "PLUSEQUAL", "MINEQUAL", "STAREQUAL",
			"SLASHEQUAL", "PERCENTEQUAL", "AMPEREQUAL", "VBAREQUAL", "CIRCUMFLEXEQUAL", "LEFTSHIFTEQUAL",
			"RIGHTSHIFTEQUAL", "DOUBLESTAREQUAL", "DOUBLESLASH", "DOUBLESLASHEQUAL", "AT", "ATEQUAL", "RARROW",
			"ELLIPSIS", "COLONEQUAL");

	private JsonTokenReader() {
	}

	/**
	 * @throws IllegalArgumentException if the input is not a JSON array of
	 *                                  tokens
	 */
	public static List<TokenInfo> read(Reader reader) {
		JsonElement root;
		try {
			root = JsonParser.parseReader(reader);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Malformed token stream: " + e.getMessage(), e);
		}
		if (!root.isJsonArray()) {
			throw new IllegalArgumentException("Token stream must be a JSON array, got: " + root);
		}
		List<TokenInfo> tokens = new ArrayList<>();
		int index = 0;
		for (JsonElement entry : root.getAsJsonArray()) {
			TokenInfo token = readToken(entry, index++);
			if (token != null) {
				tokens.add(token);
			}
		}
		return tokens;
	}

	public static List<TokenInfo> read(String json) {
		return read(new StringReader(json));
	}

	private static TokenInfo readToken(JsonElement entry, int index) {
		JsonElement type;
		JsonElement string;
		JsonElement start;
		JsonElement end;
		if (entry.isJsonObject()) {
			JsonObject object = entry.getAsJsonObject();
			type = object.get("type");
			string = object.get("string");
			start = object.get("start");
			end = object.get("end");
		} else if (entry.isJsonArray() && entry.getAsJsonArray().size() >= 4) {
			JsonArray array = entry.getAsJsonArray();
			type = array.get(0);
			string = array.get(1);
			start = array.get(2);
			end = array.get(3);
		} else {
			throw new IllegalArgumentException("Token " + index + " must be an object or a 4-5 element array, got: "
					+ entry);
		}
		String typeName = asString(type, "type", index);
		if (ENCODING.equals(typeName)) {
			return null;
		}
		return new TokenInfo(tokenType(typeName, index), asString(string, "string", index),
				position(start, "start", index), position(end, "end", index));
	}

	private static TokenType tokenType(String name, int index) {
		if (EXACT_OPERATOR_TYPES.contains(name)) {
			return TokenType.OP;
		}
		try {
			return TokenType.valueOf(name);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Token " + index + " has unknown type '" + name + "'", e);
		}
	}

	private static String asString(JsonElement value, String field, int index) {
		if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
			throw new IllegalArgumentException("Token " + index + " field '" + field + "' must be a string, got: "
					+ value);
		}
		return value.getAsString();
	}

	private static SourcePosition position(JsonElement value, String field, int index) {
		if (value == null || !value.isJsonArray() || value.getAsJsonArray().size() != 2) {
			throw new IllegalArgumentException("Token " + index + " field '" + field
					+ "' must be a [line, column] array, got: " + value);
		}
		JsonArray pair = value.getAsJsonArray();
		try {
			return new SourcePosition(pair.get(0).getAsInt(), pair.get(1).getAsInt());
		} catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
			throw new IllegalArgumentException("Token " + index + " field '" + field
					+ "' must hold two integers, got: " + value, e);
		}
	}
}
