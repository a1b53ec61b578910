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
package com.tomaszrup.asttokens.tokens;

import com.tomaszrup.asttokens.text.SourcePosition;

/**
 * An immutable token of a {@link TokenStore}: the tokenizer's data plus the
 * token's index in the store and its start and end offsets in the source
 * text.
 *
 * <p>Tokens are owned by their store and compared by identity.</p>
 */
public final class Token {
	private final TokenType type;
	private final String string;
	private final SourcePosition start;
	private final SourcePosition end;
	private final int index;
	private final int startPos;
	private final int endPos;

	Token(TokenType type, String string, SourcePosition start, SourcePosition end, int index, int startPos,
			int endPos) {
		this.type = type;
		this.string = string;
		this.start = start;
		this.end = end;
		this.index = index;
		this.startPos = startPos;
		this.endPos = endPos;
	}

	public TokenType getType() {
		return type;
	}

	public String getString() {
		return string;
	}

	public SourcePosition getStart() {
		return start;
	}

	public SourcePosition getEnd() {
		return end;
	}

	/** Position of this token in its store. */
	public int getIndex() {
		return index;
	}

	/** Offset of the first character of this token in the source text. */
	public int getStartPos() {
		return startPos;
	}

	/** Offset just past the last character of this token in the source text. */
	public int getEndPos() {
		return endPos;
	}

	/**
	 * Returns whether this token has the given type and, if {@code literal} is
	 * not {@code null}, the given text.
	 */
	public boolean matches(TokenType expectedType, String literal) {
		return type == expectedType && (literal == null || string.equals(literal));
	}

	public boolean matches(TokenType expectedType) {
		return type == expectedType;
	}

	public boolean isOp(String literal) {
		return matches(TokenType.OP, literal);
	}

	/**
	 * Returns the closing bracket text for an opening bracket token, or
	 * {@code null} if this token does not open a bracket.
	 */
	public String closingBracket() {
		if (type != TokenType.OP) {
			return null;
		}
		switch (string) {
			case "(":
				return ")";
			case "[":
				return "]";
			case "{":
				return "}";
			default:
				return null;
		}
	}

	public boolean isOpeningBracket() {
		return closingBracket() != null;
	}

	public boolean isClosingBracket() {
		return type == TokenType.OP && (")".equals(string) || "]".equals(string) || "}".equals(string));
	}

	@Override
	public String toString() {
		return repr(type, string);
	}

	/**
	 * Human-friendly rendering of a token type and text, such as
	 * {@code NAME:'foo'} or {@code NEWLINE:'\n'}.
	 */
	public static String repr(TokenType type, String string) {
		return type.name() + ":" + quote(string);
	}

	static String quote(String string) {
		if (string == null) {
			return "None";
		}
		char quote = string.indexOf('\'') >= 0 && string.indexOf('"') < 0 ? '"' : '\'';
		StringBuilder builder = new StringBuilder(string.length() + 2);
		builder.append(quote);
		for (int i = 0; i < string.length(); i++) {
			char c = string.charAt(i);
			switch (c) {
				case '\n':
					builder.append("\\n");
					break;
				case '\r':
					builder.append("\\r");
					break;
				case '\t':
					builder.append("\\t");
					break;
				case '\\':
					builder.append("\\\\");
					break;
				default:
					if (c == quote) {
						builder.append('\\');
					}
					builder.append(c);
			}
		}
		builder.append(quote);
		return builder.toString();
	}
}
