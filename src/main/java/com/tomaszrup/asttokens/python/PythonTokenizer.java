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
package com.tomaszrup.asttokens.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tomaszrup.asttokens.text.SourcePosition;
import com.tomaszrup.asttokens.tokens.TokenInfo;
import com.tomaszrup.asttokens.tokens.TokenType;

/**
 * Splits Python source into tokens the way CPython's {@code tokenize} module
 * does: comments and non-logical line breaks are kept as {@code COMMENT} and
 * {@code NL} tokens, indentation changes produce {@code INDENT} and
 * {@code DEDENT} tokens, and string literals (f-strings included) are single
 * {@code STRING} tokens. A source whose last line lacks a line break still
 * gets an empty {@code NEWLINE} token before the end marker.
 *
 * <p>Columns count code points. Instances are stateless.</p>
 */
public class PythonTokenizer {
	private static final String DIGITS = "[0-9](?:_?[0-9])*";
	private static final String EXPONENT = "[eE][-+]?" + DIGITS;
	private static final String POINT_FLOAT = "(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + ")(?:"
			+ EXPONENT + ")?";
	private static final String EXP_FLOAT = DIGITS + EXPONENT;
	private static final String FLOAT = "(?:" + POINT_FLOAT + "|" + EXP_FLOAT + ")";
	private static final String IMAGINARY = "(?:" + FLOAT + "|" + DIGITS + ")[jJ]";
	private static final String INTEGER = "0[xX](?:_?[0-9a-fA-F])+|0[bB](?:_?[01])+|0[oO](?:_?[0-7])+"
			+ "|0(?:_?0)*|[1-9](?:_?[0-9])*";
	private static final Pattern NUMBER = Pattern.compile(IMAGINARY + "|" + FLOAT + "|(?:" + INTEGER + ")");
	private static final Pattern STRING_PREFIX = Pattern.compile("(?i:rb|br|fr|rf|r|u|f|b)?('''|\"\"\"|'|\")");

	// longest first
	private static final String[] OPERATORS = { "**=", "//=", ">>=", "<<=", "...", "->", ":=", "**", "//", ">>",
			"<<", "<=", ">=", "==", "!=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=", "+", "-", "*", "/",
			"%", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "=", "@" };

	public List<TokenInfo> tokenize(String text) {
		return new Run(text).tokenize();
	}

	/** Mutable state of one tokenization. */
	private static final class Run {
		private final String text;
		private final List<TokenInfo> tokens = new ArrayList<>();
		private final Deque<Integer> indents = new ArrayDeque<>();
		private int lineNo;
		private int parenLevel;
		private boolean continued;

		// an unterminated string continued on the following lines
		private StringBuilder pendingString;
		private String pendingQuote;
		private SourcePosition pendingStart;

		Run(String text) {
			this.text = text;
			indents.push(0);
		}

		List<TokenInfo> tokenize() {
			List<String> lines = splitLines(text);
			String lastLine = "";
			for (String line : lines) {
				lineNo++;
				lastLine = line;
				if (!tokenizeLine(line)) {
					break;
				}
			}
			if (pendingString != null) {
				throw new PythonSyntaxException("EOF in multi-line string", pendingStart.getLine(),
						pendingStart.getColumn());
			}
			if (parenLevel > 0 || continued) {
				throw new PythonSyntaxException("EOF in multi-line statement", lineNo, 0);
			}
			if (!lastLine.isEmpty() && !lastLine.endsWith("\n") && !tokens.isEmpty()) {
				TokenType lastType = tokens.get(tokens.size() - 1).getType();
				if (lastType != TokenType.NEWLINE && lastType != TokenType.NL) {
					SourcePosition end = new SourcePosition(lineNo, column(lastLine, lastLine.length()));
					add(TokenType.NEWLINE, "", end, end);
				}
			}
			SourcePosition eof = new SourcePosition(lineNo + 1, 0);
			while (indents.peek() > 0) {
				indents.pop();
				add(TokenType.DEDENT, "", eof, eof);
			}
			add(TokenType.ENDMARKER, "", eof, eof);
			return tokens;
		}

		/**
		 * Tokenizes one physical line. Returns {@code false} when the rest of
		 * the input holds no more tokens.
		 */
		private boolean tokenizeLine(String line) {
			int pos = 0;
			int max = line.length();
			if (pendingString != null) {
				int end = findStringEnd(line, 0, pendingQuote);
				if (end < 0) {
					pendingString.append(line);
					return true;
				}
				pendingString.append(line, 0, end);
				add(TokenType.STRING, pendingString.toString(), pendingStart, position(line, end));
				pendingString = null;
				pos = end;
			} else if (parenLevel == 0 && !continued) {
				int column = 0;
				while (pos < max) {
					char c = line.charAt(pos);
					if (c == ' ') {
						column++;
					} else if (c == '\t') {
						column = (column / 8 + 1) * 8;
					} else if (c == '\f') {
						column = 0;
					} else {
						break;
					}
					pos++;
				}
				if (pos == max) {
					return false;
				}
				char c = line.charAt(pos);
				if (c == '#' || c == '\r' || c == '\n') {
					if (c == '#') {
						int commentEnd = lineBreakStart(line, pos);
						add(TokenType.COMMENT, line.substring(pos, commentEnd), position(line, pos),
								position(line, commentEnd));
						pos = commentEnd;
					}
					add(TokenType.NL, line.substring(pos), position(line, pos), position(line, max));
					return true;
				}
				if (column > indents.peek()) {
					indents.push(column);
					add(TokenType.INDENT, line.substring(0, pos), new SourcePosition(lineNo, 0), position(line, pos));
				}
				while (column < indents.peek()) {
					indents.pop();
					if (column > indents.peek()) {
						throw new PythonSyntaxException("unindent does not match any outer indentation level", lineNo,
								column(line, pos));
					}
					add(TokenType.DEDENT, "", position(line, pos), position(line, pos));
				}
			} else {
				continued = false;
			}

			while (pos < max) {
				char c = line.charAt(pos);
				if (c == ' ' || c == '\t' || c == '\f') {
					pos++;
					continue;
				}
				if (c == '#') {
					int commentEnd = lineBreakStart(line, pos);
					add(TokenType.COMMENT, line.substring(pos, commentEnd), position(line, pos),
							position(line, commentEnd));
					pos = commentEnd;
				} else if (c == '\r' || c == '\n') {
					add(parenLevel > 0 ? TokenType.NL : TokenType.NEWLINE, line.substring(pos), position(line, pos),
							position(line, max));
					pos = max;
				} else if (c == '\\' && lineBreakStart(line, pos + 1) == pos + 1 && pos + 1 < max) {
					continued = true;
					pos = max;
				} else {
					pos = readToken(line, pos);
				}
			}
			return true;
		}

		private int readToken(String line, int pos) {
			char c = line.charAt(pos);
			Matcher string = STRING_PREFIX.matcher(line).region(pos, line.length());
			if (string.lookingAt()) {
				return readString(line, pos, string.end(), string.group(1));
			}
			if (Character.isDigit(c) || (c == '.' && pos + 1 < line.length() && Character.isDigit(line.charAt(pos + 1)))) {
				Matcher number = NUMBER.matcher(line).region(pos, line.length());
				if (number.lookingAt()) {
					return emit(TokenType.NUMBER, line, pos, number.end());
				}
			}
			int codePoint = line.codePointAt(pos);
			if (codePoint == '_' || Character.isUnicodeIdentifierStart(codePoint)) {
				int end = pos + Character.charCount(codePoint);
				while (end < line.length()) {
					int next = line.codePointAt(end);
					if (next != '_' && !Character.isUnicodeIdentifierPart(next)) {
						break;
					}
					end += Character.charCount(next);
				}
				return emit(TokenType.NAME, line, pos, end);
			}
			for (String operator : OPERATORS) {
				if (line.startsWith(operator, pos)) {
					if ("([{".contains(operator)) {
						parenLevel++;
					} else if (")]}".contains(operator)) {
						parenLevel--;
					}
					return emit(TokenType.OP, line, pos, pos + operator.length());
				}
			}
			return emit(TokenType.ERRORTOKEN, line, pos, pos + Character.charCount(codePoint));
		}

		private int readString(String line, int start, int bodyStart, String quote) {
			int end = findStringEnd(line, bodyStart, quote);
			if (end >= 0) {
				return emit(TokenType.STRING, line, start, end);
			}
			boolean lineContinues = line.endsWith("\\\n") || line.endsWith("\\\r\n");
			if (quote.length() == 1 && !lineContinues) {
				throw new PythonSyntaxException("EOL while scanning string literal", lineNo, column(line, start));
			}
			pendingString = new StringBuilder(line.substring(start));
			pendingQuote = quote;
			pendingStart = position(line, start);
			return line.length();
		}

		private int emit(TokenType type, String line, int start, int end) {
			add(type, line.substring(start, end), position(line, start), position(line, end));
			return end;
		}

		private void add(TokenType type, String string, SourcePosition start, SourcePosition end) {
			tokens.add(new TokenInfo(type, string, start, end));
		}

		private SourcePosition position(String line, int index) {
			return new SourcePosition(lineNo, column(line, index));
		}
	}

	/**
	 * Returns the index just past the closing quote, or -1 if the string
	 * does not end on this line.
	 */
	static int findStringEnd(String line, int from, String quote) {
		int i = from;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (c == '\\') {
				i += 2;
			} else if (line.startsWith(quote, i)) {
				return i + quote.length();
			} else if (c == '\n' && quote.length() == 1) {
				return -1;
			} else {
				i++;
			}
		}
		return -1;
	}

	private static int lineBreakStart(String line, int from) {
		int i = from;
		while (i < line.length() && line.charAt(i) != '\r' && line.charAt(i) != '\n') {
			i++;
		}
		return i;
	}

	private static int column(String line, int index) {
		return line.codePointCount(0, index);
	}

	/** Splits the text after each {@code '\n'}, keeping the line breaks. */
	static List<String> splitLines(String text) {
		List<String> lines = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				lines.add(text.substring(start, i + 1));
				start = i + 1;
			}
		}
		if (start < text.length()) {
			lines.add(text.substring(start));
		}
		return lines;
	}
}
