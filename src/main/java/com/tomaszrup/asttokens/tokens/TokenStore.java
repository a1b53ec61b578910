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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.tomaszrup.asttokens.text.LineNumbers;
import com.tomaszrup.asttokens.text.SourcePosition;

/**
 * The ordered, immutable token sequence of one source text.
 *
 * <p>The last token is always an {@link TokenType#ENDMARKER}; one is appended
 * when the tokenizer's stream lacks it. Start offsets never decrease. Only
 * zero-width tokens ({@code DEDENT}, {@code ENDMARKER}) share a start offset
 * with their successor, and offset lookups resolve such ties to the last of
 * the tokens starting there.</p>
 */
public class TokenStore {
	private final String text;
	private final LineNumbers lineNumbers;
	private final List<Token> tokens;
	private final int[] startOffsets;

	public TokenStore(String text, LineNumbers lineNumbers, List<TokenInfo> tokenInfos) {
		this.text = text;
		this.lineNumbers = lineNumbers;
		List<Token> list = new ArrayList<>(tokenInfos.size() + 1);
		for (TokenInfo info : tokenInfos) {
			list.add(toToken(info, list.size()));
		}
		if (list.isEmpty() || !list.get(list.size() - 1).getType().isEof()) {
			SourcePosition end = lineNumbers.offsetToLine(text.length());
			list.add(toToken(new TokenInfo(TokenType.ENDMARKER, "", end, end), list.size()));
		}
		this.tokens = Collections.unmodifiableList(list);
		this.startOffsets = new int[list.size()];
		for (int i = 0; i < startOffsets.length; i++) {
			startOffsets[i] = list.get(i).getStartPos();
			if (i > 0 && startOffsets[i] < startOffsets[i - 1]) {
				throw new ConsistencyException("Token " + list.get(i) + " at " + list.get(i).getStart()
						+ " starts before its predecessor " + list.get(i - 1), list.get(i));
			}
		}
	}

	private Token toToken(TokenInfo info, int index) {
		SourcePosition start = info.getStart();
		SourcePosition end = info.getEnd();
		return new Token(info.getType(), info.getString(), start, end, index,
				lineNumbers.lineToOffset(start.getLine(), start.getColumn()),
				lineNumbers.lineToOffset(end.getLine(), end.getColumn()));
	}

	public String text() {
		return text;
	}

	public LineNumbers lineNumbers() {
		return lineNumbers;
	}

	/** All tokens in order, ending with the end marker. */
	public List<Token> tokens() {
		return tokens;
	}

	public Token get(int index) {
		return tokens.get(index);
	}

	public int size() {
		return tokens.size();
	}

	public Token first() {
		return tokens.get(0);
	}

	public Token endMarker() {
		return tokens.get(tokens.size() - 1);
	}

	public boolean isEnd(Token token) {
		return token.getType().isEof();
	}

	/**
	 * Returns the token containing the given character offset, or the
	 * preceding token if the offset falls between tokens.
	 */
	public Token tokenAtOffset(int offset) {
		int low = 0;
		int high = startOffsets.length;
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (startOffsets[mid] <= offset) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return tokens.get(Math.max(0, low - 1));
	}

	/**
	 * Returns the token containing the given (line, code point column)
	 * position, or the preceding token if the position is between tokens.
	 */
	public Token tokenAt(int line, int column) {
		return tokenAtOffset(lineNumbers.lineToOffset(line, column));
	}

	/**
	 * Same as {@link #tokenAt(int, int)}, but interprets the column as a UTF-8
	 * byte column.
	 */
	public Token tokenFromUtf8(int line, int utf8Column) {
		return tokenAt(line, lineNumbers.fromUtf8Col(line, utf8Column));
	}

	/**
	 * Returns the token after the given one. Unless {@code includeNonCoding}
	 * is set, comments and non-logical line breaks are skipped.
	 *
	 * @throws TokenOutOfRangeException when stepping past the end marker
	 */
	public Token next(Token token, boolean includeNonCoding) {
		int i = token.getIndex() + 1;
		if (!includeNonCoding) {
			while (i < tokens.size() && tokens.get(i).getType().isNonCoding()) {
				i++;
			}
		}
		if (i >= tokens.size()) {
			throw new TokenOutOfRangeException("No token after " + token + " at " + token.getStart());
		}
		return tokens.get(i);
	}

	public Token next(Token token) {
		return next(token, false);
	}

	/**
	 * Returns the token before the given one. Unless {@code includeNonCoding}
	 * is set, comments and non-logical line breaks are skipped.
	 *
	 * @throws TokenOutOfRangeException when stepping before the first token
	 */
	public Token prev(Token token, boolean includeNonCoding) {
		int i = token.getIndex() - 1;
		if (!includeNonCoding) {
			while (i >= 0 && tokens.get(i).getType().isNonCoding()) {
				i--;
			}
		}
		if (i < 0) {
			throw new TokenOutOfRangeException("No token before " + token + " at " + token.getStart());
		}
		return tokens.get(i);
	}

	public Token prev(Token token) {
		return prev(token, false);
	}

	/**
	 * Looks for the first token, starting at {@code start} itself, that has
	 * the given type and, if {@code literal} is not {@code null}, the given
	 * text. Searches backwards if {@code reverse} is set. Non-coding tokens
	 * are considered too.
	 *
	 * <p>When no token matches, the end marker is returned rather than an
	 * exception thrown; check the result with {@link #isEnd(Token)}.</p>
	 */
	public Token find(Token start, TokenType type, String literal, boolean reverse) {
		int step = reverse ? -1 : 1;
		for (int i = start.getIndex(); i >= 0 && i < tokens.size(); i += step) {
			Token token = tokens.get(i);
			if (token.matches(type, literal)) {
				return token;
			}
			if (token.getType().isEof()) {
				break;
			}
		}
		return endMarker();
	}

	public Token find(Token start, TokenType type, String literal) {
		return find(start, type, literal, false);
	}

	/**
	 * Returns the tokens from {@code first} through {@code last}, both
	 * included. The returned iterable is lazy and can be iterated any number of
	 * times.
	 */
	public Iterable<Token> range(Token first, Token last, boolean includeNonCoding) {
		int from = first.getIndex();
		int to = last.getIndex();
		return () -> new RangeIterator(from, to, includeNonCoding);
	}

	public Iterable<Token> range(Token first, Token last) {
		return range(first, last, false);
	}

	/**
	 * Returns whether {@code first} is an opening bracket whose matching
	 * closing bracket is {@code last}.
	 */
	public boolean isMatchingPair(Token first, Token last) {
		String closer = first.closingBracket();
		if (closer == null || !last.isOp(closer) || last.getIndex() <= first.getIndex()) {
			return false;
		}
		int depth = 0;
		for (int i = first.getIndex(); i <= last.getIndex(); i++) {
			Token token = tokens.get(i);
			if (token.isOpeningBracket()) {
				depth++;
			} else if (token.isClosingBracket()) {
				depth--;
				if (depth == 0) {
					return i == last.getIndex();
				}
			}
		}
		return false;
	}

	private final class RangeIterator implements Iterator<Token> {
		private final int last;
		private final boolean includeNonCoding;
		private int current;

		RangeIterator(int first, int last, boolean includeNonCoding) {
			this.last = last;
			this.includeNonCoding = includeNonCoding;
			this.current = first;
			skipFiltered();
		}

		private void skipFiltered() {
			if (includeNonCoding) {
				return;
			}
			while (current <= last && tokens.get(current).getType().isNonCoding()) {
				current++;
			}
		}

		@Override
		public boolean hasNext() {
			return current <= last;
		}

		@Override
		public Token next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			Token token = tokens.get(current++);
			skipFiltered();
			return token;
		}
	}
}
