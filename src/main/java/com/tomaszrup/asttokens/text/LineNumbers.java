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
package com.tomaszrup.asttokens.text;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts between character offsets in a text and (line, column) pairs of
 * 1-based line and 0-based column numbers, as used by tokens and syntax tree
 * nodes.
 *
 * <p>Offsets index the Java string (UTF-16 units) so that they can be passed
 * to {@link String#substring(int, int)} directly. Columns count Unicode code
 * points. A line starts at offset 0 and after every {@code '\n'}; a text
 * ending in a newline therefore has an empty last line.</p>
 */
public class LineNumbers {
	private final String text;
	private final int[] lineOffsets;
	private final Map<Integer, int[]> utf8Columns = new ConcurrentHashMap<>();

	public LineNumbers(String text) {
		this.text = text;
		this.lineOffsets = findLineOffsets(text);
	}

	private static int[] findLineOffsets(String text) {
		int count = 1;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		int[] offsets = new int[count];
		int line = 1;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				offsets[line++] = i + 1;
			}
		}
		return offsets;
	}

	public int getLineCount() {
		return lineOffsets.length;
	}

	public int getTextLength() {
		return text.length();
	}

	/**
	 * Converts a 1-based line number and 0-based code point column to a
	 * 0-based offset into the text. Out-of-range lines clamp to the start or
	 * the end of the text, negative columns clamp to the line start, and the
	 * result never exceeds the text length.
	 */
	public int lineToOffset(int line, int column) {
		int lineIndex = line - 1;
		if (lineIndex >= lineOffsets.length) {
			return text.length();
		}
		if (lineIndex < 0) {
			return 0;
		}
		return advanceCodePoints(lineOffsets[lineIndex], Math.max(0, column));
	}

	/**
	 * Converts a 0-based offset into a (line, column) position. The offset is
	 * clamped to {@code [0, length]} first.
	 */
	public SourcePosition offsetToLine(int offset) {
		int clamped = Math.max(0, Math.min(text.length(), offset));
		int lineIndex = upperBound(lineOffsets, clamped) - 1;
		int lineStart = lineOffsets[lineIndex];
		return new SourcePosition(lineIndex + 1, text.codePointCount(lineStart, clamped));
	}

	/**
	 * Returns the offset of the start of the line that contains the given
	 * offset.
	 */
	public int lineStartOffset(int offset) {
		int clamped = Math.max(0, Math.min(text.length(), offset));
		return lineOffsets[upperBound(lineOffsets, clamped) - 1];
	}

	/**
	 * Translates a column counted in bytes of the UTF-8 encoded line into a
	 * code point column on the same line. Columns past either end of the line
	 * clamp to it.
	 */
	public int fromUtf8Col(int line, int utf8Column) {
		int lineIndex = Math.max(0, Math.min(lineOffsets.length - 1, line - 1));
		int[] columns = utf8Columns.computeIfAbsent(lineIndex, this::buildUtf8Columns);
		return columns[Math.max(0, Math.min(columns.length - 1, utf8Column))];
	}

	/**
	 * Same as {@link #lineToOffset(int, int)} but interprets the column as a
	 * UTF-8 byte column.
	 */
	public int utf8ToOffset(int line, int utf8Column) {
		return lineToOffset(line, fromUtf8Col(line, utf8Column));
	}

	private int[] buildUtf8Columns(int lineIndex) {
		int start = lineOffsets[lineIndex];
		int end = lineIndex + 1 < lineOffsets.length ? lineOffsets[lineIndex + 1] : text.length();
		String lineText = text.substring(start, end);
		int byteLength = 0;
		for (int i = 0; i < lineText.length(); ) {
			int codePoint = lineText.codePointAt(i);
			byteLength += utf8Length(codePoint);
			i += Character.charCount(codePoint);
		}
		// one entry per UTF-8 byte, holding the code point column that byte belongs to
		int[] columns = new int[byteLength + 1];
		int byteIndex = 0;
		int column = 0;
		for (int i = 0; i < lineText.length(); ) {
			int codePoint = lineText.codePointAt(i);
			int byteCount = utf8Length(codePoint);
			Arrays.fill(columns, byteIndex, byteIndex + byteCount, column);
			byteIndex += byteCount;
			column++;
			i += Character.charCount(codePoint);
		}
		columns[byteIndex] = column;
		return columns;
	}

	private static int utf8Length(int codePoint) {
		if (codePoint < 0x80) {
			return 1;
		}
		if (codePoint < 0x800) {
			return 2;
		}
		if (codePoint < 0x10000) {
			return 3;
		}
		return 4;
	}

	private int advanceCodePoints(int offset, int count) {
		int result = offset;
		for (int i = 0; i < count && result < text.length(); i++) {
			result += Character.charCount(text.codePointAt(result));
		}
		return Math.min(result, text.length());
	}

	private static int upperBound(int[] values, int key) {
		int low = 0;
		int high = values.length;
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (values[mid] <= key) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return low;
	}
}
