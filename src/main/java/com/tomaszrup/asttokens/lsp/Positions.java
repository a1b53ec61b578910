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
package com.tomaszrup.asttokens.lsp;

import java.util.Comparator;

import org.eclipse.lsp4j.Position;

import com.tomaszrup.asttokens.text.LineNumbers;

/**
 * Conversions between text offsets and LSP positions, whose lines are 0-based
 * and whose characters count UTF-16 code units.
 */
public class Positions {
	private Positions() {
	}

	public static final Comparator<Position> COMPARATOR = (Position p1, Position p2) -> {
		if (p1.getLine() != p2.getLine()) {
			return Integer.compare(p1.getLine(), p2.getLine());
		}
		return Integer.compare(p1.getCharacter(), p2.getCharacter());
	};

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	public static Position fromOffset(LineNumbers lineNumbers, int offset) {
		int clamped = Math.max(0, Math.min(lineNumbers.getTextLength(), offset));
		int lineStart = lineNumbers.lineStartOffset(clamped);
		return new Position(lineNumbers.offsetToLine(clamped).getLine() - 1, clamped - lineStart);
	}

	/**
	 * Returns the offset of an LSP position, or -1 if the position lies
	 * outside the text or past the end of its line.
	 */
	public static int getOffset(String text, LineNumbers lineNumbers, Position position) {
		if (text == null || position == null || !valid(position)) {
			return -1;
		}
		int line = position.getLine() + 1;
		if (line > lineNumbers.getLineCount()) {
			return -1;
		}
		int lineStartOffset = lineNumbers.lineToOffset(line, 0);
		int lineEndOffset = findLineEndOffset(text, lineStartOffset);
		if (position.getCharacter() > lineEndOffset - lineStartOffset) {
			return -1;
		}
		return lineStartOffset + position.getCharacter();
	}

	private static int findLineEndOffset(String text, int lineStartOffset) {
		for (int i = lineStartOffset; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
		}
		return text.length();
	}
}
