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

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.asttokens.text.LineNumbers;

public class Ranges {
	private Ranges() {
	}

	public static boolean contains(Range range, Position position) {
		return Positions.COMPARATOR.compare(position, range.getStart()) >= 0
				&& Positions.COMPARATOR.compare(position, range.getEnd()) <= 0;
	}

	public static boolean contains(Range outer, Range inner) {
		return contains(outer, inner.getStart()) && contains(outer, inner.getEnd());
	}

	public static boolean intersect(Range r1, Range r2) {
		return contains(r1, r2.getStart()) || contains(r1, r2.getEnd());
	}

	public static Range fromOffsets(LineNumbers lineNumbers, int start, int end) {
		return new Range(Positions.fromOffset(lineNumbers, start), Positions.fromOffset(lineNumbers, end));
	}

	/**
	 * Returns the text covered by the range, or {@code null} if either end
	 * of the range is not a position in the text.
	 */
	public static String getSubstring(String text, LineNumbers lineNumbers, Range range) {
		if (text == null) {
			return null;
		}
		int start = Positions.getOffset(text, lineNumbers, range.getStart());
		int end = Positions.getOffset(text, lineNumbers, range.getEnd());
		if (start < 0 || end < start) {
			return null;
		}
		return text.substring(start, end);
	}
}
