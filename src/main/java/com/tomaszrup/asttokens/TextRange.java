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

/**
 * A half-open range {@code [start, end)} of character offsets into a source
 * text.
 */
public final class TextRange {
	public static final TextRange EMPTY = new TextRange(0, 0);

	private final int start;
	private final int end;

	public TextRange(int start, int end) {
		this.start = start;
		this.end = end;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public boolean isEmpty() {
		return start == end;
	}

	public boolean contains(TextRange other) {
		return start <= other.start && other.end <= end;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TextRange)) return false;
		TextRange other = (TextRange) o;
		return start == other.start && end == other.end;
	}

	@Override
	public int hashCode() {
		return 31 * start + end;
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}
}
