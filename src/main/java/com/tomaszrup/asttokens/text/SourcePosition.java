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

import java.util.Comparator;

/**
 * A 1-based line and 0-based column pair, the coordinate system used by
 * tokenizers and syntax tree anchors.
 */
public final class SourcePosition {
	public static final Comparator<SourcePosition> COMPARATOR = (SourcePosition p1, SourcePosition p2) -> {
		if (p1.line != p2.line) {
			return Integer.compare(p1.line, p2.line);
		}
		return Integer.compare(p1.column, p2.column);
	};

	private final int line;
	private final int column;

	public SourcePosition(int line, int column) {
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SourcePosition)) return false;
		SourcePosition other = (SourcePosition) o;
		return line == other.line && column == other.column;
	}

	@Override
	public int hashCode() {
		return 31 * line + column;
	}

	@Override
	public String toString() {
		return "(" + line + ", " + column + ")";
	}
}
