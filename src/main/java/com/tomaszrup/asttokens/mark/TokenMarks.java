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
package com.tomaszrup.asttokens.mark;

import java.util.IdentityHashMap;
import java.util.Map;

import com.tomaszrup.asttokens.tokens.Token;

/**
 * Side table from nodes to their {@link NodeMark}s. Nodes are keyed by
 * identity: tree node types (such as Gson's {@code JsonObject}) may override
 * {@code equals()} with structural comparisons, and two equal-looking nodes
 * in different places of a tree must keep separate marks.
 */
public final class TokenMarks {
	private final Map<Object, NodeMark> marks = new IdentityHashMap<>();

	public NodeMark get(Object node) {
		return marks.get(node);
	}

	public boolean isMarked(Object node) {
		NodeMark mark = marks.get(node);
		return mark != null && mark.getLastToken() != null;
	}

	public Token getFirstToken(Object node) {
		NodeMark mark = marks.get(node);
		return mark != null ? mark.getFirstToken() : null;
	}

	public Token getLastToken(Object node) {
		NodeMark mark = marks.get(node);
		return mark != null ? mark.getLastToken() : null;
	}

	public int size() {
		return marks.size();
	}

	/** Copies every mark of {@code other} into this table. */
	public void putAll(TokenMarks other) {
		marks.putAll(other.marks);
	}

	NodeMark create(Object node, String kindName, boolean expression) {
		NodeMark mark = new NodeMark(kindName, expression);
		marks.put(node, mark);
		return mark;
	}

	NodeMark require(Object node) {
		NodeMark mark = marks.get(node);
		if (mark == null) {
			throw new IllegalStateException("Node has not been visited by the first-token pass: " + node);
		}
		return mark;
	}
}
