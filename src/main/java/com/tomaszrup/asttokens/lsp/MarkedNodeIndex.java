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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.asttokens.AstTokens;
import com.tomaszrup.asttokens.mark.AstDialect;
import com.tomaszrup.asttokens.mark.TreeWalker;
import com.tomaszrup.asttokens.tokens.Token;

/**
 * Position lookups over a marked tree, the way an editor asks for them: which
 * node is under the cursor, which nodes start at a position, and what a
 * node's parent is.
 *
 * <p>Node ranges here run from the start of the first token to the end of the
 * last token, without the line-start widening of
 * {@link AstTokens#getTextRange(Object)}.</p>
 */
public class MarkedNodeIndex<N> {
	private final List<N> nodes = new ArrayList<>();
	private final Map<N, N> parents = new IdentityHashMap<>();
	private final Map<N, Range> ranges = new IdentityHashMap<>();

	public MarkedNodeIndex(AstTokens atok, N root, AstDialect<N> dialect) {
		TreeWalker.walk(dialect, root, null, (N node, N parent) -> {
			if (parent != null) {
				parents.put(node, parent);
			}
			if (atok.isMarked(node)) {
				Token first = atok.getFirstToken(node);
				Token last = atok.getLastToken(node);
				nodes.add(node);
				ranges.put(node, Ranges.fromOffsets(atok.getLineNumbers(), first.getStartPos(), last.getEndPos()));
			}
			return new TreeWalker.Visit<>(node, null);
		}, null);
	}

	/** Marked nodes in pre-order. */
	public List<N> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	public Range getRange(N node) {
		return ranges.get(node);
	}

	public N getParent(N child) {
		return child != null ? parents.get(child) : null;
	}

	public boolean contains(N ancestor, N descendant) {
		N current = getParent(descendant);
		while (current != null) {
			if (current == ancestor) {
				return true;
			}
			current = getParent(current);
		}
		return false;
	}

	/**
	 * Returns the innermost node whose range contains the position, or
	 * {@code null}.
	 */
	public N getNodeAt(Position position) {
		N best = null;
		Range bestRange = null;
		for (N node : nodes) {
			Range range = ranges.get(node);
			if (Ranges.contains(range, position) && isBetterNodeCandidate(best, bestRange, node, range)) {
				best = node;
				bestRange = range;
			}
		}
		return best;
	}

	/** Returns the nodes whose first token starts at the position, outermost first. */
	public List<N> getNodesStartingAt(Position position) {
		List<N> result = new ArrayList<>();
		for (N node : nodes) {
			if (Positions.COMPARATOR.compare(ranges.get(node).getStart(), position) == 0) {
				result.add(node);
			}
		}
		return result;
	}

	private boolean isBetterNodeCandidate(N best, Range bestRange, N candidate, Range candidateRange) {
		if (best == null) {
			return true;
		}
		int startCmp = Positions.COMPARATOR.compare(candidateRange.getStart(), bestRange.getStart());
		if (startCmp > 0) {
			return true;
		}
		if (startCmp < 0) {
			return false;
		}
		int endCmp = Positions.COMPARATOR.compare(candidateRange.getEnd(), bestRange.getEnd());
		if (endCmp < 0) {
			return true;
		}
		return endCmp == 0 && contains(best, candidate);
	}
}
