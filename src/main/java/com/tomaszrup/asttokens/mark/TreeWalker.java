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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.tomaszrup.asttokens.tokens.ConsistencyException;

/**
 * Depth-first traversal over a tree using an explicit stack instead of the
 * call stack, so that degenerate trees (a thousand chained binary operations)
 * cannot overflow the thread's stack.
 *
 * <p>For every node, {@link PreVisit} runs before its children and
 * {@link PostVisit} after all of them. A value computed by a node's pre-visit
 * is handed to its children's callbacks as their {@code parentValue}, and a
 * second value is kept for the node's own post-visit.</p>
 */
public final class TreeWalker {
	private TreeWalker() {
	}

	/**
	 * The pair of values produced by a pre-visit: one for the children, one
	 * for the node's own post-visit.
	 */
	public static final class Visit<V> {
		private final V forChildren;
		private final V forPostVisit;

		public Visit(V forChildren, V forPostVisit) {
			this.forChildren = forChildren;
			this.forPostVisit = forPostVisit;
		}
	}

	@FunctionalInterface
	public interface PreVisit<N, V> {
		Visit<V> visit(N node, V parentValue);
	}

	@FunctionalInterface
	public interface PostVisit<N, V> {
		void visit(N node, V parentValue, V value);
	}

	private static final class Frame<N, V> {
		final N node;
		final V parentValue;
		final V value;
		final boolean expanded;

		Frame(N node, V parentValue, V value, boolean expanded) {
			this.node = node;
			this.parentValue = parentValue;
			this.value = value;
			this.expanded = expanded;
		}
	}

	/**
	 * Walks the tree under {@code root}. Either callback may be {@code null}.
	 *
	 * @throws ConsistencyException if a node is reached twice, which means
	 *                              the "tree" has shared or cyclic nodes
	 */
	public static <N, V> void walk(AstDialect<N> dialect, N root, V rootParentValue, PreVisit<N, V> preVisit,
			PostVisit<N, V> postVisit) {
		Set<Object> done = Collections.newSetFromMap(new IdentityHashMap<>());
		Deque<Frame<N, V>> stack = new ArrayDeque<>();
		stack.push(new Frame<>(root, rootParentValue, null, false));
		while (!stack.isEmpty()) {
			Frame<N, V> current = stack.pop();
			if (current.expanded) {
				if (postVisit != null) {
					postVisit.visit(current.node, current.parentValue, current.value);
				}
				continue;
			}
			if (!done.add(current.node)) {
				throw new ConsistencyException("Node reached twice while walking the tree: "
						+ dialect.kindName(current.node));
			}
			Visit<V> visit = preVisit != null ? preVisit.visit(current.node, current.parentValue) : null;
			V forChildren = visit != null ? visit.forChildren : null;
			V forPostVisit = visit != null ? visit.forPostVisit : null;
			stack.push(new Frame<>(current.node, current.parentValue, forPostVisit, true));
			List<N> children = dialect.children(current.node);
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(new Frame<>(children.get(i), forChildren, null, false));
			}
		}
	}

	/**
	 * Returns all nodes of the tree, parents before children, siblings in
	 * source order.
	 */
	public static <N> List<N> preorder(AstDialect<N> dialect, N root) {
		List<N> nodes = new ArrayList<>();
		walk(dialect, root, null, (N node, Object parentValue) -> {
			nodes.add(node);
			return null;
		}, null);
		return nodes;
	}
}
