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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Nested intervals over the bracket tokens of a {@link TokenStore}, used to
 * find the smallest balanced span enclosing a token range in logarithmic
 * time.
 *
 * <p>Every matched bracket pair is an interval; its children partition the
 * tokens strictly between the two brackets densely and without overlap
 * ({@code child[i].high + 1 == child[i + 1].low}). Gaps between bracket pairs
 * are filled with empty intervals, which contain no unbalanced bracket and are
 * never widened. The root covers the whole token sequence but, having no
 * brackets of its own, is never widened either.</p>
 *
 * <pre>
 *   ( a + b + [ c ] * 3 )
 *   ^        ^ high
 *   low               ^ widened to here
 * </pre>
 */
public class BracketIntervalIndex {
	private enum Kind {
		ROOT, PAIR, EMPTY
	}

	private static final class Interval {
		final Kind kind;
		final int low;
		int high;
		final List<Interval> pairs = new ArrayList<>();
		Interval[] children = new Interval[0];
		int[] lows = new int[0];
		int[] highs = new int[0];

		Interval(Kind kind, int low, int high) {
			this.kind = kind;
			this.low = low;
			this.high = high;
		}

		/**
		 * Fills the gaps between the bracket pairs appended so far with empty
		 * intervals and precomputes the bound arrays used for bisection.
		 */
		void seal() {
			int contentLow = kind == Kind.ROOT ? low : low + 1;
			int contentHigh = kind == Kind.ROOT ? high : high - 1;
			List<Interval> dense = new ArrayList<>(pairs.size() * 2 + 1);
			int next = contentLow;
			for (Interval pair : pairs) {
				if (pair.low > next) {
					dense.add(new Interval(Kind.EMPTY, next, pair.low - 1));
				}
				dense.add(pair);
				next = pair.high + 1;
			}
			if (next <= contentHigh) {
				dense.add(new Interval(Kind.EMPTY, next, contentHigh));
			}
			children = dense.toArray(new Interval[0]);
			lows = new int[children.length];
			highs = new int[children.length];
			for (int i = 0; i < children.length; i++) {
				lows[i] = children[i].low;
				highs[i] = children[i].high;
			}
			pairs.clear();
		}

		@Override
		public String toString() {
			return kind + "[" + low + "-" + high + "]";
		}
	}

	private final Interval root;
	private final int[] matching;

	private BracketIntervalIndex(Interval root, int[] matching) {
		this.root = root;
		this.matching = matching;
	}

	/**
	 * Builds the index with a single scan over the tokens.
	 *
	 * @throws ConsistencyException if the brackets of the sequence are not
	 *                              balanced
	 */
	public static BracketIntervalIndex build(TokenStore store) {
		int count = store.size();
		Interval root = new Interval(Kind.ROOT, 0, count - 1);
		int[] matching = new int[count];
		Arrays.fill(matching, -1);
		List<Interval> all = new ArrayList<>();
		all.add(root);
		Deque<Interval> stack = new ArrayDeque<>();
		stack.push(root);
		for (Token token : store.tokens()) {
			if (token.isOpeningBracket()) {
				Interval pair = new Interval(Kind.PAIR, token.getIndex(), -1);
				stack.peek().pairs.add(pair);
				stack.push(pair);
				all.add(pair);
			} else if (token.isClosingBracket()) {
				Interval pair = stack.peek();
				if (pair.kind != Kind.PAIR
						|| !token.isOp(store.get(pair.low).closingBracket())) {
					throw new ConsistencyException("Unbalanced closing bracket " + token + " at " + token.getStart(),
							token);
				}
				stack.pop();
				pair.high = token.getIndex();
				matching[pair.low] = pair.high;
				matching[pair.high] = pair.low;
			}
		}
		if (stack.size() != 1) {
			Token open = store.get(stack.peek().low);
			throw new ConsistencyException("Unclosed bracket " + open + " at " + open.getStart(), open);
		}
		for (Interval interval : all) {
			interval.seal();
		}
		return new BracketIntervalIndex(root, matching);
	}

	/**
	 * Returns the index of the bracket matching the bracket at
	 * {@code tokenIndex}, or -1 if that token is not a bracket.
	 */
	public int matchingBracket(int tokenIndex) {
		return matching[tokenIndex];
	}

	public boolean isMatchingPair(int low, int high) {
		return low < high && matching[low] == high;
	}

	/**
	 * Returns {@code {low', high'}}, the bounds of the smallest bracket pair
	 * (at any depth) whose span contains {@code [low, high]}, or the inputs
	 * themselves when the range does not straddle an unbalanced bracket.
	 */
	public int[] smallestEnclosing(int low, int high) {
		if (low > high || low < root.low || high > root.high) {
			throw new IllegalArgumentException("Invalid token range [" + low + ", " + high + "]");
		}
		Interval node = root;
		while (true) {
			if (node.kind == Kind.EMPTY) {
				return new int[] { low, high };
			}
			if (node.kind == Kind.PAIR) {
				// a range touching one bracket of the pair spans the whole pair
				if (low == node.low) {
					return new int[] { low, node.high };
				}
				if (high == node.high) {
					return new int[] { node.low, high };
				}
			}
			if (node.children.length == 0) {
				return new int[] { low, high };
			}
			Interval lowChild = node.children[upperBound(node.lows, low) - 1];
			if (high <= lowChild.high) {
				node = lowChild;
				continue;
			}
			Interval highChild = node.children[lowerBound(node.highs, high)];
			int newLow = lowChild.kind == Kind.EMPTY ? low : lowChild.low;
			int newHigh = highChild.kind == Kind.EMPTY ? high : highChild.high;
			return new int[] { newLow, newHigh };
		}
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

	private static int lowerBound(int[] values, int key) {
		int low = 0;
		int high = values.length;
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (values[mid] < key) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return low;
	}
}
