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
import java.util.Deque;
import java.util.List;

import com.tomaszrup.asttokens.tokens.BracketIntervalIndex;
import com.tomaszrup.asttokens.tokens.ConsistencyException;
import com.tomaszrup.asttokens.tokens.Token;
import com.tomaszrup.asttokens.tokens.TokenOutOfRangeException;
import com.tomaszrup.asttokens.tokens.TokenStore;
import com.tomaszrup.asttokens.tokens.TokenType;

/**
 * Assigns every node of a tree its last token. Requires the
 * {@link FirstTokenPass} to have completed for the whole tree.
 *
 * <p>A node provisionally ends where its last child ends. Opening brackets
 * among the node's own tokens (those not inside any child) that are not
 * closed before that point extend the node up to their closers, so that
 * {@code f(x)} ends at {@code )} rather than at {@code x}. Statements then
 * extend to the end of their logical line, and per-kind corrections add
 * syntax that follows the last child, such as the {@code .name} of an
 * attribute access.</p>
 */
public final class LastTokenPass<N> {
	@FunctionalInterface
	interface Correction {
		Token correct(TokenStore store, Token first, Token last);
	}

	private static final KindHandlers<Correction> CORRECTIONS = new KindHandlers<Correction>(
			(store, first, last) -> last)
			.register(LastTokenPass::attribute, "Attribute", "AssignAttr", "DelAttr")
			.register((store, first, last) -> store.find(last, TokenType.OP, ")"), "Call")
			.register((store, first, last) -> store.find(last, TokenType.OP, "]"), "Subscript")
			.register(LastTokenPass::tuple, "Tuple")
			.register(LastTokenPass::number, "Num")
			.register(LastTokenPass::string, "Str", "Bytes", "JoinedStr", "Constant")
			.register(LastTokenPass::slice, "Slice")
			.register(LastTokenPass::alias, "alias");

	private final TokenStore store;
	private final AstDialect<N> dialect;
	private final TokenMarks marks;
	private final BracketIntervalIndex bracketIndex;

	/**
	 * @param bracketIndex when not {@code null}, unclosed brackets are
	 *                     resolved with the index instead of scanning the
	 *                     node's tokens
	 */
	public LastTokenPass(TokenStore store, AstDialect<N> dialect, TokenMarks marks,
			BracketIntervalIndex bracketIndex) {
		this.store = store;
		this.dialect = dialect;
		this.marks = marks;
		this.bracketIndex = bracketIndex;
	}

	public void run(N root) {
		TreeWalker.<N, Void>walk(dialect, root, null, null, (node, parentValue, value) -> markLast(node));
	}

	private void markLast(N node) {
		NodeMark mark = marks.require(node);
		List<N> children = dialect.children(node);
		Token first = mark.getFirstToken();
		Token last = children.isEmpty() ? first : marks.require(children.get(children.size() - 1)).getLastToken();
		if (last.getIndex() < first.getIndex()) {
			last = first;
		}

		last = bracketIndex != null ? closeWithIndex(first, last) : closeByScanning(node, children, first, last);

		if (dialect.isStatement(node)) {
			last = lastInLine(last);
		}
		mark.setLastToken(CORRECTIONS.get(dialect.kindName(node)).correct(store, first, last));
	}

	private Token closeByScanning(N node, List<N> children, Token first, Token last) {
		Deque<String> expected = new ArrayDeque<>();
		int from = first.getIndex();
		boolean reachedEnd = false;
		for (N child : children) {
			NodeMark childMark = marks.require(child);
			scanGap(from, childMark.getFirstToken().getIndex(), expected);
			if (childMark.getLastToken().getIndex() >= last.getIndex()) {
				reachedEnd = true;
				break;
			}
			from = Math.max(from, childMark.getLastToken().getIndex() + 1);
		}
		if (!reachedEnd) {
			scanGap(from, last.getIndex() + 1, expected);
		}

		Token current = last;
		while (!expected.isEmpty()) {
			if (store.isEnd(current)) {
				throw new ConsistencyException("Expected '" + expected.peek() + "' before the end of input at "
						+ current.getStart(), current);
			}
			current = store.next(current);
			// a trailing comma may precede the closer: [1, 2,]
			if (current.isOp(",") && store.next(current).isOp(expected.peek())) {
				continue;
			}
			ConsistencyException.expect(current, TokenType.OP, expected.pop());
		}
		return current;
	}

	private void scanGap(int from, int to, Deque<String> expected) {
		for (int i = from; i < to; i++) {
			Token token = store.get(i);
			if (token.getType().isNonCoding()) {
				continue;
			}
			if (!expected.isEmpty() && token.isOp(expected.peek())) {
				expected.pop();
			} else if (token.isOpeningBracket()) {
				expected.push(token.closingBracket());
			}
		}
	}

	private Token closeWithIndex(Token first, Token last) {
		int[] enclosing = bracketIndex.smallestEnclosing(first.getIndex(), last.getIndex());
		return enclosing[1] > last.getIndex() ? store.get(enclosing[1]) : last;
	}

	/**
	 * Returns the last coding token before the {@code NEWLINE}, {@code ;} or
	 * end marker that ends the logical line containing {@code start}.
	 */
	private Token lastInLine(Token start) {
		Token end = start;
		while (!end.getType().isEof() && !end.matches(TokenType.NEWLINE) && !end.isOp(";")) {
			end = store.next(end, true);
		}
		if (end.getIndex() == start.getIndex()) {
			return start;
		}
		Token last = store.prev(end);
		while (last.matches(TokenType.DEDENT) && last.getIndex() > start.getIndex()) {
			last = store.prev(last);
		}
		return last;
	}

	private static Token attribute(TokenStore store, Token first, Token last) {
		if (store.isEnd(last)) {
			throw new ConsistencyException("Attribute runs past the end of input at " + last.getStart(), last);
		}
		Token dot = ConsistencyException.expect(store.next(last), TokenType.OP, ".");
		return ConsistencyException.expect(store.next(dot), TokenType.NAME, null);
	}

	private static Token tuple(TokenStore store, Token first, Token last) {
		if (store.isMatchingPair(first, last) || store.isEnd(last)) {
			return last;
		}
		Token next = store.next(last);
		return next.isOp(",") ? next : last;
	}

	private static Token number(TokenStore store, Token first, Token last) {
		// signed literals folded into one node are anchored on the sign
		Token current = last;
		while (current.matches(TokenType.OP)) {
			current = store.next(current);
		}
		return current;
	}

	private static Token string(TokenStore store, Token first, Token last) {
		Token current = last;
		while (!store.isEnd(current) && store.next(current).matches(TokenType.STRING)) {
			current = store.next(current);
		}
		return current;
	}

	private static Token slice(TokenStore store, Token first, Token last) {
		Token current = last;
		while (!store.isEnd(current) && store.next(current).isOp(":")) {
			current = store.next(current);
		}
		return current;
	}

	private static Token alias(TokenStore store, Token first, Token last) {
		Token current = last;
		try {
			while (store.next(current).isOp(".") && store.next(store.next(current)).matches(TokenType.NAME)) {
				current = store.next(store.next(current));
			}
			if (store.next(current).matches(TokenType.NAME, "as")) {
				current = ConsistencyException.expect(store.next(store.next(current)), TokenType.NAME, null);
			}
		} catch (TokenOutOfRangeException e) {
			throw new ConsistencyException("Import alias runs past the end of input at " + last.getStart(), last);
		}
		return current;
	}
}
