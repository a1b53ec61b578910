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

import java.util.List;

import com.tomaszrup.asttokens.text.ColumnEncoding;
import com.tomaszrup.asttokens.text.SourcePosition;
import com.tomaszrup.asttokens.tokens.ConsistencyException;
import com.tomaszrup.asttokens.tokens.Token;
import com.tomaszrup.asttokens.tokens.TokenStore;
import com.tomaszrup.asttokens.tokens.TokenType;

/**
 * Assigns every node of a tree its first token.
 *
 * <p>A node starts at the token under its anchor, unless its first child
 * starts earlier (the anchor of a binary operation may sit past its left
 * operand in some trees) or it has no anchor at all. A node with neither
 * anchor nor children inherits the token of its nearest anchored ancestor.
 * Per-kind corrections then move the token to syntax that the tree does not
 * position, such as the {@code [} of a list comprehension.</p>
 */
public final class FirstTokenPass<N> {
	@FunctionalInterface
	interface Correction {
		Token correct(TokenStore store, Token token);
	}

	private static final KindHandlers<Correction> CORRECTIONS = new KindHandlers<Correction>((store, token) -> token)
			.register(FirstTokenPass::listComprehension, "ListComp")
			.register(FirstTokenPass::comprehension, "comprehension")
			.register(FirstTokenPass::decorated, "FunctionDef", "AsyncFunctionDef", "ClassDef");

	private final TokenStore store;
	private final AstDialect<N> dialect;
	private final ColumnEncoding columnEncoding;
	private final TokenMarks marks;
	private final MarkListener listener;

	public FirstTokenPass(TokenStore store, AstDialect<N> dialect, ColumnEncoding columnEncoding, TokenMarks marks,
			MarkListener listener) {
		this.store = store;
		this.dialect = dialect;
		this.columnEncoding = columnEncoding;
		this.marks = marks;
		this.listener = listener;
	}

	public void run(N root) {
		TreeWalker.walk(dialect, root, store.first(), this::beforeChildren, this::afterChildren);
	}

	private TreeWalker.Visit<Token> beforeChildren(N node, Token parentToken) {
		marks.create(node, dialect.kindName(node), dialect.isExpression(node));
		Token token = anchorToken(node);
		return new TreeWalker.Visit<>(token != null ? token : parentToken, token);
	}

	private void afterChildren(N node, Token parentToken, Token anchorToken) {
		List<N> children = dialect.children(node);
		Token childToken = children.isEmpty() ? null : marks.require(children.get(0)).getFirstToken();
		Token token = anchorToken;
		if (token == null || (childToken != null && childToken.getIndex() < token.getIndex())) {
			if (childToken != null) {
				token = childToken;
			} else {
				token = parentToken;
				listener.unsupportedConstruct(new UnsupportedConstruct(node, dialect.kindName(node), parentToken));
			}
		}
		marks.require(node).setFirstToken(CORRECTIONS.get(dialect.kindName(node)).correct(store, token));
	}

	private Token anchorToken(N node) {
		SourcePosition anchor = dialect.anchor(node);
		if (anchor == null) {
			return null;
		}
		if (columnEncoding == ColumnEncoding.UTF8) {
			return store.tokenFromUtf8(anchor.getLine(), anchor.getColumn());
		}
		return store.tokenAt(anchor.getLine(), anchor.getColumn());
	}

	private static Token listComprehension(TokenStore store, Token token) {
		// trees that anchor the comprehension on its element leave the bracket out
		if (token.isOp("[")) {
			return token;
		}
		return ConsistencyException.expect(store.prev(token), TokenType.OP, "[");
	}

	private static Token comprehension(TokenStore store, Token token) {
		Token forToken = store.find(token, TokenType.NAME, "for", true);
		if (store.isEnd(forToken)) {
			throw new ConsistencyException("No 'for' before comprehension at " + token.getStart(), token);
		}
		Token before = codingBefore(store, forToken);
		if (before != null && before.matches(TokenType.NAME, "async")) {
			return before;
		}
		return forToken;
	}

	private static Token decorated(TokenStore store, Token token) {
		Token before = codingBefore(store, token);
		if (before != null && before.isOp("@")) {
			return before;
		}
		return token;
	}

	// null when only comments and blank lines precede the token
	private static Token codingBefore(TokenStore store, Token token) {
		for (int i = token.getIndex() - 1; i >= 0; i--) {
			Token candidate = store.get(i);
			if (!candidate.getType().isNonCoding()) {
				return candidate;
			}
		}
		return null;
	}
}
