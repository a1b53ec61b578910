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

import java.util.List;
import java.util.Set;

import org.eclipse.lsp4j.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.asttokens.lsp.Ranges;
import com.tomaszrup.asttokens.mark.AstDialect;
import com.tomaszrup.asttokens.mark.FirstTokenPass;
import com.tomaszrup.asttokens.mark.LastTokenPass;
import com.tomaszrup.asttokens.mark.MarkListener;
import com.tomaszrup.asttokens.mark.NodeMark;
import com.tomaszrup.asttokens.mark.TokenMarks;
import com.tomaszrup.asttokens.text.ColumnEncoding;
import com.tomaszrup.asttokens.text.LineNumbers;
import com.tomaszrup.asttokens.text.SourcePosition;
import com.tomaszrup.asttokens.tokens.BracketIntervalIndex;
import com.tomaszrup.asttokens.tokens.ConsistencyException;
import com.tomaszrup.asttokens.tokens.Token;
import com.tomaszrup.asttokens.tokens.TokenInfo;
import com.tomaszrup.asttokens.tokens.TokenStore;
import com.tomaszrup.asttokens.tokens.TokenType;

/**
 * Holds a source text together with its line index and tokens, marks syntax
 * trees of that text with the tokens each node spans, and answers position
 * and text queries about marked nodes.
 *
 * <pre>
 * AstTokens atok = new AstTokens(text, tokens);
 * atok.markTokens(tree, dialect);
 * String callText = atok.getText(callNode);
 * </pre>
 *
 * <p>Nodes are never modified; marks live in a side table keyed by node
 * identity. Several trees of the same text may be marked on one instance.
 * Marking is not thread-safe, but once marking is done all queries are.</p>
 */
public class AstTokens {
	private static final Logger logger = LoggerFactory.getLogger(AstTokens.class);

	private static final Set<String> BLOCK_KINDS = Set.of("ExceptHandler", "excepthandler", "match_case");

	private final String text;
	private final LineNumbers lineNumbers;
	private final TokenStore store;
	private final MarkOptions options;
	private final TokenMarks marks = new TokenMarks();
	private BracketIntervalIndex bracketIndex;
	private boolean bracketIndexFailed;

	public AstTokens(String text, List<TokenInfo> tokens) {
		this(text, tokens, MarkOptions.DEFAULTS);
	}

	public AstTokens(String text, List<TokenInfo> tokens, MarkOptions options) {
		this.text = text;
		this.lineNumbers = new LineNumbers(text);
		this.store = new TokenStore(text, lineNumbers, tokens);
		this.options = options != null ? options : MarkOptions.DEFAULTS;
	}

	public String getText() {
		return text;
	}

	public LineNumbers getLineNumbers() {
		return lineNumbers;
	}

	public TokenStore getTokenStore() {
		return store;
	}

	/** All tokens of the text, ending with the end marker. */
	public List<Token> getTokens() {
		return store.tokens();
	}

	public MarkOptions getOptions() {
		return options;
	}

	/**
	 * Marks every node of the tree under {@code root} with its first and last
	 * token. Findings that do not stop marking are logged.
	 *
	 * @throws ConsistencyException if the tree and the tokens disagree; no
	 *                              node of the tree is marked in that case
	 */
	public <N> void markTokens(N root, AstDialect<N> dialect) {
		markTokens(root, dialect, MarkListener.LOGGING);
	}

	public <N> void markTokens(N root, AstDialect<N> dialect, MarkListener listener) {
		long startTime = System.nanoTime();
		ColumnEncoding encoding = columnEncoding(dialect);
		TokenMarks fresh = new TokenMarks();
		new FirstTokenPass<>(store, dialect, encoding, fresh, listener).run(root);
		new LastTokenPass<>(store, dialect, fresh, options.isBracketIndex() ? bracketIndex() : null).run(root);
		marks.putAll(fresh);
		logger.debug("Marked {} nodes over {} tokens in {}ms", fresh.size(), store.size(),
				(System.nanoTime() - startTime) / 1_000_000);
	}

	private BracketIntervalIndex bracketIndex() {
		if (bracketIndex == null && !bracketIndexFailed) {
			try {
				bracketIndex = BracketIntervalIndex.build(store);
			} catch (ConsistencyException e) {
				bracketIndexFailed = true;
				logger.warn("Cannot build bracket index, scanning tokens instead: {}", e.getMessage());
			}
		}
		return bracketIndex;
	}

	/** The marks of all trees marked so far. */
	public TokenMarks getMarks() {
		return marks;
	}

	public boolean isMarked(Object node) {
		return marks.isMarked(node);
	}

	/** Returns the node's first token, or {@code null} if it is not marked. */
	public Token getFirstToken(Object node) {
		return marks.getFirstToken(node);
	}

	/** Returns the node's last token, or {@code null} if it is not marked. */
	public Token getLastToken(Object node) {
		return marks.getLastToken(node);
	}

	/**
	 * Returns the tokens making up the node, or nothing for a node that is not
	 * marked.
	 */
	public Iterable<Token> getTokens(Object node, boolean includeNonCoding) {
		NodeMark mark = marks.get(node);
		if (mark == null || mark.getLastToken() == null) {
			return List.of();
		}
		return store.range(mark.getFirstToken(), mark.getLastToken(), includeNonCoding);
	}

	public Iterable<Token> getTokens(Object node) {
		return getTokens(node, false);
	}

	/**
	 * Returns the offsets of the text of the node. A node spanning several
	 * logical lines (a compound statement, for instance) starts at the
	 * beginning of its first line, so that its text keeps consistent
	 * indentation. Nodes that are not marked, such as load and store context
	 * markers, give the empty range {@code [0, 0)}.
	 */
	public TextRange getTextRange(Object node) {
		NodeMark mark = marks.get(node);
		if (mark == null || mark.getLastToken() == null) {
			return TextRange.EMPTY;
		}
		int start = mark.getFirstToken().getStartPos();
		if (containsType(mark, TokenType.NEWLINE)) {
			start = lineNumbers.lineStartOffset(start);
		}
		return new TextRange(start, mark.getLastToken().getEndPos());
	}

	/**
	 * Returns the text of the node. An expression continued over several lines
	 * without enclosing brackets of its own is wrapped in parentheses, so that
	 * the text can be parsed by itself.
	 */
	public String getText(Object node) {
		TextRange range = getTextRange(node);
		String nodeText = text.substring(range.getStart(), range.getEnd());
		NodeMark mark = marks.get(node);
		if (mark != null && mark.isExpression() && !containsType(mark, TokenType.NEWLINE)
				&& containsType(mark, TokenType.NL)
				&& !store.isMatchingPair(mark.getFirstToken(), mark.getLastToken())) {
			return "(" + nodeText + ")";
		}
		return nodeText;
	}

	/**
	 * Returns the start of the node's first token and the end of its last
	 * token as line and column pairs. Unlike {@link #getTextRange(Object)},
	 * the start is not moved back to the beginning of its line. Unmarked
	 * nodes give {@code (1, 0)} twice.
	 */
	public SourcePosition[] getTextPositions(Object node) {
		NodeMark mark = marks.get(node);
		if (mark == null || mark.getLastToken() == null) {
			SourcePosition origin = lineNumbers.offsetToLine(0);
			return new SourcePosition[] { origin, origin };
		}
		return new SourcePosition[] { lineNumbers.offsetToLine(mark.getFirstToken().getStartPos()),
				lineNumbers.offsetToLine(mark.getLastToken().getEndPos()) };
	}

	/**
	 * Returns the node's range as an LSP range, or {@code null} if the node is
	 * not marked.
	 */
	public Range getLspRange(Object node) {
		if (!isMarked(node)) {
			return null;
		}
		TextRange range = getTextRange(node);
		return Ranges.fromOffsets(lineNumbers, range.getStart(), range.getEnd());
	}

	/**
	 * Tells whether {@link #getTextRangeUnmarked(Object, AstDialect)} can
	 * answer for the node: modules and nodes without a position always can,
	 * other nodes need an end position on the statement they end with.
	 */
	public <N> boolean supportsUnmarked(N node, AstDialect<N> dialect) {
		if (dialect.isModule(node) || dialect.anchor(node) == null) {
			return true;
		}
		return dialect.endAnchor(lastStatement(node, dialect)) != null;
	}

	/**
	 * Like {@link #getTextRange(Object)}, but computed from the positions
	 * declared in the tree, so the node need not be marked. A module spans the
	 * whole text and nodes without a position give the empty range. A
	 * decorated definition starts at its first decorator. The range of a
	 * compound statement ends where its last nested statement ends, leaving
	 * out trailing comments and semicolons.
	 *
	 * @throws UnsupportedOperationException if the tree declares no end
	 *                                       position for the node
	 */
	public <N> TextRange getTextRangeUnmarked(N node, AstDialect<N> dialect) {
		if (dialect.isModule(node)) {
			return new TextRange(0, text.length());
		}
		SourcePosition anchor = dialect.anchor(node);
		if (anchor == null) {
			return TextRange.EMPTY;
		}
		ColumnEncoding encoding = columnEncoding(dialect);
		N decorator = dialect.firstDecorator(node);
		SourcePosition startAnchor = decorator != null && dialect.anchor(decorator) != null
				? dialect.anchor(decorator)
				: anchor;
		int start = toOffset(startAnchor, encoding);

		N last = lastStatement(node, dialect);
		SourcePosition lastAnchor = dialect.anchor(last);
		if (lastAnchor != null && lastAnchor.getLine() != anchor.getLine()) {
			start = lineNumbers.lineStartOffset(start);
		}
		SourcePosition endAnchor = dialect.endAnchor(last);
		if (endAnchor == null) {
			throw new UnsupportedOperationException("No end position declared for " + dialect.kindName(last)
					+ " at " + (lastAnchor != null ? lastAnchor : anchor));
		}
		return new TextRange(start, Math.max(start, toOffset(endAnchor, encoding)));
	}

	/**
	 * Like {@link #getText(Object)}, but without requiring the node to be
	 * marked. See {@link #getTextRangeUnmarked(Object, AstDialect)}.
	 */
	public <N> String getTextUnmarked(N node, AstDialect<N> dialect) {
		TextRange range = getTextRangeUnmarked(node, dialect);
		return text.substring(range.getStart(), range.getEnd());
	}

	// descends into the last nested statement (or handler, or match case) as long as there is one
	private static <N> N lastStatement(N node, AstDialect<N> dialect) {
		N current = node;
		while (true) {
			N lastChild = null;
			for (N child : dialect.children(current)) {
				if (dialect.isStatement(child) || BLOCK_KINDS.contains(dialect.kindName(child))) {
					lastChild = child;
				}
			}
			if (lastChild == null) {
				return current;
			}
			current = lastChild;
		}
	}

	private <N> ColumnEncoding columnEncoding(AstDialect<N> dialect) {
		return options.getColumnEncoding() != null ? options.getColumnEncoding() : dialect.columnEncoding();
	}

	private int toOffset(SourcePosition position, ColumnEncoding encoding) {
		return encoding == ColumnEncoding.UTF8 ? lineNumbers.utf8ToOffset(position.getLine(), position.getColumn())
				: lineNumbers.lineToOffset(position.getLine(), position.getColumn());
	}

	private boolean containsType(NodeMark mark, TokenType type) {
		for (Token token : store.range(mark.getFirstToken(), mark.getLastToken(), true)) {
			if (token.matches(type)) {
				return true;
			}
		}
		return false;
	}

	public Token getTokenFromOffset(int offset) {
		return store.tokenAtOffset(offset);
	}

	public Token getToken(int line, int column) {
		return store.tokenAt(line, column);
	}

	public Token getTokenFromUtf8(int line, int utf8Column) {
		return store.tokenFromUtf8(line, utf8Column);
	}

	public Token nextToken(Token token, boolean includeNonCoding) {
		return store.next(token, includeNonCoding);
	}

	public Token nextToken(Token token) {
		return store.next(token);
	}

	public Token prevToken(Token token, boolean includeNonCoding) {
		return store.prev(token, includeNonCoding);
	}

	public Token prevToken(Token token) {
		return store.prev(token);
	}

	public Token findToken(Token start, TokenType type, String literal, boolean reverse) {
		return store.find(start, type, literal, reverse);
	}

	public Token findToken(Token start, TokenType type, String literal) {
		return store.find(start, type, literal);
	}

	public Iterable<Token> tokenRange(Token first, Token last, boolean includeNonCoding) {
		return store.range(first, last, includeNonCoding);
	}

	public Iterable<Token> tokenRange(Token first, Token last) {
		return store.range(first, last);
	}
}
