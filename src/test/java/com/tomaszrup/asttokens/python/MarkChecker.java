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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.asttokens.python;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Assertions;

import com.tomaszrup.asttokens.AstTokens;
import com.tomaszrup.asttokens.MarkOptions;
import com.tomaszrup.asttokens.mark.TreeWalker;
import com.tomaszrup.asttokens.tokens.Token;

/**
 * Parses and marks a source, with helpers for checking the marks.
 */
public class MarkChecker {
	private static final Pattern INDENTED = Pattern.compile("^[ \t]+\\S");
	private static final Pattern ELIF = Pattern.compile("^(\\s*)elif(\\W)");

	private final PythonParser parser = new PythonParser();
	private final String source;
	private final PythonAstTokens marked;
	private final List<PyNode> allNodes;

	public MarkChecker(String source) {
		this(source, MarkOptions.DEFAULTS);
	}

	public MarkChecker(String source, MarkOptions options) {
		this.source = source;
		this.marked = PythonAstTokens.parse(source, options);
		this.allNodes = TreeWalker.preorder(PythonDialect.INSTANCE, marked.getTree());
	}

	public static String readFixture(String name) {
		try (InputStream in = MarkChecker.class.getResourceAsStream("/fixtures/" + name)) {
			if (in == null) {
				throw new IllegalArgumentException("No fixture " + name);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public AstTokens atok() {
		return marked.getAstTokens();
	}

	public PyNode tree() {
		return marked.getTree();
	}

	/** All nodes except markers, in pre-order. */
	public List<PyNode> allNodes() {
		return allNodes;
	}

	public String view(PyNode node) {
		return node.getKind() + ":" + atok().getText(node);
	}

	/** Views of the nodes whose first token is the token at the given position. */
	public Set<String> viewNodesAt(int line, int column) {
		Token token = atok().getToken(line, column);
		Set<String> views = new HashSet<>();
		for (PyNode node : allNodes) {
			if (atok().getFirstToken(node) == token) {
				views.add(view(node));
			}
		}
		return views;
	}

	public Set<String> viewNodeKindsAt(int line, int column) {
		Token token = atok().getToken(line, column);
		Set<String> kinds = new HashSet<>();
		for (PyNode node : allNodes) {
			if (atok().getFirstToken(node) == token) {
				kinds.add(node.getKind());
			}
		}
		return kinds;
	}

	/**
	 * Returns the 1-based line and 0-based column of the {@code occurrence}-th
	 * (0-based) occurrence of {@code snippet} in the source.
	 */
	public int[] find(String snippet, int occurrence) {
		int offset = -1;
		for (int i = 0; i <= occurrence; i++) {
			offset = source.indexOf(snippet, offset + 1);
			if (offset < 0) {
				throw new IllegalArgumentException("'" + snippet + "' not found in source");
			}
		}
		String before = source.substring(0, offset);
		int line = 1 + (int) before.chars().filter(c -> c == '\n').count();
		int lineStart = before.lastIndexOf('\n') + 1;
		return new int[] { line, source.codePointCount(lineStart, offset) };
	}

	public Set<String> viewNodesAt(String snippet) {
		int[] position = find(snippet, 0);
		return viewNodesAt(position[0], position[1]);
	}

	public Set<String> viewNodeKindsAt(String snippet) {
		int[] position = find(snippet, 0);
		return viewNodeKindsAt(position[0], position[1]);
	}

	/**
	 * Checks that every child's tokens lie within its parent's tokens.
	 */
	public void verifyContainment() {
		for (PyNode node : allNodes) {
			Token first = atok().getFirstToken(node);
			Token last = atok().getLastToken(node);
			Assertions.assertNotNull(first, () -> "unmarked " + node);
			Assertions.assertTrue(first.getIndex() <= last.getIndex(), () -> "reversed tokens for " + node);
			for (PyNode child : PythonDialect.INSTANCE.children(node)) {
				Assertions.assertTrue(atok().getFirstToken(child).getIndex() >= first.getIndex(),
						() -> child + " starts before its parent " + node);
				Assertions.assertTrue(atok().getLastToken(child).getIndex() <= last.getIndex(),
						() -> child + " ends after its parent " + node);
			}
		}
	}

	/**
	 * For every statement and expression, parses its text on its own and
	 * compares the result with the node. Returns the number of nodes checked.
	 */
	public int verifyAllNodes() {
		int tested = 0;
		for (PyNode node : allNodes) {
			boolean module = "Module".equals(node.getKind());
			if (!node.isStatement() && !node.isExpression() && !module) {
				continue;
			}
			// slices cannot be parsed on their own
			if ("Slice".equals(node.getKind()) || hasSliceChild(node)) {
				continue;
			}
			String text = atok().getText(node);
			text = ELIF.matcher(text).replaceFirst("$1if$2");
			PyNode rebuilt = parseSnippet(text, node.isExpression(), module);
			Assertions.assertEquals(node.dump(true), rebuilt.dump(true), "text differs: " + text);
			tested++;
		}
		return tested;
	}

	private static boolean hasSliceChild(PyNode node) {
		for (PyNode child : node.getChildren()) {
			if ("Slice".equals(child.getKind())) {
				return true;
			}
		}
		return false;
	}

	private PyNode parseSnippet(String text, boolean expression, boolean module) {
		if (INDENTED.matcher(text).lookingAt()) {
			// the first child of the wrapper function is its parameter list
			return parser.parse("def dummy():\n" + text).getChildren().get(0).getChildren().get(1);
		}
		if (expression) {
			return parser.parseExpression("(" + text + ")");
		}
		PyNode parsed = parser.parse(text);
		return module ? parsed : parsed.getChildren().get(0);
	}
}
