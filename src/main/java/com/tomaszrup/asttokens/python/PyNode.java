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
package com.tomaszrup.asttokens.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * A node of a Python syntax tree, named and positioned like the nodes of
 * CPython's {@code ast} module: {@link #getLineNo()} is 1-based and
 * {@link #getColOffset()} counts UTF-8 bytes. Nodes without a position
 * ({@code arguments}, {@code comprehension}, {@code withitem}, markers) report
 * a line number of 0.
 *
 * <p>Markers are nodes that denote no source text of their own, such as the
 * {@code Load} context of a name that is read or the {@code Add} operator of a
 * binary operation. They are kept as children so that dumps show them, and
 * left out by {@link PythonDialect}.</p>
 */
public final class PyNode {
	private static final Set<String> STATEMENTS = Set.of("FunctionDef", "AsyncFunctionDef", "ClassDef", "Return",
			"Delete", "Assign", "AugAssign", "AnnAssign", "For", "AsyncFor", "While", "If", "With", "AsyncWith",
			"Raise", "Try", "Assert", "Import", "ImportFrom", "Global", "Nonlocal", "Expr", "Pass", "Break",
			"Continue");
	private static final Set<String> EXPRESSIONS = Set.of("BoolOp", "NamedExpr", "BinOp", "UnaryOp", "Lambda",
			"IfExp", "Dict", "Set", "ListComp", "SetComp", "DictComp", "GeneratorExp", "Await", "Yield", "YieldFrom",
			"Compare", "Call", "FormattedValue", "JoinedStr", "Num", "Str", "Bytes", "NameConstant", "Ellipsis",
			"Attribute", "Subscript", "Starred", "Name", "List", "Tuple", "Slice");
	private static final Set<String> CONTEXTS = Set.of("Load", "Store", "Del");

	private final String kind;
	private final String value;
	private final int lineNo;
	private final int colOffset;
	private final boolean marker;
	private final List<PyNode> children = new ArrayList<>();

	private PyNode(String kind, String value, int lineNo, int colOffset, boolean marker) {
		this.kind = kind;
		this.value = value;
		this.lineNo = lineNo;
		this.colOffset = colOffset;
		this.marker = marker;
	}

	/** A positioned node. */
	public static PyNode of(String kind, int lineNo, int colOffset) {
		return new PyNode(kind, null, lineNo, colOffset, false);
	}

	/** A positioned leaf carrying a value, such as a name or a literal. */
	public static PyNode leaf(String kind, String value, int lineNo, int colOffset) {
		return new PyNode(kind, value, lineNo, colOffset, false);
	}

	/** A node without a position. */
	public static PyNode unpositioned(String kind) {
		return new PyNode(kind, null, 0, -1, false);
	}

	/** A marker: a context or operator. */
	public static PyNode marker(String kind) {
		return new PyNode(kind, null, 0, -1, true);
	}

	PyNode add(PyNode child) {
		if (child != null) {
			children.add(child);
		}
		return this;
	}

	PyNode addAll(List<PyNode> nodes) {
		for (PyNode node : nodes) {
			add(node);
		}
		return this;
	}

	/** Replaces this node's load/store/delete marker. */
	void setContext(String context) {
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i).isContext()) {
				children.set(i, marker(context));
				return;
			}
		}
	}

	public String getKind() {
		return kind;
	}

	/**
	 * The identifier or literal text of a leaf ({@code Name}, {@code Num},
	 * {@code Str}, {@code arg}, {@code alias}, ...), else {@code null}.
	 */
	public String getValue() {
		return value;
	}

	public int getLineNo() {
		return lineNo;
	}

	public int getColOffset() {
		return colOffset;
	}

	public boolean hasPosition() {
		return lineNo > 0;
	}

	public boolean isMarker() {
		return marker;
	}

	public boolean isContext() {
		return marker && CONTEXTS.contains(kind);
	}

	public boolean isStatement() {
		return STATEMENTS.contains(kind);
	}

	public boolean isExpression() {
		return EXPRESSIONS.contains(kind);
	}

	/** All children in source order, markers included. */
	public List<PyNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * Renders the tree without positions, for comparing trees parsed from
	 * different texts. With {@code ignoreContext}, {@code Load}, {@code Store}
	 * and {@code Del} markers are left out, so that an expression parsed
	 * alone and the same expression parsed as an assignment target compare
	 * equal.
	 */
	public String dump(boolean ignoreContext) {
		StringBuilder builder = new StringBuilder();
		// explicit stack: the closing parenthesis is pushed as a sentinel
		Deque<Object> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty()) {
			Object item = stack.pop();
			if (item instanceof String) {
				builder.append((String) item);
				continue;
			}
			PyNode node = (PyNode) item;
			builder.append(node.kind);
			if (node.value != null) {
				builder.append(':').append(node.value);
			}
			builder.append('(');
			stack.push(")");
			boolean first = true;
			List<Object> pending = new ArrayList<>();
			for (PyNode child : node.children) {
				if (ignoreContext && child.isContext()) {
					continue;
				}
				if (!first) {
					pending.add(", ");
				}
				pending.add(child);
				first = false;
			}
			for (int i = pending.size() - 1; i >= 0; i--) {
				stack.push(pending.get(i));
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		if (!hasPosition()) {
			return kind;
		}
		return kind + (value != null ? ":" + value : "") + "@" + lineNo + ":" + colOffset;
	}
}
