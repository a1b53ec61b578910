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

/**
 * What the marking passes need to know about one kind of syntax tree. The
 * reconciliation algorithm is written once against this interface, and each
 * tree representation (the bundled Python nodes, JSON exports) implements it.
 *
 * <p>Implementations must be stateless with respect to the trees they
 * describe, so that one dialect instance can serve any number of trees.</p>
 *
 * @param <N> the node type
 */
public interface AstDialect<N> {
	/**
	 * Kind tag used to select per-kind corrections, for example
	 * {@code "Call"}. Matching is case-insensitive.
	 */
	String kindName(N node);

	/**
	 * Declared (line, column) of the node, or {@code null} when the node
	 * carries no position. The column is expressed in
	 * {@link #columnEncoding()}.
	 */
	SourcePosition anchor(N node);

	/**
	 * Children in source order. Pseudo-children that denote no source span
	 * of their own (load/store/delete contexts, operator symbols) must be left
	 * out.
	 */
	List<N> children(N node);

	/**
	 * Declared (line, column) where the node's text ends, exclusive, in
	 * {@link #columnEncoding()}. Trees that record only start positions
	 * return {@code null}, which is the default.
	 */
	default SourcePosition endAnchor(N node) {
		return null;
	}

	/**
	 * The first decorator of a decorated definition, or {@code null}. Trees
	 * that anchor such definitions on {@code def} or {@code class} need it to
	 * find the start of the text without tokens.
	 */
	default N firstDecorator(N node) {
		return null;
	}

	boolean isStatement(N node);

	boolean isExpression(N node);

	default boolean isModule(N node) {
		return "Module".equals(kindName(node));
	}

	default ColumnEncoding columnEncoding() {
		return ColumnEncoding.UTF8;
	}
}
