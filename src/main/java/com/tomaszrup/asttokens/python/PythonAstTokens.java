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

import com.tomaszrup.asttokens.AstTokens;
import com.tomaszrup.asttokens.BatchMarker;
import com.tomaszrup.asttokens.MarkOptions;

/**
 * Entry points for marking Python source with the bundled tokenizer and
 * parser.
 */
public final class PythonAstTokens {
	private static final PythonTokenizer TOKENIZER = new PythonTokenizer();
	private static final PythonParser PARSER = new PythonParser();

	private final AstTokens astTokens;
	private final PyNode tree;

	private PythonAstTokens(AstTokens astTokens, PyNode tree) {
		this.astTokens = astTokens;
		this.tree = tree;
	}

	/**
	 * Tokenizes and parses the source, then marks the tree.
	 *
	 * @throws PythonSyntaxException if the source is not valid Python
	 */
	public static PythonAstTokens parse(String source) {
		return parse(source, MarkOptions.DEFAULTS);
	}

	public static PythonAstTokens parse(String source, MarkOptions options) {
		AstTokens atok = new AstTokens(source, TOKENIZER.tokenize(source), options);
		PyNode tree = PARSER.parse(source);
		atok.markTokens(tree, PythonDialect.INSTANCE);
		return new PythonAstTokens(atok, tree);
	}

	/** A batch marker for Python sources. */
	public static BatchMarker<PyNode> batchMarker(MarkOptions options, int threads) {
		return new BatchMarker<>(PythonDialect.INSTANCE, TOKENIZER::tokenize, PARSER::parse, options, threads);
	}

	public AstTokens getAstTokens() {
		return astTokens;
	}

	/** The marked {@code Module} node. */
	public PyNode getTree() {
		return tree;
	}
}
