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

import java.util.ArrayList;
import java.util.List;

import com.tomaszrup.asttokens.mark.AstDialect;
import com.tomaszrup.asttokens.text.SourcePosition;

/**
 * Describes {@link PyNode} trees to the marking passes. Markers are hidden,
 * so contexts and operators are never marked.
 */
public final class PythonDialect implements AstDialect<PyNode> {
	public static final PythonDialect INSTANCE = new PythonDialect();

	private PythonDialect() {
	}

	@Override
	public String kindName(PyNode node) {
		return node.getKind();
	}

	@Override
	public SourcePosition anchor(PyNode node) {
		return node.hasPosition() ? new SourcePosition(node.getLineNo(), node.getColOffset()) : null;
	}

	@Override
	public List<PyNode> children(PyNode node) {
		List<PyNode> children = new ArrayList<>(node.getChildren().size());
		for (PyNode child : node.getChildren()) {
			if (!child.isMarker()) {
				children.add(child);
			}
		}
		return children;
	}

	@Override
	public boolean isStatement(PyNode node) {
		return node.isStatement();
	}

	@Override
	public boolean isExpression(PyNode node) {
		return node.isExpression();
	}
}
