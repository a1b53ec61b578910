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
package com.tomaszrup.asttokens.lsp;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.asttokens.python.PyNode;
import com.tomaszrup.asttokens.python.PythonAstTokens;
import com.tomaszrup.asttokens.python.PythonDialect;

class MarkedNodeIndexTests {
	private PythonAstTokens marked;
	private MarkedNodeIndex<PyNode> index;

	@BeforeEach
	void setup() {
		marked = PythonAstTokens.parse("x = foo(a, b)\n");
		index = new MarkedNodeIndex<>(marked.getAstTokens(), marked.getTree(), PythonDialect.INSTANCE);
	}

	private String view(PyNode node) {
		return node == null ? null : node.getKind() + ":" + marked.getAstTokens().getText(node);
	}

	@Test
	void testNodesSkipMarkers() {
		Assertions.assertEquals(7, index.getNodes().size());
		Assertions.assertSame(marked.getTree(), index.getNodes().get(0));
	}

	@Test
	void testGetNodeAtReturnsInnermost() {
		Assertions.assertEquals("Name:a", view(index.getNodeAt(new Position(0, 8))));
		Assertions.assertEquals("Name:foo", view(index.getNodeAt(new Position(0, 5))));
		Assertions.assertEquals("Name:x", view(index.getNodeAt(new Position(0, 0))));
		Assertions.assertEquals("Call:foo(a, b)", view(index.getNodeAt(new Position(0, 13))));
		Assertions.assertNull(index.getNodeAt(new Position(5, 0)));
	}

	@Test
	void testGetNodesStartingAt() {
		List<String> views = new ArrayList<>();
		for (PyNode node : index.getNodesStartingAt(new Position(0, 0))) {
			views.add(view(node));
		}
		Assertions.assertEquals(List.of("Module:x = foo(a, b)", "Assign:x = foo(a, b)", "Name:x"), views);
	}

	@Test
	void testParentsAndContainment() {
		PyNode assign = marked.getTree().getChildren().get(0);
		PyNode call = assign.getChildren().get(1);
		PyNode a = call.getChildren().get(1);
		Assertions.assertSame(call, index.getParent(a));
		Assertions.assertSame(marked.getTree(), index.getParent(assign));
		Assertions.assertNull(index.getParent(marked.getTree()));
		Assertions.assertTrue(index.contains(assign, a));
		Assertions.assertFalse(index.contains(a, assign));
	}

	@Test
	void testRange() {
		PyNode call = marked.getTree().getChildren().get(0).getChildren().get(1);
		Range range = index.getRange(call);
		Assertions.assertEquals(new Position(0, 4), range.getStart());
		Assertions.assertEquals(new Position(0, 13), range.getEnd());
	}
}
