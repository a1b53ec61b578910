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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.asttokens.AstTokens;
import com.tomaszrup.asttokens.MarkOptions;
import com.tomaszrup.asttokens.mark.UnsupportedConstruct;

/**
 * Marks real Python sources and checks the resulting node texts.
 */
class PythonMarkingTests {

	// -------------------------------------------------------------------------
	// nodes at positions

	@Test
	void testMarkTokensSimple() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("module.py"));

		Assertions.assertEquals(Set.of("Name:MY_DICT", "Subscript:MY_DICT[key]", "Assign:MY_DICT[key] = val"),
				m.viewNodesAt(15, 4));

		Assertions.assertEquals(Set.of("Raise:raise XXXError()"), m.viewNodesAt(37, 12));
		Assertions.assertEquals(Set.of("Call:XXXError()", "Name:XXXError"), m.viewNodesAt(37, 18));

		Assertions.assertEquals(Set.of("ListComp:[a for (a, b) in MY_DICT if b]"), m.viewNodesAt(56, 16));
		Assertions.assertEquals(Set.of("Name:a"), m.viewNodesAt(56, 17));
		Assertions.assertEquals(Set.of("comprehension:for (a, b) in MY_DICT if b"), m.viewNodesAt(56, 19));
		Assertions.assertEquals(Set.of("Tuple:(a, b)"), m.viewNodesAt(56, 23));

		Assertions.assertEquals(Set.of("Name", "Call", "Expr"), m.viewNodeKindsAt(61, 8));
		Assertions.assertEquals(Set.of("Name"), m.viewNodeKindsAt(61, 22));
		Assertions.assertEquals(Set.of("keyword:val=autre"), m.viewNodesAt(61, 29));
		Assertions.assertEquals(Set.of("Name:autre"), m.viewNodesAt(61, 33));
	}

	@Test
	void testImportAliases() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("module.py"));
		Assertions.assertEquals(Set.of("Import:import os.path as osp"), m.viewNodesAt(3, 0));
		Assertions.assertEquals(Set.of("alias:os.path as osp"), m.viewNodesAt(3, 7));
		Assertions.assertEquals(Set.of("ImportFrom:from os import (\n    sep,\n    path as p2,\n)"),
				m.viewNodesAt(4, 0));
		Assertions.assertEquals(Set.of("alias:sep"), m.viewNodesAt(5, 4));
		Assertions.assertEquals(Set.of("alias:path as p2"), m.viewNodesAt(6, 4));
	}

	@Test
	void testDecoratedDefinitionsStartAtDecorator() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("module.py"));
		Assertions.assertEquals(Set.of("ClassDef"), m.viewNodeKindsAt(42, 0));
		Assertions.assertEquals(Set.of("Name:decorator"), m.viewNodesAt(42, 1));
		Assertions.assertEquals(Set.of("AsyncFunctionDef"), m.viewNodeKindsAt(66, 4));

		PyNode coroutine = findFirst(m, "AsyncFunctionDef");
		String text = m.atok().getText(coroutine);
		Assertions.assertTrue(text.startsWith("    @staticmethod\n    async def coroutine("), text);
		Assertions.assertTrue(text.endsWith("return {k: v async for k, v in items.pairs()}"), text);
	}

	@Test
	void testDefinitionAfterLeadingComment() {
		MarkChecker m = new MarkChecker("# header\ndef f():\n    pass\n");
		PyNode function = findFirst(m, "FunctionDef");
		Assertions.assertEquals("def f():\n    pass", m.atok().getText(function));
	}

	@Test
	void testElifStartsAtElif() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("module.py"));
		Assertions.assertEquals(Set.of("If:        elif a in autre:\n            return a"), m.viewNodesAt(59, 8));
	}

	@Test
	void testAsyncComprehensionStartsAtAsync() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("module.py"));
		Assertions.assertEquals(Set.of("comprehension:async for k, v in items.pairs()"), m.viewNodesAt(71, 21));
		Assertions.assertEquals(Set.of("DictComp:{k: v async for k, v in items.pairs()}"), m.viewNodesAt(71, 15));
	}

	@Test
	void testYieldWithoutValue() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("module.py"));
		Assertions.assertEquals(Set.of("Yield:yield"), m.viewNodesAt(76, 8));
		Assertions.assertEquals(Set.of("Expr:yield from items", "YieldFrom:yield from items"), m.viewNodesAt(75, 4));
	}

	// -------------------------------------------------------------------------
	// multi-line expressions

	@Test
	void testMarkTokensMultiline() {
		String source = "(    # line1\n"
				+ "a,      # line2\n"
				+ "b +     # line3\n"
				+ "  c +   # line4\n"
				+ "  d     # line5\n"
				+ ")";
		MarkChecker m = new MarkChecker(source);

		Assertions.assertTrue(m.viewNodesAt(2, 0).contains("Name:a"));
		Assertions.assertEquals(Set.of("Name:b", "BinOp:(b +     # line3\n  c)",
				"BinOp:(b +     # line3\n  c +   # line4\n  d)"), m.viewNodesAt(3, 0));

		Set<String> allText = new HashSet<>();
		for (PyNode node : m.allNodes()) {
			allText.add(m.atok().getText(node));
		}
		Assertions.assertEquals(Set.of(source, "a", "b", "c", "d", "(b +     # line3\n  c)",
				"(b +     # line3\n  c +   # line4\n  d)"), allText);
	}

	@Test
	void testParenthesizedAttribute() {
		MarkChecker m = new MarkChecker("(x).foo()");
		m.verifyAllNodes();
		Assertions.assertEquals(Set.of("Name:x"), m.viewNodesAt(1, 1));
		Assertions.assertEquals(Set.of("Module:(x).foo()", "Expr:(x).foo()", "Call:(x).foo()", "Attribute:(x).foo"),
				m.viewNodesAt(1, 0));
	}

	@Test
	void testSplat() {
		String source = "\n"
				+ "arr = [1,2,3,4,5]\n"
				+ "def print_all(a, b, c, d, e):\n"
				+ "    print(a, b, c, d ,e)\n"
				+ "print_all(*arr)\n";
		MarkChecker m = new MarkChecker(source);
		m.verifyAllNodes();
		Assertions.assertEquals(Set.of("Expr:print_all(*arr)", "Call:print_all(*arr)", "Name:print_all"),
				m.viewNodesAt(5, 0));
		Assertions.assertEquals(Set.of("Starred:*arr"), m.viewNodesAt(5, 10));
		Assertions.assertEquals(Set.of("Name:arr"), m.viewNodesAt(5, 11));
	}

	@Test
	void testNonAsciiNames() {
		for (String source : List.of("sünnikuupäev=str((18+int(isikukood[0:1])-1)//2)+isikukood[1:3]",
				"sünnikuupaev=str((18+int(isikukood[0:1])-1)//2)+isikukood[1:3]")) {
			MarkChecker m = new MarkChecker(source);
			m.verifyAllNodes();
			Assertions.assertEquals(Set.of("Module:" + source, "Assign:" + source, "Name:" + source.substring(0, 12)),
					m.viewNodesAt(1, 0));
		}
	}

	// -------------------------------------------------------------------------
	// deep trees

	@Test
	void testDeepRecursion() {
		StringBuilder source = new StringBuilder("x = 'a0'");
		for (int i = 1; i < 1050; i++) {
			source.append(" + 'a").append(i).append('\'');
		}
		source.append('\n');
		MarkChecker m = new MarkChecker(source.toString());

		List<PyNode> all = m.allNodes();
		Assertions.assertEquals(2102, all.size());
		Assertions.assertEquals("Str:'a1049'", m.view(all.get(all.size() - 1)));
		Assertions.assertEquals("Str:'a1048'", m.view(all.get(all.size() - 2)));
		Assertions.assertEquals("Str:'a1'", m.view(all.get(1053)));
		Assertions.assertEquals("Str:'a0'", m.view(all.get(1052)));
		Assertions.assertEquals("BinOp:'a0' + 'a1'", m.view(all.get(1051)));

		String assign = m.atok().getText(findFirst(m, "Assign"));
		Assertions.assertTrue(assign.startsWith("x = 'a0' + 'a1'"));
		Assertions.assertTrue(assign.endsWith("'a1049'"));

		String binOp = m.atok().getText(findFirst(m, "BinOp"));
		Assertions.assertTrue(binOp.startsWith("'a0'"));
		Assertions.assertTrue(binOp.endsWith("'a1049'"));
	}

	// -------------------------------------------------------------------------
	// round trips through the parser

	@Test
	void testModuleFixture() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("module.py"));
		m.verifyContainment();
		Assertions.assertTrue(m.verifyAllNodes() > 50);
	}

	@Test
	void testExpressionsFixture() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("expressions.py"));
		m.verifyContainment();
		Assertions.assertTrue(m.verifyAllNodes() > 50);
	}

	@Test
	void testExpressionTexts() {
		MarkChecker m = new MarkChecker(MarkChecker.readFixture("expressions.py"));
		Assertions.assertEquals(Set.of("Assign:items = [1, 2, 3,]", "Name:items"), m.viewNodesAt(1, 0));
		Assertions.assertEquals(Set.of("List:[1, 2, 3,]"), m.viewNodesAt(1, 8));
		Assertions.assertEquals(Set.of("Tuple:first, *rest", "Name:first", "Assign:first, *rest = items"),
				m.viewNodesAt(2, 0));
		Assertions.assertEquals(Set.of("Starred:*rest"), m.viewNodesAt("*rest"));
		Assertions.assertEquals(Set.of("GeneratorExp:(x for x in items if x > 1)"), m.viewNodesAt("(x for x"));
		Assertions.assertEquals(Set.of("Slice:1:", "Num:1"), m.viewNodesAt("1:]"));
		Assertions.assertEquals(Set.of("Slice:::2"), m.viewNodesAt("::2"));
		Assertions.assertEquals(Set.of("Tuple:1:2, ::3", "Slice:1:2", "Num:1"), m.viewNodesAt("1:2, ::3"));
		Assertions.assertEquals(Set.of("Str:'abc' \\\n    'def'"), m.viewNodesAt("'abc'"));
		Assertions.assertEquals(Set.of("JoinedStr:f'hello {name}!'"), m.viewNodesAt("f'hello"));
		Assertions.assertEquals(Set.of("Bytes:rb'bytes\\d'"), m.viewNodesAt("rb'"));
		Assertions.assertEquals(Set.of("NamedExpr:y := len(items)", "Name:y"), m.viewNodesAt("y :="));
		Assertions.assertEquals(Set.of("Tuple:(), [], {}", "Tuple:()"), m.viewNodesAt("(), [], {}"));
		Assertions.assertEquals(Set.of("UnaryOp:-1"), m.viewNodesAt("-1"));
		Assertions.assertEquals(Set.of("Assign:a = 1", "Name:a"), m.viewNodesAt("a = 1;"));
		Assertions.assertEquals(Set.of("Assign:b = 2", "Name:b"), m.viewNodesAt("b = 2"));
		Assertions.assertEquals(Set.of("Attribute:(items).count", "Call:(items).count(1)"),
				m.viewNodesAt("(items).count"));
		Assertions.assertEquals(Set.of("Call:(func(\n    a,\n    b +\n    c,\n))", "Name:func"),
				m.viewNodesAt("func("));
		Assertions.assertEquals(Set.of("BinOp:(b +\n    c)", "Name:b"), m.viewNodesAt("b +\n"));
	}

	@Test
	void testIndexedBracketsGiveSameMarks() {
		for (String fixture : List.of("module.py", "expressions.py")) {
			String source = MarkChecker.readFixture(fixture);
			MarkChecker scanning = new MarkChecker(source);
			MarkChecker indexed = new MarkChecker(source, MarkOptions.DEFAULTS.withBracketIndex(true));
			List<PyNode> scanned = scanning.allNodes();
			List<PyNode> index = indexed.allNodes();
			Assertions.assertEquals(scanned.size(), index.size());
			for (int i = 0; i < scanned.size(); i++) {
				Assertions.assertEquals(scanning.view(scanned.get(i)), indexed.view(index.get(i)),
						fixture + " node " + i);
			}
		}
	}

	// -------------------------------------------------------------------------
	// findings

	@Test
	void testEmptyParametersAreReported() {
		String source = "def f(): pass\n";
		PyNode tree = new PythonParser().parse(source);
		AstTokens atok = new AstTokens(source, new PythonTokenizer().tokenize(source));
		List<UnsupportedConstruct> found = new ArrayList<>();
		atok.markTokens(tree, PythonDialect.INSTANCE, found::add);

		Assertions.assertEquals(1, found.size());
		Assertions.assertEquals("arguments", found.get(0).getKindName());
		Assertions.assertEquals("def", found.get(0).getFallbackToken().getString());
		Assertions.assertEquals("def f(): pass", atok.getText(tree.getChildren().get(0)));
	}

	@Test
	void testContextMarkersAreUnmarked() {
		MarkChecker m = new MarkChecker("x = y\n");
		PyNode name = findFirst(m, "Name");
		PyNode store = name.getChildren().get(0);
		Assertions.assertTrue(store.isContext());
		Assertions.assertFalse(m.atok().isMarked(store));
		Assertions.assertEquals("", m.atok().getText(store));
	}

	// -------------------------------------------------------------------------
	// helpers

	private static PyNode findFirst(MarkChecker m, String kind) {
		for (PyNode node : m.allNodes()) {
			if (kind.equals(node.getKind())) {
				return node;
			}
		}
		throw new AssertionError("No " + kind + " node");
	}
}
