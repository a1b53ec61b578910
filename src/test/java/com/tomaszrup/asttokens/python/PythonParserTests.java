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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PythonParserTests {
	private PythonParser parser;

	@BeforeEach
	void setup() {
		parser = new PythonParser();
	}

	// -------------------------------------------------------------------------
	// tree shape

	@Test
	void testDumpWithContexts() {
		PyNode tree = parser.parse("x = 1\n");
		Assertions.assertEquals("Module(Assign(Name:x(Store()), Num:1()))", tree.dump(false));
		Assertions.assertEquals("Module(Assign(Name:x(), Num:1()))", tree.dump(true));
	}

	@Test
	void testFunctionChildrenOrder() {
		PyNode tree = parser.parse("@d\ndef f(a=1) -> int:\n    return a\n");
		Assertions.assertEquals("Module(FunctionDef(Name:d(), arguments(arg:a(), Num:1()), Name:int(), Return(Name:a())))",
				tree.dump(true));
	}

	@Test
	void testDictWithUnpacking() {
		PyNode dict = parser.parseExpression("{**a, 'k': 1}");
		Assertions.assertEquals("Dict(Name:a(Load()), Str:'k'(), Num:1())", dict.dump(false));
	}

	@Test
	void testStringKinds() {
		Assertions.assertEquals("Str:'a' 'b'()", parser.parseExpression("'a' 'b'").dump(true));
		Assertions.assertEquals("JoinedStr:f'x' 'y'()", parser.parseExpression("f'x' 'y'").dump(true));
		Assertions.assertEquals("Bytes:b'x'()", parser.parseExpression("b'x'").dump(true));
	}

	@Test
	void testExpressionTuple() {
		Assertions.assertEquals("Tuple(Name:a(), Name:b())", parser.parseExpression("a, b").dump(true));
	}

	@Test
	void testImportAliasValues() {
		PyNode tree = parser.parse("import a.b as c, d\nfrom . import (e as f)\n");
		Assertions.assertEquals("Module(Import(alias:a.b as c(), alias:d()), ImportFrom(alias:e as f()))",
				tree.dump(true));
	}

	// -------------------------------------------------------------------------
	// anchors

	@Test
	void testAnchorColumnsCountUtf8Bytes() {
		PyNode tree = parser.parse("x = 'é'; y = 2\n");
		PyNode y = tree.getChildren().get(1).getChildren().get(0);
		Assertions.assertEquals("y", y.getValue());
		Assertions.assertEquals(1, y.getLineNo());
		Assertions.assertEquals(10, y.getColOffset());
	}

	@Test
	void testParenthesizedAnchors() {
		PyNode tuple = parser.parseExpression("(a, b)");
		Assertions.assertEquals("Tuple", tuple.getKind());
		Assertions.assertEquals(0, tuple.getColOffset());

		PyNode name = parser.parseExpression("(a)");
		Assertions.assertEquals("Name", name.getKind());
		Assertions.assertEquals(1, name.getColOffset());
	}

	@Test
	void testGeneratorArgumentAnchoredAtParenthesis() {
		PyNode call = parser.parseExpression("f(x for x in y)");
		PyNode generator = call.getChildren().get(1);
		Assertions.assertEquals("GeneratorExp", generator.getKind());
		Assertions.assertEquals(1, generator.getColOffset());
	}

	@Test
	void testElifAnchoredAtElif() {
		PyNode tree = parser.parse("if a:\n    pass\nelif b:\n    pass\n");
		PyNode elif = tree.getChildren().get(0).getChildren().get(2);
		Assertions.assertEquals("If", elif.getKind());
		Assertions.assertEquals(3, elif.getLineNo());
		Assertions.assertEquals(0, elif.getColOffset());
	}

	@Test
	void testArgumentsHaveNoPosition() {
		PyNode tree = parser.parse("def f(): pass\n");
		PyNode arguments = tree.getChildren().get(0).getChildren().get(0);
		Assertions.assertEquals("arguments", arguments.getKind());
		Assertions.assertFalse(arguments.hasPosition());
		Assertions.assertTrue(arguments.getChildren().isEmpty());
	}

	// -------------------------------------------------------------------------
	// errors

	@Test
	void testSyntaxErrorPosition() {
		PythonSyntaxException e = Assertions.assertThrows(PythonSyntaxException.class,
				() -> parser.parse("x = = 1\n"));
		Assertions.assertEquals(1, e.getLine());
		Assertions.assertEquals(4, e.getColumn());
	}

	@Test
	void testExpressionMustEndAtEndOfInput() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> parser.parseExpression("x = 1"));
	}

	@Test
	void testTryNeedsHandler() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> parser.parse("try:\n    pass\nx = 1\n"));
	}
}
