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
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.asttokens.text.SourcePosition;
import com.tomaszrup.asttokens.tokens.Token;
import com.tomaszrup.asttokens.tokens.TokenInfo;
import com.tomaszrup.asttokens.tokens.TokenType;

class PythonTokenizerTests {
	private final PythonTokenizer tokenizer = new PythonTokenizer();

	private List<String> reprs(String text) {
		List<String> result = new ArrayList<>();
		for (TokenInfo token : tokenizer.tokenize(text)) {
			result.add(Token.repr(token.getType(), token.getString()));
		}
		return result;
	}

	// ------------------------------------------------------------------
	// Basic token kinds
	// ------------------------------------------------------------------

	@Test
	void testSimpleStatement() {
		Assertions.assertEquals(List.of("NAME:'x'", "OP:'='", "NUMBER:'1'", "OP:'+'", "NAME:'y'", "NEWLINE:'\\n'",
				"ENDMARKER:''"), reprs("x = 1 + y\n"));
	}

	@Test
	void testPositions() {
		List<TokenInfo> tokens = tokenizer.tokenize("foo(bar)\n");
		Assertions.assertEquals(new SourcePosition(1, 0), tokens.get(0).getStart());
		Assertions.assertEquals(new SourcePosition(1, 3), tokens.get(0).getEnd());
		Assertions.assertEquals(new SourcePosition(1, 4), tokens.get(2).getStart());
		Assertions.assertEquals(new SourcePosition(1, 8), tokens.get(4).getStart());
		Assertions.assertEquals(new SourcePosition(2, 0), tokens.get(5).getStart());
		Assertions.assertEquals(TokenType.ENDMARKER, tokens.get(5).getType());
	}

	@Test
	void testOperatorsPreferLongestMatch() {
		Assertions.assertEquals(List.of("NAME:'a'", "OP:'**='", "NAME:'b'", "OP:'//'", "NAME:'c'", "NEWLINE:'\\n'",
				"ENDMARKER:''"), reprs("a **= b // c\n"));
		Assertions.assertEquals(List.of("OP:'...'", "NEWLINE:'\\n'", "ENDMARKER:''"), reprs("...\n"));
		Assertions.assertEquals(List.of("NAME:'f'", "OP:'->'", "NAME:'x'", "OP:':='", "NEWLINE:'\\n'",
				"ENDMARKER:''"), reprs("f -> x :=\n"));
	}

	@Test
	void testNumbers() {
		Assertions.assertEquals(List.of("NUMBER:'0x1F'", "NUMBER:'1_000'", "NUMBER:'3.14'", "NUMBER:'1e-5'",
				"NUMBER:'2j'", "NUMBER:'.5'", "NEWLINE:'\\n'", "ENDMARKER:''"), reprs("0x1F 1_000 3.14 1e-5 2j .5\n"));
	}

	@Test
	void testStringPrefixes() {
		Assertions.assertEquals(List.of("STRING:\"b'x'\"", "STRING:\"rb'y'\"", "STRING:'f\"{z}\"'",
				"NAME:'bar'", "NEWLINE:'\\n'", "ENDMARKER:''"), reprs("b'x' rb'y' f\"{z}\" bar\n"));
	}

	@Test
	void testStringWithEscapedQuote() {
		Assertions.assertEquals(List.of("STRING:\"'a\\\\'b'\"", "NEWLINE:'\\n'", "ENDMARKER:''"), reprs("'a\\'b'\n"));
	}

	@Test
	void testTripleQuotedStringSpansLines() {
		List<TokenInfo> tokens = tokenizer.tokenize("x = '''a\nb'''\n");
		TokenInfo string = tokens.get(2);
		Assertions.assertEquals(TokenType.STRING, string.getType());
		Assertions.assertEquals("'''a\nb'''", string.getString());
		Assertions.assertEquals(new SourcePosition(1, 4), string.getStart());
		Assertions.assertEquals(new SourcePosition(2, 4), string.getEnd());
		Assertions.assertEquals(TokenType.NEWLINE, tokens.get(3).getType());
	}

	// ------------------------------------------------------------------
	// Line structure
	// ------------------------------------------------------------------

	@Test
	void testCommentsAndBlankLines() {
		Assertions.assertEquals(List.of("NAME:'import'", "NAME:'re'", "COMMENT:'# comment'", "NEWLINE:'\\n'",
				"NL:'\\n'", "NAME:'foo'", "OP:'='", "STRING:\"'bar'\"", "NEWLINE:'\\n'", "ENDMARKER:''"),
				reprs("import re  # comment\n\nfoo = 'bar'\n"));
	}

	@Test
	void testLineBreaksInsideBracketsAreNonLogical() {
		Assertions.assertEquals(List.of("OP:'('", "NAME:'a'", "OP:','", "NL:'\\n'", "NAME:'b'", "OP:')'",
				"NEWLINE:''", "ENDMARKER:''"), reprs("(a,\nb)"));
	}

	@Test
	void testBackslashContinuation() {
		Assertions.assertEquals(List.of("NAME:'x'", "OP:'='", "NUMBER:'1'", "OP:'+'", "NUMBER:'2'",
				"NEWLINE:'\\n'", "ENDMARKER:''"), reprs("x = 1 + \\\n    2\n"));
	}

	@Test
	void testIndentAndDedent() {
		Assertions.assertEquals(List.of("NAME:'if'", "NAME:'x'", "OP:':'", "NEWLINE:'\\n'", "INDENT:'    '",
				"NAME:'y'", "NEWLINE:'\\n'", "DEDENT:''", "NAME:'z'", "NEWLINE:'\\n'", "ENDMARKER:''"),
				reprs("if x:\n    y\nz\n"));
	}

	@Test
	void testDedentsAtEndOfInput() {
		List<TokenInfo> tokens = tokenizer.tokenize("if x:\n    if y:\n        z\n");
		int size = tokens.size();
		Assertions.assertEquals(TokenType.DEDENT, tokens.get(size - 3).getType());
		Assertions.assertEquals(TokenType.DEDENT, tokens.get(size - 2).getType());
		Assertions.assertEquals(TokenType.ENDMARKER, tokens.get(size - 1).getType());
		Assertions.assertEquals(new SourcePosition(4, 0), tokens.get(size - 1).getStart());
	}

	@Test
	void testMissingFinalNewlineGetsEmptyNewlineToken() {
		List<TokenInfo> tokens = tokenizer.tokenize("foo");
		Assertions.assertEquals(3, tokens.size());
		Assertions.assertEquals(TokenType.NEWLINE, tokens.get(1).getType());
		Assertions.assertEquals("", tokens.get(1).getString());
		Assertions.assertEquals(new SourcePosition(1, 3), tokens.get(1).getStart());
		Assertions.assertEquals(new SourcePosition(2, 0), tokens.get(2).getStart());
	}

	@Test
	void testCommentOnlyLastLine() {
		Assertions.assertEquals(List.of("NAME:'x'", "NEWLINE:'\\n'", "COMMENT:'# done'", "NL:''", "ENDMARKER:''"),
				reprs("x\n# done"));
	}

	@Test
	void testNonAsciiColumnsCountCodePoints() {
		List<TokenInfo> tokens = tokenizer.tokenize("foo('фыва',a,b)\n");
		Assertions.assertEquals(new SourcePosition(1, 4), tokens.get(2).getStart());
		Assertions.assertEquals(new SourcePosition(1, 10), tokens.get(2).getEnd());
		Assertions.assertEquals("a", tokens.get(4).getString());
		Assertions.assertEquals(new SourcePosition(1, 11), tokens.get(4).getStart());
	}

	@Test
	void testUnicodeIdentifiers() {
		Assertions.assertEquals(List.of("NAME:'ñame'", "OP:'='", "NAME:'été'", "NEWLINE:'\\n'", "ENDMARKER:''"),
				reprs("ñame = été\n"));
	}

	// ------------------------------------------------------------------
	// Errors
	// ------------------------------------------------------------------

	@Test
	void testUnterminatedString() {
		PythonSyntaxException e = Assertions.assertThrows(PythonSyntaxException.class,
				() -> tokenizer.tokenize("x = 'abc\n"));
		Assertions.assertEquals(1, e.getLine());
		Assertions.assertEquals(4, e.getColumn());
	}

	@Test
	void testUnterminatedTripleQuotedString() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> tokenizer.tokenize("x = '''abc\n\n"));
	}

	@Test
	void testUnclosedBracket() {
		Assertions.assertThrows(PythonSyntaxException.class, () -> tokenizer.tokenize("f(a,\n"));
	}

	@Test
	void testInconsistentDedent() {
		Assertions.assertThrows(PythonSyntaxException.class,
				() -> tokenizer.tokenize("if x:\n    y\n  z\n"));
	}
}
