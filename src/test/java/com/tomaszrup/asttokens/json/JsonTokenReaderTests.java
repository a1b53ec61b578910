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
package com.tomaszrup.asttokens.json;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.tomaszrup.asttokens.AstTokens;
import com.tomaszrup.asttokens.text.SourcePosition;
import com.tomaszrup.asttokens.tokens.TokenInfo;
import com.tomaszrup.asttokens.tokens.TokenType;

class JsonTokenReaderTests {

	@Test
	void testReadObjectEntries() {
		List<TokenInfo> tokens = JsonTokenReader
				.read("[{\"type\": \"NAME\", \"string\": \"foo\", \"start\": [1, 0], \"end\": [1, 3]}]");
		Assertions.assertEquals(1, tokens.size());
		TokenInfo token = tokens.get(0);
		Assertions.assertEquals(TokenType.NAME, token.getType());
		Assertions.assertEquals("foo", token.getString());
		Assertions.assertEquals(new SourcePosition(1, 0), token.getStart());
		Assertions.assertEquals(new SourcePosition(1, 3), token.getEnd());
	}

	@Test
	void testReadTupleEntries() {
		List<TokenInfo> tokens = JsonTokenReader.read("[[\"ENCODING\", \"utf-8\", [0, 0], [0, 0], \"\"], "
				+ "[\"NAME\", \"f\", [1, 0], [1, 1], \"f()\\n\"], "
				+ "[\"LPAR\", \"(\", [1, 1], [1, 2], \"f()\\n\"], "
				+ "[\"OP\", \")\", [1, 2], [1, 3], \"f()\\n\"]]");
		Assertions.assertEquals(3, tokens.size());
		Assertions.assertEquals(TokenType.NAME, tokens.get(0).getType());
		Assertions.assertEquals(TokenType.OP, tokens.get(1).getType());
		Assertions.assertEquals("(", tokens.get(1).getString());
		Assertions.assertEquals(TokenType.OP, tokens.get(2).getType());
	}

	// -------------------------------------------------------------------------
	// invalid streams

	@Test
	void testRejectsUnknownType() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> JsonTokenReader.read("[[\"WHATEVER\", \"x\", [1, 0], [1, 1]]]"));
	}

	@Test
	void testRejectsMalformedEntries() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> JsonTokenReader.read("[[\"NAME\", \"x\"]]"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> JsonTokenReader.read("[42]"));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> JsonTokenReader.read("[[\"NAME\", \"x\", [1], [1, 1]]]"));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> JsonTokenReader.read("[[\"NAME\", \"x\", [\"a\", 0], [1, 1]]]"));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> JsonTokenReader.read("[[1, \"x\", [1, 0], [1, 1]]]"));
	}

	@Test
	void testRejectsNonArrays() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> JsonTokenReader.read("{}"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> JsonTokenReader.read("[[\"NAME\""));
	}

	// -------------------------------------------------------------------------
	// marking with exported tokens

	@Test
	void testMarkWithExportedTokensAndTree() {
		String source = "x = 1\n";
		List<TokenInfo> tokens = JsonTokenReader.read("[[\"NAME\", \"x\", [1, 0], [1, 1], \"\"], "
				+ "[\"EQUAL\", \"=\", [1, 2], [1, 3], \"\"], "
				+ "[\"NUMBER\", \"1\", [1, 4], [1, 5], \"\"], "
				+ "[\"NEWLINE\", \"\\n\", [1, 5], [1, 6], \"\"], "
				+ "[\"ENDMARKER\", \"\", [2, 0], [2, 0], \"\"]]");
		JsonObject tree = JsonTreeDialect.read("{\"_type\": \"Module\", \"body\": [{\"_type\": \"Assign\", "
				+ "\"lineno\": 1, \"col_offset\": 0, \"targets\": [{\"_type\": \"Name\", \"lineno\": 1, "
				+ "\"col_offset\": 0, \"id\": \"x\", \"ctx\": {\"_type\": \"Store\"}}], "
				+ "\"value\": {\"_type\": \"Constant\", \"lineno\": 1, \"col_offset\": 4, \"value\": 1}}]}");
		AstTokens atok = new AstTokens(source, tokens);
		atok.markTokens(tree, JsonTreeDialect.INSTANCE);

		JsonObject assign = JsonTreeDialect.INSTANCE.children(tree).get(0);
		Assertions.assertEquals("x = 1", atok.getText(assign));
		Assertions.assertEquals("x = 1", atok.getText(tree));
		Assertions.assertEquals(4, atok.getMarks().size());
	}
}
