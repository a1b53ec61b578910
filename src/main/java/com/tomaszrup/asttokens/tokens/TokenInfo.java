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
package com.tomaszrup.asttokens.tokens;

import com.tomaszrup.asttokens.text.SourcePosition;

/**
 * A token as delivered by a tokenizer: its type, its text and its start and
 * end positions (1-based lines, 0-based code point columns).
 */
public final class TokenInfo {
	private final TokenType type;
	private final String string;
	private final SourcePosition start;
	private final SourcePosition end;

	public TokenInfo(TokenType type, String string, SourcePosition start, SourcePosition end) {
		this.type = type;
		this.string = string;
		this.start = start;
		this.end = end;
	}

	public TokenType getType() {
		return type;
	}

	public String getString() {
		return string;
	}

	public SourcePosition getStart() {
		return start;
	}

	public SourcePosition getEnd() {
		return end;
	}

	@Override
	public String toString() {
		return Token.repr(type, string) + " " + start + "-" + end;
	}
}
