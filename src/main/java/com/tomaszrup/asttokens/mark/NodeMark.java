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

import com.tomaszrup.asttokens.tokens.Token;

/**
 * The tokens assigned to one node: its first and last token, plus whether the
 * node is an expression, which text extraction needs once the tree's dialect
 * is out of reach.
 */
public final class NodeMark {
	private final String kindName;
	private final boolean expression;
	private Token firstToken;
	private Token lastToken;

	NodeMark(String kindName, boolean expression) {
		this.kindName = kindName;
		this.expression = expression;
	}

	public String getKindName() {
		return kindName;
	}

	public boolean isExpression() {
		return expression;
	}

	public Token getFirstToken() {
		return firstToken;
	}

	public Token getLastToken() {
		return lastToken;
	}

	void setFirstToken(Token firstToken) {
		this.firstToken = firstToken;
	}

	void setLastToken(Token lastToken) {
		this.lastToken = lastToken;
	}

	@Override
	public String toString() {
		return kindName + "[" + firstToken + " .. " + lastToken + "]";
	}
}
