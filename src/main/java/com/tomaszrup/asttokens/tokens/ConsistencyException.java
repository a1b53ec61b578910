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

/**
 * Raised when a token does not match the kind or text that the tree shape
 * predicts, which means the tokens and the tree disagree or the tree contains
 * a construct the marking rules do not handle. Marking cannot continue past
 * such a mismatch.
 */
public class ConsistencyException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final transient Token token;

	public ConsistencyException(String message) {
		this(message, null);
	}

	public ConsistencyException(String message, Token token) {
		super(message);
		this.token = token;
	}

	/**
	 * The offending token, or {@code null} when the failure is not tied to
	 * one.
	 */
	public Token getToken() {
		return token;
	}

	/**
	 * Verifies that {@code token} has the given type and, when
	 * {@code literal} is not {@code null}, the given text.
	 *
	 * @throws ConsistencyException describing the expected and actual token
	 */
	public static Token expect(Token token, TokenType type, String literal) {
		if (!token.matches(type, literal)) {
			throw new ConsistencyException("Expected token " + Token.repr(type, literal) + ", got " + token
					+ " on line " + token.getStart().getLine() + " col " + (token.getStart().getColumn() + 1), token);
		}
		return token;
	}
}
