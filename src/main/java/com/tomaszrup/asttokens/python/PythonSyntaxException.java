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

/**
 * Thrown by {@link PythonTokenizer} and {@link PythonParser} for input that
 * is not valid Python.
 */
public class PythonSyntaxException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final int line;
	private final int column;

	/**
	 * @param line   1-based line of the error
	 * @param column 0-based code point column of the error
	 */
	public PythonSyntaxException(String message, int line, int column) {
		super(message + " (line " + line + ", column " + (column + 1) + ")");
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}
}
