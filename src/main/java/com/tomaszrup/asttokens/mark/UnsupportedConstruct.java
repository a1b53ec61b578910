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
 * Reported when a node has neither a declared position nor children to infer
 * one from (an empty parameter list, for instance). Such a node starts at its
 * parent's token; this is not an error, but its span is only approximate.
 */
public final class UnsupportedConstruct {
	private final Object node;
	private final String kindName;
	private final Token fallbackToken;

	UnsupportedConstruct(Object node, String kindName, Token fallbackToken) {
		this.node = node;
		this.kindName = kindName;
		this.fallbackToken = fallbackToken;
	}

	public Object getNode() {
		return node;
	}

	public String getKindName() {
		return kindName;
	}

	/** The parent's token that the node was given instead of its own. */
	public Token getFallbackToken() {
		return fallbackToken;
	}

	@Override
	public String toString() {
		return kindName + " has no position and no children; using " + fallbackToken + " at "
				+ fallbackToken.getStart();
	}
}
