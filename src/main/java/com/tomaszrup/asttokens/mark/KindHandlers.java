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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps node kind names to handlers, falling back to a default handler for
 * kinds without one. Kind names match case-insensitively, and each kind's
 * resolution is cached the first time it is asked for. Registration happens
 * while the table is built; lookups may then come from any thread.
 *
 * @param <H> the handler type
 */
final class KindHandlers<H> {
	private final Map<String, H> registered = new HashMap<>();
	private final Map<String, H> resolved = new ConcurrentHashMap<>();
	private final H fallback;

	KindHandlers(H fallback) {
		this.fallback = fallback;
	}

	KindHandlers<H> register(H handler, String... kindNames) {
		for (String kindName : kindNames) {
			registered.put(kindName.toLowerCase(Locale.ROOT), handler);
		}
		resolved.clear();
		return this;
	}

	H get(String kindName) {
		return resolved.computeIfAbsent(kindName,
				k -> registered.getOrDefault(k.toLowerCase(Locale.ROOT), fallback));
	}
}
