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
package com.tomaszrup.asttokens;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.tomaszrup.asttokens.mark.AstDialect;
import com.tomaszrup.asttokens.tokens.TokenInfo;

/**
 * Marks many independent sources in parallel, one source per task. A source
 * that fails to tokenize, parse or mark does not affect the others; its
 * failure is reported in its {@link Result}.
 *
 * <p>Log lines written while a source is processed carry the source's name
 * in the {@value #MDC_SOURCE_KEY} MDC key.</p>
 *
 * @param <N> the tree node type
 */
public class BatchMarker<N> implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(BatchMarker.class);

	public static final String MDC_SOURCE_KEY = "source";

	/** Turns a source text into tokens. */
	@FunctionalInterface
	public interface Tokenizer {
		List<TokenInfo> tokenize(String text);
	}

	/** Turns a source text into a tree. */
	@FunctionalInterface
	public interface Parser<N> {
		N parse(String text);
	}

	/** The outcome of marking one source. */
	public static final class Result<N> {
		private final String name;
		private final AstTokens astTokens;
		private final N tree;
		private final RuntimeException error;

		private Result(String name, AstTokens astTokens, N tree, RuntimeException error) {
			this.name = name;
			this.astTokens = astTokens;
			this.tree = tree;
			this.error = error;
		}

		public String getName() {
			return name;
		}

		/** The marked source, or {@code null} if marking failed. */
		public AstTokens getAstTokens() {
			return astTokens;
		}

		public N getTree() {
			return tree;
		}

		/** Why the source could not be marked, or {@code null}. */
		public RuntimeException getError() {
			return error;
		}

		public boolean isSuccess() {
			return error == null;
		}
	}

	private final AstDialect<N> dialect;
	private final Tokenizer tokenizer;
	private final Parser<N> parser;
	private final MarkOptions options;
	private final ExecutorService pool;

	public BatchMarker(AstDialect<N> dialect, Tokenizer tokenizer, Parser<N> parser, MarkOptions options,
			int threads) {
		this.dialect = dialect;
		this.tokenizer = tokenizer;
		this.parser = parser;
		this.options = options;
		this.pool = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
			Thread t = new Thread(r, "asttokens-mark");
			t.setDaemon(true);
			return t;
		});
	}

	public BatchMarker(AstDialect<N> dialect, Tokenizer tokenizer, Parser<N> parser, MarkOptions options) {
		this(dialect, tokenizer, parser, options, Math.max(2, Runtime.getRuntime().availableProcessors()));
	}

	/**
	 * Marks every source and returns one result per source, in the order of
	 * the given map.
	 *
	 * @param sources source texts keyed by a name used in results and logs
	 * @throws InterruptedException if interrupted while waiting for results
	 */
	public List<Result<N>> markAll(Map<String, String> sources) throws InterruptedException {
		Map<String, Future<Result<N>>> futures = new LinkedHashMap<>();
		for (Map.Entry<String, String> source : sources.entrySet()) {
			futures.put(source.getKey(), pool.submit(() -> markOne(source.getKey(), source.getValue())));
		}
		List<Result<N>> results = new ArrayList<>(futures.size());
		int failures = 0;
		for (Map.Entry<String, Future<Result<N>>> entry : futures.entrySet()) {
			Result<N> result;
			try {
				result = entry.getValue().get();
			} catch (ExecutionException e) {
				// markOne only lets errors through
				Throwable cause = e.getCause();
				if (cause instanceof Error) {
					throw (Error) cause;
				}
				throw new IllegalStateException("Marking " + entry.getKey() + " failed", cause);
			}
			if (!result.isSuccess()) {
				failures++;
			}
			results.add(result);
		}
		logger.info("Marked {} sources, {} failed", results.size(), failures);
		return results;
	}

	private Result<N> markOne(String name, String text) {
		MDC.put(MDC_SOURCE_KEY, name);
		try {
			AstTokens atok = new AstTokens(text, tokenizer.tokenize(text), options);
			N tree = parser.parse(text);
			atok.markTokens(tree, dialect);
			return new Result<>(name, atok, tree, null);
		} catch (RuntimeException e) {
			logger.warn("Cannot mark {}: {}", name, e.getMessage());
			return new Result<>(name, null, null, e);
		} finally {
			MDC.remove(MDC_SOURCE_KEY);
		}
	}

	/**
	 * Shuts the pool down, waiting up to 5 seconds for running tasks.
	 */
	@Override
	public void close() {
		logger.debug("Shutting down batch marker pool");
		pool.shutdownNow();
		try {
			pool.awaitTermination(5, TimeUnit.SECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}
}
