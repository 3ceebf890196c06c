package io.vena.factoid.util;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static java.util.stream.Collectors.toList;

public final class Futures {
	/**
	 * Completes when all of <code>futures</code> have completed, with their results in the same order.
	 * Fails if any of them fails, but only once all of them have completed.
	 */
	public static <T> CompletableFuture<List<T>> allOf(List<CompletableFuture<T>> futures) {
		return CompletableFuture
			.allOf(futures.toArray(new CompletableFuture[0]))
			.thenApply(__ -> futures.stream()
				.map(CompletableFuture::join)
				.collect(toList()));
	}

	/**
	 * Strips the wrappers that {@link CompletableFuture} adds around the exception
	 * that actually caused a failure.
	 */
	public static Throwable unwrap(Throwable e) {
		Throwable result = e;
		while ((result instanceof CompletionException || result instanceof ExecutionException) && result.getCause() != null) {
			result = result.getCause();
		}
		return result;
	}

	private Futures() { }
}
