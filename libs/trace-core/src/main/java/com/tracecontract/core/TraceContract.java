package com.tracecontract.core;

/**
 * Marker for interfaces that declare trace operations. Each abstract method carries one of
 * {@link LogDebug}, {@link LogInfo}, {@link LogWarning}, {@link LogError} or {@link LogIgnored}
 * and returns either {@code void} or {@link Activity}.
 *
 * <pre>{@code
 * public interface CatalogTrace extends TraceContract {
 *
 *     @LogInfo("Loaded {count} products from {source}")
 *     void loaded(int count, String source);
 *
 *     @LogError("Failed to load {source}")
 *     void loadFailed(Exception error, String source);
 *
 *     @LogInfo("Refreshing {source}")
 *     Activity refreshing(String source);
 * }
 *
 * private static final CatalogTrace TRACE = Tracer.bind(CatalogTrace.class, CatalogService.class);
 * }</pre>
 */
public interface TraceContract {
}
