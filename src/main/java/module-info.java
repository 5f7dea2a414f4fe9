// Part of Fibers
/**
 * Fibers is an interruptible virtual-tree reconciliation engine.
 * It diffs trees of node descriptors against the committed tree, can pause, prioritize, or discard the diffing,
 * and applies the result to a host tree through pluggable primitives.
 * <p>
 * The main package {@link com.machinezoo.fibers} contains the engine and its public API.
 */
module com.machinezoo.fibers {
	exports com.machinezoo.fibers;
	exports com.machinezoo.fibers.util;
	requires com.machinezoo.stagean;
	/*
	 * CloseableScope is part of the public API (FiberRoot.batch()).
	 */
	requires transitive com.machinezoo.closeablescope;
	requires com.machinezoo.noexception;
	requires com.machinezoo.noexception.slf4j;
	requires org.slf4j;
	/*
	 * Guava's Ticker and ImmutableMap appear in the public API.
	 */
	requires transitive com.google.common;
	requires io.opentracing.api;
	requires io.opentracing.util;
	requires it.unimi.dsi.fastutil;
	requires micrometer.core;
}
