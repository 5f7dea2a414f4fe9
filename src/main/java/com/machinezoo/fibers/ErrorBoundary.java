// Part of Fibers
package com.machinezoo.fibers;

/**
 * Component that catches render errors thrown anywhere in its subtree.
 * When a descendant throws during render, the nearest boundary renders {@link #fallback(NodeDescriptor, Throwable)}
 * in place of its regular output. Errors thrown by the boundary's own render or fallback propagate to the next boundary up.
 * The boundary retries regular rendering on every later render that reaches it.
 */
public interface ErrorBoundary extends Component {
	NodeDescriptor fallback(NodeDescriptor element, Throwable error);
}
