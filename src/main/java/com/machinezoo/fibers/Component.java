// Part of Fibers
package com.machinezoo.fibers;

/*
 * Components are identified by object identity. The same instance must be used across renders
 * for the engine to reuse the component's subtree.
 */
/**
 * Producer of node descriptors for a component node.
 * Implementations must be free of side effects while rendering.
 * 
 * @see NodeDescriptor#component(Component)
 * @see ErrorBoundary
 * @see Lifecycle
 */
@FunctionalInterface
public interface Component {
	/**
	 * Computes what this component should display.
	 * 
	 * @param element
	 *            descriptor of the component node itself, carrying props and children
	 * @return rendered subtree or {@code null} to render nothing
	 */
	NodeDescriptor render(NodeDescriptor element);
}
