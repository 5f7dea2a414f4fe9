// Part of Fibers
package com.machinezoo.fibers;

/**
 * Kind of {@link NodeDescriptor}.
 */
public enum NodeKind {
	/**
	 * Node backed by a host handle, identified by its tag.
	 */
	HOST,
	/**
	 * Node whose children are computed by a {@link Component}.
	 */
	COMPONENT,
	/**
	 * Plain text.
	 */
	TEXT
}
