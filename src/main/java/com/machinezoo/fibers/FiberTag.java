// Part of Fibers
package com.machinezoo.fibers;

/**
 * Variant of {@link Fiber}.
 */
public enum FiberTag {
	HOST,
	TEXT,
	COMPONENT,
	ROOT
}
