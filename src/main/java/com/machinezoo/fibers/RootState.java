// Part of Fibers
package com.machinezoo.fibers;

/**
 * Rendering state of {@link FiberRoot}.
 */
public enum RootState {
	IDLE,
	/**
	 * Pending tree is being built.
	 */
	RENDERING,
	/**
	 * Concurrent render has yielded between two units of work and will resume later.
	 */
	YIELDED,
	/**
	 * Host mutations are being applied. This state cannot be interrupted.
	 */
	COMMITTING
}
