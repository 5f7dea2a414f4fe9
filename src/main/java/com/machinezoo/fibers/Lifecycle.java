// Part of Fibers
package com.machinezoo.fibers;

import com.machinezoo.stagean.*;

/*
 * Components opt into commit callbacks by implementing this interface in addition to Component.
 * All callbacks run on the thread that commits and exceptions they throw are logged, never propagated.
 */
/**
 * Commit callbacks for components.
 */
@StubDocs
public interface Lifecycle {
	/*
	 * Runs before any host mutation of the commit, only for components that are being updated.
	 * The result is passed to updated().
	 */
	default Object beforeMutation(Fiber fiber) {
		return null;
	}
	default void mounted(Fiber fiber) {
	}
	default void updated(Fiber fiber, Object snapshot) {
	}
	default void unmounted(Fiber fiber) {
	}
	/*
	 * Passive callbacks run after the commit, asynchronously or before the next render starts.
	 */
	default void passive(Fiber fiber) {
	}
}
