// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;

/**
 * Host tree primitives used by the commit applier.
 * Handles are opaque objects owned by fibers. All methods are called on the committing thread and never reentrantly.
 * Implementations are expected to be total over valid handles. Exception thrown from any method aborts the commit
 * with {@link CommitException}, leaving host mutations applied so far in place.
 */
public interface HostPlatform {
	Object createHostHandle(String tag, Map<String, Object> props);
	Object createTextHandle(String text);
	/**
	 * Inserts or moves {@code child} under {@code parent}.
	 * 
	 * @param before
	 *            sibling to insert before or {@code null} to append
	 */
	void insertHostHandle(Object parent, Object child, Object before);
	void removeHostHandle(Object parent, Object child);
	void applyHostPropDiff(Object handle, List<PropChange> diff);
	void updateTextHandle(Object handle, String text);
	/**
	 * Releases resources of a handle that was removed from the host tree. Called bottom-up for every handle in a deleted subtree.
	 */
	default void releaseHostHandle(Object handle) {
	}
}
