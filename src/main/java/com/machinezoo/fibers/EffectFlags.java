// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;

/**
 * Bits stored in {@link Fiber#flags()} and {@link Fiber#subtreeFlags()}.
 * Flags are meaningful only between completion of the render and the end of the commit.
 * They are cleared whenever the fiber is reused in the next render.
 */
public final class EffectFlags {
	private EffectFlags() {
	}
	public static final int NONE = 0;
	/**
	 * Host nodes of this fiber must be inserted or moved.
	 */
	public static final int PLACEMENT = 1 << 1;
	/**
	 * Props or text of this fiber changed and must be applied to its host handle.
	 */
	public static final int UPDATE = 1 << 2;
	/**
	 * Fiber's {@link Fiber#deletions()} list is not empty.
	 */
	public static final int DELETION = 1 << 3;
	/**
	 * Host node's text content must be cleared, because it now has child nodes instead.
	 */
	public static final int CONTENT_RESET = 1 << 4;
	public static final int CALLBACK = 1 << 5;
	public static final int SNAPSHOT = 1 << 6;
	public static final int PASSIVE = 1 << 7;
	/**
	 * Error boundary rendered its fallback.
	 */
	public static final int DID_CAPTURE = 1 << 8;
	public static final int BEFORE_MUTATION_MASK = SNAPSHOT;
	public static final int MUTATION_MASK = PLACEMENT | UPDATE | DELETION | CONTENT_RESET;
	public static final int LAYOUT_MASK = CALLBACK;
	public static final int PASSIVE_MASK = PASSIVE;
	private static final String[] names = {
		null, "Placement", "Update", "Deletion", "ContentReset", "Callback", "Snapshot", "Passive", "DidCapture"
	};
	public static String toString(int flags) {
		if (flags == NONE)
			return "None";
		StringJoiner joiner = new StringJoiner("|");
		for (int bit = 1; bit < names.length; ++bit)
			if ((flags & (1 << bit)) != 0)
				joiner.add(names[bit]);
		return joiner.toString();
	}
}
