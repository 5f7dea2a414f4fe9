// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;

/*
 * Lower bits are more urgent. This makes the most urgent lane in a set cheap to extract (lanes & -lanes).
 * Gaps between lanes leave room for more priority classes without renumbering.
 */
/**
 * Priority classes of updates, represented as bits in an {@code int} mask.
 * Urgency decreases from {@link #SYNC} through {@link #CONTINUOUS} and {@link #DEFAULT} to {@link #IDLE}.
 */
public final class Lanes {
	private Lanes() {
	}
	public static final int NONE = 0;
	/**
	 * Discrete user input. Renders synchronously without yielding.
	 */
	public static final int SYNC = 1;
	/**
	 * Continuous user input like scrolling or dragging.
	 */
	public static final int CONTINUOUS = 1 << 2;
	public static final int DEFAULT = 1 << 4;
	/**
	 * Background work that runs only when nothing else is pending.
	 */
	public static final int IDLE = 1 << 29;
	public static final int ALL = SYNC | CONTINUOUS | DEFAULT | IDLE;
	public static int highest(int lanes) {
		return lanes & -lanes;
	}
	public static boolean overlaps(int a, int b) {
		return (a & b) != NONE;
	}
	public static boolean subset(int set, int subset) {
		return (set & subset) == subset;
	}
	public static int merge(int a, int b) {
		return a | b;
	}
	public static int remove(int set, int subset) {
		return set & ~subset;
	}
	public static boolean isSync(int lanes) {
		return (lanes & SYNC) != NONE;
	}
	/*
	 * Smaller number means higher priority. Empty set has the lowest priority of all.
	 */
	public static int priority(int lanes) {
		if (lanes == NONE)
			return Integer.MAX_VALUE;
		return Integer.numberOfTrailingZeros(lanes);
	}
	/**
	 * Returns {@code true} if the most urgent lane in {@code a} is more urgent than the most urgent lane in {@code b}.
	 */
	public static boolean higher(int a, int b) {
		return priority(a) < priority(b);
	}
	public static void validate(int lane) {
		if (lane != SYNC && lane != CONTINUOUS && lane != DEFAULT && lane != IDLE)
			throw new IllegalArgumentException("Not a single known lane: " + lane);
	}
	public static String toString(int lanes) {
		if (lanes == NONE)
			return "None";
		StringJoiner joiner = new StringJoiner("|");
		if ((lanes & SYNC) != 0)
			joiner.add("Sync");
		if ((lanes & CONTINUOUS) != 0)
			joiner.add("Continuous");
		if ((lanes & DEFAULT) != 0)
			joiner.add("Default");
		if ((lanes & IDLE) != 0)
			joiner.add("Idle");
		int unknown = lanes & ~ALL;
		if (unknown != 0)
			joiner.add(Integer.toBinaryString(unknown));
		return joiner.toString();
	}
}
