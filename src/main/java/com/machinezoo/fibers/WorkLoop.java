// Part of Fibers
package com.machinezoo.fibers;

import java.util.function.*;
import org.slf4j.*;
import io.micrometer.core.instrument.*;

/*
 * Explicit context of one render. It replaces ambient "current render target" state,
 * so that independent roots can render without interfering with each other.
 *
 * Traversal is iterative. Pointer to the next unit of work is the only continuation state,
 * which makes it possible to stop after any unit and resume later without a call stack.
 * Begin runs in pre-order. Complete runs in post-order, moving to the next sibling or back to the parent.
 */
final class WorkLoop {
	private static final Logger logger = LoggerFactory.getLogger(WorkLoop.class);
	private static final Counter captures = Metrics.counter("fibers.render.captures");
	private final int lanes;
	int lanes() {
		return lanes;
	}
	private final Fiber pendingRoot;
	Fiber pendingRoot() {
		return pendingRoot;
	}
	private Fiber next;
	private Throwable failure;
	/*
	 * Render error that no boundary caught. The pending tree is unusable when this is set.
	 */
	Throwable failure() {
		return failure;
	}
	private int units;
	int units() {
		return units;
	}
	int bailouts;
	WorkLoop(Fiber current, Object element, int lanes) {
		this.lanes = lanes;
		pendingRoot = Fiber.createWorkInProgress(current, element, lanes);
		next = pendingRoot;
	}
	boolean completed() {
		return next == null && failure == null;
	}
	boolean finished() {
		return next == null;
	}
	void runSync() {
		while (next != null)
			performUnit();
	}
	/*
	 * Returns true when the whole tree is finished (or failed), false when the loop yielded.
	 * Yield predicate is checked only after a unit finishes, never inside one.
	 */
	boolean runConcurrent(TimeSlice slice, BooleanSupplier preempted) {
		while (next != null) {
			performUnit();
			if (next != null && (slice.expired() || preempted.getAsBoolean()))
				return false;
		}
		return true;
	}
	private void performUnit() {
		Fiber unit = next;
		Fiber child;
		try {
			child = FiberWork.begin(this, unit.alternate, unit);
		} catch (Throwable ex) {
			capture(unit, ex);
			return;
		} finally {
			++units;
		}
		if (child != null)
			next = child;
		else
			completeUnit(unit);
	}
	private void completeUnit(Fiber unit) {
		Fiber completed = unit;
		while (completed != null) {
			/*
			 * Prop diff calls equals() on application values, which can throw just like render.
			 */
			try {
				FiberWork.complete(this, completed.alternate, completed);
			} catch (Throwable ex) {
				capture(completed, ex);
				return;
			}
			if (completed.sibling != null) {
				next = completed.sibling;
				return;
			}
			completed = completed.parent;
		}
		next = null;
	}
	/*
	 * Nearest ancestor boundary that is not already showing its fallback gets another begin, this time rendering the fallback.
	 * Everything built under the boundary so far is dropped. The boundary's own placement flag survives.
	 */
	private void capture(Fiber unit, Throwable error) {
		for (Fiber ancestor = unit.parent; ancestor != null; ancestor = ancestor.parent) {
			if (ancestor.tag == FiberTag.COMPONENT && ancestor.type instanceof ErrorBoundary && ancestor.capturedError == null) {
				logger.debug("Render error in {} captured by {}.", unit, ancestor, error);
				captures.increment();
				ancestor.capturedError = error;
				ancestor.flags &= EffectFlags.PLACEMENT;
				ancestor.subtreeFlags = EffectFlags.NONE;
				ancestor.deletions = null;
				ancestor.child = ancestor.alternate != null ? ancestor.alternate.child : null;
				next = ancestor;
				return;
			}
		}
		failure = error;
		next = null;
	}
}
