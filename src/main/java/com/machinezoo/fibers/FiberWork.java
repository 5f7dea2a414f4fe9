// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;

/*
 * Begin and complete steps of a single unit of work. Both are dispatched by fiber tag with exhaustive switches.
 * Neither step can be suspended midway. Yielding happens only between units in WorkLoop.
 *
 * Host handles are not created here. Render phase must not touch the host, so that abandoned renders leave no trace.
 * Handles of new fibers are created by the commit applier when the new subtree is inserted.
 */
final class FiberWork {
	private FiberWork() {
	}
	/*
	 * Returns first child to work on next or null if the fiber has no children and can be completed.
	 */
	static Fiber begin(WorkLoop loop, Fiber current, Fiber pending) {
		switch (pending.tag) {
		case ROOT:
			return beginRoot(loop, current, pending);
		case HOST:
			return beginHost(loop, current, pending);
		case COMPONENT:
			return beginComponent(loop, current, pending);
		case TEXT:
			return null;
		default:
			throw new IllegalStateException();
		}
	}
	private static Fiber beginRoot(WorkLoop loop, Fiber current, Fiber pending) {
		if (current != null && current.committedProps == pending.pendingProps && pending.pendingProps != null)
			return bailout(loop, current, pending);
		reconcileChildren(loop, current, pending, pending.pendingProps);
		return pending.child;
	}
	private static Fiber beginHost(WorkLoop loop, Fiber current, Fiber pending) {
		NodeDescriptor descriptor = (NodeDescriptor)pending.pendingProps;
		if (current != null && current.committedProps == descriptor)
			return bailout(loop, current, pending);
		Object children = descriptor.textContent() != null ? null : descriptor.children();
		if (current != null && children != null && ((NodeDescriptor)current.committedProps).textContent() != null)
			pending.flags |= EffectFlags.CONTENT_RESET;
		reconcileChildren(loop, current, pending, children);
		return pending.child;
	}
	private static Fiber beginComponent(WorkLoop loop, Fiber current, Fiber pending) {
		NodeDescriptor element = (NodeDescriptor)pending.pendingProps;
		Component component = (Component)pending.type;
		if (current != null && current.committedProps == element && pending.capturedError == null && !current.has(EffectFlags.DID_CAPTURE))
			return bailout(loop, current, pending);
		NodeDescriptor rendered;
		if (pending.capturedError != null) {
			rendered = ((ErrorBoundary)component).fallback(element, pending.capturedError);
			pending.flags |= EffectFlags.DID_CAPTURE;
		} else
			rendered = component.render(element);
		if (component instanceof Lifecycle) {
			pending.flags |= EffectFlags.CALLBACK | EffectFlags.PASSIVE;
			if (current != null)
				pending.flags |= EffectFlags.SNAPSHOT;
		}
		reconcileChildren(loop, current, pending, rendered);
		return pending.child;
	}
	private static void reconcileChildren(WorkLoop loop, Fiber current, Fiber pending, Object children) {
		if (current == null)
			ChildReconciler.MOUNT.reconcile(pending, null, children, loop.lanes());
		else
			ChildReconciler.UPDATE.reconcile(pending, current.child, children, loop.lanes());
	}
	/*
	 * Unchanged descriptor means unchanged subtree. Children are still cloned into the pending tree,
	 * because the two trees never share fibers. Cloned children carry their committed descriptors,
	 * so they bail out in turn when they are begun.
	 */
	private static Fiber bailout(WorkLoop loop, Fiber current, Fiber pending) {
		Fiber previous = null;
		for (Fiber child = current.child; child != null; child = child.sibling) {
			Fiber clone = Fiber.createWorkInProgress(child, child.committedProps, loop.lanes());
			clone.parent = pending;
			if (previous == null)
				pending.child = clone;
			else
				previous.sibling = clone;
			previous = clone;
		}
		if (previous == null)
			pending.child = null;
		loop.bailouts++;
		return pending.child;
	}
	static void complete(WorkLoop loop, Fiber current, Fiber pending) {
		switch (pending.tag) {
		case HOST:
			if (current != null) {
				NodeDescriptor previous = (NodeDescriptor)current.committedProps;
				NodeDescriptor next = (NodeDescriptor)pending.pendingProps;
				if (previous != next) {
					List<PropChange> diff = PropDiff.diff(previous, next);
					if (!diff.isEmpty()) {
						pending.updatePayload = diff;
						pending.flags |= EffectFlags.UPDATE;
					}
				}
			}
			break;
		case TEXT:
			if (current != null && !current.committedProps.equals(pending.pendingProps))
				pending.flags |= EffectFlags.UPDATE;
			break;
		case COMPONENT:
		case ROOT:
			break;
		default:
			throw new IllegalStateException();
		}
		pending.committedProps = pending.pendingProps;
		bubble(pending);
	}
	private static void bubble(Fiber pending) {
		int subtree = EffectFlags.NONE;
		for (Fiber child = pending.child; child != null; child = child.sibling) {
			subtree |= child.subtreeFlags | child.flags;
			child.parent = pending;
		}
		pending.subtreeFlags = subtree;
	}
}
