// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;

/*
 * Commit runs in three passes over the finished pending tree. None of them can be interrupted.
 * Subtree flags let every pass skip branches without relevant effects.
 *
 * Mutation pass processes every fiber in the same order: deletions owned by the fiber, then its children,
 * then its own placement, content reset, and update. Deleted handles are therefore gone before anything
 * is inserted next to them, and placed siblings are inserted left to right, so that an anchor is never
 * a sibling that has not been inserted yet.
 *
 * Exceptions from host primitives propagate. Exceptions from lifecycle callbacks are logged.
 */
final class CommitApplier {
	private static final Logger logger = LoggerFactory.getLogger(CommitApplier.class);
	private final HostPlatform host;
	CommitApplier(HostPlatform host) {
		this.host = host;
	}
	void beforeMutation(Fiber fiber) {
		if ((fiber.subtreeFlags & EffectFlags.BEFORE_MUTATION_MASK) != 0)
			for (Fiber child = fiber.child; child != null; child = child.sibling)
				beforeMutation(child);
		if (fiber.has(EffectFlags.SNAPSHOT)) {
			Lifecycle lifecycle = (Lifecycle)fiber.type;
			fiber.snapshot = null;
			ExceptionLogging.log(logger).run(() -> fiber.snapshot = lifecycle.beforeMutation(fiber));
		}
	}
	void mutate(Fiber fiber) {
		if (fiber.deletions != null) {
			for (Fiber deleted : fiber.deletions)
				delete(fiber, deleted);
			fiber.deletions = null;
		}
		if ((fiber.subtreeFlags & EffectFlags.MUTATION_MASK) != 0)
			for (Fiber child = fiber.child; child != null; child = child.sibling)
				mutate(child);
		if (fiber.has(EffectFlags.PLACEMENT)) {
			place(fiber);
			fiber.flags &= ~EffectFlags.PLACEMENT;
		}
		if (fiber.has(EffectFlags.CONTENT_RESET))
			resetContent(fiber);
		if (fiber.has(EffectFlags.UPDATE)) {
			switch (fiber.tag) {
			case HOST:
				host.applyHostPropDiff(fiber.hostHandle, fiber.updatePayload);
				break;
			case TEXT:
				host.updateTextHandle(fiber.hostHandle, (String)fiber.committedProps);
				break;
			default:
				break;
			}
		}
	}
	/*
	 * Mount callbacks of a new subtree fire bottom-up. Update callbacks fire after the component's children.
	 * Passive callbacks are only collected here.
	 */
	void layout(Fiber fiber, List<Fiber> passive) {
		if ((fiber.subtreeFlags & (EffectFlags.LAYOUT_MASK | EffectFlags.PASSIVE_MASK)) != 0)
			for (Fiber child = fiber.child; child != null; child = child.sibling)
				layout(child, passive);
		if (fiber.has(EffectFlags.CALLBACK)) {
			Lifecycle lifecycle = (Lifecycle)fiber.type;
			if (fiber.alternate == null)
				ExceptionLogging.log(logger).run(() -> lifecycle.mounted(fiber));
			else {
				Object snapshot = fiber.snapshot;
				ExceptionLogging.log(logger).run(() -> lifecycle.updated(fiber, snapshot));
			}
			fiber.snapshot = null;
		}
		if (fiber.has(EffectFlags.PASSIVE))
			passive.add(fiber);
	}
	private static boolean isHostParent(Fiber fiber) {
		return fiber.tag == FiberTag.HOST || fiber.tag == FiberTag.ROOT;
	}
	private static Fiber hostParent(Fiber fiber) {
		for (Fiber ancestor = fiber; ancestor != null; ancestor = ancestor.parent)
			if (isHostParent(ancestor))
				return ancestor;
		throw new IllegalStateException("Fiber is not attached to any root.");
	}
	private void resetContent(Fiber fiber) {
		host.applyHostPropDiff(fiber.hostHandle, Collections.singletonList(PropChange.text(null)));
		fiber.flags &= ~EffectFlags.CONTENT_RESET;
	}
	private void place(Fiber fiber) {
		Fiber parent = hostParent(fiber.parent);
		if (parent.has(EffectFlags.CONTENT_RESET))
			resetContent(parent);
		insert(fiber, hostSibling(fiber), parent.hostHandle);
	}
	/*
	 * Finds host handle to insert before. Siblings that are themselves being placed are not inserted yet and cannot serve as anchors.
	 * Component siblings are searched for their first host descendant. Search ends at the nearest host parent.
	 */
	private static Object hostSibling(Fiber fiber) {
		Fiber node = fiber;
		siblings: while (true) {
			while (node.sibling == null) {
				if (node.parent == null || isHostParent(node.parent))
					return null;
				node = node.parent;
			}
			node = node.sibling;
			while (node.tag != FiberTag.HOST && node.tag != FiberTag.TEXT) {
				if (node.has(EffectFlags.PLACEMENT) || node.child == null)
					continue siblings;
				node = node.child;
			}
			if (!node.has(EffectFlags.PLACEMENT))
				return node.hostHandle;
		}
	}
	private void insert(Fiber fiber, Object before, Object parent) {
		if (fiber.tag == FiberTag.HOST || fiber.tag == FiberTag.TEXT) {
			if (fiber.hostHandle == null)
				materialize(fiber);
			host.insertHostHandle(parent, fiber.hostHandle, before);
		} else {
			for (Fiber child = fiber.child; child != null; child = child.sibling)
				insert(child, before, parent);
		}
	}
	/*
	 * New subtree is built bottom-up and fully assembled before its top is inserted into the live host tree.
	 */
	private Object materialize(Fiber fiber) {
		if (fiber.tag == FiberTag.TEXT) {
			fiber.hostHandle = host.createTextHandle((String)fiber.committedProps);
			return fiber.hostHandle;
		}
		List<Object> children = new ArrayList<>();
		collect(fiber.child, children);
		NodeDescriptor descriptor = (NodeDescriptor)fiber.committedProps;
		Object handle = host.createHostHandle((String)fiber.type, descriptor.props());
		fiber.hostHandle = handle;
		String text = descriptor.textContent();
		if (text != null)
			host.applyHostPropDiff(handle, Collections.singletonList(PropChange.text(text)));
		for (Object child : children)
			host.insertHostHandle(handle, child, null);
		return handle;
	}
	private void collect(Fiber first, List<Object> handles) {
		for (Fiber child = first; child != null; child = child.sibling) {
			if (child.tag == FiberTag.HOST || child.tag == FiberTag.TEXT)
				handles.add(materialize(child));
			else
				collect(child.child, handles);
		}
	}
	private void delete(Fiber parent, Fiber deleted) {
		Object container = hostParent(parent).hostHandle;
		unmount(deleted, container);
	}
	/*
	 * Component callbacks fire top-down. Host handles are released bottom-up.
	 * Only the topmost host nodes of the deleted subtree are removed from the host parent. Nested nodes leave together with them.
	 * Pointers to released handles are cleared on both alternates, so that no fiber references a destroyed handle.
	 */
	private void unmount(Fiber fiber, Object container) {
		switch (fiber.tag) {
		case HOST:
		case TEXT:
			for (Fiber child = fiber.child; child != null; child = child.sibling)
				unmount(child, null);
			if (fiber.hostHandle != null) {
				if (container != null)
					host.removeHostHandle(container, fiber.hostHandle);
				host.releaseHostHandle(fiber.hostHandle);
			}
			break;
		case COMPONENT:
			if (fiber.type instanceof Lifecycle) {
				Lifecycle lifecycle = (Lifecycle)fiber.type;
				ExceptionLogging.log(logger).run(() -> lifecycle.unmounted(fiber));
			}
			for (Fiber child = fiber.child; child != null; child = child.sibling)
				unmount(child, container);
			break;
		default:
			throw new IllegalStateException();
		}
		fiber.hostHandle = null;
		if (fiber.alternate != null) {
			fiber.alternate.hostHandle = null;
			fiber.alternate.alternate = null;
			fiber.alternate = null;
		}
	}
}
