// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Fibers form two trees at most: the current (committed) tree and the pending tree under construction.
 * Every fiber belongs to exactly one of them. Alternate pointer pairs fibers at the same position across the two trees.
 * It is used for lookup only. Ownership follows parent/child/sibling links.
 *
 * Fields are package-private and mutated directly by the reconciler, the work loop, and the commit applier.
 * Public API is read-only and intended for diagnostics and lifecycle callbacks.
 */
/**
 * Unit of reconciliation work, one per position in the rendered tree.
 * Committed tree is available via {@link FiberRoot#readCommittedTree()}.
 */
@StubDocs
public final class Fiber {
	final FiberTag tag;
	final String key;
	/*
	 * Host tag for host fibers, component instance for component fibers, null for text and root fibers.
	 */
	Object type;
	Fiber parent;
	Fiber child;
	Fiber sibling;
	int index;
	Fiber alternate;
	/*
	 * Descriptor for host, component, and root fibers. String for text fibers.
	 * Root descriptor may be null when nothing is rendered.
	 */
	Object pendingProps;
	Object committedProps;
	Object hostHandle;
	int flags;
	int subtreeFlags;
	List<Fiber> deletions;
	int lanes;
	List<PropChange> updatePayload;
	Object snapshot;
	Throwable capturedError;
	Fiber(FiberTag tag, Object pendingProps, String key) {
		this.tag = tag;
		this.pendingProps = pendingProps;
		this.key = key;
	}
	static Fiber root(Object container) {
		Fiber root = new Fiber(FiberTag.ROOT, null, null);
		root.hostHandle = container;
		return root;
	}
	static Fiber fromDescriptor(NodeDescriptor descriptor, int lanes) {
		Fiber fiber = new Fiber(descriptor.kind() == NodeKind.HOST ? FiberTag.HOST : FiberTag.COMPONENT, descriptor, descriptor.key());
		fiber.type = descriptor.type();
		fiber.lanes = lanes;
		return fiber;
	}
	static Fiber fromText(String text, int lanes) {
		Fiber fiber = new Fiber(FiberTag.TEXT, text, null);
		fiber.lanes = lanes;
		return fiber;
	}
	/*
	 * Double buffering. Alternate of the current fiber is recycled if it exists, so that steady-state renders do not allocate fibers.
	 * Everything left over from the previous use of the alternate is reset here, including abandoned renders.
	 * Children are initially shared with the current fiber. Reconciler replaces them with pending children when the fiber is begun.
	 */
	static Fiber createWorkInProgress(Fiber current, Object pendingProps, int lanes) {
		Fiber pending = current.alternate;
		if (pending == null) {
			pending = new Fiber(current.tag, pendingProps, current.key);
			pending.alternate = current;
			current.alternate = pending;
		} else {
			pending.pendingProps = pendingProps;
			pending.flags = EffectFlags.NONE;
			pending.subtreeFlags = EffectFlags.NONE;
			pending.deletions = null;
			pending.updatePayload = null;
			pending.snapshot = null;
			pending.capturedError = null;
		}
		pending.type = current.type;
		pending.hostHandle = current.hostHandle;
		pending.child = current.child;
		pending.committedProps = current.committedProps;
		pending.index = current.index;
		pending.sibling = null;
		pending.parent = null;
		pending.lanes = lanes;
		return pending;
	}
	public FiberTag tag() {
		return tag;
	}
	public String key() {
		return key;
	}
	public Object type() {
		return type;
	}
	public Fiber parent() {
		return parent;
	}
	public Fiber child() {
		return child;
	}
	public Fiber sibling() {
		return sibling;
	}
	public int index() {
		return index;
	}
	public Fiber alternate() {
		return alternate;
	}
	public Object pendingProps() {
		return pendingProps;
	}
	public Object committedProps() {
		return committedProps;
	}
	/**
	 * Committed descriptor of host, component, or root fiber. Returns {@code null} for text fibers.
	 */
	public NodeDescriptor descriptor() {
		return committedProps instanceof NodeDescriptor ? (NodeDescriptor)committedProps : null;
	}
	public String text() {
		return tag == FiberTag.TEXT ? (String)committedProps : null;
	}
	public Object hostHandle() {
		return hostHandle;
	}
	public int flags() {
		return flags;
	}
	public boolean has(int flag) {
		return (flags & flag) != 0;
	}
	public int subtreeFlags() {
		return subtreeFlags;
	}
	public List<Fiber> deletions() {
		return deletions != null ? Collections.unmodifiableList(deletions) : Collections.emptyList();
	}
	public int lanes() {
		return lanes;
	}
	public List<PropChange> updatePayload() {
		return updatePayload != null ? Collections.unmodifiableList(updatePayload) : Collections.emptyList();
	}
	public List<Fiber> children() {
		List<Fiber> children = new ArrayList<>();
		for (Fiber next = child; next != null; next = next.sibling)
			children.add(next);
		return children;
	}
	/*
	 * Type check used to decide whether a fiber can be reused for a descriptor.
	 * Host tags are compared by value, components by identity.
	 */
	boolean matches(NodeDescriptor descriptor) {
		switch (tag) {
		case HOST:
			return descriptor.kind() == NodeKind.HOST && type.equals(descriptor.type());
		case COMPONENT:
			return descriptor.kind() == NodeKind.COMPONENT && type == descriptor.type();
		default:
			return false;
		}
	}
	@Override
	public String toString() {
		StringBuilder description = new StringBuilder();
		description.append("Fiber(").append(tag);
		if (tag == FiberTag.HOST)
			description.append(' ').append(type);
		else if (tag == FiberTag.COMPONENT)
			description.append(' ').append(type.getClass().getSimpleName());
		else if (tag == FiberTag.TEXT)
			description.append(" \"").append(pendingProps).append('"');
		if (key != null)
			description.append(" key=").append(key);
		if (flags != EffectFlags.NONE)
			description.append(' ').append(EffectFlags.toString(flags));
		description.append(')');
		return description.toString();
	}
}
