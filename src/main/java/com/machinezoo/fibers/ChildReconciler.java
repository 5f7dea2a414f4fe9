// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;
import org.slf4j.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * General minimal tree edit distance is far too expensive for interactive use.
 * This reconciler is linear, because it relies on two heuristics:
 * - Children are matched only among siblings. Subtree moved to another parent is deleted and created anew.
 * - Children are reused only when both key and type match. Otherwise the old subtree is deleted and new one created.
 *
 * There are two instances. One tracks side effects and it is used when the parent already exists in the committed tree.
 * The other one is used under newly mounted parents. It does not flag anything,
 * because the whole new subtree is inserted at once by its topmost placed ancestor.
 *
 * Output depends only on the parent, its old children, and new children. Nothing here looks at time or scheduling state.
 */
final class ChildReconciler {
	private static final Logger logger = LoggerFactory.getLogger(ChildReconciler.class);
	static final ChildReconciler UPDATE = new ChildReconciler(true);
	static final ChildReconciler MOUNT = new ChildReconciler(false);
	private final boolean tracking;
	private ChildReconciler(boolean tracking) {
		this.tracking = tracking;
	}
	/*
	 * New children may be a single descriptor, single string, list of normalized children, or null.
	 * Returns the first pending child, which is also linked from the parent.
	 */
	Fiber reconcile(Fiber parent, Fiber currentFirstChild, Object children, int lanes) {
		Fiber first;
		if (children instanceof List) {
			@SuppressWarnings("unchecked")
			List<Object> list = (List<Object>)children;
			first = reconcileList(parent, currentFirstChild, list, lanes);
		} else {
			Object child = NodeDescriptor.normalize(children);
			if (child instanceof NodeDescriptor)
				first = placeSingle(reconcileSingleElement(parent, currentFirstChild, (NodeDescriptor)child, lanes));
			else if (child instanceof String)
				first = placeSingle(reconcileSingleText(parent, currentFirstChild, (String)child, lanes));
			else {
				deleteRemaining(parent, currentFirstChild);
				first = null;
			}
		}
		parent.child = first;
		return first;
	}
	private void deleteChild(Fiber parent, Fiber child) {
		if (!tracking)
			return;
		if (parent.deletions == null)
			parent.deletions = new ArrayList<>();
		parent.deletions.add(child);
		parent.flags |= EffectFlags.DELETION;
	}
	private void deleteRemaining(Fiber parent, Fiber first) {
		if (!tracking)
			return;
		for (Fiber child = first; child != null; child = child.sibling)
			deleteChild(parent, child);
	}
	private Fiber reuse(Fiber current, Object props, int lanes) {
		Fiber pending = Fiber.createWorkInProgress(current, props, lanes);
		pending.index = 0;
		pending.sibling = null;
		return pending;
	}
	private Fiber reconcileSingleElement(Fiber parent, Fiber currentFirstChild, NodeDescriptor descriptor, int lanes) {
		String key = descriptor.key();
		Fiber child = currentFirstChild;
		while (child != null) {
			if (Objects.equals(child.key, key)) {
				if (child.matches(descriptor)) {
					deleteRemaining(parent, child.sibling);
					Fiber existing = reuse(child, descriptor, lanes);
					existing.parent = parent;
					return existing;
				}
				/*
				 * Key matched, but type didn't. No later sibling can have the same key, so stop scanning.
				 */
				deleteRemaining(parent, child);
				break;
			}
			deleteChild(parent, child);
			child = child.sibling;
		}
		Fiber created = Fiber.fromDescriptor(descriptor, lanes);
		created.parent = parent;
		return created;
	}
	private Fiber reconcileSingleText(Fiber parent, Fiber currentFirstChild, String text, int lanes) {
		if (currentFirstChild != null && currentFirstChild.tag == FiberTag.TEXT) {
			deleteRemaining(parent, currentFirstChild.sibling);
			Fiber existing = reuse(currentFirstChild, text, lanes);
			existing.parent = parent;
			return existing;
		}
		deleteRemaining(parent, currentFirstChild);
		Fiber created = Fiber.fromText(text, lanes);
		created.parent = parent;
		return created;
	}
	private Fiber placeSingle(Fiber fiber) {
		if (tracking && fiber.alternate == null)
			fiber.flags |= EffectFlags.PLACEMENT;
		return fiber;
	}
	/*
	 * Reused child that was positioned before an already placed child has moved backwards and needs a host move.
	 * Otherwise it stays where it is and becomes the new reference point for the following children.
	 * This flags all children skipped over by a single item moved from front to back rather than the moved item itself.
	 */
	private int place(Fiber fiber, int lastPlacedIndex, int index) {
		fiber.index = index;
		if (!tracking)
			return lastPlacedIndex;
		Fiber current = fiber.alternate;
		if (current != null) {
			int oldIndex = current.index;
			if (oldIndex < lastPlacedIndex) {
				fiber.flags |= EffectFlags.PLACEMENT;
				return lastPlacedIndex;
			}
			return oldIndex;
		}
		fiber.flags |= EffectFlags.PLACEMENT;
		return lastPlacedIndex;
	}
	private Fiber create(Fiber parent, Object child, int lanes) {
		Fiber created;
		if (child instanceof NodeDescriptor)
			created = Fiber.fromDescriptor((NodeDescriptor)child, lanes);
		else if (child instanceof String)
			created = Fiber.fromText((String)child, lanes);
		else
			return null;
		created.parent = parent;
		return created;
	}
	/*
	 * Returns reused fiber if the old fiber matches the new child by key and type, null otherwise.
	 * Keyless children match keyless old fibers by position.
	 */
	private Fiber updateSlot(Fiber parent, Fiber old, Object child, int lanes) {
		if (old == null || child == null)
			return null;
		Fiber reused = null;
		if (child instanceof String) {
			if (old.tag == FiberTag.TEXT && old.key == null)
				reused = reuse(old, child, lanes);
		} else {
			NodeDescriptor descriptor = (NodeDescriptor)child;
			if (Objects.equals(old.key, descriptor.key()) && old.matches(descriptor))
				reused = reuse(old, descriptor, lanes);
		}
		if (reused != null)
			reused.parent = parent;
		return reused;
	}
	private static Object slotKey(Object child, int index) {
		if (child instanceof NodeDescriptor) {
			String key = ((NodeDescriptor)child).key();
			if (key != null)
				return key;
		}
		return index;
	}
	private Fiber reconcileList(Fiber parent, Fiber currentFirstChild, List<Object> children, int lanes) {
		if (tracking)
			warnDuplicates(parent, children);
		Fiber first = null;
		Fiber previous = null;
		Fiber old = currentFirstChild;
		Fiber nextOld = null;
		int lastPlacedIndex = 0;
		int index = 0;
		/*
		 * Common prefix. Stops at the first position where the old fiber cannot be reused.
		 */
		for (; old != null && index < children.size(); ++index) {
			/*
			 * Old fiber ahead of current position means there was a hole in the old list. Nothing can be reused for this slot.
			 */
			if (old.index > index) {
				nextOld = old;
				old = null;
			} else
				nextOld = old.sibling;
			Fiber fiber = updateSlot(parent, old, children.get(index), lanes);
			if (fiber == null) {
				if (old == null)
					old = nextOld;
				break;
			}
			lastPlacedIndex = place(fiber, lastPlacedIndex, index);
			if (previous == null)
				first = fiber;
			else
				previous.sibling = fiber;
			previous = fiber;
			old = nextOld;
		}
		if (index == children.size()) {
			deleteRemaining(parent, old);
			return first;
		}
		if (old == null) {
			for (; index < children.size(); ++index) {
				Fiber fiber = create(parent, children.get(index), lanes);
				if (fiber == null)
					continue;
				lastPlacedIndex = place(fiber, lastPlacedIndex, index);
				if (previous == null)
					first = fiber;
				else
					previous.sibling = fiber;
				previous = fiber;
			}
			return first;
		}
		/*
		 * Divergent remainder. Old fibers are looked up by key or by position if they have no key.
		 * Linked map keeps deletion order deterministic. Duplicate old keys are never matched and get deleted at the end.
		 */
		Object2ObjectLinkedOpenHashMap<Object, Fiber> existing = new Object2ObjectLinkedOpenHashMap<>();
		List<Fiber> shadowed = new ArrayList<>();
		for (Fiber remaining = old; remaining != null; remaining = remaining.sibling) {
			Object slot = remaining.key != null ? remaining.key : (Object)remaining.index;
			if (existing.containsKey(slot))
				shadowed.add(remaining);
			else
				existing.put(slot, remaining);
		}
		for (; index < children.size(); ++index) {
			Object child = children.get(index);
			if (child == null)
				continue;
			Object slot = slotKey(child, index);
			Fiber match = existing.get(slot);
			Fiber fiber = null;
			if (match != null) {
				fiber = updateSlot(parent, match, child, lanes);
				if (fiber != null)
					existing.remove(slot);
			}
			if (fiber == null)
				fiber = create(parent, child, lanes);
			lastPlacedIndex = place(fiber, lastPlacedIndex, index);
			if (previous == null)
				first = fiber;
			else
				previous.sibling = fiber;
			previous = fiber;
		}
		for (Fiber unmatched : existing.values())
			deleteChild(parent, unmatched);
		for (Fiber unmatched : shadowed)
			deleteChild(parent, unmatched);
		return first;
	}
	/*
	 * Duplicate keys are not supported. First occurrence wins and later duplicates are treated as new children.
	 */
	private void warnDuplicates(Fiber parent, List<Object> children) {
		ObjectOpenHashSet<String> seen = null;
		for (Object child : children) {
			if (child instanceof NodeDescriptor) {
				String key = ((NodeDescriptor)child).key();
				if (key != null) {
					if (seen == null)
						seen = new ObjectOpenHashSet<>();
					if (!seen.add(key)) {
						logger.warn("Duplicate key '{}' among children of {}. Only the first child with this key can be reused.", key, parent);
						return;
					}
				}
			}
		}
	}
}
