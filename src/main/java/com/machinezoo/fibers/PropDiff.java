// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;

/*
 * Diff is flat. Nested maps or lists in prop values are compared with equals() and replaced as a whole.
 * Order of changes is deterministic: removals in the order of old props, then additions and modifications in the order of new props.
 */
/**
 * Property diff between two descriptors of the same host node.
 */
public final class PropDiff {
	private PropDiff() {
	}
	public static List<PropChange> diff(Map<String, Object> previous, Map<String, Object> next) {
		Objects.requireNonNull(previous);
		Objects.requireNonNull(next);
		List<PropChange> changes = new ArrayList<>();
		for (String name : previous.keySet())
			if (!next.containsKey(name))
				changes.add(PropChange.remove(name));
		for (Map.Entry<String, Object> entry : next.entrySet())
			if (!Objects.equals(previous.get(entry.getKey()), entry.getValue()))
				changes.add(PropChange.set(entry.getKey(), entry.getValue()));
		return changes;
	}
	/*
	 * Children are structural and handled by the reconciler. Only single-text children are part of the diff.
	 * Transition from text content to child nodes is not a diff entry. It is signaled by CONTENT_RESET flag instead.
	 */
	public static List<PropChange> diff(NodeDescriptor previous, NodeDescriptor next) {
		List<PropChange> changes = diff(previous.props(), next.props());
		String text = next.textContent();
		if (text != null && !text.equals(previous.textContent()))
			changes.add(PropChange.text(text));
		return changes;
	}
}
