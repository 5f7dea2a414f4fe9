// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;

/*
 * Root updates replace the whole element, so the only question is which element a render for given lanes should see.
 * Updates are applied in order, skipping those outside the rendered lanes. Once something is skipped,
 * all later updates are kept for the next render too, so that the last scheduled element always wins eventually.
 *
 * Planning does not modify the queue. The queue advances only when the planned render commits,
 * which keeps abandoned renders free of side effects on the queue.
 */
final class UpdateQueue {
	static final class Update {
		final NodeDescriptor element;
		final int lane;
		Update(NodeDescriptor element, int lane) {
			this.element = element;
			this.lane = lane;
		}
	}
	static final class Plan {
		final NodeDescriptor element;
		final int lanes;
		final NodeDescriptor base;
		final List<Update> rebased;
		final int consumed;
		Plan(NodeDescriptor element, int lanes, NodeDescriptor base, List<Update> rebased, int consumed) {
			this.element = element;
			this.lanes = lanes;
			this.base = base;
			this.rebased = rebased;
			this.consumed = consumed;
		}
	}
	private NodeDescriptor base;
	NodeDescriptor base() {
		return base;
	}
	private final List<Update> updates = new ArrayList<>();
	void enqueue(NodeDescriptor element, int lane) {
		updates.add(new Update(element, lane));
	}
	int lanes() {
		int lanes = Lanes.NONE;
		for (Update update : updates)
			lanes |= update.lane;
		return lanes;
	}
	int size() {
		return updates.size();
	}
	Plan plan(int lanes) {
		NodeDescriptor element = base;
		NodeDescriptor nextBase = null;
		boolean skipped = false;
		List<Update> rebased = new ArrayList<>();
		for (Update update : updates) {
			if (!Lanes.subset(lanes, update.lane)) {
				if (!skipped) {
					skipped = true;
					nextBase = element;
				}
				rebased.add(update);
			} else {
				/*
				 * Applied update after a skipped one must be applied again when the skipped one is rendered.
				 * Empty lane makes it part of every future render.
				 */
				if (skipped)
					rebased.add(new Update(update.element, Lanes.NONE));
				element = update.element;
			}
		}
		if (!skipped)
			nextBase = element;
		return new Plan(element, lanes, nextBase, rebased, updates.size());
	}
	/*
	 * Updates enqueued after the plan was made are preserved.
	 */
	void commit(Plan plan) {
		List<Update> later = new ArrayList<>(updates.subList(plan.consumed, updates.size()));
		updates.clear();
		updates.addAll(plan.rebased);
		updates.addAll(later);
		base = plan.base;
	}
	/*
	 * Failed render or commit drops the updates it was rendering. Base stays, because the committed tree didn't change.
	 */
	void drop(Plan plan) {
		List<Update> kept = new ArrayList<>();
		for (int i = 0; i < updates.size(); ++i) {
			Update update = updates.get(i);
			if (i >= plan.consumed || !Lanes.subset(plan.lanes, update.lane))
				kept.add(update);
		}
		updates.clear();
		updates.addAll(kept);
	}
}
