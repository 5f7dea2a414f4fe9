// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;
import java.util.function.*;

/*
 * Collects tasks posted while holding a lock and runs them after the lock is released.
 * Used for callbacks into application code, which must not run under the root's lock.
 * Queue is local to one call, so nested and concurrent sections do not share posted tasks.
 * Posted tasks run even if the section throws.
 */
final class PostLockQueue {
	private final Object lock;
	private final ThreadLocal<List<Runnable>> queue = new ThreadLocal<>();
	PostLockQueue(Object lock) {
		this.lock = lock;
	}
	void run(Runnable section) {
		eval(() -> {
			section.run();
			return null;
		});
	}
	<T> T eval(Supplier<T> section) {
		List<Runnable> outer = queue.get();
		List<Runnable> tasks = new ArrayList<>();
		queue.set(tasks);
		try {
			synchronized (lock) {
				return section.get();
			}
		} finally {
			if (outer != null)
				queue.set(outer);
			else
				queue.remove();
			for (Runnable task : tasks)
				task.run();
		}
	}
	/*
	 * Outside of any section, the task runs immediately.
	 */
	void post(Runnable task) {
		List<Runnable> tasks = queue.get();
		if (tasks != null)
			tasks.add(task);
		else
			task.run();
	}
}
