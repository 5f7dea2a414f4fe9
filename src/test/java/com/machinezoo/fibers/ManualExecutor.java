// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;
import java.util.concurrent.*;

/*
 * Runs tasks only when the test says so, on the test thread.
 */
public class ManualExecutor implements Executor {
	private final Deque<Runnable> tasks = new ArrayDeque<>();
	@Override
	public synchronized void execute(Runnable task) {
		tasks.add(task);
	}
	public synchronized int pending() {
		return tasks.size();
	}
	public boolean runNext() {
		Runnable task;
		synchronized (this) {
			task = tasks.poll();
		}
		if (task == null)
			return false;
		task.run();
		return true;
	}
	/*
	 * Returns number of executed tasks. Tasks scheduled by executed tasks are executed too.
	 */
	public int runAll() {
		int count = 0;
		while (runNext()) {
			++count;
			if (count > 10_000)
				throw new IllegalStateException("Tasks keep scheduling more tasks.");
		}
		return count;
	}
}
