// Part of Fibers
package com.machinezoo.fibers;

import java.lang.ref.*;
import java.util.*;
import java.util.function.*;
import org.slf4j.*;

/*
 * Executor task of a root. Roots abandoned by the application may still have tasks queued,
 * so the task holds its root weakly and does nothing once the root is collected.
 */
final class RootTask implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(RootTask.class);
	private final WeakReference<FiberRoot> root;
	private final String name;
	private final Consumer<FiberRoot> action;
	RootTask(FiberRoot root, String name, Consumer<FiberRoot> action) {
		Objects.requireNonNull(root);
		Objects.requireNonNull(name);
		Objects.requireNonNull(action);
		this.root = new WeakReference<>(root);
		this.name = name;
		this.action = action;
	}
	@Override
	public void run() {
		FiberRoot target = root.get();
		if (target == null) {
			logger.trace("Skipping {} task of collected root.", name);
			return;
		}
		action.accept(target);
	}
	@Override
	public String toString() {
		FiberRoot target = root.get();
		return name + "@" + (target != null ? target : "collected");
	}
}
