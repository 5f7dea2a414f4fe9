// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;

/*
 * Standard ThreadPoolExecutor with a priority queue. Tasks are ordered by their lane first and by submission order second,
 * so that urgent renders overtake queued low-priority renders instead of waiting behind them.
 *
 * Tasks submitted via plain execute() run in the default lane. Roots tag their tasks via lane(int, Runnable).
 * Ordering is strict only with a single thread. With more threads, tasks merely start in priority order.
 */
/**
 * Executor that runs render tasks in lane priority order.
 */
@StubDocs
public class FiberExecutor extends ThreadPoolExecutor {
	private static final AtomicLong counter = new AtomicLong();
	private static final Timer timer = Metrics.timer("fibers.executor.tasks");
	private static class LaneTask implements Runnable {
		final int lanes;
		final Runnable runnable;
		LaneTask(int lanes, Runnable runnable) {
			this.lanes = lanes;
			this.runnable = runnable;
		}
		@Override
		public void run() {
			runnable.run();
		}
	}
	/*
	 * Wraps a task, so that it is queued with the priority of the highest of the given lanes.
	 */
	public static Runnable lane(int lanes, Runnable runnable) {
		Objects.requireNonNull(runnable);
		return new LaneTask(lanes, runnable);
	}
	private static class PrioritizedTask implements Runnable, Comparable<PrioritizedTask> {
		final FiberExecutor executor;
		final int priority;
		final long id = counter.incrementAndGet();
		final Runnable runnable;
		final Timer.Sample sample;
		PrioritizedTask(FiberExecutor executor, int priority, Runnable runnable) {
			this.executor = executor;
			this.priority = priority;
			this.runnable = runnable;
			/*
			 * Queuing latency is included.
			 */
			sample = executor == common ? Timer.start() : null;
		}
		@Override
		public int compareTo(PrioritizedTask other) {
			if (priority != other.priority)
				return Integer.compare(priority, other.priority);
			return Long.compare(id, other.id);
		}
		@Override
		public void run() {
			try {
				runnable.run();
			} finally {
				if (sample != null)
					sample.stop(timer);
			}
		}
	}
	public FiberExecutor(int parallelism, ThreadFactory threads) {
		super(parallelism, parallelism, 0, TimeUnit.MILLISECONDS, new PriorityBlockingQueue<>(), threads);
	}
	public FiberExecutor(int parallelism) {
		this(parallelism, Executors.defaultThreadFactory());
	}
	public FiberExecutor() {
		this(1);
	}
	@Override
	public void execute(Runnable runnable) {
		Objects.requireNonNull(runnable);
		int lanes = runnable instanceof LaneTask ? ((LaneTask)runnable).lanes : Lanes.DEFAULT;
		super.execute(new PrioritizedTask(this, Lanes.priority(Lanes.highest(lanes)), runnable));
	}
	/*
	 * Rendering of one root is serialized anyway, so one thread is enough for the shared executor.
	 */
	private static final FiberExecutor common = new FiberExecutor(1, new ThreadFactory() {
		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable);
			thread.setDaemon(true);
			thread.setName("fibers-" + thread.getId());
			return thread;
		}
	});
	static {
		Metrics.gauge("fibers.executor.threads", common, x -> x.getPoolSize());
		Metrics.gauge("fibers.executor.queue", common, x -> x.getQueue().size());
	}
	public static FiberExecutor common() {
		return common;
	}
}
