// Part of Fibers
package com.machinezoo.fibers;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.common.base.Ticker;
import com.machinezoo.closeablescope.*;
import com.machinezoo.fibers.util.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Root owns the committed tree, the update queue, and at most one render in progress.
 * All of it is guarded by the root's monitor. Render units and the whole commit run while holding the monitor,
 * so at most one thread works on the root at a time. Concurrent render releases the monitor whenever it yields.
 *
 * Sync updates render and commit on the calling thread. Updates scheduled from within render or commit
 * on the same thread are queued and handled right after the commit. Other lanes are rendered by executor tasks.
 *
 * Render with higher-priority lanes always starts from the committed tree. Render in progress is abandoned instead of merged.
 */
/**
 * Container of one rendered tree.
 */
@StubDocs
@DraftApi("requires review")
public class FiberRoot {
	private static final Logger logger = LoggerFactory.getLogger(FiberRoot.class);
	private static final Timer renderTimer = Metrics.timer("fibers.render");
	private static final Timer commitTimer = Metrics.timer("fibers.commit");
	private static final Counter abandonedCounter = Metrics.counter("fibers.render.abandoned");
	private static final Counter yieldCounter = Metrics.counter("fibers.render.yields");
	/*
	 * Sync update scheduled from every sync commit would otherwise loop forever on the calling thread.
	 */
	private static final int MAX_NESTED_UPDATES = 50;
	private final HostPlatform host;
	private final CommitApplier applier;
	private final PostLockQueue post = new PostLockQueue(this);
	private final UpdateQueue queue = new UpdateQueue();
	private Fiber current;
	private WorkLoop loop;
	private UpdateQueue.Plan plan;
	private RootState state = RootState.IDLE;
	private int scheduled = Lanes.NONE;
	private int batching;
	private boolean flushing;
	private List<Fiber> passive = new ArrayList<>();
	private boolean passiveScheduled;
	public FiberRoot(HostPlatform host, Object container) {
		Objects.requireNonNull(host);
		Objects.requireNonNull(container);
		this.host = host;
		applier = new CommitApplier(host);
		current = Fiber.root(container);
		OwnerTrace.of(this)
			.alias("root")
			.generateId();
	}
	public HostPlatform host() {
		return host;
	}
	private Executor executor = FiberExecutor.common();
	public synchronized FiberRoot executor(Executor executor) {
		Objects.requireNonNull(executor);
		this.executor = executor;
		return this;
	}
	public synchronized Executor executor() {
		return executor;
	}
	/*
	 * Time slice of concurrent render. Zero budget yields after every unit of work.
	 */
	private Duration budget = Duration.ofMillis(5);
	public synchronized FiberRoot budget(Duration budget) {
		Objects.requireNonNull(budget);
		if (budget.isNegative())
			throw new IllegalArgumentException("Negative render budget.");
		this.budget = budget;
		return this;
	}
	public synchronized Duration budget() {
		return budget;
	}
	private Ticker ticker = Ticker.systemTicker();
	public synchronized FiberRoot ticker(Ticker ticker) {
		Objects.requireNonNull(ticker);
		this.ticker = ticker;
		return this;
	}
	public synchronized Ticker ticker() {
		return ticker;
	}
	/*
	 * Receives render and commit errors of executor-driven renders. Sync entry points throw instead.
	 * Global default is volatile to avoid synchronization.
	 */
	private static volatile BiConsumer<FiberRoot, Throwable> handlerDefault = (r, ex) -> logger.error("Unhandled exception in fiber root.", ex);
	public static void handlerDefault(BiConsumer<FiberRoot, Throwable> handler) {
		Objects.requireNonNull(handler);
		handlerDefault = handler;
	}
	public static BiConsumer<FiberRoot, Throwable> handlerDefault() {
		return handlerDefault;
	}
	private BiConsumer<FiberRoot, Throwable> handler = (r, ex) -> handlerDefault.accept(r, ex);
	public synchronized FiberRoot handler(BiConsumer<FiberRoot, Throwable> handler) {
		Objects.requireNonNull(handler);
		this.handler = handler;
		return this;
	}
	public synchronized BiConsumer<FiberRoot, Throwable> handler() {
		return handler;
	}
	public synchronized RootState state() {
		return state;
	}
	public synchronized int pendingLanes() {
		return queue.lanes();
	}
	/**
	 * Returns the root of the committed tree. The tree must be treated as read-only.
	 */
	public synchronized Fiber readCommittedTree() {
		return current;
	}
	/**
	 * Schedules rendering of {@code element} into this root with given priority.
	 * Sync updates are rendered and committed before this method returns unless batched or scheduled from within render or commit.
	 *
	 * @throws RenderException
	 *             if a sync render fails and no error boundary catches the error
	 * @throws CommitException
	 *             if a sync commit fails
	 */
	public void scheduleUpdate(NodeDescriptor element, int lane) {
		Lanes.validate(lane);
		post.run(() -> {
			queue.enqueue(element, lane);
			if (Lanes.isSync(lane)) {
				if (batching == 0 && !working())
					drainSync();
			} else
				schedule();
		});
	}
	public void render(NodeDescriptor element) {
		scheduleUpdate(element, Lanes.DEFAULT);
	}
	/*
	 * Deletes the whole tree synchronously. Root can be rendered into again afterwards.
	 */
	public void unmount() {
		scheduleUpdate(null, Lanes.SYNC);
	}
	/**
	 * Renders and commits all pending updates on the calling thread.
	 */
	public void flushSync() {
		post.run(() -> {
			if (working())
				throw new IllegalStateException("Cannot flush the root while it is rendering or committing.");
			flushPassive();
			int pending = queue.lanes();
			if (pending != Lanes.NONE)
				performSync(pending);
			drainSync();
		});
	}
	/*
	 * Sync updates within the batch are held back and rendered together when the outermost batch is closed.
	 * Batching is per root, so sync updates from other threads are held back too.
	 */
	public CloseableScope batch() {
		synchronized (this) {
			++batching;
		}
		return () -> post.run(() -> {
			if (batching <= 0)
				throw new IllegalStateException("Batch closed twice.");
			--batching;
			if (batching == 0 && !working())
				drainSync();
		});
	}
	private boolean working() {
		return state == RootState.RENDERING || state == RootState.COMMITTING || flushing;
	}
	@DraftCode("handle RejectedExecutionException")
	private void schedule() {
		int next = Lanes.highest(Lanes.remove(queue.lanes(), Lanes.SYNC));
		if (next == Lanes.NONE)
			return;
		if (scheduled != Lanes.NONE && !Lanes.higher(next, scheduled))
			return;
		scheduled = next;
		executor.execute(FiberExecutor.lane(next, ExceptionLogging.log(logger).runnable(new RootTask(this, "render", FiberRoot::work))));
	}
	private void work() {
		post.run(() -> {
			scheduled = Lanes.NONE;
			if (working())
				return;
			try {
				flushPassive();
				step();
			} catch (RuntimeException ex) {
				report(ex);
			}
			schedule();
		});
	}
	/*
	 * Sync updates held back by an open batch are invisible to the executor-driven render.
	 */
	private int eligible() {
		return batching > 0 ? Lanes.remove(queue.lanes(), Lanes.SYNC) : queue.lanes();
	}
	private void step() {
		int pending = eligible();
		if (pending == Lanes.NONE)
			return;
		int lanes = Lanes.highest(pending);
		if (Lanes.isSync(lanes)) {
			drainSync();
			return;
		}
		if (loop != null && loop.lanes() != lanes)
			abandon();
		if (loop == null)
			prepare(lanes);
		state = RootState.RENDERING;
		boolean finished;
		Timer.Sample sample = Timer.start();
		try {
			finished = loop.runConcurrent(new TimeSlice(ticker, budget), this::preempted);
		} catch (RuntimeException ex) {
			abandon();
			throw ex;
		} finally {
			sample.stop(renderTimer);
		}
		if (!finished) {
			yieldCounter.increment();
			state = RootState.YIELDED;
			if (Lanes.isSync(eligible()))
				drainSync();
			return;
		}
		finish();
		drainSync();
	}
	private boolean preempted() {
		return Lanes.higher(eligible(), loop.lanes());
	}
	private void prepare(int lanes) {
		plan = queue.plan(lanes);
		loop = new WorkLoop(current, plan.element, lanes);
		logger.trace("Rendering {} in lanes {}.", this, Lanes.toString(lanes));
	}
	private void abandon() {
		if (loop != null) {
			logger.debug("Abandoning render of {} in lanes {} after {} units.", this, Lanes.toString(loop.lanes()), loop.units());
			abandonedCounter.increment();
		}
		loop = null;
		plan = null;
		state = RootState.IDLE;
	}
	private void drainSync() {
		for (int depth = 0; Lanes.isSync(queue.lanes()); ++depth) {
			if (depth >= MAX_NESTED_UPDATES)
				throw new IllegalStateException("Sync updates keep scheduling more sync updates.");
			performSync(Lanes.SYNC);
		}
	}
	private void performSync(int lanes) {
		flushPassive();
		abandon();
		prepare(lanes);
		state = RootState.RENDERING;
		Timer.Sample sample = Timer.start();
		try {
			loop.runSync();
		} catch (RuntimeException ex) {
			abandon();
			throw ex;
		} finally {
			sample.stop(renderTimer);
		}
		finish();
	}
	/*
	 * Updates of a failed render are dropped, so that the failure is not repeated on every following render.
	 */
	private void finish() {
		Throwable failure = loop.failure();
		if (failure != null) {
			queue.drop(plan);
			loop = null;
			plan = null;
			state = RootState.IDLE;
			throw new RenderException("Render failed and no error boundary caught the error.", failure);
		}
		commit();
	}
	private void commit() {
		state = RootState.COMMITTING;
		Fiber finished = loop.pendingRoot();
		UpdateQueue.Plan committed = plan;
		loop = null;
		plan = null;
		Span span = GlobalTracer.get().buildSpan("fibers.commit")
			.withTag("component", "fibers")
			.start();
		OwnerTrace.of(this).fill(span);
		Timer.Sample sample = Timer.start();
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			try {
				applier.beforeMutation(finished);
				applier.mutate(finished);
			} catch (RuntimeException ex) {
				queue.drop(committed);
				state = RootState.IDLE;
				throw new CommitException("Host primitive failed during commit.", ex);
			}
			current = finished;
			queue.commit(committed);
			applier.layout(finished, passive);
			state = RootState.IDLE;
		} finally {
			sample.stop(commitTimer);
			span.finish();
		}
		schedulePassive();
	}
	private void schedulePassive() {
		if (passive.isEmpty() || passiveScheduled)
			return;
		passiveScheduled = true;
		executor.execute(FiberExecutor.lane(Lanes.DEFAULT, ExceptionLogging.log(logger).runnable(new RootTask(this, "passive", FiberRoot::passiveTask))));
	}
	private void passiveTask() {
		post.run(() -> {
			passiveScheduled = false;
			if (working())
				return;
			try {
				flushPassive();
				if (batching == 0)
					drainSync();
			} catch (RuntimeException ex) {
				report(ex);
			}
		});
	}
	/*
	 * Passive callbacks of the previous commit always run before the next render starts.
	 * Sync updates they schedule are queued, not rendered from within the flush.
	 */
	private void flushPassive() {
		if (passive.isEmpty())
			return;
		List<Fiber> effects = passive;
		passive = new ArrayList<>();
		flushing = true;
		try {
			for (Fiber fiber : effects) {
				Lifecycle lifecycle = (Lifecycle)fiber.type;
				ExceptionLogging.log(logger).run(() -> lifecycle.passive(fiber));
			}
		} finally {
			flushing = false;
		}
	}
	private void report(Throwable exception) {
		BiConsumer<FiberRoot, Throwable> handler = this.handler;
		post.post(() -> ExceptionLogging.log(logger).fromBiConsumer(handler).accept(this, exception));
	}
	/**
	 * Returns indented outline of the committed tree.
	 */
	public synchronized String dump() {
		StringBuilder outline = new StringBuilder();
		dump(outline, current, 0);
		return outline.toString();
	}
	private static void dump(StringBuilder outline, Fiber fiber, int depth) {
		for (int i = 0; i < depth; ++i)
			outline.append("  ");
		switch (fiber.tag) {
		case ROOT:
			outline.append("root");
			break;
		case TEXT:
			outline.append('"').append(fiber.committedProps).append('"');
			break;
		case HOST: {
			NodeDescriptor descriptor = (NodeDescriptor)fiber.committedProps;
			outline.append(fiber.type);
			if (fiber.key != null)
				outline.append(" key=").append(fiber.key);
			if (!descriptor.props().isEmpty())
				outline.append(' ').append(descriptor.props());
			if (descriptor.textContent() != null)
				outline.append(" \"").append(descriptor.textContent()).append('"');
			break;
		}
		case COMPONENT:
			outline.append('<').append(fiber.type.getClass().getSimpleName()).append('>');
			if (fiber.key != null)
				outline.append(" key=").append(fiber.key);
			break;
		default:
			throw new IllegalStateException();
		}
		outline.append('\n');
		for (Fiber child = fiber.child; child != null; child = child.sibling)
			dump(outline, child, depth + 1);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
