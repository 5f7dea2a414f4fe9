// Part of Fibers
package com.machinezoo.fibers;

import static org.awaitility.Awaitility.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;

public class FiberExecutorTest extends TestBase {
	FiberExecutor x = new FiberExecutor();
	@AfterEach
	public void cleanup() throws Exception {
		x.shutdown();
		x.awaitTermination(1, TimeUnit.MINUTES);
	}
	@Test
	public void priority() throws Exception {
		CountDownLatch gate = new CountDownLatch(1);
		List<String> order = Collections.synchronizedList(new ArrayList<>());
		// Occupy the only thread, so that the following tasks queue up.
		x.execute(() -> {
			try {
				gate.await();
			} catch (InterruptedException ex) {
				throw new IllegalStateException(ex);
			}
		});
		x.execute(FiberExecutor.lane(Lanes.IDLE, () -> order.add("idle")));
		x.execute(FiberExecutor.lane(Lanes.DEFAULT, () -> order.add("default1")));
		x.execute(() -> order.add("untagged"));
		x.execute(FiberExecutor.lane(Lanes.CONTINUOUS, () -> order.add("continuous")));
		x.execute(FiberExecutor.lane(Lanes.DEFAULT | Lanes.SYNC, () -> order.add("sync")));
		gate.countDown();
		await().until(order::size, equalTo(5));
		// Lane priority first, submission order second. Untagged tasks run in the default lane.
		assertEquals(List.of("sync", "continuous", "default1", "untagged", "idle"), new ArrayList<>(order));
	}
	@Test
	public void submit() throws Exception {
		Future<String> f = x.submit(() -> "done");
		assertEquals("done", f.get());
	}
	@Test
	public void common() {
		assertSame(FiberExecutor.common(), FiberExecutor.common());
		List<String> names = Collections.synchronizedList(new ArrayList<>());
		FiberExecutor.common().execute(() -> names.add(Thread.currentThread().getName()));
		await().until(names::size, equalTo(1));
		assertThat(names.get(0), startsWith("fibers-"));
	}
}
