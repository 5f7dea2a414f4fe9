// Part of Fibers
package com.machinezoo.fibers;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class PostLockQueueTest {
	Object lock = new Object();
	PostLockQueue q = new PostLockQueue(lock);
	@Test
	public void afterLock() {
		List<String> log = new ArrayList<>();
		q.run(() -> {
			q.post(() -> log.add("posted " + Thread.holdsLock(lock)));
			log.add("section " + Thread.holdsLock(lock));
		});
		assertEquals(List.of("section true", "posted false"), log);
	}
	@Test
	public void nested() {
		List<String> log = new ArrayList<>();
		String result = q.eval(() -> {
			q.run(() -> q.post(() -> log.add("inner")));
			q.post(() -> log.add("outer"));
			return "ok";
		});
		assertEquals("ok", result);
		// Inner section runs its tasks when it ends. They run while the outer section still holds the lock.
		assertEquals(List.of("inner", "outer"), log);
	}
	@Test
	public void failure() {
		List<String> log = new ArrayList<>();
		// Posted tasks run even if the section throws.
		assertThrows(IllegalStateException.class, () -> q.run(() -> {
			q.post(() -> log.add("posted"));
			throw new IllegalStateException();
		}));
		assertEquals(List.of("posted"), log);
		// Posting outside of any section runs the task immediately.
		q.post(() -> log.add("direct"));
		assertEquals(List.of("posted", "direct"), log);
	}
}
