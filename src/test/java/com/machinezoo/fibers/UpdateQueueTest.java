// Part of Fibers
package com.machinezoo.fibers;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;

public class UpdateQueueTest extends TestBase {
	NodeDescriptor a = host("a");
	NodeDescriptor b = host("b");
	NodeDescriptor c = host("c");
	UpdateQueue q = new UpdateQueue();
	@Test
	public void inOrder() {
		q.enqueue(a, Lanes.DEFAULT);
		q.enqueue(b, Lanes.DEFAULT);
		assertEquals(Lanes.DEFAULT, q.lanes());
		UpdateQueue.Plan p = q.plan(Lanes.DEFAULT);
		// Last update wins.
		assertSame(b, p.element);
		// Planning alone leaves the queue untouched.
		assertEquals(2, q.size());
		q.commit(p);
		assertEquals(0, q.size());
		assertEquals(Lanes.NONE, q.lanes());
		assertSame(b, q.base());
	}
	@Test
	public void rebase() {
		q.enqueue(a, Lanes.DEFAULT);
		q.enqueue(b, Lanes.SYNC);
		UpdateQueue.Plan p = q.plan(Lanes.SYNC);
		// Sync render skips the default update and shows the sync one.
		assertSame(b, p.element);
		q.commit(p);
		// Skipped update is still pending, followed by a copy of the applied one.
		assertEquals(Lanes.DEFAULT, q.lanes());
		assertEquals(2, q.size());
		assertNull(q.base());
		// Once the skipped update is rendered, the last scheduled element still wins.
		p = q.plan(Lanes.DEFAULT);
		assertSame(b, p.element);
		q.commit(p);
		assertEquals(0, q.size());
		assertSame(b, q.base());
	}
	@Test
	public void skippedOnly() {
		q.enqueue(a, Lanes.SYNC);
		q.commit(q.plan(Lanes.SYNC));
		q.enqueue(b, Lanes.IDLE);
		// Render of lanes without updates shows the base element.
		UpdateQueue.Plan p = q.plan(Lanes.DEFAULT);
		assertSame(a, p.element);
	}
	@Test
	public void laterUpdates() {
		q.enqueue(a, Lanes.DEFAULT);
		UpdateQueue.Plan p = q.plan(Lanes.DEFAULT);
		q.enqueue(c, Lanes.DEFAULT);
		q.commit(p);
		// Update enqueued while rendering survives the commit.
		assertEquals(1, q.size());
		assertSame(c, q.plan(Lanes.DEFAULT).element);
	}
	@Test
	public void drop() {
		q.enqueue(a, Lanes.SYNC);
		q.commit(q.plan(Lanes.SYNC));
		q.enqueue(b, Lanes.DEFAULT);
		q.enqueue(c, Lanes.IDLE);
		UpdateQueue.Plan p = q.plan(Lanes.DEFAULT);
		q.enqueue(c, Lanes.DEFAULT);
		q.drop(p);
		// Failed render loses only its own updates. Base is unchanged.
		assertEquals(2, q.size());
		assertEquals(Lanes.IDLE | Lanes.DEFAULT, q.lanes());
		assertSame(a, q.base());
	}
}
