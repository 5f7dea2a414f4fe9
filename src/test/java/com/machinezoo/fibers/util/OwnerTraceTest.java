// Part of Fibers
package com.machinezoo.fibers.util;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import io.opentracing.mock.*;

public class OwnerTraceTest {
	@Test
	public void tags() {
		Object owner = new Object();
		OwnerTrace.of(owner)
			.alias("widget")
			.tag("size", 3)
			.tag("color", "red")
			.tag("color", "blue")
			.tag("ignored", null);
		// Tags are kept outside of the object and found again by identity.
		assertEquals("widget{color=blue, size=3}", OwnerTrace.of(owner).toString());
		MockSpan span = new MockTracer().buildSpan("test").start();
		OwnerTrace.of(owner).fill(span);
		assertEquals(Map.of("color", "blue", "size", 3), span.tags());
	}
	@Test
	public void defaults() {
		assertEquals("ArrayList", OwnerTrace.of(new ArrayList<>()).toString());
		Object a = new Object();
		Object b = new Object();
		OwnerTrace.of(a).generateId();
		OwnerTrace.of(b).generateId();
		assertThat(OwnerTrace.of(a).toString(), startsWith("Object{id="));
		assertNotEquals(OwnerTrace.of(a).toString(), OwnerTrace.of(b).toString());
	}
}
