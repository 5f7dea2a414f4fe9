// Part of Fibers
package com.machinezoo.fibers;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.fibers.TestHost.*;

public class ChildReconcilerTest extends TestBase {
	TestHost host = new TestHost();
	FiberRoot root = new FiberRoot(host, host.container).executor(new ManualExecutor());
	void mount(NodeDescriptor element) {
		root.scheduleUpdate(element, Lanes.SYNC);
		host.clear();
	}
	/*
	 * Renders against the committed tree without committing, so that flags can be inspected.
	 */
	Fiber pending(NodeDescriptor element) {
		WorkLoop loop = new WorkLoop(root.readCommittedTree(), element, Lanes.SYNC);
		loop.runSync();
		assertTrue(loop.completed());
		return loop.pendingRoot();
	}
	static NodeDescriptor list(String... keys) {
		return host("ul", Arrays.stream(keys).map(k -> keyed(k, "li", k.toUpperCase())).toArray());
	}
	static void assertNoEffects(Fiber fiber) {
		assertEquals(0, fiber.flags() & (EffectFlags.PLACEMENT | EffectFlags.UPDATE | EffectFlags.DELETION), fiber.toString());
		assertEquals(List.of(), fiber.deletions());
		for (Fiber child : fiber.children())
			assertNoEffects(child);
	}
	@Test
	public void identical() {
		Component c = e -> host("p", e.props().get("label"));
		mount(host("div", list("a", "b"), NodeDescriptor.component(c).prop("label", "x"), "tail").prop("id", 1));
		// Structurally identical descriptors produce no effects anywhere.
		Fiber p = pending(host("div", list("a", "b"), NodeDescriptor.component(c).prop("label", "x"), "tail").prop("id", 1));
		assertNoEffects(p);
		assertEquals(0, p.subtreeFlags() & EffectFlags.MUTATION_MASK);
	}
	@Test
	public void removal() {
		mount(list("a", "b", "c"));
		Fiber ul = pending(list("a", "c")).child();
		// Only the removed child is deleted. Its siblings are reused as they are.
		assertEquals(1, ul.deletions().size());
		assertEquals("b", ul.deletions().get(0).key());
		assertTrue(ul.has(EffectFlags.DELETION));
		for (Fiber li : ul.children()) {
			assertFalse(li.has(EffectFlags.PLACEMENT));
			assertFalse(li.has(EffectFlags.UPDATE));
			assertNotNull(li.alternate());
		}
		TestNode a = host.container.children.get(0).children.get(0);
		TestNode c = host.container.children.get(0).children.get(2);
		root.scheduleUpdate(list("a", "c"), Lanes.SYNC);
		assertEquals("ul[li(A),li(C)]", host.html());
		assertEquals(List.of("remove li from ul", "release li"), host.log);
		assertSame(a, host.container.children.get(0).children.get(0));
		assertSame(c, host.container.children.get(0).children.get(1));
	}
	@Test
	public void backwardMove() {
		mount(list("a", "b", "c"));
		List<Fiber> items = pending(list("c", "a", "b")).child().children();
		// The last child stays in place and becomes the reference point. The two skipped over are moved.
		assertFalse(items.get(0).has(EffectFlags.PLACEMENT));
		assertTrue(items.get(1).has(EffectFlags.PLACEMENT));
		assertTrue(items.get(2).has(EffectFlags.PLACEMENT));
		List<TestNode> before = new ArrayList<>(host.container.children.get(0).children);
		root.scheduleUpdate(list("c", "a", "b"), Lanes.SYNC);
		assertEquals("ul[li(C),li(A),li(B)]", host.html());
		assertEquals(2, host.count("insert"));
		assertEquals(0, host.count("create"));
		assertEquals(0, host.count("remove"));
		assertEquals(List.of(before.get(2), before.get(0), before.get(1)), host.container.children.get(0).children);
	}
	@Test
	public void forwardMove() {
		mount(list("a", "b", "c", "d"));
		List<Fiber> items = pending(list("b", "c", "d", "a")).child().children();
		// Moving the first child to the end costs one move.
		assertTrue(items.get(3).has(EffectFlags.PLACEMENT));
		for (Fiber item : items.subList(0, 3))
			assertFalse(item.has(EffectFlags.PLACEMENT));
		root.scheduleUpdate(list("b", "c", "d", "a"), Lanes.SYNC);
		assertEquals("ul[li(B),li(C),li(D),li(A)]", host.html());
		assertEquals(List.of("insert li into ul"), host.log);
	}
	@Test
	public void typeChange() {
		mount(host("a"));
		Fiber p = pending(host("b"));
		// Different type is never reused, even without keys.
		assertEquals(1, p.deletions().size());
		assertTrue(p.child().has(EffectFlags.PLACEMENT));
		assertFalse(p.child().has(EffectFlags.UPDATE));
		assertNull(p.child().alternate());
		root.scheduleUpdate(host("b"), Lanes.SYNC);
		assertEquals(List.of("remove a from container", "release a", "create b", "insert b into container"), host.log);
	}
	@Test
	public void typeChangeInList() {
		mount(host("div", host("a"), host("c")));
		Fiber div = pending(host("div", host("b"), host("c"))).child();
		assertEquals(1, div.deletions().size());
		assertTrue(div.children().get(0).has(EffectFlags.PLACEMENT));
		assertFalse(div.children().get(1).has(EffectFlags.PLACEMENT));
		root.scheduleUpdate(host("div", host("b"), host("c")), Lanes.SYNC);
		assertEquals("div[b,c]", host.html());
		assertEquals(0, host.count("update"));
		// New node is inserted before its stable sibling.
		assertThat(host.log, hasItem("insert b into div before c"));
	}
	@Test
	public void keyChange() {
		mount(host("div", keyed("x", "p")));
		// Same type with different key is not the same node.
		root.scheduleUpdate(host("div", keyed("y", "p")), Lanes.SYNC);
		assertEquals(1, host.count("create"));
		assertEquals(1, host.count("remove"));
	}
	@Test
	public void props() {
		mount(host("div", keyed("a", "p").prop("x", 1).prop("y", 2)));
		root.scheduleUpdate(host("div", keyed("a", "p").prop("x", 3)), Lanes.SYNC);
		assertEquals("div[p{x=3}]", host.html());
		assertEquals(List.of("update p [-y, x=3]"), host.log);
	}
	@Test
	public void holes() {
		mount(host("div", host("a"), null, host("c")));
		// Hole keeps its position, so the child after it is still matched by position.
		Fiber div = pending(host("div", host("a"), host("b"), host("c"))).child();
		assertEquals(List.of(), div.deletions());
		assertNotNull(div.children().get(2).alternate());
		root.scheduleUpdate(host("div", host("a"), host("b"), host("c")), Lanes.SYNC);
		assertEquals("div[a,b,c]", host.html());
		assertEquals(List.of("create b", "insert b into div before c"), host.log);
		host.clear();
		root.scheduleUpdate(host("div", host("a"), false, host("c")), Lanes.SYNC);
		assertEquals("div[a,c]", host.html());
		assertEquals(List.of("remove b from div", "release b"), host.log);
	}
	@Test
	public void appendAndTruncate() {
		mount(list("a"));
		root.scheduleUpdate(list("a", "b", "c"), Lanes.SYNC);
		assertEquals("ul[li(A),li(B),li(C)]", host.html());
		assertEquals(2, host.count("create"));
		assertEquals(2, host.count("insert"));
		assertEquals(0, host.count("remove"));
		host.clear();
		root.scheduleUpdate(list("a"), Lanes.SYNC);
		assertEquals(2, host.count("remove"));
		assertEquals("ul[li(A)]", host.html());
	}
	@Test
	public void textAndNodes() {
		mount(host("div", "t", host("b")));
		assertEquals("div['t',b]", host.html());
		// Text and node never match each other.
		root.scheduleUpdate(host("div", host("i"), host("b")), Lanes.SYNC);
		assertEquals("div[i,b]", host.html());
		assertEquals(1, host.count("create"));
		assertEquals(1, host.count("remove"));
		host.clear();
		root.scheduleUpdate(host("div", "u", host("b")), Lanes.SYNC);
		assertEquals("div['u',b]", host.html());
		host.clear();
		// Text nodes are updated in place.
		root.scheduleUpdate(host("div", "v", host("b")), Lanes.SYNC);
		assertEquals(List.of("updateText 'u' -> 'v'"), host.log);
	}
	@Test
	public void singleText() {
		mount(host("div", host("a"), host("b")));
		root.scheduleUpdate(NodeDescriptor.component(e -> NodeDescriptor.text("x")), Lanes.SYNC);
		assertEquals("'x'", host.html());
	}
	@Test
	public void duplicates() {
		// First child with the key wins. Later duplicates are new children.
		mount(host("ul", keyed("a", "li", "X"), keyed("a", "li", "Y")));
		assertEquals("ul[li(X),li(Y)]", host.html());
		TestNode x = host.container.children.get(0).children.get(0);
		root.scheduleUpdate(host("ul", keyed("b", "li", "B"), keyed("a", "li", "Z")), Lanes.SYNC);
		assertEquals("ul[li(B),li(Z)]", host.html());
		assertSame(x, host.container.children.get(0).children.get(1));
		assertEquals(1, host.count("remove"));
		assertEquals(1, host.count("create"));
	}
	@Test
	public void components() {
		Component c = e -> host("span", e.props().get("v"));
		Component d = e -> host("span", e.props().get("v"));
		mount(host("div", NodeDescriptor.component(c).prop("v", "1")));
		root.scheduleUpdate(host("div", NodeDescriptor.component(c).prop("v", "2")), Lanes.SYNC);
		// Same component instance is reused and its output diffed.
		assertEquals(List.of("update span [text=\"2\"]"), host.log);
		host.clear();
		// Different component instance is a different type.
		root.scheduleUpdate(host("div", NodeDescriptor.component(d).prop("v", "2")), Lanes.SYNC);
		assertEquals(List.of("remove span from div", "release span", "create span", "update span [text=\"2\"]", "insert span into div"), host.log);
	}
	@Test
	public void bailout() {
		List<String> renders = new ArrayList<>();
		Component c = e -> {
			renders.add("c");
			return host("span", "s");
		};
		NodeDescriptor child = NodeDescriptor.component(c);
		mount(host("div", child, host("p", "a")));
		renders.clear();
		// Identical descriptor skips rendering of the component.
		root.scheduleUpdate(host("div", child, host("p", "b")), Lanes.SYNC);
		assertEquals(List.of(), renders);
		assertEquals("div[span(s),p(b)]", host.html());
	}
}
