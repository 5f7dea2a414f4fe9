// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;
import org.slf4j.*;
import com.google.common.collect.*;
import com.machinezoo.stagean.*;

/*
 * Descriptors are produced fresh by every render and never mutated afterwards.
 * Identity is the only equality the engine relies on. It is used to skip diffing of unchanged subtrees.
 *
 * Children are normalized when the descriptor is built, so that the reconciler sees only three kinds of children:
 * host/component descriptors, strings, and nulls (holes that still occupy a position).
 */
/**
 * Immutable description of a node that should exist in the rendered tree.
 * Descriptors are built with {@link #host(String)}, {@link #component(Component)}, and {@link #text(Object)}
 * and refined with {@link #key(String)}, {@link #props(Map)}, {@link #prop(String, Object)}, and {@link #children(Object...)},
 * which all return modified copies.
 */
@StubDocs
public final class NodeDescriptor {
	private static final Logger logger = LoggerFactory.getLogger(NodeDescriptor.class);
	private final NodeKind kind;
	public NodeKind kind() {
		return kind;
	}
	/*
	 * Host tag for host nodes, component instance for component nodes, null for text.
	 */
	private final Object type;
	public Object type() {
		return type;
	}
	private final String key;
	public String key() {
		return key;
	}
	private final ImmutableMap<String, Object> props;
	public Map<String, Object> props() {
		return props;
	}
	private final List<Object> children;
	public List<Object> children() {
		return children;
	}
	private final String text;
	public String text() {
		return text;
	}
	private NodeDescriptor(NodeKind kind, Object type, String key, ImmutableMap<String, Object> props, List<Object> children, String text) {
		this.kind = kind;
		this.type = type;
		this.key = key;
		this.props = props;
		this.children = children;
		this.text = text;
	}
	public static NodeDescriptor host(String tag) {
		Objects.requireNonNull(tag);
		return new NodeDescriptor(NodeKind.HOST, tag, null, ImmutableMap.of(), Collections.emptyList(), null);
	}
	public static NodeDescriptor component(Component component) {
		Objects.requireNonNull(component);
		return new NodeDescriptor(NodeKind.COMPONENT, component, null, ImmutableMap.of(), Collections.emptyList(), null);
	}
	public static NodeDescriptor text(Object value) {
		Objects.requireNonNull(value);
		return new NodeDescriptor(NodeKind.TEXT, null, null, ImmutableMap.of(), Collections.emptyList(), value.toString());
	}
	private void ensureElement() {
		if (kind == NodeKind.TEXT)
			throw new IllegalStateException("Text nodes have no key, props, or children.");
	}
	public NodeDescriptor key(String key) {
		ensureElement();
		return new NodeDescriptor(kind, type, key, props, children, null);
	}
	/*
	 * Null prop values are dropped, because null prop is the same as missing prop.
	 */
	public NodeDescriptor props(Map<String, ?> props) {
		Objects.requireNonNull(props);
		ensureElement();
		Map<String, Object> filtered = new LinkedHashMap<>();
		for (Map.Entry<String, ?> entry : props.entrySet()) {
			Objects.requireNonNull(entry.getKey());
			if (entry.getValue() != null)
				filtered.put(entry.getKey(), entry.getValue());
		}
		return new NodeDescriptor(kind, type, key, ImmutableMap.copyOf(filtered), children, null);
	}
	public NodeDescriptor prop(String name, Object value) {
		Objects.requireNonNull(name);
		Map<String, Object> changed = new LinkedHashMap<>(props);
		if (value != null)
			changed.put(name, value);
		else
			changed.remove(name);
		return props(changed);
	}
	public NodeDescriptor children(Object... children) {
		return children(Arrays.asList(children));
	}
	public NodeDescriptor children(List<?> children) {
		Objects.requireNonNull(children);
		ensureElement();
		List<Object> normalized = new ArrayList<>(children.size());
		for (Object child : children)
			normalized.add(normalize(child));
		return new NodeDescriptor(kind, type, key, props, Collections.unmodifiableList(normalized), null);
	}
	/*
	 * Malformed children are treated as holes. Reconciliation must remain total, so we log instead of throwing.
	 */
	static Object normalize(Object child) {
		if (child == null || child instanceof Boolean)
			return null;
		if (child instanceof NodeDescriptor) {
			NodeDescriptor descriptor = (NodeDescriptor)child;
			return descriptor.kind == NodeKind.TEXT ? descriptor.text : descriptor;
		}
		if (child instanceof CharSequence || child instanceof Number || child instanceof Character)
			return child.toString();
		logger.warn("Ignoring child of unsupported type {}.", child.getClass().getName());
		return null;
	}
	/*
	 * Host node with exactly one text child keeps the text as its content instead of creating a text node.
	 */
	public String textContent() {
		if (kind == NodeKind.HOST && children.size() == 1 && children.get(0) instanceof String)
			return (String)children.get(0);
		return null;
	}
	@Override
	public String toString() {
		if (kind == NodeKind.TEXT)
			return '"' + text + '"';
		StringBuilder description = new StringBuilder();
		description.append('<');
		description.append(kind == NodeKind.HOST ? type : type.getClass().getSimpleName());
		if (key != null)
			description.append(" key=").append(key);
		for (Map.Entry<String, Object> entry : props.entrySet())
			description.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
		if (!children.isEmpty())
			description.append(" children=").append(children.size());
		description.append('>');
		return description.toString();
	}
}
