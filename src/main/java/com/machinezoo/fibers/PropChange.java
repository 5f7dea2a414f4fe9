// Part of Fibers
package com.machinezoo.fibers;

import java.util.*;

/**
 * Single entry of a property diff passed to {@link HostPlatform#applyHostPropDiff(Object, List)}.
 * Text content of host nodes travels in the diff as {@link Kind#TEXT} change with {@code null} name.
 * {@code TEXT} change with {@code null} value clears text content.
 */
public final class PropChange {
	public enum Kind {
		SET,
		REMOVE,
		TEXT
	}
	private final Kind kind;
	public Kind kind() {
		return kind;
	}
	private final String name;
	public String name() {
		return name;
	}
	private final Object value;
	public Object value() {
		return value;
	}
	private PropChange(Kind kind, String name, Object value) {
		this.kind = kind;
		this.name = name;
		this.value = value;
	}
	public static PropChange set(String name, Object value) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(value);
		return new PropChange(Kind.SET, name, value);
	}
	public static PropChange remove(String name) {
		Objects.requireNonNull(name);
		return new PropChange(Kind.REMOVE, name, null);
	}
	public static PropChange text(String text) {
		return new PropChange(Kind.TEXT, null, text);
	}
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof PropChange))
			return false;
		PropChange other = (PropChange)obj;
		return kind == other.kind && Objects.equals(name, other.name) && Objects.equals(value, other.value);
	}
	@Override
	public int hashCode() {
		return Objects.hash(kind, name, value);
	}
	@Override
	public String toString() {
		switch (kind) {
		case SET:
			return name + "=" + value;
		case REMOVE:
			return "-" + name;
		default:
			return "text=" + (value != null ? '"' + value.toString() + '"' : "null");
		}
	}
}
