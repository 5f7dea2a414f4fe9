// Part of Fibers
package com.machinezoo.fibers.util;

import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;

/*
 * Attaches an alias and tags to any object without the object carrying a field for it.
 * Roots use it to identify themselves in log messages and tracing spans.
 *
 * Data lives in a weak-keys Guava cache. It compares keys by identity, so tagged objects can safely sit in collections.
 * Values must not reference the key, which is why this class is only a short-lived builder around the stored data.
 */
@DraftApi("should be in a separate library")
public class OwnerTrace {
	private static final LoadingCache<Object, Data> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(Data::new));
	public static OwnerTrace of(Object target) {
		Objects.requireNonNull(target);
		return new OwnerTrace(all.getUnchecked(target));
	}
	private final Data data;
	private OwnerTrace(Data data) {
		this.data = data;
	}
	private static class Data {
		volatile String alias;
		final Map<String, Object> tags = new TreeMap<>();
		Data(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	public OwnerTrace alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Null value leaves the tag unchanged.
	 */
	public OwnerTrace tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			synchronized (data.tags) {
				data.tags.put(key, value);
			}
		}
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace generateId() {
		return tag("id", counter.incrementAndGet());
	}
	private Map<String, Object> tags() {
		synchronized (data.tags) {
			return new TreeMap<>(data.tags);
		}
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		for (Map.Entry<String, Object> tag : tags().entrySet()) {
			Object value = tag.getValue();
			if (value instanceof String)
				span.setTag(tag.getKey(), (String)value);
			else if (value instanceof Number)
				span.setTag(tag.getKey(), (Number)value);
			else if (value instanceof Boolean)
				span.setTag(tag.getKey(), (boolean)value);
			else
				span.setTag(tag.getKey(), value.toString());
		}
		return span;
	}
	/*
	 * Alias followed by sorted tags, for example root{id=3}.
	 */
	@Override
	public String toString() {
		Map<String, Object> tags = tags();
		return tags.isEmpty() ? data.alias : data.alias + tags;
	}
}
