// Part of Ripple
package com.machinezoo.ripple.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Signals and computeds are anonymous graph nodes. When a callback fails or a flush is traced,
 * we want to know which node it was and what owns it (an effect, a tracker, a selector slot).
 *
 * Owner information is kept outside of the traced objects in a weak map,
 * so that nodes which never show up in logs or traces pay only for one map entry.
 * Guava cache with weak keys compares keys by identity, which is what we want for graph nodes,
 * because signals may end up in collections that rely on equals().
 *
 * The map cannot hold reference back to the target, because that would keep the weak key alive.
 * The outer class is therefore a short-lived builder and the data lives in a private value object.
 */
/**
 * Alias, tags, and owner chain of an object for {@code toString()} and tracing.
 */
@StubDocs
@DraftApi("should be shared with other reactive libraries")
public class OwnerTrace<T> {
	private static final LoadingCache<Object, Data> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(Data::new));
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<>(target, all.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final Data data;
	private OwnerTrace(T target, Data data) {
		Objects.requireNonNull(target);
		this.target = target;
		this.data = data;
	}
	private static class Data {
		/*
		 * The graph is single-threaded, but toString() may be called from a debugger or logging thread.
		 */
		volatile String alias;
		volatile Tag tags;
		volatile Data parent;
		Data(Object target) {
			alias = target instanceof Class ? ((Class<?>)target).getSimpleName() : target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	public String alias() {
		return data.alias;
	}
	/*
	 * Tag lists are short, so an immutable linked list with mutable values is enough.
	 */
	private static class Tag {
		final String key;
		volatile Object value;
		final Tag next;
		Tag(String key, Object value, Tag next) {
			this.key = key;
			this.value = value;
			this.next = next;
		}
	}
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		/*
		 * Null values are ignored, so that callers can tag optional properties without checks.
		 */
		if (value == null)
			return this;
		for (Tag tag = data.tags; tag != null; tag = tag.next) {
			if (tag.key.equals(key)) {
				tag.value = value;
				return this;
			}
		}
		data.tags = new Tag(key, value, data.tags);
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		data.parent = parent != null ? all.getUnchecked(parent) : null;
		return this;
	}
	/*
	 * Ancestors are listed from the root down. Repeated aliases are numbered, e.g. computed.computed2.
	 */
	private List<String> names(List<Data> chain) {
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>();
		List<String> names = new ArrayList<>();
		for (Data ancestor : chain) {
			String alias = ancestor.alias;
			int seen = numbering.getInt(alias);
			names.add(seen == 0 ? alias : alias + (seen + 1));
			numbering.put(alias, seen + 1);
		}
		return names;
	}
	private List<Data> chain() {
		List<Data> chain = new ArrayList<>();
		for (Data ancestor = data; ancestor != null; ancestor = ancestor.parent)
			chain.add(ancestor);
		Collections.reverse(chain);
		return chain;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Data> chain = chain();
		List<String> names = names(chain);
		span.setTag("owner", String.join(".", names));
		for (int i = 0; i < chain.size(); ++i) {
			for (Tag tag = chain.get(i).tags; tag != null; tag = tag.next) {
				String key = names.get(i) + "." + tag.key;
				Object value = tag.value;
				if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
		return span;
	}
	@Override
	public String toString() {
		List<Data> chain = chain();
		List<String> names = names(chain);
		Map<String, Object> sorted = new TreeMap<>();
		for (int i = 0; i < chain.size(); ++i)
			for (Tag tag = chain.get(i).tags; tag != null; tag = tag.next)
				sorted.put(names.get(i) + "." + tag.key, tag.value);
		String path = names.stream().collect(joining("."));
		return sorted.isEmpty() ? path : path + sorted;
	}
}
