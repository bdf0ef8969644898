// Part of Ripple
package com.machinezoo.ripple;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.machinezoo.closeablescope.*;

public class ReactiveSignalTest {
	@Test
	public void crud() {
		// Construct default.
		ReactiveSignal<String> s = new ReactiveSignal<>();
		assertNull(s.get());
		// Write and read.
		s.set("hello");
		assertEquals("hello", s.get());
		assertEquals("hello", s.peek());
		// Construct non-default.
		s = new ReactiveSignal<>("hi");
		assertEquals("hi", s.get());
		// Allow nulls.
		s.set(null);
		assertNull(s.get());
	}
	@Test
	public void versions() {
		// First version is 1. Only actual changes increment it.
		ReactiveSignal<String> s = new ReactiveSignal<>("hello");
		assertEquals(1, s.version());
		s.set("world");
		assertEquals(2, s.version());
		s.set("world");
		assertEquals(2, s.version());
		s.set(null);
		assertEquals(3, s.version());
		s.set(null);
		assertEquals(3, s.version());
	}
	@Test
	public void boxedValues() {
		// Boxed numbers outside of the cache are distinct objects, but they are the same value.
		ReactiveSignal<Integer> s = new ReactiveSignal<>(1000);
		s.set(Integer.valueOf(1000));
		assertEquals(1, s.version());
		ReactiveSignal<Double> d = new ReactiveSignal<>(Double.NaN);
		d.set(Double.NaN);
		assertEquals(1, d.version());
		d.set(0.0);
		assertEquals(2, d.version());
		d.set(-0.0);
		assertEquals(3, d.version());
	}
	@Test
	public void referenceEquality() {
		// Mutable objects compare by reference by default.
		ReactiveSignal<List<String>> s = new ReactiveSignal<>(new ArrayList<>());
		s.set(new ArrayList<>());
		assertEquals(2, s.version());
		// Full equality suppresses writes of equal objects and keeps the original object.
		List<String> original = new ArrayList<>(List.of("a"));
		ReactiveSignal<List<String>> f = new ReactiveSignal<>(original, ReactiveEquality.full());
		f.set(new ArrayList<>(List.of("a")));
		assertEquals(1, f.version());
		assertSame(original, f.get());
		// Mutation in place can be published by disabling equality.
		ReactiveSignal<List<String>> n = new ReactiveSignal<List<String>>(original).equality(ReactiveEquality.never());
		n.set(original);
		assertEquals(2, n.version());
	}
	@Test
	public void subscribe() {
		ReactiveSignal<String> s = new ReactiveSignal<>("hello");
		AtomicInteger n = new AtomicInteger();
		CloseableScope subscription = s.subscribe(n::incrementAndGet);
		assertEquals(1, s.subscriberCount());
		// Every change runs the callback before the write returns.
		s.set("hi");
		assertEquals(1, n.get());
		s.set("world");
		assertEquals(2, n.get());
		// Unchanged value does not notify.
		s.set("world");
		assertEquals(2, n.get());
		// Unsubscribed callback is not called anymore. Closing twice is harmless.
		subscription.close();
		subscription.close();
		assertEquals(0, s.subscriberCount());
		s.set("stop");
		assertEquals(2, n.get());
	}
	@Test
	public void subscriberOrder() {
		ReactiveSignal<String> s = new ReactiveSignal<>("hello");
		List<String> log = new ArrayList<>();
		s.subscribe(() -> log.add("a"));
		s.subscribe(() -> log.add("b"));
		s.subscribe(() -> log.add("c"));
		s.set("hi");
		assertEquals(List.of("a", "b", "c"), log);
	}
	@Test
	public void unsubscribeWhileNotifying() {
		ReactiveSignal<String> s = new ReactiveSignal<>("hello");
		AtomicInteger n = new AtomicInteger();
		AtomicReference<CloseableScope> self = new AtomicReference<>();
		self.set(s.subscribe(() -> {
			n.incrementAndGet();
			self.get().close();
		}));
		s.subscribe(n::incrementAndGet);
		s.set("hi");
		assertEquals(2, n.get());
		s.set("world");
		assertEquals(3, n.get());
	}
	@Test
	public void failingSubscriber() {
		// Failing callback is logged and the others still run.
		ReactiveSignal<String> s = new ReactiveSignal<>("hello");
		AtomicInteger n = new AtomicInteger();
		s.subscribe(() -> {
			throw new IllegalStateException("expected failure");
		});
		s.subscribe(n::incrementAndGet);
		s.set("hi");
		assertEquals(1, n.get());
	}
	@Test
	public void update() {
		ReactiveSignal<Integer> s = new ReactiveSignal<>(1);
		s.update(x -> x + 1);
		assertEquals(2, s.get());
		assertEquals(2, s.version());
	}
	@Test
	public void readonly() {
		ReactiveSignal<String> s = new ReactiveSignal<>("hello");
		ReactiveReadable<String> r = s.readonly();
		assertEquals("hello", r.get());
		AtomicInteger n = new AtomicInteger();
		r.subscribe(n::incrementAndGet);
		s.set("hi");
		assertEquals("hi", r.peek());
		assertEquals(1, n.get());
		// Computeds depend on the signal behind the view.
		ReactiveComputed<Integer> c = new ReactiveComputed<>(() -> r.get().length());
		assertEquals(1, s.targetCount());
		s.set("world");
		assertEquals(5, c.get());
		assertTrue(r.toString().contains("world"));
	}
}
