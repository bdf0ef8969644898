// Part of Ripple
package com.machinezoo.ripple;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.machinezoo.closeablescope.*;

public class ReactiveBatchTest extends TestBase {
	@Test
	public void deferAndDeduplicate() {
		ReactiveSignal<Integer> a = new ReactiveSignal<>(1);
		ReactiveSignal<Integer> b = new ReactiveSignal<>(2);
		AtomicInteger n = new AtomicInteger();
		Runnable callback = n::incrementAndGet;
		a.subscribe(callback);
		b.subscribe(callback);
		ReactiveBatch.batch(() -> {
			a.set(10);
			b.set(20);
			a.set(30);
			// Nothing runs inside the batch.
			assertEquals(0, n.get());
			assertTrue(ReactiveBatch.active());
		});
		// The shared callback runs once after the batch.
		assertEquals(1, n.get());
		assertFalse(ReactiveBatch.active());
	}
	@Test
	public void computedInBatch() {
		ReactiveSignal<Integer> a = new ReactiveSignal<>(1);
		ReactiveSignal<Integer> b = new ReactiveSignal<>(2);
		AtomicInteger n = new AtomicInteger();
		ReactiveComputed<Integer> sum = new ReactiveComputed<>(counted(n, () -> a.get() + b.get()));
		List<Integer> seen = new ArrayList<>();
		sum.subscribe(() -> seen.add(sum.get()));
		ReactiveBatch.batch(() -> {
			a.set(10);
			b.set(20);
			assertTrue(seen.isEmpty());
		});
		assertEquals(List.of(30), seen);
		assertEquals(2, n.get());
	}
	@Test
	public void nested() {
		ReactiveSignal<String> s = new ReactiveSignal<>("a");
		AtomicInteger n = new AtomicInteger();
		s.subscribe(n::incrementAndGet);
		ReactiveBatch.batch(() -> {
			ReactiveBatch.batch(() -> s.set("b"));
			// Inner batch does not flush.
			assertEquals(0, n.get());
			s.set("c");
		});
		assertEquals(1, n.get());
	}
	@Test
	public void result() {
		ReactiveSignal<String> s = new ReactiveSignal<>("a");
		AtomicInteger n = new AtomicInteger();
		s.subscribe(n::incrementAndGet);
		String previous = ReactiveBatch.batch(() -> {
			String old = s.get();
			s.set("b");
			return old;
		});
		assertEquals("a", previous);
		assertEquals(1, n.get());
	}
	@Test
	public void scope() {
		ReactiveSignal<String> s = new ReactiveSignal<>("a");
		AtomicInteger n = new AtomicInteger();
		s.subscribe(n::incrementAndGet);
		CloseableScope batch = ReactiveBatch.open();
		s.set("b");
		s.set("c");
		assertEquals(0, n.get());
		batch.close();
		assertEquals(1, n.get());
		// Closing twice does not close outer batch.
		try (CloseableScope outer = ReactiveBatch.open()) {
			batch.close();
			s.set("d");
			assertEquals(1, n.get());
		}
		assertEquals(2, n.get());
	}
	@Test
	public void flushOnException() {
		ReactiveSignal<String> s = new ReactiveSignal<>("a");
		AtomicInteger n = new AtomicInteger();
		s.subscribe(n::incrementAndGet);
		assertThrows(IllegalStateException.class, () -> ReactiveBatch.batch(() -> {
			s.set("b");
			throw new IllegalStateException();
		}));
		assertEquals(1, n.get());
		assertFalse(ReactiveBatch.active());
	}
	@Test
	public void writeInCallback() {
		// Callbacks may write. Writes outside of the batch flush immediately.
		ReactiveSignal<Integer> a = new ReactiveSignal<>(1);
		ReactiveSignal<Integer> b = new ReactiveSignal<>(1);
		a.subscribe(() -> b.set(a.get() * 10));
		AtomicInteger n = new AtomicInteger();
		b.subscribe(n::incrementAndGet);
		ReactiveBatch.batch(() -> a.set(2));
		assertEquals(20, b.get());
		assertEquals(1, n.get());
	}
}
