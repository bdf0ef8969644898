// Part of Ripple
package com.machinezoo.ripple;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.closeablescope.*;

public class ReactiveDisposablesTest {
	@Test
	public void disposeAll() {
		ReactiveSignal<Integer> s = new ReactiveSignal<>(1);
		List<String> log = new ArrayList<>();
		ReactiveDisposables disposables = new ReactiveDisposables();
		ReactiveComputed<Integer> c;
		ReactiveEffect e;
		try (CloseableScope scope = disposables.enter()) {
			assertSame(disposables, ReactiveDisposables.current());
			c = new ReactiveComputed<>(() -> s.get() + 1);
			e = ReactiveEffect.run(() -> {
				s.get();
				return () -> log.add("cleanup");
			});
		}
		assertNull(ReactiveDisposables.current());
		assertEquals(2, s.targetCount());
		disposables.dispose();
		assertTrue(disposables.disposed());
		assertTrue(c.disposed());
		assertTrue(e.disposed());
		assertEquals(0, s.targetCount());
		assertEquals(List.of("cleanup"), log);
		// Repeated disposal has no effect.
		disposables.dispose();
		assertEquals(1, log.size());
	}
	@Test
	public void nesting() {
		ReactiveSignal<Integer> s = new ReactiveSignal<>(1);
		ReactiveDisposables outer = new ReactiveDisposables();
		ReactiveDisposables inner = new ReactiveDisposables();
		ReactiveComputed<Integer> a;
		ReactiveComputed<Integer> b;
		try (CloseableScope o = outer.enter()) {
			a = new ReactiveComputed<>(s::get);
			try (CloseableScope i = inner.enter()) {
				b = new ReactiveComputed<>(s::get);
			}
			assertSame(outer, ReactiveDisposables.current());
		}
		// Objects register only with the innermost scope.
		outer.dispose();
		assertTrue(a.disposed());
		assertFalse(b.disposed());
		inner.dispose();
		assertTrue(b.disposed());
	}
	@Test
	public void closeTwice() {
		ReactiveSignal<Integer> s = new ReactiveSignal<>(1);
		ReactiveDisposables outer = new ReactiveDisposables();
		ReactiveDisposables inner = new ReactiveDisposables();
		ReactiveComputed<Integer> c;
		try (CloseableScope o = outer.enter()) {
			CloseableScope i = inner.enter();
			i.close();
			// Second close must not drop the enclosing scope.
			i.close();
			assertSame(outer, ReactiveDisposables.current());
			c = new ReactiveComputed<>(s::get);
			assertEquals(1, outer.size());
			assertEquals(0, inner.size());
			// Inner scope can be entered again.
			try (CloseableScope again = inner.enter()) {
				assertSame(inner, ReactiveDisposables.current());
			}
		}
		assertNull(ReactiveDisposables.current());
		outer.dispose();
		assertTrue(c.disposed());
	}
	@Test
	public void reverseOrder() {
		List<String> log = new ArrayList<>();
		ReactiveDisposables disposables = new ReactiveDisposables();
		try (CloseableScope scope = disposables.enter()) {
			ReactiveEffect.run(() -> () -> log.add("first"));
			ReactiveEffect.run(() -> () -> log.add("second"));
		}
		disposables.dispose();
		assertEquals(List.of("second", "first"), log);
	}
	@Test
	public void enterRecursively() {
		ReactiveDisposables disposables = new ReactiveDisposables();
		try (CloseableScope scope = disposables.enter()) {
			assertThrows(IllegalStateException.class, disposables::enter);
		}
	}
	@Test
	public void afterDisposal() {
		// Objects created in already disposed scope are disposed immediately.
		ReactiveSignal<Integer> s = new ReactiveSignal<>(1);
		ReactiveDisposables disposables = new ReactiveDisposables();
		disposables.dispose();
		try (CloseableScope scope = disposables.enter()) {
			ReactiveComputed<Integer> c = new ReactiveComputed<>(s::get);
			assertTrue(c.disposed());
		}
		assertEquals(0, s.targetCount());
	}
}
