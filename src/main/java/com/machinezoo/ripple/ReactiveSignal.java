// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.ripple.util.*;
import com.machinezoo.stagean.*;

/**
 * Mutable reactive value.
 * Reading it via {@link #get()} inside {@link ReactiveComputed} makes the computed depend on it.
 * Writing it via {@link #set(Object)} invalidates dependent computeds and notifies subscribers.
 * <p>
 * Signals hold no resources and need no disposal.
 * {@link ReactiveSignal} is not thread-safe. It must be used from one thread at a time together with the rest of its graph.
 *
 * @param <T>
 *            type of the stored value
 *
 * @see ReactiveComputed
 * @see ReactiveBatch
 */
@DraftDocs("link to reactive graph docs")
public class ReactiveSignal<T> extends ReactiveSource<T> {
	private T value;
	private ReactiveEquality<? super T> equality = ReactiveEquality.same();
	/**
	 * Creates new signal holding {@code value}.
	 *
	 * @param value
	 *            initial value, may be {@code null}
	 */
	public ReactiveSignal(T value) {
		OwnerTrace.of(this).alias("signal");
		this.value = value;
		version = 1;
	}
	/**
	 * Creates new signal holding {@code value} with custom change detection.
	 *
	 * @param value
	 *            initial value, may be {@code null}
	 * @param equality
	 *            test deciding whether a write is a change
	 * @throws NullPointerException
	 *             if {@code equality} is {@code null}
	 */
	public ReactiveSignal(T value, ReactiveEquality<? super T> equality) {
		this(value);
		equality(equality);
	}
	/**
	 * Creates new signal holding {@code null}.
	 */
	public ReactiveSignal() {
		this(null);
	}
	/**
	 * Returns test deciding whether a write is a change. Defaults to {@link ReactiveEquality#same()}.
	 *
	 * @return current equality test
	 */
	public ReactiveEquality<? super T> equality() {
		return equality;
	}
	/**
	 * Configures test deciding whether a write is a change.
	 *
	 * @param equality
	 *            new equality test
	 * @return {@code this} (fluent method)
	 */
	public ReactiveSignal<T> equality(ReactiveEquality<? super T> equality) {
		Objects.requireNonNull(equality);
		this.equality = equality;
		return this;
	}
	@Override
	public T get() {
		track(ReactiveRuntime.get());
		return value;
	}
	@Override
	public T peek() {
		return value;
	}
	/**
	 * Stores new value.
	 * If the value is equal to the current one per {@link #equality()}, nothing happens.
	 * Otherwise {@link #version()} is incremented, dependent computeds are invalidated,
	 * and subscribers are notified, either before this method returns or at the end of current {@link ReactiveBatch}.
	 *
	 * @param value
	 *            new value, may be {@code null}
	 */
	public void set(T value) {
		T previous = this.value;
		/*
		 * Equal writes must not replace the stored object. Readers could otherwise see different objects at the same version.
		 */
		if (equality.test(previous, value))
			return;
		this.value = value;
		++version;
		ReactiveRuntime runtime = ReactiveRuntime.get();
		ReactiveBatch.begin(runtime);
		try {
			fireSlots(runtime, previous, value);
			invalidateTargets(runtime);
			notifySubscribers(runtime);
		} finally {
			ReactiveBatch.end(runtime, this);
		}
	}
	/**
	 * Replaces the value with the result of applying {@code updater} to the current value.
	 * No dependency is recorded on the current value.
	 *
	 * @param updater
	 *            function computing new value from the current one
	 */
	public void update(UnaryOperator<T> updater) {
		Objects.requireNonNull(updater);
		set(updater.apply(value));
	}
	/**
	 * Returns read-only view of this signal.
	 *
	 * @return view that supports everything except writes
	 */
	public ReactiveReadable<T> readonly() {
		return new ReadonlySignal<>(this);
	}
	private static class ReadonlySignal<T> implements ReactiveReadable<T> {
		final ReactiveSignal<T> signal;
		ReadonlySignal(ReactiveSignal<T> signal) {
			this.signal = signal;
		}
		@Override
		public T get() {
			return signal.get();
		}
		@Override
		public T peek() {
			return signal.peek();
		}
		@Override
		public boolean is(T key) {
			return signal.is(key);
		}
		@Override
		public CloseableScope subscribe(Runnable callback) {
			return signal.subscribe(callback);
		}
		@Override
		public String toString() {
			return "readonly " + signal;
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + value;
	}
}
