// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.ripple.util.*;
import com.machinezoo.stagean.*;

/*
 * APIs built on top of the graph (templates, component properties) accept a value that may be a signal,
 * a computed, a plain function, or just a constant. Classifying it once on entry keeps instanceof checks
 * out of the rest of the code. Plain functions are wrapped in a computed owned by the input.
 */
/**
 * Value accepted at API boundary, classified as signal, computed, or plain value.
 *
 * @param <T>
 *            type of the value
 */
@DraftApi("may be replaced with sealed types")
public final class ReactiveInput<T> {
	/**
	 * Classification of {@link ReactiveInput}.
	 */
	public enum Kind {
		SIGNAL,
		COMPUTED,
		PLAIN
	}
	private final Kind kind;
	private final ReactiveReadable<T> readable;
	private final T constant;
	/*
	 * True if the computed was created by this input and this input is responsible for disposing it.
	 */
	private final boolean owned;
	private ReactiveInput(Kind kind, ReactiveReadable<T> readable, T constant, boolean owned) {
		this.kind = kind;
		this.readable = readable;
		this.constant = constant;
		this.owned = owned;
		OwnerTrace.of(this).alias("input").tag("kind", kind);
		if (owned)
			OwnerTrace.of(readable).parent(this);
	}
	/**
	 * Wraps existing reactive value. The input does not take ownership of it.
	 *
	 * @param <T>
	 *            type of the value
	 * @param readable
	 *            signal, computed, or read-only view of a signal
	 * @return new input
	 */
	public static <T> ReactiveInput<T> of(ReactiveReadable<T> readable) {
		Objects.requireNonNull(readable);
		return new ReactiveInput<>(readable instanceof ReactiveComputed ? Kind.COMPUTED : Kind.SIGNAL, readable, null, false);
	}
	/**
	 * Wraps plain function in new computed owned by the input.
	 * The computed is disposed by {@link #dispose()}.
	 *
	 * @param <T>
	 *            type of the value
	 * @param supplier
	 *            function that may read reactive values
	 * @return new input
	 */
	@SuppressWarnings("unchecked")
	public static <T> ReactiveInput<T> of(Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		if (supplier instanceof ReactiveReadable)
			return of((ReactiveReadable<T>)supplier);
		return new ReactiveInput<>(Kind.COMPUTED, new ReactiveComputed<>(supplier), null, true);
	}
	/**
	 * Wraps non-reactive value.
	 *
	 * @param <T>
	 *            type of the value
	 * @param value
	 *            constant value, may be {@code null}
	 * @return new input
	 */
	public static <T> ReactiveInput<T> constant(T value) {
		return new ReactiveInput<>(Kind.PLAIN, null, value, false);
	}
	/**
	 * Classifies arbitrary object. Reactive values and suppliers are wrapped as with {@code of(...)},
	 * everything else, including {@code null}, is treated as constant.
	 *
	 * @param value
	 *            object to classify
	 * @return new input
	 */
	@SuppressWarnings("unchecked")
	public static ReactiveInput<Object> classify(Object value) {
		if (value instanceof ReactiveReadable)
			return of((ReactiveReadable<Object>)value);
		if (value instanceof Supplier)
			return of((Supplier<Object>)value);
		return constant(value);
	}
	public Kind kind() {
		return kind;
	}
	public boolean reactive() {
		return kind != Kind.PLAIN;
	}
	/**
	 * Returns current value. Reactive inputs record dependency in the current computed.
	 *
	 * @return current value
	 */
	public T get() {
		return readable != null ? readable.get() : constant;
	}
	public T peek() {
		return readable != null ? readable.peek() : constant;
	}
	/**
	 * Subscribes to changes of the value. Plain inputs never change, so the callback is never called for them.
	 *
	 * @param callback
	 *            callback to run on change
	 * @return scope that unsubscribes the callback when closed
	 */
	public CloseableScope subscribe(Runnable callback) {
		Objects.requireNonNull(callback);
		if (readable == null)
			return () -> {
			};
		return readable.subscribe(callback);
	}
	/**
	 * Disposes the computed created by {@link #of(Supplier)}. Reactive values supplied by the caller are left alone.
	 */
	public void dispose() {
		if (owned)
			((ReactiveComputed<?>)readable).dispose();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + (readable != null ? readable : constant);
	}
}
