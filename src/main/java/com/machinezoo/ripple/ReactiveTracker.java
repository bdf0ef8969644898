// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.ripple.util.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Trackers let code outside of the graph find out what a piece of code depends on,
 * for example to restart some external process whenever any of its inputs change.
 * They do not create graph edges. Reads are only recorded in the tracker.
 *
 * Reads inside nested computeds are attributed to the computed, because computeds run with tracking suspended.
 */
/**
 * Observer of reactive reads performed while it is entered.
 *
 * @see ReactiveSource#ignore()
 */
@DraftDocs("link to dependency tracking docs")
public class ReactiveTracker {
	private final ReferenceLinkedOpenHashSet<ReactiveSource<?>> sources = new ReferenceLinkedOpenHashSet<>();
	private List<CloseableScope> subscriptions;
	public ReactiveTracker() {
		OwnerTrace.of(this).alias("tracker").generateId();
	}
	/**
	 * Starts recording reads on the current thread until the returned scope is closed.
	 * Nested trackers shadow outer ones.
	 *
	 * @return scope that stops recording
	 */
	public CloseableScope enter() {
		return ReactiveRuntime.get().observe(this);
	}
	void record(ReactiveSource<?> source) {
		sources.add(source);
	}
	/**
	 * Returns all sources read while the tracker was entered in order of first read.
	 * Sources compared via {@link ReactiveSource#is(Object)} are included.
	 *
	 * @return unmodifiable view of recorded sources
	 */
	public Set<ReactiveSource<?>> sources() {
		return Collections.unmodifiableSet(sources);
	}
	/**
	 * Subscribes {@code callback} to every recorded source.
	 * The callback runs once per batch even if several sources change in it.
	 *
	 * @param callback
	 *            callback to run when any recorded source changes
	 * @throws IllegalStateException
	 *             if the tracker is already subscribed
	 */
	public void subscribe(Runnable callback) {
		Objects.requireNonNull(callback);
		if (subscriptions != null)
			throw new IllegalStateException("Tracker is already subscribed.");
		subscriptions = new ArrayList<>();
		for (ReactiveSource<?> source : sources)
			subscriptions.add(source.subscribe(callback));
	}
	/**
	 * Removes subscriptions created by {@link #subscribe(Runnable)}. Does nothing if there are none.
	 */
	public void unsubscribe() {
		if (subscriptions != null) {
			for (CloseableScope subscription : subscriptions)
				subscription.close();
			subscriptions = null;
		}
	}
	/**
	 * Runs {@code supplier} with this tracker entered.
	 *
	 * @param <T>
	 *            type of the result
	 * @param supplier
	 *            code to observe
	 * @return result of {@code supplier}
	 */
	public <T> T supply(Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		try (CloseableScope scope = enter()) {
			return supplier.get();
		}
	}
	/**
	 * Runs {@code supplier} with new tracker entered.
	 * If {@code supplier} throws, the exception propagates and the tracker is discarded.
	 *
	 * @param <T>
	 *            type of the result
	 * @param supplier
	 *            code to observe
	 * @return result of {@code supplier} together with the tracker that observed it
	 */
	public static <T> Tracked<T> track(Supplier<T> supplier) {
		ReactiveTracker tracker = new ReactiveTracker();
		T value = tracker.supply(supplier);
		return new Tracked<>(value, tracker);
	}
	/**
	 * Result of {@link ReactiveTracker#track(Supplier)}.
	 *
	 * @param <T>
	 *            type of the result
	 */
	public static final class Tracked<T> {
		private final T value;
		private final ReactiveTracker tracker;
		Tracked(T value, ReactiveTracker tracker) {
			this.value = value;
			this.tracker = tracker;
		}
		public T value() {
			return value;
		}
		public ReactiveTracker tracker() {
			return tracker;
		}
		public Set<ReactiveSource<?>> sources() {
			return tracker.sources();
		}
		public void subscribe(Runnable callback) {
			tracker.subscribe(callback);
		}
		public void unsubscribe() {
			tracker.unsubscribe();
		}
		@Override
		public String toString() {
			return tracker + " = " + value;
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).tag("sources", sources.size()).toString();
	}
}
