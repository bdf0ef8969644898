// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Shared machinery of signals, computeds, and selector slots:
 * list of dependent computeds, fast re-tracking cache, version counter, and subscriber list.
 *
 * Strong references go in both directions here, from sources to targets and back.
 * This is unlike the weak back-references in thread-based reactive libraries.
 * Our graph is torn down deterministically by ReactiveComputed.dispose(), so there is nothing for the GC to decide.
 */
/**
 * Node of the reactive graph that other computeds can depend on.
 *
 * @param <T>
 *            type of the value
 *
 * @see ReactiveSignal
 * @see ReactiveComputed
 */
@StubDocs
public abstract class ReactiveSource<T> implements ReactiveReadable<T> {
	/*
	 * Incremented only on actual change. Edges remember the version they were tracked at.
	 */
	long version;
	/**
	 * Returns number of actual changes of this source.
	 * Writes and recomputations that produce equal value do not change the version.
	 *
	 * @return current version
	 */
	public long version() {
		return version;
	}
	/*
	 * Head of the list of edges that have this source as their source.
	 */
	ReactiveEdge targets;
	/*
	 * Edge of the currently running computed, if it has one. Set up by ReactiveComputed's prepare phase
	 * and by first tracking, restored in its cleanup phase. Lets repeated reads skip any list search.
	 */
	ReactiveEdge cached;
	/*
	 * Records dependency of the context computed on this source.
	 */
	void depend(ReactiveComputed<?> context) {
		ReactiveEdge edge = cached;
		if (edge != null && edge.target == context) {
			if (edge.version == ReactiveEdge.UNUSED) {
				edge.version = version;
				edge.promote();
			}
			return;
		}
		edge = new ReactiveEdge(this, context);
		edge.link();
		edge.rollback = cached;
		cached = edge;
	}
	/*
	 * Common entry point of all reads. Reports the read to the tracker and links the edge if there is a context.
	 */
	void track(ReactiveRuntime runtime) {
		if (runtime.tracker != null)
			runtime.tracker.record(this);
		ReactiveComputed<?> context = runtime.context;
		if (context != null && context != this && context.supplier != null)
			depend(context);
	}
	/**
	 * Suspends dependency tracking until the returned scope is closed.
	 * Reads in the scope are neither recorded in the current computed nor reported to the current {@link ReactiveTracker}.
	 *
	 * @return scope that restores tracking when closed
	 */
	public static CloseableScope ignore() {
		return ReactiveRuntime.get().enter(null, null);
	}
	/**
	 * Runs {@code supplier} without dependency tracking.
	 *
	 * @param <V>
	 *            type of the result
	 * @param supplier
	 *            code to run
	 * @return result of {@code supplier}
	 */
	public static <V> V untracked(Supplier<V> supplier) {
		Objects.requireNonNull(supplier);
		try (CloseableScope scope = ignore()) {
			return supplier.get();
		}
	}
	/**
	 * Returns number of computeds that currently depend on this source.
	 * Dependencies on {@link #is(Object)} comparisons are not included.
	 * This is intended for diagnostics and tests. It walks the whole list.
	 *
	 * @return number of dependent computeds
	 */
	public int targetCount() {
		int count = 0;
		for (ReactiveEdge edge = targets; edge != null; edge = edge.nextTarget)
			++count;
		return count;
	}
	/*
	 * Called when the last edge is removed from this source.
	 */
	void unwatched() {
	}
	/*
	 * Subscriber order is only maintained until the first unsubscription.
	 * Removal swaps the last subscriber into the vacated position.
	 */
	private final ObjectArrayList<Runnable> subscribers = new ObjectArrayList<>(0);
	@Override
	public CloseableScope subscribe(Runnable callback) {
		Objects.requireNonNull(callback);
		subscribers.add(callback);
		return new CloseableScope() {
			boolean closed;
			@Override
			public void close() {
				if (!closed) {
					closed = true;
					unsubscribe(callback);
				}
			}
		};
	}
	private void unsubscribe(Runnable callback) {
		for (int i = 0; i < subscribers.size(); ++i) {
			if (subscribers.get(i) == callback) {
				int last = subscribers.size() - 1;
				subscribers.set(i, subscribers.get(last));
				subscribers.remove(last);
				return;
			}
		}
	}
	/**
	 * Returns number of subscribed callbacks.
	 *
	 * @return number of subscribers
	 */
	public int subscriberCount() {
		return subscribers.size();
	}
	boolean subscribed() {
		return !subscribers.isEmpty();
	}
	void unsubscribeAll() {
		subscribers.clear();
		subscribers.trim();
	}
	/*
	 * Subscribers are copied, because they may unsubscribe themselves or subscribe others while running.
	 */
	void notifySubscribers(ReactiveRuntime runtime) {
		if (subscribers.isEmpty())
			return;
		for (Runnable subscriber : subscribers.toArray(new Runnable[subscribers.size()]))
			ReactiveBatch.enqueue(runtime, subscriber);
	}
	/*
	 * Selector slots are created lazily on first is() call inside a computed
	 * and removed again when the last dependent computed drops them.
	 */
	private Object2ObjectOpenHashMap<Object, SelectorSlot> slots;
	@Override
	public boolean is(T key) {
		ReactiveRuntime runtime = ReactiveRuntime.get();
		if (runtime.tracker != null)
			runtime.tracker.record(this);
		/*
		 * The owner is refreshed before the edge is linked, so that the edge records the slot's refreshed version.
		 */
		try {
			return Objects.equals(peek(), key);
		} finally {
			ReactiveComputed<?> context = runtime.context;
			if (context != null && context != this && context.supplier != null) {
				if (slots == null)
					slots = new Object2ObjectOpenHashMap<>();
				SelectorSlot slot = slots.get(key);
				if (slot == null) {
					slot = new SelectorSlot(this, key);
					slots.put(key, slot);
				}
				slot.depend(context);
			}
		}
	}
	/**
	 * Returns number of distinct keys that computeds currently watch via {@link #is(Object)}.
	 *
	 * @return number of live selector slots
	 */
	public int slotCount() {
		return slots != null ? slots.size() : 0;
	}
	boolean hasSlots() {
		return slots != null && !slots.isEmpty();
	}
	Collection<SelectorSlot> slots() {
		return slots != null ? slots.values() : Collections.emptyList();
	}
	void dropSlot(SelectorSlot slot) {
		if (slots != null && slots.get(slot.key) == slot) {
			slots.remove(slot.key);
			if (slots.isEmpty())
				slots = null;
		}
	}
	/*
	 * Value changed from previous to next. Only the two affected slots are invalidated.
	 * Must be called inside a batch, because invalidation only schedules notifications.
	 */
	void fireSlots(ReactiveRuntime runtime, Object previous, Object next) {
		if (slots == null)
			return;
		SelectorSlot left = slots.get(previous);
		SelectorSlot right = slots.get(next);
		if (left != null)
			left.fire(runtime);
		if (right != null && right != left)
			right.fire(runtime);
	}
	/*
	 * Same as fireSlots(), but for owners whose slot dependents are already dirty.
	 */
	void bumpSlots(Object previous, Object next) {
		if (slots == null)
			return;
		SelectorSlot left = slots.get(previous);
		SelectorSlot right = slots.get(next);
		if (left != null)
			++left.version;
		if (right != null && right != left)
			++right.version;
	}
	/*
	 * Invalidates all direct dependents. Dirtiness then spreads breadth-first from each of them.
	 */
	void invalidateTargets(ReactiveRuntime runtime) {
		for (ReactiveEdge edge = targets; edge != null; edge = edge.nextTarget)
			edge.target.markDirty(runtime);
	}
}
