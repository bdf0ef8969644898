// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.ripple.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Computed is an invalidate-then-refresh node. Writes only mark it dirty. It recomputes when somebody reads it.
 *
 * Refresh is iterative. We walk down to dirty computed sources with an explicit stack and recompute bottom-up,
 * so that arbitrarily long chains do not overflow the thread's stack and every dirty ancestor is recomputed
 * at most once per refresh before any of its dependents.
 *
 * Recompute has three phases:
 * - prepare: every existing edge is marked unused and becomes the source's cached edge, so that re-tracking is O(1)
 * - execute: the supplier runs with this computed as the current context
 * - cleanup: edges that are still marked unused are unlinked and the sources' cached edges are restored
 *
 * A dirty computed whose sources all kept their versions is marked clean without running its supplier.
 * Equal results therefore stop propagation of recomputations, though not of invalidation.
 *
 * Dependents of selector slots are invalidated together with the owner's ordinary targets.
 * Recompute then bumps only the slots of the previous and the next value,
 * so that dependents comparing with other keys pass the version check without running.
 *
 * Subscribed computeds are eager. Invalidation schedules a notifier
 * that refreshes them as soon as the current batch ends and notifies subscribers if the value changed.
 */
/**
 * Memoized reactive computation.
 * Sources read by the supplier are recorded automatically. When any of them changes,
 * the computed is invalidated and the supplier runs again on next read.
 * <p>
 * The supplier runs once in the constructor. Computeds hold strong references from their sources
 * and must be released with {@link #dispose()} or via {@link ReactiveDisposables}.
 * {@link ReactiveComputed} is not thread-safe.
 *
 * @param <T>
 *            type of the computed value
 *
 * @see ReactiveSignal
 * @see ReactiveEffect
 */
@DraftDocs("link to reactive graph docs")
public class ReactiveComputed<T> extends ReactiveSource<T> {
	private static final Logger logger = LoggerFactory.getLogger(ReactiveComputed.class);
	private static final Counter recomputeCount = Metrics.counter("ripple.computed.recomputes");
	private static final Counter failureCount = Metrics.counter("ripple.computed.failures");
	/*
	 * Null after disposal.
	 */
	Supplier<T> supplier;
	private T value;
	private boolean initialized;
	boolean dirty = true;
	private boolean computing;
	/*
	 * Set while the computed is on the refresh stack. Prevents endless descent into cyclic graphs.
	 */
	private boolean visiting;
	/*
	 * Head of the list of edges that have this computed as their target.
	 */
	ReactiveEdge sources;
	/*
	 * Last exception thrown by the supplier. Cleared by successful recompute and by invalidation.
	 */
	private Throwable failure;
	private long failurePass;
	private ReactiveEquality<? super T> equality = ReactiveEquality.same();
	/**
	 * Creates new computed and runs {@code supplier} for the first time.
	 * If the supplier throws, the computed is disposed and the exception propagates.
	 *
	 * @param supplier
	 *            computation that reads other reactive values
	 */
	public ReactiveComputed(Supplier<T> supplier) {
		this(supplier, ReactiveEquality.same());
	}
	/**
	 * Creates new computed with custom change detection and runs {@code supplier} for the first time.
	 *
	 * @param supplier
	 *            computation that reads other reactive values
	 * @param equality
	 *            test deciding whether new result is a change
	 */
	public ReactiveComputed(Supplier<T> supplier, ReactiveEquality<? super T> equality) {
		Objects.requireNonNull(supplier);
		Objects.requireNonNull(equality);
		OwnerTrace.of(this).alias("computed");
		this.supplier = supplier;
		this.equality = equality;
		ReactiveRuntime runtime = ReactiveRuntime.get();
		try {
			recompute(runtime);
		} catch (Throwable ex) {
			dispose();
			throw ex;
		}
		ReactiveDisposables.register(runtime, this::dispose);
	}
	public ReactiveEquality<? super T> equality() {
		return equality;
	}
	/**
	 * Configures test deciding whether new result of the supplier is a change.
	 * Dependents and subscribers are not notified of results that are equal to the previous one.
	 *
	 * @param equality
	 *            new equality test
	 * @return {@code this} (fluent method)
	 */
	public ReactiveComputed<T> equality(ReactiveEquality<? super T> equality) {
		Objects.requireNonNull(equality);
		this.equality = equality;
		return this;
	}
	/**
	 * Returns current value, recomputing it first if it is stale, and records dependency in the current computed.
	 * Reading the computed from its own supplier returns previous value.
	 *
	 * @return current value
	 * @throws RuntimeException
	 *             thrown by the supplier
	 */
	@Override
	public T get() {
		ReactiveRuntime runtime = ReactiveRuntime.get();
		/*
		 * Tracking comes after refresh, so that the edge records the refreshed version.
		 * It must happen even if refresh throws, otherwise the dependent would never learn about recovery.
		 */
		try {
			if (stale())
				refresh(runtime);
		} finally {
			track(runtime);
		}
		return value;
	}
	@Override
	public T peek() {
		if (stale())
			refresh(ReactiveRuntime.get());
		return value;
	}
	private boolean stale() {
		return dirty && !computing && supplier != null;
	}
	/**
	 * Returns {@code true} if the cached value might be out of date.
	 *
	 * @return {@code true} if dirty
	 */
	public boolean dirty() {
		return dirty;
	}
	/**
	 * Returns {@code true} if {@link #dispose()} was called or the constructor failed.
	 *
	 * @return {@code true} if disposed
	 */
	public boolean disposed() {
		return supplier == null;
	}
	/*
	 * Eager behavior requires clean state, because already dirty computeds are not invalidated again.
	 * Refresh failure is recorded in the computed and it will be reported when the value is read.
	 */
	@Override
	public CloseableScope subscribe(Runnable callback) {
		CloseableScope subscription = super.subscribe(callback);
		if (stale() && failure == null) {
			try {
				refresh(ReactiveRuntime.get());
			} catch (Throwable ex) {
				logger.debug("Computed {} failed while being subscribed. Failure will be reported on next read.", this, ex);
			}
		}
		return subscription;
	}
	void refresh(ReactiveRuntime runtime) {
		if (failure != null && runtime.refreshing > 0 && failurePass == runtime.pass)
			throw rethrow(failure);
		if (runtime.refreshing++ == 0)
			++runtime.pass;
		ObjectArrayList<ReactiveComputed<?>> stack = runtime.stack;
		int base = stack.size();
		visiting = true;
		try {
			ReactiveComputed<?> current = this;
			while (true) {
				ReactiveComputed<?> next = current.dirtySource(runtime);
				if (next != null) {
					stack.push(current);
					next.visiting = true;
					current = next;
				} else if (current == this) {
					revalidate(runtime);
					return;
				} else {
					current.visiting = false;
					try {
						current.revalidate(runtime);
					} catch (Throwable ex) {
						/*
						 * The failure is remembered in the ancestor and rethrown when the dependent reads it.
						 */
						logger.debug("Computed {} failed. Dependent will observe the failure on read.", current, ex);
					}
					current = stack.pop();
				}
			}
		} finally {
			visiting = false;
			for (int i = base; i < stack.size(); ++i)
				stack.get(i).visiting = false;
			stack.size(base);
			--runtime.refreshing;
		}
	}
	/*
	 * Finds a dirty computed source that must be refreshed before this computed.
	 * Ancestors that already failed in the current pass are not retried.
	 */
	private ReactiveComputed<?> dirtySource(ReactiveRuntime runtime) {
		for (ReactiveEdge edge = sources; edge != null; edge = edge.nextSource) {
			ReactiveComputed<?> source = computedOf(edge.source);
			if (source != null && source.stale() && !source.visiting && !(source.failure != null && source.failurePass == runtime.pass))
				return source;
		}
		return null;
	}
	/*
	 * Selector slot of a computed stands for its owner during refresh.
	 */
	private static ReactiveComputed<?> computedOf(ReactiveSource<?> source) {
		if (source instanceof SelectorSlot)
			source = ((SelectorSlot)source).owner;
		return source instanceof ReactiveComputed ? (ReactiveComputed<?>)source : null;
	}
	/*
	 * Called when all computed sources are fresh.
	 */
	private void revalidate(ReactiveRuntime runtime) {
		if (outdated())
			recompute(runtime);
		else
			dirty = false;
	}
	private boolean outdated() {
		if (!initialized || failure != null)
			return true;
		for (ReactiveEdge edge = sources; edge != null; edge = edge.nextSource) {
			if (edge.version != edge.source.version)
				return true;
			ReactiveComputed<?> source = computedOf(edge.source);
			if (source != null && source.failure != null)
				return true;
		}
		return false;
	}
	void recompute(ReactiveRuntime runtime) {
		for (ReactiveEdge edge = sources; edge != null; edge = edge.nextSource) {
			edge.rollback = edge.source.cached;
			edge.source.cached = edge;
			edge.version = ReactiveEdge.UNUSED;
		}
		computing = true;
		recomputeCount.increment();
		T next;
		try (CloseableScope scope = runtime.enter(this, null)) {
			next = supplier.get();
		} catch (Throwable ex) {
			failure = ex;
			failurePass = runtime.pass;
			failureCount.increment();
			throw ex;
		} finally {
			computing = false;
			cleanup();
		}
		failure = null;
		boolean changed = !initialized || !equality.test(value, next);
		T previous = value;
		value = next;
		initialized = true;
		if (changed) {
			++version;
			/*
			 * Slot dependents were already invalidated by markDirty(). Only versions change here.
			 */
			bumpSlots(previous, next);
		}
		dirty = false;
	}
	/*
	 * Edges that were not tracked by the last run of the supplier are removed.
	 * Edges that the supplier never reached because it threw are removed too.
	 */
	private void cleanup() {
		ReactiveEdge edge = sources;
		while (edge != null) {
			ReactiveEdge next = edge.nextSource;
			release(edge);
			if (edge.version == ReactiveEdge.UNUSED) {
				edge.unlinkFromTarget();
				edge.unlinkFromSource();
			}
			edge = next;
		}
	}
	/*
	 * Restores source's cached edge to what it was before this edge replaced it.
	 * The edge is normally on top of the chain, but disposal of a computing computed can find it deeper.
	 */
	private static void release(ReactiveEdge edge) {
		ReactiveSource<?> source = edge.source;
		if (source.cached == edge)
			source.cached = edge.rollback;
		else {
			for (ReactiveEdge cached = source.cached; cached != null; cached = cached.rollback) {
				if (cached.rollback == edge) {
					cached.rollback = edge.rollback;
					break;
				}
			}
		}
		edge.rollback = null;
	}
	/*
	 * Breadth-first invalidation. Work queue is used instead of recursion, so that long chains cannot overflow the stack.
	 * Failed computeds are dirty, but they are invalidated again, because invalidation clears the remembered failure.
	 * Dependents of the computed's selector slots are invalidated too. They will find out in refresh whether their slot fired.
	 */
	void markDirty(ReactiveRuntime runtime) {
		if (supplier == null || dirty && failure == null)
			return;
		ObjectArrayList<ReactiveComputed<?>> queue = runtime.queue;
		int base = queue.size();
		try {
			invalidate(runtime);
			queue.add(this);
			for (int i = base; i < queue.size(); ++i) {
				ReactiveComputed<?> current = queue.get(i);
				enqueueTargets(runtime, current, queue);
				if (current.hasSlots())
					for (SelectorSlot slot : current.slots())
						enqueueTargets(runtime, slot, queue);
			}
		} finally {
			queue.size(base);
		}
	}
	private static void enqueueTargets(ReactiveRuntime runtime, ReactiveSource<?> source, ObjectArrayList<ReactiveComputed<?>> queue) {
		for (ReactiveEdge edge = source.targets; edge != null; edge = edge.nextTarget) {
			ReactiveComputed<?> target = edge.target;
			if (target.supplier != null && (!target.dirty || target.failure != null)) {
				target.invalidate(runtime);
				queue.add(target);
			}
		}
	}
	private void invalidate(ReactiveRuntime runtime) {
		dirty = true;
		failure = null;
		if (subscribed())
			schedule(runtime);
	}
	/*
	 * Eager notification state. One notifier per computed, so that batches deduplicate it.
	 */
	private boolean notifying;
	private T before;
	private Runnable notifier;
	private void schedule(ReactiveRuntime runtime) {
		if (notifying)
			return;
		notifying = true;
		before = value;
		if (notifier == null)
			notifier = this::settle;
		ReactiveBatch.enqueue(runtime, notifier);
	}
	private void settle() {
		notifying = false;
		T previous = before;
		before = null;
		if (supplier == null)
			return;
		ReactiveRuntime runtime = ReactiveRuntime.get();
		if (stale())
			refresh(runtime);
		if (equality.test(previous, value))
			return;
		ReactiveBatch.begin(runtime);
		try {
			notifySubscribers(runtime);
		} finally {
			ReactiveBatch.end(runtime, this);
		}
	}
	private static RuntimeException rethrow(Throwable ex) {
		if (ex instanceof RuntimeException)
			return (RuntimeException)ex;
		if (ex instanceof Error)
			throw (Error)ex;
		return new CompletionException(ex);
	}
	/**
	 * Releases the computed from the graph. All edges to its sources are removed and subscribers are dropped.
	 * The computed keeps returning its last value and never recomputes again.
	 * Calling this method repeatedly has no effect. It is safe to call it from the computed's own supplier.
	 */
	public void dispose() {
		if (supplier == null)
			return;
		supplier = null;
		ReactiveEdge edge = sources;
		sources = null;
		while (edge != null) {
			ReactiveEdge next = edge.nextSource;
			release(edge);
			edge.prevSource = null;
			edge.nextSource = null;
			edge.unlinkFromSource();
			edge = next;
		}
		unsubscribeAll();
		before = null;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + (failure != null ? failure : value);
	}
}
