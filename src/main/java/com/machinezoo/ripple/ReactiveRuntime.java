// Part of Ripple
package com.machinezoo.ripple;

import com.machinezoo.closeablescope.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * All mutable global state of the graph lives here. There is one instance per thread.
 *
 * The graph itself is not thread-safe. Keeping context, batch, and refresh stack thread-local
 * merely ensures that independent graphs used from different threads do not see each other's context.
 * Sharing one graph between threads requires external synchronization.
 *
 * Fields are accessed directly by the other classes in this package. This is hot code
 * and we want exactly one thread-local lookup per operation.
 */
final class ReactiveRuntime {
	private static final ThreadLocal<ReactiveRuntime> current = ThreadLocal.withInitial(ReactiveRuntime::new);
	static ReactiveRuntime get() {
		return current.get();
	}
	/*
	 * Computed whose supplier is currently running. Sources read now become its dependencies.
	 */
	ReactiveComputed<?> context;
	/*
	 * External observer of reads. Independent of the context, because trackers are used outside of computeds.
	 */
	ReactiveTracker tracker;
	/*
	 * Installs new context and tracker. Used with try-with-resources, so that the previous state
	 * is restored even if the supplier throws.
	 */
	CloseableScope enter(ReactiveComputed<?> context, ReactiveTracker tracker) {
		ReactiveComputed<?> outerContext = this.context;
		ReactiveTracker outerTracker = this.tracker;
		this.context = context;
		this.tracker = tracker;
		return () -> {
			this.context = outerContext;
			this.tracker = outerTracker;
		};
	}
	/*
	 * Trackers can be entered inside computeds. Reads are then recorded by both.
	 */
	CloseableScope observe(ReactiveTracker tracker) {
		ReactiveTracker outer = this.tracker;
		this.tracker = tracker;
		return () -> this.tracker = outer;
	}
	/*
	 * Innermost disposal scope. Computeds and effects created while it is entered register with it.
	 */
	ReactiveDisposables disposables;
	/*
	 * Batch state. Pending callbacks are ordered by first insertion and deduplicated by identity.
	 */
	int depth;
	ReferenceLinkedOpenHashSet<Runnable> pending;
	/*
	 * Reusable stack for iterative refresh. Nested refreshes share it by remembering their base index.
	 */
	final ObjectArrayList<ReactiveComputed<?>> stack = new ObjectArrayList<>();
	/*
	 * Reusable work queue of breadth-first invalidation. Shared the same way as the refresh stack.
	 */
	final ObjectArrayList<ReactiveComputed<?>> queue = new ObjectArrayList<>();
	/*
	 * Refresh passes are numbered, so that a computed that failed in the current pass
	 * can rethrow its failure instead of running its supplier again for every dependent.
	 * Pass number changes only when the outermost refresh starts.
	 */
	int refreshing;
	long pass;
}
