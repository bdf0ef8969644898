// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.ripple.util.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Computeds and effects are referenced by their sources. Dropping the last application reference
 * does not make them garbage. Code that creates many of them, for example one per rendered component,
 * can instead enter a disposal scope and release everything created in it with one call.
 *
 * Disposal scope is entered the same way computeds enter their tracking context, i.e. it is thread-local state
 * restored by closing the returned scope. Disposal scopes nest. Objects register only with the innermost one.
 */
/**
 * Collection of computeds and effects that are disposed together.
 */
@StubDocs
public class ReactiveDisposables {
	private final ObjectArrayList<Runnable> disposers = new ObjectArrayList<>();
	private boolean entered;
	private boolean disposed;
	public ReactiveDisposables() {
		OwnerTrace.of(this).alias("disposables");
	}
	/**
	 * Makes this the current disposal scope until the returned scope is closed.
	 * Every {@link ReactiveComputed} and {@link ReactiveEffect} created meanwhile on this thread is registered with it.
	 *
	 * @return scope that restores previous disposal scope, closing it repeatedly has no effect
	 * @throws IllegalStateException
	 *             if this disposal scope is already entered
	 */
	public CloseableScope enter() {
		if (entered)
			throw new IllegalStateException("Cannot enter the same disposal scope recursively.");
		ReactiveRuntime runtime = ReactiveRuntime.get();
		entered = true;
		ReactiveDisposables outer = runtime.disposables;
		runtime.disposables = this;
		return new CloseableScope() {
			boolean closed;
			@Override
			public void close() {
				if (!closed) {
					closed = true;
					entered = false;
					/*
					 * Scope closed out of order leaves the current scope alone.
					 */
					if (runtime.disposables == ReactiveDisposables.this)
						runtime.disposables = outer;
				}
			}
		};
	}
	/**
	 * Returns the current disposal scope.
	 *
	 * @return current disposal scope or {@code null} if none is entered
	 */
	public static ReactiveDisposables current() {
		return ReactiveRuntime.get().disposables;
	}
	static void register(ReactiveRuntime runtime, Runnable disposer) {
		if (runtime.disposables != null)
			runtime.disposables.add(disposer);
	}
	/*
	 * Objects created in already disposed scope are disposed immediately.
	 */
	void add(Runnable disposer) {
		if (disposed)
			disposer.run();
		else
			disposers.add(disposer);
	}
	/**
	 * Returns number of objects registered with this scope since it was created.
	 * Objects disposed individually are still counted until the scope is disposed.
	 *
	 * @return number of registered disposers
	 */
	public int size() {
		return disposers.size();
	}
	public boolean disposed() {
		return disposed;
	}
	/**
	 * Disposes all registered objects in reverse order of creation.
	 * Subsequent calls have no effect. If some disposer throws, the remaining ones still run
	 * and the first exception is rethrown with the others suppressed.
	 */
	public void dispose() {
		if (disposed)
			return;
		disposed = true;
		RuntimeException failure = null;
		for (int i = disposers.size() - 1; i >= 0; --i) {
			try {
				disposers.get(i).run();
			} catch (RuntimeException ex) {
				if (failure == null)
					failure = ex;
				else
					failure.addSuppressed(ex);
			}
		}
		disposers.clear();
		if (failure != null)
			throw failure;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).tag("size", disposers.size()).toString();
	}
}
