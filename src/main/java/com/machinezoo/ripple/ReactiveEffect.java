// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.ripple.util.*;
import com.machinezoo.stagean.*;

/*
 * Effect is a computed that is kept eager by a no-op subscriber.
 * Its body runs immediately and again, at the end of the batch, whenever anything it read changes.
 *
 * The body can return cleanup that undoes its side effects. Cleanup runs before the next run of the body
 * and when the effect is disposed. Cleanup runs with tracking suspended, so that it cannot add dependencies.
 */
/**
 * Side effect that re-runs whenever reactive values it reads change.
 */
@DraftDocs("link to effect docs")
public class ReactiveEffect implements CloseableScope {
	private final Supplier<Runnable> body;
	private Runnable cleanup;
	private final ReactiveComputed<Object> computed;
	private final CloseableScope subscription;
	private boolean disposed;
	/**
	 * Runs {@code body} immediately and then every time reactive values it has read change.
	 *
	 * @param body
	 *            code performing the side effect, returning cleanup or {@code null}
	 */
	public ReactiveEffect(Supplier<Runnable> body) {
		Objects.requireNonNull(body);
		OwnerTrace.of(this).alias("effect").generateId();
		this.body = body;
		computed = OwnerTrace.of(new ReactiveComputed<Object>(this::execute, ReactiveEquality.never()))
			.parent(this)
			.target();
		subscription = computed.subscribe(() -> {
		});
		ReactiveDisposables.register(ReactiveRuntime.get(), this::dispose);
	}
	/**
	 * Creates effect without cleanup.
	 *
	 * @param body
	 *            code performing the side effect
	 * @return new effect
	 */
	public static ReactiveEffect of(Runnable body) {
		Objects.requireNonNull(body);
		return new ReactiveEffect(() -> {
			body.run();
			return null;
		});
	}
	/**
	 * Same as {@link #ReactiveEffect(Supplier)}.
	 *
	 * @param body
	 *            code performing the side effect, returning cleanup or {@code null}
	 * @return new effect
	 */
	public static ReactiveEffect run(Supplier<Runnable> body) {
		return new ReactiveEffect(body);
	}
	private Object execute() {
		runCleanup();
		cleanup = body.get();
		return null;
	}
	private void runCleanup() {
		Runnable pending = cleanup;
		cleanup = null;
		if (pending != null) {
			try (CloseableScope scope = ReactiveSource.ignore()) {
				pending.run();
			}
		}
	}
	public boolean disposed() {
		return disposed;
	}
	/**
	 * Stops the effect and runs its last cleanup. Subsequent calls have no effect.
	 */
	public void dispose() {
		if (disposed)
			return;
		disposed = true;
		subscription.close();
		computed.dispose();
		runCleanup();
	}
	@Override
	public void close() {
		dispose();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
