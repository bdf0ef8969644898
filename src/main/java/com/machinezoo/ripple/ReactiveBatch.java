// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.ripple.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.opentracing.*;
import io.opentracing.util.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Batches defer subscriber callbacks and eager recomputations until the outermost batch ends.
 * Every callback runs once per batch no matter how many writes scheduled it.
 *
 * Every signal write is itself wrapped in a batch. This way all dirty flags in the graph are set
 * before the first callback runs and callbacks never observe partially propagated invalidation.
 * Outside of an explicit batch, callbacks still run before the write returns.
 *
 * Callbacks have nowhere to propagate exceptions to. Exceptions are therefore logged and the remaining callbacks still run.
 */
/**
 * Deferred and deduplicated notification of reactive changes.
 */
@DraftDocs("link to batching docs")
public class ReactiveBatch {
	private static final Logger logger = LoggerFactory.getLogger(ReactiveBatch.class);
	private static final Counter flushCount = Metrics.counter("ripple.batch.flushes");
	/**
	 * Returns {@code true} if a batch is open on the current thread.
	 *
	 * @return {@code true} if callbacks are currently deferred
	 */
	public static boolean active() {
		return ReactiveRuntime.get().depth > 0;
	}
	/**
	 * Opens a batch that lasts until the returned scope is closed.
	 * Batches can be nested. Callbacks run when the outermost batch is closed.
	 *
	 * @return scope that closes the batch
	 */
	public static CloseableScope open() {
		ReactiveRuntime runtime = ReactiveRuntime.get();
		begin(runtime);
		return new CloseableScope() {
			boolean closed;
			@Override
			public void close() {
				if (!closed) {
					closed = true;
					end(runtime, null);
				}
			}
		};
	}
	/**
	 * Runs {@code runnable} in a batch. Callbacks scheduled by writes in {@code runnable} run after it returns or throws.
	 *
	 * @param runnable
	 *            code performing writes
	 */
	public static void batch(Runnable runnable) {
		Objects.requireNonNull(runnable);
		ReactiveRuntime runtime = ReactiveRuntime.get();
		begin(runtime);
		try {
			runnable.run();
		} finally {
			end(runtime, null);
		}
	}
	/**
	 * Runs {@code supplier} in a batch and returns its result.
	 * Callbacks scheduled by writes in {@code supplier} run after it returns or throws.
	 *
	 * @param <T>
	 *            type of the result
	 * @param supplier
	 *            code performing writes
	 * @return result of {@code supplier}
	 */
	public static <T> T batch(Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		ReactiveRuntime runtime = ReactiveRuntime.get();
		begin(runtime);
		try {
			return supplier.get();
		} finally {
			end(runtime, null);
		}
	}
	static void begin(ReactiveRuntime runtime) {
		++runtime.depth;
	}
	/*
	 * The origin is the object that opened an implicit batch. It is used to tag the trace span if there is anything to run.
	 */
	static void end(ReactiveRuntime runtime, Object origin) {
		if (--runtime.depth > 0)
			return;
		ReferenceLinkedOpenHashSet<Runnable> pending = runtime.pending;
		runtime.pending = null;
		if (pending == null || pending.isEmpty())
			return;
		flushCount.increment();
		Span span = GlobalTracer.get().buildSpan("ripple.flush")
			.withTag("component", "ripple")
			.withTag("callbacks", pending.size())
			.start();
		if (origin != null)
			OwnerTrace.of(origin).fill(span);
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			for (Runnable callback : pending)
				ExceptionLogging.log(logger).run(callback);
		} finally {
			span.finish();
		}
	}
	/*
	 * Inside a batch the callback is queued. Outside of it, it runs immediately.
	 */
	static void enqueue(ReactiveRuntime runtime, Runnable callback) {
		if (runtime.depth > 0) {
			if (runtime.pending == null)
				runtime.pending = new ReferenceLinkedOpenHashSet<>();
			runtime.pending.add(callback);
		} else
			ExceptionLogging.log(logger).run(callback);
	}
}
