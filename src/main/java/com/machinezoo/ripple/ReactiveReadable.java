// Part of Ripple
package com.machinezoo.ripple;

import java.util.function.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;

/**
 * Read side of a reactive value. Implemented by {@link ReactiveSignal}, {@link ReactiveComputed},
 * and read-only views returned from {@link ReactiveSignal#readonly()}.
 *
 * @param <T>
 *            type of the value
 */
@DraftDocs("link to reactive graph docs")
public interface ReactiveReadable<T> extends Supplier<T> {
	/**
	 * Returns current value and records dependency in the currently running {@link ReactiveComputed} if there is any.
	 *
	 * @return current value
	 */
	@Override
	T get();
	/**
	 * Returns current value without recording any dependency.
	 *
	 * @return current value
	 */
	T peek();
	/**
	 * Tests whether current value equals {@code key} and records dependency on just this comparison.
	 * Dependent computeds are then invalidated only when the result of the comparison may have changed,
	 * i.e. when the value changes from or to {@code key}.
	 *
	 * @param key
	 *            value to compare with
	 * @return {@code true} if current value equals {@code key}
	 */
	boolean is(T key);
	/**
	 * Registers a callback that runs whenever the value changes.
	 * Callbacks are deferred until the end of the current {@link ReactiveBatch} if one is open.
	 *
	 * @param callback
	 *            callback to run on change
	 * @return scope that unsubscribes the callback when closed
	 */
	CloseableScope subscribe(Runnable callback);
}
