// Part of Ripple
package com.machinezoo.ripple;

import java.util.concurrent.atomic.*;
import java.util.function.*;

public abstract class TestBase {
	/*
	 * Wraps the supplier, so that its invocations can be counted.
	 */
	public static <T> Supplier<T> counted(AtomicInteger counter, Supplier<T> supplier) {
		return () -> {
			counter.incrementAndGet();
			return supplier.get();
		};
	}
}
