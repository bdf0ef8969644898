// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Deciding whether a write is a change is a trade-off, same as in any reactive library.
 * Full equals() suppresses trivial rewrites of equal values, but it can be slow and surprising for mutable objects.
 * Pure reference equality is cheap, but boxed numbers are not canonical in Java,
 * so writing 1000 twice would then look like a change.
 *
 * The default is therefore value semantics for immutable boxed values and strings and reference semantics for everything else.
 * Boxed floating point equals() has exactly the semantics we want: NaN equals NaN and 0.0 differs from -0.0.
 */
/**
 * Equality test deciding whether a new value of {@link ReactiveSignal} or {@link ReactiveComputed} is a change.
 *
 * @param <T>
 *            type of compared values
 */
@DraftDocs("link to change detection docs")
@FunctionalInterface
public interface ReactiveEquality<T> {
	/**
	 * Returns {@code true} if {@code next} should be considered the same as {@code previous}.
	 *
	 * @param previous
	 *            currently stored value
	 * @param next
	 *            newly written or computed value
	 * @return {@code true} if there is no change
	 */
	boolean test(T previous, T next);
	/**
	 * Value equality for boxed primitives and strings, reference equality for all other objects.
	 * This is the default for signals and computeds.
	 *
	 * @param <T>
	 *            type of compared values
	 * @return same-value equality
	 */
	@SuppressWarnings("unchecked")
	static <T> ReactiveEquality<T> same() {
		return (ReactiveEquality<T>)SameValue.INSTANCE;
	}
	/**
	 * Full equality via {@link Objects#equals(Object, Object)}.
	 *
	 * @param <T>
	 *            type of compared values
	 * @return full equality
	 */
	static <T> ReactiveEquality<T> full() {
		return Objects::equals;
	}
	/**
	 * Reference equality.
	 *
	 * @param <T>
	 *            type of compared values
	 * @return reference equality
	 */
	static <T> ReactiveEquality<T> identity() {
		return (a, b) -> a == b;
	}
	/**
	 * Treats every write as a change. Useful for signals holding mutable objects that are modified in place.
	 *
	 * @param <T>
	 *            type of compared values
	 * @return equality that never matches
	 */
	static <T> ReactiveEquality<T> never() {
		return (a, b) -> false;
	}
}

final class SameValue implements ReactiveEquality<Object> {
	static final SameValue INSTANCE = new SameValue();
	@Override
	public boolean test(Object previous, Object next) {
		if (previous == next)
			return true;
		if (previous == null || next == null || previous.getClass() != next.getClass())
			return false;
		return isValue(previous) && previous.equals(next);
	}
	private static boolean isValue(Object object) {
		return object instanceof Number && object.getClass().getName().startsWith("java.lang.")
			|| object instanceof String
			|| object instanceof Boolean
			|| object instanceof Character;
	}
}
