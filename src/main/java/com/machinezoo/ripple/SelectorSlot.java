// Part of Ripple
package com.machinezoo.ripple;

import java.util.*;
import com.machinezoo.ripple.util.*;

/*
 * Dependency on "owner equals key" instead of on the owner's whole value.
 *
 * When many computeds each compare the same source with their own key (the classic "is this row selected" case),
 * depending on the raw value would invalidate all of them on every change.
 * Each key instead gets its own slot with its own list of targets and the owner invalidates only the slots
 * of the previous and the next value. Slots are graph sources in their own right, so all the edge machinery
 * (re-tracking, cleanup, disposal) applies to them unchanged.
 */
final class SelectorSlot extends ReactiveSource<Boolean> {
	final ReactiveSource<?> owner;
	final Object key;
	SelectorSlot(ReactiveSource<?> owner, Object key) {
		this.owner = owner;
		this.key = key;
		OwnerTrace.of(this).alias("slot").parent(owner).tag("key", key);
	}
	@Override
	public Boolean get() {
		return peek();
	}
	@Override
	public Boolean peek() {
		return Objects.equals(owner.peek(), key);
	}
	void fire(ReactiveRuntime runtime) {
		++version;
		invalidateTargets(runtime);
	}
	@Override
	void unwatched() {
		owner.dropSlot(this);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
