// Part of Ripple
package com.machinezoo.ripple;

/*
 * One dependency of one computed on one source.
 *
 * Every edge is a member of two doubly-linked lists at the same time:
 * the target's list of sources (prevSource/nextSource) and the source's list of targets (prevTarget/nextTarget).
 * Both memberships are always created and removed together, which gives us O(1) insertion and removal
 * without any hash lookups. Lists are headed by ReactiveComputed.sources and ReactiveSource.targets.
 *
 * Edges are plain mutable records. All manipulation is done by ReactiveSource and ReactiveComputed.
 */
final class ReactiveEdge {
	/*
	 * Version marker meaning "not seen in the recompute that is in progress".
	 * Real versions are never negative.
	 */
	static final long UNUSED = -1;
	final ReactiveSource<?> source;
	final ReactiveComputed<?> target;
	long version;
	ReactiveEdge prevSource;
	ReactiveEdge nextSource;
	ReactiveEdge prevTarget;
	ReactiveEdge nextTarget;
	/*
	 * Source's cached edge before this edge replaced it during recompute. Restored in cleanup.
	 */
	ReactiveEdge rollback;
	ReactiveEdge(ReactiveSource<?> source, ReactiveComputed<?> target) {
		this.source = source;
		this.target = target;
		version = source.version;
	}
	/*
	 * Links the edge at the head of both lists.
	 */
	void link() {
		nextSource = target.sources;
		if (nextSource != null)
			nextSource.prevSource = this;
		target.sources = this;
		nextTarget = source.targets;
		if (nextTarget != null)
			nextTarget.prevTarget = this;
		source.targets = this;
	}
	/*
	 * Removes the edge from the source's list of targets only.
	 * Callers that walk the target's source list fix that list themselves.
	 */
	void unlinkFromSource() {
		if (prevTarget != null)
			prevTarget.nextTarget = nextTarget;
		else
			source.targets = nextTarget;
		if (nextTarget != null)
			nextTarget.prevTarget = prevTarget;
		prevTarget = null;
		nextTarget = null;
		if (source.targets == null)
			source.unwatched();
	}
	void unlinkFromTarget() {
		if (prevSource != null)
			prevSource.nextSource = nextSource;
		else
			target.sources = nextSource;
		if (nextSource != null)
			nextSource.prevSource = prevSource;
		prevSource = null;
		nextSource = null;
	}
	/*
	 * Moves the edge to the head of the target's source list, so that cleanup sees live edges first.
	 */
	void promote() {
		if (prevSource == null)
			return;
		prevSource.nextSource = nextSource;
		if (nextSource != null)
			nextSource.prevSource = prevSource;
		prevSource = null;
		nextSource = target.sources;
		nextSource.prevSource = this;
		target.sources = this;
	}
	@Override
	public String toString() {
		return source + " -> " + target;
	}
}
