// Part of Ripple
/*
 * Diagnostic functions supported by all reactive objects:
 * - Null check is performed on method parameters where appropriate.
 * - Exceptions from suppliers propagate to the reader. Exceptions from callbacks cannot propagate and they are logged.
 *   There's no other logging by default except debug messages about deferred failures.
 * - Metrics are exposed only where events originate, i.e. in computeds (recomputes, failures) and batches (flushes).
 * - Opentracing spans are created only when a batch actually runs callbacks.
 * - Object's OwnerTrace has at least an alias. Identifying parameters of the object are added as tags.
 * - Child reactive objects have their OwnerTrace parent set.
 * - Method toString() is defined. It uses OwnerTrace.toString(). It never creates reactive dependencies.
 */
/**
 * Fine-grained reactive graph: signals, computeds, batches, and selector slots.
 */
package com.machinezoo.ripple;
