// Part of Ripple
/**
 * Diagnostic utilities shared by reactive objects.
 */
package com.machinezoo.ripple.util;
