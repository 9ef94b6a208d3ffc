/**
 * Worker-side coordination.
 *
 * <p>{@link io.dicehall.runtime.SessionCoordinator} reacts to bus events,
 * {@link io.dicehall.runtime.TurnTimeoutManager} enforces turn deadlines,
 * {@link io.dicehall.runtime.Finalizer} settles sessions exactly once and
 * {@link io.dicehall.runtime.FallbackPoller} recovers from lost notifications.
 */
package io.dicehall.runtime;
