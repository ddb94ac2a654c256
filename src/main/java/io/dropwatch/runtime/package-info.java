/**
 * Supervisory cycle.
 *
 * <p>{@link io.dropwatch.runtime.TickScheduler} gates on the control file, takes each active build's tick
 * lease and runs {@link io.dropwatch.runtime.OrchestrationPass} followed by recovery.
 * {@link io.dropwatch.runtime.DropWatchRuntime} wires the components for one data root and carries the
 * operator operations used by the CLI.
 */
package io.dropwatch.runtime;
