/**
 * Worker lifecycle.
 *
 * <p>{@link io.serverpulse.runtime.ServerPulseRuntime} wires storage and the periodic jobs for
 * one data root; {@link io.serverpulse.runtime.Scheduler} runs them on a fixed tick until a
 * {@link io.serverpulse.runtime.StopSignal} is raised.
 */
package io.serverpulse.runtime;
