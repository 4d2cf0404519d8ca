/**
 * ServerPulse source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.serverpulse.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.serverpulse.cli.ServerPulseCommand} maps commands to runtime operations.</li>
 *   <li>{@code io.serverpulse.runtime.Scheduler} drives the metric, ingestion and cleanup jobs.</li>
 *   <li>{@code io.serverpulse.reconcile.StateReconciler} turns log lines into player state.</li>
 *   <li>{@code io.serverpulse.storage.Database} owns the SQLite schema read by the dashboard.</li>
 * </ul>
 */
package io.serverpulse;
