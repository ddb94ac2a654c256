/**
 * DropWatch source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.dropwatch.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.dropwatch.cli.DropWatchCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.dropwatch.runtime.TickScheduler} runs one supervisory cycle per invocation.</li>
 *   <li>{@code io.dropwatch.recovery.RecoveryEngine} holds the recovery rule table.</li>
 *   <li>{@code io.dropwatch.storage.BuildStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.dropwatch;
