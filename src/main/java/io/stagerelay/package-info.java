/**
 * StageRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.stagerelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.stagerelay.cli.StageRelayCommand} maps commands to runner and replay APIs.</li>
 *   <li>{@code io.stagerelay.runtime.PipelineRunner} schedules stages, retries, fallbacks and recording.</li>
 *   <li>{@code io.stagerelay.storage.RunStore} holds the append-only run log.</li>
 * </ul>
 */
package io.stagerelay;
