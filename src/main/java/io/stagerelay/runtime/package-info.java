/**
 * Pipeline execution package.
 *
 * <p>{@link io.stagerelay.runtime.PipelineRunner} owns a run from graph build to
 * terminal output; {@link io.stagerelay.runtime.StageExecutor} performs single
 * bounded capability calls and {@link io.stagerelay.runtime.Run} holds per-run state.
 */
package io.stagerelay.runtime;
