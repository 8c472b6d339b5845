/**
 * A configurable driver over the core passes.
 * <p>
 * The main entrypoint is the {@link io.github.eutro.tirpass.api.LoweringCompiler},
 * to which mixed host and device functions are submitted for lowering.
 * <p>
 * Lowering can be observed and configured using the {@link io.github.eutro.tirpass.api.events
 * events API}.
 */
package io.github.eutro.tirpass.api;
