/**
 * Events fired while lowering functions.
 * <p>
 * Listeners registered on an {@link io.github.eutro.tirpass.api.events.EventSupplier} can inspect,
 * replace or drop the functions at each stage, or run extra passes over them.
 */
package io.github.eutro.tirpass.api.events;
