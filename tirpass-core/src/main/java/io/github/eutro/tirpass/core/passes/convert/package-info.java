/**
 * Passes which convert between representations: functions into other functions, or
 * Java bytecode into IR.
 */
package io.github.eutro.tirpass.core.passes.convert;
