/**
 * This package defines the lowered intermediate representation (IR) the passes of tirpass operate on.
 * <p>
 * A {@link io.github.eutro.tirpass.core.ir.LoweredFunc lowered function} has a body, which is a tree of
 * {@link io.github.eutro.tirpass.core.ir.Stmt statements} and {@link io.github.eutro.tirpass.core.ir.Expr expressions}.
 * The kinds of node are fixed, and are enumerated by {@link io.github.eutro.tirpass.core.ir.StmtVisitor}
 * and {@link io.github.eutro.tirpass.core.ir.ExprVisitor}.
 * <p>
 * Trees are persistent. A pass never modifies its input; where a subtree is left unchanged,
 * the very same object appears in the output, so {@code ==} is a cheap "nothing happened" check.
 * See {@link io.github.eutro.tirpass.core.util.StmtExprMutator}.
 * <p>
 * {@link io.github.eutro.tirpass.core.ir.Var Variables} are compared by identity. The passes that need it
 * expect their input to be in single-definition form: each variable is defined by at most one
 * let, loop, allocation or thread binding, before any of its uses. This invariant can be assumed
 * to be upheld, unless it is explicitly stated otherwise.
 */
package io.github.eutro.tirpass.core.ir;
