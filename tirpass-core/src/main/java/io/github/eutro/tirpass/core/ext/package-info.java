/**
 * The ext API associates arbitrary data with instances of
 * {@link io.github.eutro.tirpass.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * FunctionRef sqrt = new FunctionRef("sqrt", 1);
 * sqrt.attachExt(CommonExts.IS_PURE, true);
 *
 * sqrt.getExt(CommonExts.IS_PURE).orElse(false); // => true
 * }</pre>
 * <p>
 * The IR trees themselves are persistent, so exts only live on the identity-carrying
 * objects around them: {@link io.github.eutro.tirpass.core.ir.FunctionRef function references}
 * and {@link io.github.eutro.tirpass.core.ir.LoweredFunc lowered functions}.
 */
package io.github.eutro.tirpass.core.ext;
