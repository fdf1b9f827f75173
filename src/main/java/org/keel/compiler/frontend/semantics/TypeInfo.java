package org.keel.compiler.frontend.semantics;

/**
 * Type information produced by a {@link Typechecker} for one module.
 * Implementations are immutable once returned.
 */
public interface TypeInfo {
}
