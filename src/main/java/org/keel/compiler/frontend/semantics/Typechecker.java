package org.keel.compiler.frontend.semantics;

import org.keel.compiler.frontend.module.ImportException;
import org.keel.compiler.frontend.parser.ast.ModuleAst;

/**
 * Typechecks a parsed module. Supplied by the caller of
 * {@link org.keel.compiler.frontend.module.ModuleImporter#doImport}.
 *
 * <p>A typechecker may import the module's own dependencies through the same importer;
 * failures of those nested imports propagate unchanged.</p>
 */
@FunctionalInterface
public interface Typechecker {

    /**
     * @param module The parsed module.
     * @return The module's type information.
     * @throws org.keel.compiler.frontend.module.TypecheckException If the module is ill-typed.
     * @throws ImportException If a nested import fails.
     */
    TypeInfo typecheck(ModuleAst module) throws ImportException;
}
