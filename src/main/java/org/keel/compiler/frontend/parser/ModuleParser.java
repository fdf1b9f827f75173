package org.keel.compiler.frontend.parser;

import org.keel.compiler.frontend.module.ModuleParseException;
import org.keel.compiler.frontend.parser.ast.ModuleAst;

import java.nio.file.Path;

/**
 * Turns the text of one module source file into its syntax tree.
 */
@FunctionalInterface
public interface ModuleParser {

    /**
     * @param moduleName The fully-qualified module name, used as the module's identity.
     * @param sourcePath The file the text was read from, for diagnostics.
     * @param sourceText The complete source text.
     * @return The parsed module.
     * @throws ModuleParseException If the text is not a valid module.
     */
    ModuleAst parse(String moduleName, Path sourcePath, String sourceText) throws ModuleParseException;
}
