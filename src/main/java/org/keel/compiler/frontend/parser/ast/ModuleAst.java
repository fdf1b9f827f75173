package org.keel.compiler.frontend.parser.ast;

import java.nio.file.Path;

/**
 * Root of the syntax tree of one parsed module.
 */
public interface ModuleAst {

    /**
     * The fully-qualified name the module was parsed under.
     */
    String moduleName();

    /**
     * The file the module was parsed from.
     */
    Path sourcePath();
}
