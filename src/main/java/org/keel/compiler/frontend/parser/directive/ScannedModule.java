package org.keel.compiler.frontend.parser.directive;

import org.keel.compiler.frontend.module.ModuleReference;
import org.keel.compiler.frontend.parser.ast.ModuleAst;

import java.nio.file.Path;
import java.util.List;

/**
 * A module as seen by the {@link DirectiveScanner}: its import declarations and
 * the remaining, uninterpreted body lines.
 *
 * @param moduleName The fully-qualified module name.
 * @param sourcePath The file the module was read from.
 * @param imports    Import declarations, in source order.
 * @param body       Non-empty, non-import lines with comments stripped.
 */
public record ScannedModule(
        String moduleName,
        Path sourcePath,
        List<ImportDecl> imports,
        List<String> body
) implements ModuleAst {

    public ScannedModule {
        imports = List.copyOf(imports);
        body = List.copyOf(body);
    }

    /**
     * An {@code import} declaration.
     *
     * @param target The imported module.
     * @param alias  The local name; the last segment of the target unless given with {@code as}.
     * @param line   The 1-based source line.
     */
    public record ImportDecl(ModuleReference target, String alias, int line) {}
}
