package org.keel.compiler.frontend.semantics;

import org.keel.compiler.frontend.module.ImportCache;
import org.keel.compiler.frontend.module.ImportException;
import org.keel.compiler.frontend.module.ModuleImporter;
import org.keel.compiler.frontend.module.ModuleInfo;
import org.keel.compiler.frontend.module.TypecheckException;
import org.keel.compiler.frontend.parser.ast.ModuleAst;
import org.keel.compiler.frontend.parser.directive.ScannedModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typechecks {@link ScannedModule}s by importing every declared dependency through the
 * same {@link ModuleImporter} and {@link ImportCache}, and binding each alias to the
 * imported module.
 *
 * <p>Rejects a module that binds the same alias twice. Failures of nested imports
 * propagate unchanged.</p>
 */
public final class ImportingTypechecker implements Typechecker {

    private static final Logger log = LoggerFactory.getLogger(ImportingTypechecker.class);

    private final ModuleImporter importer;
    private final ImportCache cache;
    private final List<Path> searchPaths;

    public ImportingTypechecker(ModuleImporter importer, ImportCache cache, List<Path> searchPaths) {
        this.importer = importer;
        this.cache = cache;
        this.searchPaths = List.copyOf(searchPaths);
    }

    @Override
    public ImportBindings typecheck(ModuleAst module) throws ImportException {
        if (!(module instanceof ScannedModule scanned)) {
            throw new TypecheckException(module.moduleName(),
                    "unsupported syntax tree " + module.getClass().getName());
        }

        Map<String, ModuleInfo> bindings = new LinkedHashMap<>();
        for (ScannedModule.ImportDecl decl : scanned.imports()) {
            if (bindings.containsKey(decl.alias())) {
                throw new TypecheckException(scanned.moduleName(),
                        scanned.sourcePath() + ":" + decl.line() + ": import alias '" + decl.alias()
                                + "' is already bound");
            }
            log.debug("{} imports {} as {}", scanned.moduleName(), decl.target(), decl.alias());
            bindings.put(decl.alias(), importer.doImport(this, decl.target(), searchPaths, cache));
        }
        return new ImportBindings(bindings);
    }
}
