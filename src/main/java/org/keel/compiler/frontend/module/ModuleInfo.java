package org.keel.compiler.frontend.module;

import org.keel.compiler.frontend.parser.ast.ModuleAst;
import org.keel.compiler.frontend.semantics.TypeInfo;

import java.util.Objects;

/**
 * The result of importing one module: its parsed tree and the type information
 * produced by typechecking that same tree.
 *
 * <p>Instances are created only by {@link ModuleImporter} and are owned by the
 * {@link ImportCache}; every importer of the module receives the same instance.
 */
public final class ModuleInfo {

    private final ModuleAst module;
    private final TypeInfo typeInfo;

    ModuleInfo(ModuleAst module, TypeInfo typeInfo) {
        this.module = Objects.requireNonNull(module, "module");
        this.typeInfo = Objects.requireNonNull(typeInfo, "typeInfo");
    }

    public ModuleAst module() {
        return module;
    }

    public TypeInfo typeInfo() {
        return typeInfo;
    }

    @Override
    public String toString() {
        return "ModuleInfo[" + module.moduleName() + " @ " + module.sourcePath() + "]";
    }
}
