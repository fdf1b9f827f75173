package org.keel.compiler.frontend.module;

/**
 * Thrown by a {@link org.keel.compiler.frontend.semantics.Typechecker} when a parsed module
 * fails type checking. The diagnostic text is whatever the typechecker produced.
 */
public class TypecheckException extends ImportException {

    private final String moduleName;

    public TypecheckException(String moduleName, String diagnostic) {
        super("Typecheck of module " + moduleName + " failed: " + diagnostic);
        this.moduleName = moduleName;
    }

    public TypecheckException(String moduleName, String diagnostic, Throwable cause) {
        super("Typecheck of module " + moduleName + " failed: " + diagnostic, cause);
        this.moduleName = moduleName;
    }

    public String moduleName() {
        return moduleName;
    }
}
