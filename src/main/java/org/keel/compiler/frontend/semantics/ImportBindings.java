package org.keel.compiler.frontend.semantics;

import org.keel.compiler.frontend.module.ModuleInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Type information produced by {@link ImportingTypechecker}: the module each
 * import alias is bound to. The bound {@link ModuleInfo}s are the shared cache entries.
 */
public final class ImportBindings implements TypeInfo {

    private final Map<String, ModuleInfo> bindings;

    public ImportBindings(Map<String, ModuleInfo> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Optional<ModuleInfo> lookup(String alias) {
        return Optional.ofNullable(bindings.get(alias));
    }

    /**
     * Alias to module, in declaration order.
     */
    public Map<String, ModuleInfo> bindings() {
        return bindings;
    }
}
