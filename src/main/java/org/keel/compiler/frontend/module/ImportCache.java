package org.keel.compiler.frontend.module;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Memoizes imported modules for one compilation session so that each
 * {@link ModuleReference} is parsed and typechecked at most once.
 *
 * <p>Besides completed entries the cache tracks which references are currently
 * being imported. A reference that is requested again while still in progress
 * is an import cycle.</p>
 *
 * <p>Not thread-safe. A session that imports from several threads must serialize
 * access to both the cache and {@link ModuleImporter#doImport}.</p>
 */
public final class ImportCache {

    private final Map<ModuleReference, ModuleInfo> entries = new LinkedHashMap<>();
    private final Set<ModuleReference> inProgress = new LinkedHashSet<>();

    public boolean contains(ModuleReference reference) {
        return entries.containsKey(reference);
    }

    /**
     * Returns the cached module.
     *
     * @throws IllegalStateException If the reference is not cached. Callers check {@link #contains} first.
     */
    public ModuleInfo get(ModuleReference reference) {
        ModuleInfo info = entries.get(reference);
        if (info == null) {
            throw new IllegalStateException("Module is not in the import cache: " + reference);
        }
        return info;
    }

    /**
     * Stores a freshly imported module and returns the stored instance.
     *
     * @throws IllegalStateException If an entry already exists for the reference. The existing entry is kept.
     */
    public ModuleInfo put(ModuleReference reference, ModuleInfo info) {
        ModuleInfo existing = entries.putIfAbsent(reference, info);
        if (existing != null) {
            throw new IllegalStateException("Module was already imported: " + reference);
        }
        return info;
    }

    /**
     * Marks a reference as being imported.
     *
     * @return {@code false} if the reference is already in progress, i.e. the import is cyclic.
     */
    public boolean beginImport(ModuleReference reference) {
        return inProgress.add(reference);
    }

    public void endImport(ModuleReference reference) {
        inProgress.remove(reference);
    }

    public boolean isInProgress(ModuleReference reference) {
        return inProgress.contains(reference);
    }

    /**
     * Returns the chain of in-progress imports starting at {@code reference} and closed by it again,
     * e.g. {@code [a, b, a]} when {@code a} imports {@code b} which imports {@code a}.
     */
    public List<ModuleReference> importChain(ModuleReference reference) {
        List<ModuleReference> chain = new ArrayList<>();
        boolean started = false;
        for (ModuleReference pending : inProgress) {
            if (pending.equals(reference)) {
                started = true;
            }
            if (started) {
                chain.add(pending);
            }
        }
        chain.add(reference);
        return chain;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns the cached references in the order their imports completed.
     */
    public Set<ModuleReference> references() {
        return Collections.unmodifiableSet(entries.keySet());
    }
}
