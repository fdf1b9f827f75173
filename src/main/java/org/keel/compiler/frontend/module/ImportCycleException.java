package org.keel.compiler.frontend.module;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a module is requested again while its own import is still in progress.
 *
 * @see ImportCache#importChain(ModuleReference)
 */
public class ImportCycleException extends ImportException {

    private final List<ModuleReference> cycle;

    public ImportCycleException(List<ModuleReference> cycle) {
        super("Import cycle detected: "
                + cycle.stream().map(ModuleReference::toString).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * The cycle, starting and ending with the same module.
     */
    public List<ModuleReference> cycle() {
        return cycle;
    }
}
