package org.keel.compiler.frontend.module;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no source file for a module exists anywhere on the search chain.
 * Carries every path that was checked, in the order it was checked, and the
 * working directory the relative candidates were resolved against.
 */
public class ModuleNotFoundException extends ImportException {

    private final ModuleReference reference;
    private final List<Path> attemptedPaths;
    private final Path workingDirectory;

    public ModuleNotFoundException(ModuleReference reference, List<Path> attemptedPaths, Path workingDirectory) {
        super("Could not find source file for import " + reference + "; attempted: [ "
                + attemptedPaths.stream().map(Path::toString).collect(Collectors.joining(" :: "))
                + " ]; working directory: " + workingDirectory);
        this.reference = reference;
        this.attemptedPaths = List.copyOf(attemptedPaths);
        this.workingDirectory = workingDirectory;
    }

    public ModuleReference reference() {
        return reference;
    }

    public List<Path> attemptedPaths() {
        return attemptedPaths;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }
}
