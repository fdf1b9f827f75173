package org.keel.compiler.frontend.module;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a resolved source file cannot be read, e.g. because it vanished
 * between resolution and reading.
 */
public class ModuleReadException extends ImportException {

    private final Path path;

    public ModuleReadException(Path path, IOException cause) {
        super("Could not read module source " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
