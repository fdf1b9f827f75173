package org.keel.compiler.frontend.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Filesystem access used by module resolution and loading.
 * Injected so that tests can pin the working directory or fake the filesystem.
 */
public interface SourceFileSystem {

    /**
     * Returns true if the path names an existing regular file.
     */
    boolean exists(Path path);

    /**
     * Reads the whole file as text, with line endings normalized to {@code \n}.
     *
     * @throws IOException If the file cannot be read.
     */
    String readAll(Path path) throws IOException;

    /**
     * The absolute directory that relative candidates are resolved against.
     */
    Path currentWorkingDirectory();
}
