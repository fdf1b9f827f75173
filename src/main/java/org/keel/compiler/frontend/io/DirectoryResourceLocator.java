package org.keel.compiler.frontend.io;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Looks up bundled files under an installation directory, e.g. {@code APP_HOME/lib}.
 */
public final class DirectoryResourceLocator implements BundledResourceLocator {

    private final Path root;

    public DirectoryResourceLocator(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Optional<Path> locate(String relativePath) {
        Path candidate = root.resolve(relativePath).normalize();
        if (!candidate.startsWith(root) || !Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
