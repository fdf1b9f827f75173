package org.keel.compiler.frontend.io;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Locates files that ship with the compiler itself, independent of the working directory.
 */
@FunctionalInterface
public interface BundledResourceLocator {

    /**
     * @param relativePath A {@code /}-separated path such as {@code keel/stdlib/std.x}.
     * @return The bundled file's path, or empty if nothing is bundled under that name.
     */
    Optional<Path> locate(String relativePath);

    /**
     * A locator that never finds anything.
     */
    static BundledResourceLocator none() {
        return relativePath -> Optional.empty();
    }

    /**
     * Asks each locator in turn; the first hit wins.
     */
    static BundledResourceLocator chain(List<BundledResourceLocator> locators) {
        List<BundledResourceLocator> ordered = List.copyOf(locators);
        return relativePath -> {
            for (BundledResourceLocator locator : ordered) {
                Optional<Path> located = locator.locate(relativePath);
                if (located.isPresent()) {
                    return located;
                }
            }
            return Optional.empty();
        };
    }
}
