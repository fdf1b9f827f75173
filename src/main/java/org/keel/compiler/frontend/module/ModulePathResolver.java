package org.keel.compiler.frontend.module;

import org.keel.compiler.frontend.io.BundledResourceLocator;
import org.keel.compiler.frontend.io.SourceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the source file of a module on the search chain.
 *
 * <p>Two relative candidates are derived from a reference: the <em>primary</em> one
 * ({@code foo/bar/baz.x}) and, for references with at least two segments, the
 * <em>parent-stripped</em> one ({@code bar/baz.x}) for build layouts that drop the
 * leading directory. Reserved standard-library names map to a fixed path under the
 * standard-library root and have no parent-stripped candidate.</p>
 *
 * <p>Candidates are tried in this order, first existing file wins:</p>
 * <ol>
 *   <li>primary, relative to the working directory</li>
 *   <li>primary, through the bundled-resource lookup</li>
 *   <li>parent-stripped, relative to the working directory, then through the bundled lookup</li>
 *   <li>for each additional search root in order: primary, then parent-stripped</li>
 * </ol>
 */
public final class ModulePathResolver {

    private static final Logger log = LoggerFactory.getLogger(ModulePathResolver.class);

    private final SourceFileSystem fileSystem;
    private final BundledResourceLocator bundled;
    private final ImportSettings settings;

    public ModulePathResolver(SourceFileSystem fileSystem, BundledResourceLocator bundled, ImportSettings settings) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.bundled = Objects.requireNonNull(bundled, "bundled");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Resolves a module reference to an existing source file.
     *
     * @param reference             The module to locate.
     * @param additionalSearchPaths Caller-supplied roots, tried after the working directory and bundled resources.
     * @return The first existing candidate path.
     * @throws ModuleNotFoundException If no candidate exists; lists every attempted path.
     */
    public Path resolve(ModuleReference reference, List<Path> additionalSearchPaths) throws ModuleNotFoundException {
        Path primary = primaryCandidate(reference);
        Optional<Path> parentStripped = parentStrippedCandidate(reference);
        Path workingDirectory = fileSystem.currentWorkingDirectory();
        Attempts attempts = new Attempts();

        log.debug("Attempting CWD-relative import path for {}", reference);
        Optional<Path> found = attempts.tryUnder(workingDirectory, primary);
        if (found.isPresent()) return found.get();

        log.debug("Attempting bundled import path via {}", primary);
        found = attempts.tryBundled(primary);
        if (found.isPresent()) return found.get();

        if (parentStripped.isPresent()) {
            log.debug("Attempting CWD-relative parent import path via {}", parentStripped.get());
            found = attempts.tryUnder(workingDirectory, parentStripped.get());
            if (found.isPresent()) return found.get();

            log.debug("Attempting bundled parent import path via {}", parentStripped.get());
            found = attempts.tryBundled(parentStripped.get());
            if (found.isPresent()) return found.get();
        }

        for (Path searchPath : additionalSearchPaths) {
            Path root = workingDirectory.resolve(searchPath);
            log.debug("Attempting search path root: {}", root);
            found = attempts.tryUnder(root, primary);
            if (found.isPresent()) return found.get();
            if (parentStripped.isPresent()) {
                found = attempts.tryUnder(root, parentStripped.get());
                if (found.isPresent()) return found.get();
            }
        }

        throw new ModuleNotFoundException(reference, attempts.paths, workingDirectory);
    }

    Path primaryCandidate(ModuleReference reference) {
        if (settings.isStdlibModule(reference)) {
            return Path.of(settings.stdlibRoot(), withExtension(reference.first()));
        }
        return joinWithExtension(reference.segments());
    }

    Optional<Path> parentStrippedCandidate(ModuleReference reference) {
        if (settings.isStdlibModule(reference) || reference.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(joinWithExtension(reference.withoutFirst()));
    }

    private Path joinWithExtension(List<String> segments) {
        List<String> parts = new ArrayList<>(segments);
        int last = parts.size() - 1;
        parts.set(last, withExtension(parts.get(last)));
        return Path.of(parts.get(0), parts.subList(1, parts.size()).toArray(new String[0]));
    }

    private String withExtension(String name) {
        return name + "." + settings.sourceExtension();
    }

    /**
     * Records every path that was checked so a failure can report all of them.
     */
    private final class Attempts {
        private final List<Path> paths = new ArrayList<>();

        Optional<Path> tryUnder(Path base, Path candidate) {
            return check(base.resolve(candidate).normalize());
        }

        Optional<Path> tryBundled(Path candidate) {
            Optional<Path> located = bundled.locate(candidate.toString().replace('\\', '/'));
            if (located.isEmpty()) {
                return Optional.empty();
            }
            return check(located.get());
        }

        private Optional<Path> check(Path fullPath) {
            log.debug("Trying path: {}", fullPath);
            paths.add(fullPath);
            if (fileSystem.exists(fullPath)) {
                log.debug("Found existing file for import path: {}", fullPath);
                return Optional.of(fullPath);
            }
            return Optional.empty();
        }
    }
}
