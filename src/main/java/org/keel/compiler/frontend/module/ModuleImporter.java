package org.keel.compiler.frontend.module;

import org.keel.compiler.frontend.io.SourceFileSystem;
import org.keel.compiler.frontend.parser.ModuleParser;
import org.keel.compiler.frontend.parser.ast.ModuleAst;
import org.keel.compiler.frontend.semantics.Typechecker;
import org.keel.compiler.frontend.semantics.TypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for importing a module: cache lookup, path resolution, reading, parsing
 * and typechecking, then publication into the {@link ImportCache}.
 *
 * <p>The typechecker may call back into {@link #doImport} for the module's own imports.
 * Such nested imports share the cache, so diamond-shaped imports are processed once and
 * a cyclic import fails with {@link ImportCycleException} instead of recursing forever.</p>
 */
public final class ModuleImporter {

    private static final Logger log = LoggerFactory.getLogger(ModuleImporter.class);

    private final ModulePathResolver resolver;
    private final SourceFileSystem fileSystem;
    private final ModuleParser parser;

    public ModuleImporter(ModulePathResolver resolver, SourceFileSystem fileSystem, ModuleParser parser) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * Imports a module, or returns the cached result of an earlier import.
     *
     * @param typechecker           Typechecks the parsed module; may import further modules.
     * @param reference             The module to import.
     * @param additionalSearchPaths Search roots tried after the working directory and bundled resources.
     * @param cache                 The session's import cache.
     * @return The cached module info; identical for every import of the same reference.
     * @throws ModuleNotFoundException If no source file exists for the reference.
     * @throws ModuleReadException     If the resolved file cannot be read.
     * @throws ModuleParseException    If the source is malformed.
     * @throws ImportCycleException    If the reference is already being imported further up the stack.
     * @throws ImportException         Whatever the typechecker raises, including failures of nested imports.
     */
    public ModuleInfo doImport(Typechecker typechecker,
                               ModuleReference reference,
                               List<Path> additionalSearchPaths,
                               ImportCache cache) throws ImportException {
        Objects.requireNonNull(cache, "cache");
        if (cache.contains(reference)) {
            return cache.get(reference);
        }
        if (!cache.beginImport(reference)) {
            throw new ImportCycleException(cache.importChain(reference));
        }
        try {
            log.debug("DoImport (uncached) subject: {}", reference);
            Path foundPath = resolver.resolve(reference, additionalSearchPaths);
            String contents = read(foundPath);

            String fullyQualifiedName = reference.fullyQualifiedName();
            log.debug("Parsing and typechecking {}: start", fullyQualifiedName);
            ModuleAst module = parser.parse(fullyQualifiedName, foundPath, contents);
            TypeInfo typeInfo = typechecker.typecheck(module);
            log.debug("Parsing and typechecking {}: done", fullyQualifiedName);

            return cache.put(reference, new ModuleInfo(module, typeInfo));
        } finally {
            cache.endImport(reference);
        }
    }

    private String read(Path path) throws ModuleReadException {
        try {
            return fileSystem.readAll(path);
        } catch (IOException e) {
            throw new ModuleReadException(path, e);
        }
    }
}
