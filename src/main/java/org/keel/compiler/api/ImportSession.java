package org.keel.compiler.api;

import org.keel.compiler.frontend.io.BundledResourceLocator;
import org.keel.compiler.frontend.io.ClasspathResourceLocator;
import org.keel.compiler.frontend.io.DirectoryResourceLocator;
import org.keel.compiler.frontend.io.SourceFileSystem;
import org.keel.compiler.frontend.module.ImportCache;
import org.keel.compiler.frontend.module.ImportException;
import org.keel.compiler.frontend.module.ImportSettings;
import org.keel.compiler.frontend.module.ModuleImporter;
import org.keel.compiler.frontend.module.ModuleInfo;
import org.keel.compiler.frontend.module.ModuleNotFoundException;
import org.keel.compiler.frontend.module.ModulePathResolver;
import org.keel.compiler.frontend.module.ModuleReference;
import org.keel.compiler.frontend.parser.directive.DirectiveScanner;
import org.keel.compiler.frontend.semantics.ImportingTypechecker;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One compilation session: a single {@link ImportCache} shared by every import, wired to the
 * {@link DirectiveScanner} and {@link ImportingTypechecker}.
 *
 * <p>Search roots passed to {@link #resolve} and {@link #importModule} are tried before the
 * configured {@code keel.imports.search-paths}.</p>
 */
public final class ImportSession {

    private final ImportSettings settings;
    private final ModulePathResolver resolver;
    private final ModuleImporter importer;
    private final ImportCache cache = new ImportCache();

    public ImportSession(ImportSettings settings, SourceFileSystem fileSystem, BundledResourceLocator bundled) {
        this.settings = settings;
        this.resolver = new ModulePathResolver(fileSystem, bundled, settings);
        this.importer = new ModuleImporter(resolver, fileSystem, new DirectiveScanner());
    }

    /**
     * Bundled lookup through the classpath first, then each configured bundled root.
     */
    public static BundledResourceLocator defaultBundledLocator(ImportSettings settings) {
        List<BundledResourceLocator> locators = new ArrayList<>();
        locators.add(new ClasspathResourceLocator());
        for (Path root : settings.bundledRoots()) {
            locators.add(new DirectoryResourceLocator(root));
        }
        return BundledResourceLocator.chain(locators);
    }

    public Path resolve(ModuleReference reference, List<Path> searchPaths) throws ModuleNotFoundException {
        return resolver.resolve(reference, withConfigured(searchPaths));
    }

    public ModuleInfo importModule(ModuleReference reference, List<Path> searchPaths) throws ImportException {
        List<Path> roots = withConfigured(searchPaths);
        ImportingTypechecker typechecker = new ImportingTypechecker(importer, cache, roots);
        return importer.doImport(typechecker, reference, roots, cache);
    }

    public ImportCache cache() {
        return cache;
    }

    private List<Path> withConfigured(List<Path> searchPaths) {
        List<Path> roots = new ArrayList<>(searchPaths);
        roots.addAll(settings.searchPaths());
        return roots;
    }
}
