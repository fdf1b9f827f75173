package org.keel.compiler.frontend.module;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed view of the {@code keel.imports} configuration block.
 *
 * @param sourceExtension File extension of module sources, without the leading dot.
 * @param stdlibRoot      Relative directory holding the reserved standard-library modules.
 * @param stdlibModules   Single-segment module names that resolve under {@code stdlibRoot}.
 * @param searchPaths     Search roots appended after any roots given by the caller.
 * @param bundledRoots    Installation directories consulted by the bundled-resource lookup.
 */
public record ImportSettings(
        String sourceExtension,
        String stdlibRoot,
        Set<String> stdlibModules,
        List<Path> searchPaths,
        List<Path> bundledRoots
) {

    public static final String CONFIG_PATH = "keel.imports";

    public ImportSettings {
        if (sourceExtension == null || sourceExtension.isBlank()) {
            throw new IllegalArgumentException("Source extension must not be empty.");
        }
        sourceExtension = sourceExtension.startsWith(".") ? sourceExtension.substring(1) : sourceExtension;
        stdlibModules = Set.copyOf(stdlibModules);
        searchPaths = List.copyOf(searchPaths);
        bundledRoots = List.copyOf(bundledRoots);
    }

    /**
     * Reads the settings from the {@code keel.imports} block of a resolved configuration.
     *
     * @param config The application configuration.
     * @return The import settings.
     * @throws com.typesafe.config.ConfigException If a key is missing or has the wrong type.
     */
    public static ImportSettings fromConfig(Config config) {
        Config imports = config.getConfig(CONFIG_PATH);
        return new ImportSettings(
                imports.getString("source-extension"),
                imports.getString("stdlib.root"),
                new LinkedHashSet<>(imports.getStringList("stdlib.modules")),
                toPaths(imports.getStringList("search-paths")),
                toPaths(imports.getStringList("bundled-roots")));
    }

    /**
     * Settings from {@code reference.conf} alone.
     */
    public static ImportSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    public ImportSettings withSearchPaths(List<Path> paths) {
        return new ImportSettings(sourceExtension, stdlibRoot, stdlibModules, paths, bundledRoots);
    }

    public boolean isStdlibModule(ModuleReference reference) {
        return reference.size() == 1 && stdlibModules.contains(reference.first());
    }

    private static List<Path> toPaths(List<String> values) {
        return values.stream().map(Path::of).collect(Collectors.toList());
    }
}
