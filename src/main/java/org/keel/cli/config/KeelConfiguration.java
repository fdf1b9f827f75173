package org.keel.cli.config;

import com.typesafe.config.Config;
import org.keel.compiler.frontend.module.ImportSettings;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The configuration the CLI runs with, already checked by {@link ConfigLoader}.
 *
 * @param config  The fully resolved HOCON tree, used for the {@code logging} block.
 * @param imports The validated {@code keel.imports} block.
 * @param source  The user file the configuration was read from; empty when only defaults apply.
 */
public record KeelConfiguration(Config config, ImportSettings imports, Optional<Path> source) {

    public String describeSource() {
        return source.map(Path::toString).orElse("built-in defaults");
    }
}
