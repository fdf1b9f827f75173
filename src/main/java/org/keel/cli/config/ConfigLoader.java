package org.keel.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.keel.compiler.frontend.module.ImportSettings;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Loads and validates the CLI configuration.
 * <p>
 * The user file is the one given with {@code --config}, otherwise {@code config/keel.conf} in the
 * working directory if present. Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dkeel.imports.source-extension=kl})</li>
 *   <li>the user file</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Every failure, whether a missing file, a HOCON syntax error or a key of the wrong type, is
 * reported as one {@link InvalidConfigurationException} that names the file.
 */
public final class ConfigLoader {

    static final Path DEFAULT_CONFIG_FILE = Path.of("config", "keel.conf");
    private static final Set<String> LOGGING_FORMATS = Set.of("PLAIN", "COLOR");

    private ConfigLoader() {
    }

    /**
     * Loads the configuration relative to the process working directory.
     *
     * @param explicitConfigFile File from {@code --config}, or {@code null} for discovery.
     * @return The validated configuration.
     * @throws InvalidConfigurationException If the file is missing or the configuration is invalid.
     */
    public static KeelConfiguration load(final File explicitConfigFile) {
        return load(explicitConfigFile, Path.of("").toAbsolutePath());
    }

    static KeelConfiguration load(final File explicitConfigFile, final Path workingDirectory) {
        final Optional<Path> source = locate(explicitConfigFile, workingDirectory);
        final String origin = source.map(Path::toString).orElse("reference.conf");

        final Config config;
        try {
            config = compose(source);
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Failed to parse configuration " + origin + ": " + e.getMessage(), e);
        }

        try {
            final ImportSettings imports = ImportSettings.fromConfig(config);
            validateLogging(config);
            return new KeelConfiguration(config, imports, source);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new InvalidConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    private static Optional<Path> locate(final File explicitConfigFile, final Path workingDirectory) {
        if (explicitConfigFile != null) {
            final Path explicit = workingDirectory.resolve(explicitConfigFile.toPath()).normalize();
            if (!Files.isRegularFile(explicit)) {
                throw new InvalidConfigurationException("Configuration file not found: " + explicit);
            }
            return Optional.of(explicit);
        }
        final Path discovered = workingDirectory.resolve(DEFAULT_CONFIG_FILE);
        return Files.isRegularFile(discovered) ? Optional.of(discovered) : Optional.empty();
    }

    static Config compose(final Optional<Path> source) {
        Config layered = ConfigFactory.systemProperties();
        if (source.isPresent()) {
            layered = layered.withFallback(ConfigFactory.parseFile(source.get().toFile()));
        }
        return layered.withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve();
    }

    private static void validateLogging(final Config config) {
        final String format = config.getString("logging.format");
        if (!LOGGING_FORMATS.contains(format.toUpperCase())) {
            throw new ConfigException.BadValue(config.origin(), "logging.format",
                    "expected one of " + LOGGING_FORMATS + " but was '" + format + "'");
        }
        config.getObject("logging.levels");
    }
}
