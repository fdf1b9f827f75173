package org.keel.compiler.frontend.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up bundled files on the classpath. Resources in a directory resolve to
 * plain filesystem paths; resources inside a jar resolve to paths of the jar's
 * zip filesystem, which stays open for the life of the JVM.
 */
public final class ClasspathResourceLocator implements BundledResourceLocator {

    private static final Logger log = LoggerFactory.getLogger(ClasspathResourceLocator.class);

    private final ClassLoader classLoader;

    public ClasspathResourceLocator() {
        this(ClasspathResourceLocator.class.getClassLoader());
    }

    public ClasspathResourceLocator(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Optional<Path> locate(String relativePath) {
        URL url = classLoader.getResource(relativePath);
        if (url == null) {
            return Optional.empty();
        }
        try {
            URI uri = url.toURI();
            if ("jar".equals(uri.getScheme())) {
                openJarFileSystem(uri);
            }
            return Optional.of(Path.of(uri));
        } catch (URISyntaxException | IOException | IllegalArgumentException | FileSystemNotFoundException e) {
            log.debug("Bundled resource {} at {} is not addressable as a path: {}", relativePath, url, e.getMessage());
            return Optional.empty();
        }
    }

    private static synchronized void openJarFileSystem(URI uri) throws IOException {
        try {
            FileSystems.getFileSystem(uri);
        } catch (FileSystemNotFoundException e) {
            FileSystems.newFileSystem(uri, Map.of());
        }
    }
}
