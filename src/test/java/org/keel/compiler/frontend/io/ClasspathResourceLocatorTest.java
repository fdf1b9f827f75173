package org.keel.compiler.frontend.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ClasspathResourceLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void locatesResourceInClassesDirectory() throws Exception {
        Optional<Path> located = new ClasspathResourceLocator().locate("bundled/pkg/fixture.x");

        assertThat(located).isPresent();
        assertThat(Files.readString(located.get())).contains("Fixture");
    }

    @Test
    void bundledStandardLibraryIsOnTheClasspath() {
        ClasspathResourceLocator locator = new ClasspathResourceLocator();

        assertThat(locator.locate("keel/stdlib/std.x")).isPresent();
        assertThat(locator.locate("keel/stdlib/float32.x")).isPresent();
        assertThat(locator.locate("keel/stdlib/bfloat16.x")).isPresent();
    }

    @Test
    void missingResourceIsEmpty() {
        assertThat(new ClasspathResourceLocator().locate("bundled/pkg/absent.x")).isEmpty();
    }

    @Test
    void locatesResourceInsideJar() throws Exception {
        Path jar = tempDir.resolve("lib.jar");
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            out.putNextEntry(new JarEntry("vendor/lib.x"));
            out.write("type Vendored = u4\n".getBytes());
            out.closeEntry();
        }

        try (URLClassLoader loader = new URLClassLoader(new URL[]{jar.toUri().toURL()}, null)) {
            Optional<Path> located = new ClasspathResourceLocator(loader).locate("vendor/lib.x");

            assertThat(located).isPresent();
            assertThat(new LocalSourceFileSystem().exists(located.get())).isTrue();
            assertThat(new LocalSourceFileSystem().readAll(located.get())).isEqualTo("type Vendored = u4\n");
        }
    }
}
