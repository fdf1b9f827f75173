package org.keel.compiler.frontend.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SourceFileSystem} over {@code java.nio.file}. Works for any provider, including
 * paths inside a jar returned by {@link ClasspathResourceLocator}.
 */
public final class LocalSourceFileSystem implements SourceFileSystem {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final Path workingDirectory;

    /**
     * Uses the process working directory.
     */
    public LocalSourceFileSystem() {
        this(Path.of(""));
    }

    public LocalSourceFileSystem(Path workingDirectory) {
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    @Override
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public String readAll(Path path) throws IOException {
        return normalizeLineEndings(stripByteOrderMark(Files.readString(path)));
    }

    @Override
    public Path currentWorkingDirectory() {
        return workingDirectory;
    }

    static String stripByteOrderMark(String text) {
        return text.startsWith(BYTE_ORDER_MARK) ? text.substring(1) : text;
    }

    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
