package org.keel.compiler.frontend.module;

import java.nio.file.Path;

/**
 * Thrown by a {@link org.keel.compiler.frontend.parser.ModuleParser} when module source is not
 * syntactically valid. Line and column are 1-based.
 */
public class ModuleParseException extends ImportException {

    private final Path sourcePath;
    private final int line;
    private final int column;

    public ModuleParseException(String message, Path sourcePath, int line, int column) {
        super(sourcePath + ":" + line + ":" + column + ": " + message);
        this.sourcePath = sourcePath;
        this.line = line;
        this.column = column;
    }

    public Path sourcePath() {
        return sourcePath;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
