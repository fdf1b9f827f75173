package org.keel.compiler.frontend.module;

import java.util.Arrays;
import java.util.List;

/**
 * Identifies an importable module by an ordered sequence of name segments,
 * e.g. {@code ["std"]} or {@code ["foo", "bar", "baz"]}.
 * Used as the key of the {@link ImportCache}.
 *
 * @param segments The non-empty, ordered name segments. Each segment is a non-blank string that
 *                 contains no {@code .}, {@code /} or {@code \}, so it always names a single path element.
 */
public record ModuleReference(List<String> segments) {

    public ModuleReference {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("A module reference needs at least one segment.");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new IllegalArgumentException("Module reference segments must be non-empty: " + segments);
            }
            if (segment.indexOf('.') >= 0 || segment.indexOf('/') >= 0 || segment.indexOf('\\') >= 0) {
                throw new IllegalArgumentException(
                        "Module reference segment '" + segment + "' must not contain '.', '/' or '\\'");
            }
        }
        segments = List.copyOf(segments);
    }

    public static ModuleReference of(String... segments) {
        return new ModuleReference(Arrays.asList(segments));
    }

    /**
     * Parses a dotted module name such as {@code foo.bar.baz}.
     *
     * @param dottedName The fully-qualified module name.
     * @return The corresponding reference.
     * @throws IllegalArgumentException If the name is empty or has an empty or path-like segment.
     */
    public static ModuleReference parse(String dottedName) {
        if (dottedName == null || dottedName.isBlank()) {
            throw new IllegalArgumentException("Module name must not be empty.");
        }
        return new ModuleReference(Arrays.asList(dottedName.trim().split("\\.", -1)));
    }

    public int size() {
        return segments.size();
    }

    public String first() {
        return segments.get(0);
    }

    /**
     * Returns every segment except the first. Empty for single-segment references.
     */
    public List<String> withoutFirst() {
        return segments.subList(1, segments.size());
    }

    /**
     * Returns the segments joined by {@code .}, the module identity handed to the parser.
     */
    public String fullyQualifiedName() {
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return fullyQualifiedName();
    }
}
