package org.keel.compiler.frontend.module;

/**
 * Base class of every failure an import can surface to its caller.
 * <p>
 * Each subclass identifies the stage that failed (resolution, reading, parsing,
 * typechecking, cycle detection). Failures are never cached: a later import of the
 * same module starts again from scratch.
 */
public class ImportException extends Exception {

    /**
     * @param message Description of the import failure
     */
    public ImportException(String message) {
        super(message);
    }

    /**
     * @param message Description of the import failure
     * @param cause The underlying exception that caused the failure
     */
    public ImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
