package org.keel.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.keel.cli.CommandLineInterface;
import org.keel.cli.config.InvalidConfigurationException;
import org.keel.compiler.api.ImportSession;
import org.keel.compiler.frontend.module.ModuleReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Base for subcommands that act on one module. Parses the module name and opens the import
 * session before handing over to {@link #run}.
 * <p>
 * Exit codes: 0 success, 1 import or configuration failure, 2 invalid module name.
 */
abstract class ModuleCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_NAME = 2;

    private static final Logger log = LoggerFactory.getLogger(ModuleCommand.class);

    @Parameters(index = "0", paramLabel = "MODULE", description = "Dotted module name, e.g. foo.bar.baz")
    private String module;

    @Option(
        names = {"-I", "--search-path"},
        paramLabel = "DIR",
        description = "Additional search root, tried in the given order (repeatable)"
    )
    private List<Path> searchPaths = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public final Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final ModuleReference reference;
            try {
                reference = ModuleReference.parse(module);
            } catch (IllegalArgumentException e) {
                err.println("Error: invalid module name '" + module + "': " + e.getMessage());
                return EXIT_INVALID_NAME;
            }

            final ImportSession session;
            try {
                session = parent.openSession();
            } catch (InvalidConfigurationException e) {
                log.debug("Configuration rejected", e);
                err.println("Error: " + e.getMessage());
                return EXIT_FAILURE;
            }

            return run(session, reference, List.copyOf(searchPaths), out, err);
        } finally {
            out.flush();
            err.flush();
        }
    }

    /**
     * Performs the command against an open session.
     *
     * @return The process exit code.
     */
    protected abstract int run(ImportSession session, ModuleReference reference, List<Path> searchPaths,
                               PrintWriter out, PrintWriter err);
}
