package org.keel.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

import org.keel.compiler.api.ImportSession;
import org.keel.compiler.frontend.module.ModuleNotFoundException;
import org.keel.compiler.frontend.module.ModuleReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;

/**
 * Prints the source file a module reference resolves to, without parsing it.
 * On failure prints every path that was tried.
 */
@Command(
    name = "resolve",
    description = "Print the source file a module resolves to"
)
public class ResolveCommand extends ModuleCommand {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    @Override
    protected int run(ImportSession session, ModuleReference reference, List<Path> searchPaths,
                      PrintWriter out, PrintWriter err) {
        try {
            Path path = session.resolve(reference, searchPaths);
            log.debug("Resolved {} to {}", reference, path);
            out.println(path);
            return EXIT_OK;
        } catch (ModuleNotFoundException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
