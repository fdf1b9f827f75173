package org.keel.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.keel.compiler.api.ImportSession;
import org.keel.compiler.frontend.module.ImportException;
import org.keel.compiler.frontend.module.ModuleInfo;
import org.keel.compiler.frontend.module.ModuleReference;
import org.keel.compiler.frontend.semantics.ImportBindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Imports a module and, transitively, everything it imports, then lists the loaded
 * modules in the order their imports completed.
 */
@Command(
    name = "import",
    description = "Parse and typecheck a module and its imports"
)
public class ImportCommand extends ModuleCommand {

    private static final Logger log = LoggerFactory.getLogger(ImportCommand.class);

    @Option(
        names = {"--json"},
        description = "Print the loaded modules as JSON"
    )
    private boolean json;

    /**
     * One loaded module, as printed.
     */
    record LoadedModule(String name, String path, Map<String, String> imports) {}

    @Override
    protected int run(ImportSession session, ModuleReference reference, List<Path> searchPaths,
                      PrintWriter out, PrintWriter err) {
        try {
            session.importModule(reference, searchPaths);
        } catch (ImportException e) {
            log.debug("Import of {} failed", reference, e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        List<LoadedModule> loaded = new ArrayList<>();
        for (ModuleReference ref : session.cache().references()) {
            loaded.add(describe(session.cache().get(ref)));
        }
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(loaded));
        } else {
            printText(out, loaded);
        }
        return EXIT_OK;
    }

    private static LoadedModule describe(ModuleInfo info) {
        Map<String, String> imports = new LinkedHashMap<>();
        if (info.typeInfo() instanceof ImportBindings bindings) {
            bindings.bindings().forEach((alias, target) -> imports.put(alias, target.module().moduleName()));
        }
        return new LoadedModule(info.module().moduleName(), info.module().sourcePath().toString(), imports);
    }

    private static void printText(PrintWriter out, List<LoadedModule> loaded) {
        out.println("Loaded " + loaded.size() + " module(s):");
        for (LoadedModule module : loaded) {
            out.println("  " + module.name() + "  (" + module.path() + ")");
            module.imports().forEach((alias, target) -> out.println("    " + alias + " -> " + target));
        }
    }
}
