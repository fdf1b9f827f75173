package org.keel.compiler.frontend.parser.directive;

import org.keel.compiler.frontend.module.ModuleParseException;
import org.keel.compiler.frontend.module.ModuleReference;
import org.keel.compiler.frontend.parser.ModuleParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based scanner for Keel module sources. Recognizes
 * {@code import a.b.c;} and {@code import a.b.c as name;} declarations and keeps every
 * other non-empty line as body text. {@code #} starts a comment that runs to the end of the line.
 *
 * <p>This is a lightweight text scan, not a full parser: it is enough to drive module
 * imports from the command line and in tests.</p>
 */
public final class DirectiveScanner implements ModuleParser {

    private static final Pattern IMPORT_KEYWORD = Pattern.compile("^import\\b");
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "^import\\s+([A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)*)(?:\\s+as\\s+([A-Za-z_]\\w*))?\\s*;$");

    @Override
    public ScannedModule parse(String moduleName, Path sourcePath, String sourceText) throws ModuleParseException {
        List<ScannedModule.ImportDecl> imports = new ArrayList<>();
        List<String> body = new ArrayList<>();

        String[] lines = sourceText.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String raw = lines[i];
            int commentIdx = raw.indexOf('#');
            String line = (commentIdx >= 0 ? raw.substring(0, commentIdx) : raw).strip();
            if (line.isEmpty()) continue;

            if (!IMPORT_KEYWORD.matcher(line).find()) {
                body.add(line);
                continue;
            }

            int column = raw.indexOf("import") + 1;
            Matcher importMatcher = IMPORT_PATTERN.matcher(line);
            if (!importMatcher.matches()) {
                throw new ModuleParseException(
                        "Malformed import declaration, expected 'import name[.name]* [as alias];'",
                        sourcePath, i + 1, column);
            }
            ModuleReference target = ModuleReference.parse(importMatcher.group(1));
            String alias = importMatcher.group(2) != null
                    ? importMatcher.group(2)
                    : target.segments().get(target.size() - 1);
            imports.add(new ScannedModule.ImportDecl(target, alias, i + 1));
        }

        return new ScannedModule(moduleName, sourcePath, imports, body);
    }
}
