package org.keel.compiler.frontend.module;

import org.keel.compiler.frontend.io.BundledResourceLocator;
import org.keel.compiler.frontend.io.SourceFileSystem;
import org.keel.compiler.frontend.parser.ModuleParser;
import org.keel.compiler.frontend.parser.ast.ModuleAst;
import org.keel.compiler.frontend.semantics.Typechecker;
import org.keel.compiler.frontend.semantics.TypeInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests the import pipeline with a fake filesystem, parser and typechecker.
 */
@Tag("unit")
class ModuleImporterTest {

    private static final Path CWD = Path.of("/work");
    private static final Path LIBS = Path.of("/opt/libs");

    private SourceFileSystem fileSystem;
    private ModuleParser parser;
    private Typechecker typechecker;
    private ModuleImporter importer;
    private ImportCache cache;

    @BeforeEach
    void setUp() {
        fileSystem = mock(SourceFileSystem.class);
        when(fileSystem.currentWorkingDirectory()).thenReturn(CWD);
        parser = mock(ModuleParser.class);
        typechecker = mock(Typechecker.class);
        ModulePathResolver resolver = new ModulePathResolver(
                fileSystem, BundledResourceLocator.none(), ImportSettings.defaults());
        importer = new ModuleImporter(resolver, fileSystem, parser);
        cache = new ImportCache();
    }

    private static ModuleAst ast(String name, Path path) {
        ModuleAst module = mock(ModuleAst.class);
        when(module.moduleName()).thenReturn(name);
        when(module.sourcePath()).thenReturn(path);
        return module;
    }

    @Test
    void importsModuleFoundUnderSearchRoot() throws Exception {
        Path file = LIBS.resolve("a/b.x");
        ModuleAst module = ast("a.b", file);
        TypeInfo types = mock(TypeInfo.class);
        when(fileSystem.exists(file)).thenReturn(true);
        when(fileSystem.readAll(file)).thenReturn("body\n");
        when(parser.parse("a.b", file, "body\n")).thenReturn(module);
        when(typechecker.typecheck(module)).thenReturn(types);

        ModuleInfo info = importer.doImport(typechecker, ModuleReference.of("a", "b"), List.of(LIBS), cache);

        assertThat(info.module()).isSameAs(module);
        assertThat(info.typeInfo()).isSameAs(types);
        assertThat(cache.get(ModuleReference.of("a", "b"))).isSameAs(info);
    }

    @Test
    void repeatedImportReturnsSameInstanceAndProcessesOnce() throws Exception {
        Path file = CWD.resolve("lib.x");
        ModuleAst module = ast("lib", file);
        TypeInfo types = mock(TypeInfo.class);
        when(fileSystem.exists(file)).thenReturn(true);
        when(fileSystem.readAll(file)).thenReturn("");
        when(parser.parse(any(), any(), any())).thenReturn(module);
        when(typechecker.typecheck(module)).thenReturn(types);

        ModuleInfo first = importer.doImport(typechecker, ModuleReference.of("lib"), List.of(), cache);
        ModuleInfo second = importer.doImport(typechecker, ModuleReference.of("lib"), List.of(), cache);

        assertThat(second).isSameAs(first);
        verify(parser, times(1)).parse(any(), any(), any());
        verify(typechecker, times(1)).typecheck(any());
        verify(fileSystem, times(1)).readAll(file);
    }

    @Test
    void cacheHitTouchesNeitherFilesystemNorParser() throws Exception {
        ModuleReference reference = ModuleReference.of("lib");
        ModuleAst module = ast("lib", CWD.resolve("lib.x"));
        ModuleInfo cached = cache.put(reference, new ModuleInfo(module, mock(TypeInfo.class)));

        ModuleInfo info = importer.doImport(typechecker, reference, List.of(LIBS), cache);

        assertThat(info).isSameAs(cached);
        verifyNoMoreInteractions(fileSystem, parser, typechecker);
    }

    @Test
    void fullyQualifiedNameIsPassedToParser() throws Exception {
        Path file = CWD.resolve("foo/bar/baz.x");
        ModuleAst module = ast("foo.bar.baz", file);
        when(fileSystem.exists(file)).thenReturn(true);
        when(fileSystem.readAll(file)).thenReturn("x");
        when(parser.parse(eq("foo.bar.baz"), eq(file), eq("x"))).thenReturn(module);
        TypeInfo types = mock(TypeInfo.class);
        when(typechecker.typecheck(any())).thenReturn(types);

        importer.doImport(typechecker, ModuleReference.of("foo", "bar", "baz"), List.of(), cache);

        verify(parser).parse("foo.bar.baz", file, "x");
    }

    @Test
    void resolutionFailurePropagatesAndCachesNothing() throws Exception {
        ModuleNotFoundException e = assertThrows(ModuleNotFoundException.class,
                () -> importer.doImport(typechecker, ModuleReference.of("missing"), List.of(LIBS), cache));

        assertThat(e.attemptedPaths()).containsExactly(CWD.resolve("missing.x"), LIBS.resolve("missing.x"));
        assertThat(cache.size()).isZero();
        assertThat(cache.isInProgress(ModuleReference.of("missing"))).isFalse();
        verify(parser, never()).parse(any(), any(), any());
    }

    @Test
    void readFailureIsReportedWithPath() throws Exception {
        Path file = CWD.resolve("gone.x");
        when(fileSystem.exists(file)).thenReturn(true);
        when(fileSystem.readAll(file)).thenThrow(new NoSuchFileException(file.toString()));

        ModuleReadException e = assertThrows(ModuleReadException.class,
                () -> importer.doImport(typechecker, ModuleReference.of("gone"), List.of(), cache));

        assertThat(e.path()).isEqualTo(file);
        assertThat(e.getCause()).isInstanceOf(IOException.class);
        assertThat(cache.contains(ModuleReference.of("gone"))).isFalse();
    }

    @Test
    void parseFailurePropagatesUnchanged() throws Exception {
        Path file = CWD.resolve("bad.x");
        ModuleParseException failure = new ModuleParseException("unexpected token", file, 3, 7);
        when(fileSystem.exists(file)).thenReturn(true);
        when(fileSystem.readAll(file)).thenReturn("???");
        when(parser.parse(any(), any(), any())).thenThrow(failure);

        assertThatThrownBy(() -> importer.doImport(typechecker, ModuleReference.of("bad"), List.of(), cache))
                .isSameAs(failure)
                .hasMessageContaining(":3:7:");
        verify(typechecker, never()).typecheck(any());
    }

    @Test
    void typecheckFailureIsNotCachedAndIsRetriedFromScratch() throws Exception {
        Path file = CWD.resolve("flaky.x");
        ModuleAst module = ast("flaky", file);
        TypeInfo types = mock(TypeInfo.class);
        when(fileSystem.exists(file)).thenReturn(true);
        when(fileSystem.readAll(file)).thenReturn("");
        when(parser.parse(any(), any(), any())).thenReturn(module);
        when(typechecker.typecheck(module))
                .thenThrow(new TypecheckException("flaky", "type mismatch"))
                .thenReturn(types);
        ModuleReference reference = ModuleReference.of("flaky");

        assertThatThrownBy(() -> importer.doImport(typechecker, reference, List.of(), cache))
                .isInstanceOf(TypecheckException.class)
                .hasMessageContaining("type mismatch");
        assertThat(cache.contains(reference)).isFalse();

        ModuleInfo info = importer.doImport(typechecker, reference, List.of(), cache);

        assertThat(info.typeInfo()).isSameAs(types);
        verify(parser, times(2)).parse(any(), any(), any());
        verify(typechecker, times(2)).typecheck(module);
    }

    @Test
    void cyclicImportFailsFastWithTheCycle() throws Exception {
        ModuleReference a = ModuleReference.of("a");
        ModuleReference b = ModuleReference.of("b");
        Path aFile = CWD.resolve("a.x");
        Path bFile = CWD.resolve("b.x");
        ModuleAst aAst = ast("a", aFile);
        ModuleAst bAst = ast("b", bFile);
        when(fileSystem.exists(aFile)).thenReturn(true);
        when(fileSystem.exists(bFile)).thenReturn(true);
        when(fileSystem.readAll(any())).thenReturn("");
        when(parser.parse(eq("a"), any(), any())).thenReturn(aAst);
        when(parser.parse(eq("b"), any(), any())).thenReturn(bAst);

        Typechecker recursive = new Typechecker() {
            @Override
            public TypeInfo typecheck(ModuleAst module) throws ImportException {
                ModuleReference next = module == aAst ? b : a;
                importer.doImport(this, next, List.of(), cache);
                return mock(TypeInfo.class);
            }
        };

        ImportCycleException e = assertThrows(ImportCycleException.class,
                () -> importer.doImport(recursive, a, List.of(), cache));

        assertThat(e.cycle()).containsExactly(a, b, a);
        assertThat(e.getMessage()).contains("a -> b -> a");
        assertThat(cache.size()).isZero();
        assertThat(cache.isInProgress(a)).isFalse();
        assertThat(cache.isInProgress(b)).isFalse();
    }

    @Test
    void nestedImportsShareTheCache() throws Exception {
        ModuleReference main = ModuleReference.of("main");
        ModuleReference dep = ModuleReference.of("dep");
        ModuleAst mainAst = ast("main", CWD.resolve("main.x"));
        ModuleAst depAst = ast("dep", CWD.resolve("dep.x"));
        when(fileSystem.exists(any())).thenReturn(true);
        when(fileSystem.readAll(any())).thenReturn("");
        when(parser.parse(eq("main"), any(), any())).thenReturn(mainAst);
        when(parser.parse(eq("dep"), any(), any())).thenReturn(depAst);

        Typechecker importsDep = new Typechecker() {
            @Override
            public TypeInfo typecheck(ModuleAst module) throws ImportException {
                if (module == mainAst) {
                    importer.doImport(this, dep, List.of(), cache);
                    importer.doImport(this, dep, List.of(), cache);
                }
                return mock(TypeInfo.class);
            }
        };

        importer.doImport(importsDep, main, List.of(), cache);

        assertThat(cache.references()).containsExactly(dep, main);
        verify(parser, times(1)).parse(eq("dep"), any(), any());
    }

    @Test
    void cacheIsRequired() {
        assertThatThrownBy(() -> importer.doImport(typechecker, ModuleReference.of("a"), List.of(), null))
                .isInstanceOf(NullPointerException.class);
    }
}
