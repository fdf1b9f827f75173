package org.keel.compiler.frontend.module;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ImportSettingsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        ImportSettings settings = ImportSettings.defaults();

        assertThat(settings.sourceExtension()).isEqualTo("x");
        assertThat(settings.stdlibRoot()).isEqualTo("keel/stdlib");
        assertThat(settings.stdlibModules()).containsExactlyInAnyOrder("std", "float32", "bfloat16");
        assertThat(settings.searchPaths()).isEmpty();
        assertThat(settings.bundledRoots()).isEmpty();
    }

    @Test
    void overridesAreLayeredOverReference() {
        ImportSettings settings = ImportSettings.fromConfig(ConfigFactory.parseString("""
                keel.imports {
                  source-extension = ".kl"
                  search-paths = ["/opt/a", "rel/b"]
                  stdlib.modules = [core]
                }
                """).withFallback(ConfigFactory.defaultReference()));

        assertThat(settings.sourceExtension()).isEqualTo("kl");
        assertThat(settings.searchPaths()).containsExactly(Path.of("/opt/a"), Path.of("rel/b"));
        assertThat(settings.isStdlibModule(ModuleReference.of("core"))).isTrue();
        assertThat(settings.isStdlibModule(ModuleReference.of("std"))).isFalse();
    }

    @Test
    void onlySingleSegmentReservedNamesAreStdlib() {
        ImportSettings settings = ImportSettings.defaults();

        assertThat(settings.isStdlibModule(ModuleReference.of("std"))).isTrue();
        assertThat(settings.isStdlibModule(ModuleReference.of("std", "extra"))).isFalse();
        assertThat(settings.isStdlibModule(ModuleReference.of("mystd"))).isFalse();
    }

    @Test
    void withSearchPathsReplacesOnlySearchPaths() {
        ImportSettings settings = ImportSettings.defaults().withSearchPaths(List.of(Path.of("/libs")));

        assertThat(settings.searchPaths()).containsExactly(Path.of("/libs"));
        assertThat(settings.sourceExtension()).isEqualTo("x");
    }

    @Test
    void missingBlockIsAConfigError() {
        assertThatThrownBy(() -> ImportSettings.fromConfig(ConfigFactory.empty()))
                .isInstanceOf(ConfigException.Missing.class);
    }
}
