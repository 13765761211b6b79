package io.usymbol.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link OptionsLoader}: YAML parsing, defaults and environment overlay. */
class OptionsLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("usymbol.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    class YamlFile {

        @Test
        void readsAllKeys() throws IOException {
            Path file = write("""
                    context:
                      initial-capacity: 4096
                      max-folded-exponent: 512
                    """);

            ContextOptions options = OptionsLoader.load(file, NO_ENV);

            assertThat(options).isEqualTo(new ContextOptions(4096, 512));
        }

        @Test
        void missingKeysKeepDefaults() throws IOException {
            Path file = write("""
                    context:
                      initial-capacity: 16
                    """);

            ContextOptions options = OptionsLoader.load(file, NO_ENV);

            assertThat(options.initialCapacity()).isEqualTo(16);
            assertThat(options.maxFoldedExponent()).isEqualTo(ContextOptions.DEFAULT.maxFoldedExponent());
        }

        @Test
        void unrelatedSectionsAreIgnored() throws IOException {
            Path file = write("""
                    logging:
                      level: debug
                    """);

            assertThat(OptionsLoader.load(file, NO_ENV)).isEqualTo(ContextOptions.DEFAULT);
        }

        @Test
        void missingFileFails() {
            Path absent = tempDir.resolve("absent.yaml");

            assertThatThrownBy(() -> OptionsLoader.load(absent, NO_ENV))
                    .isInstanceOf(OptionsLoadException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        void malformedYamlFails() throws IOException {
            Path file = write("context: [unclosed\n");

            assertThatThrownBy(() -> OptionsLoader.load(file, NO_ENV))
                    .isInstanceOf(OptionsLoadException.class)
                    .hasMessageContaining("Failed to parse");
        }

        @Test
        void nonIntegerValueFails() throws IOException {
            Path file = write("""
                    context:
                      initial-capacity: lots
                    """);

            assertThatThrownBy(() -> OptionsLoader.load(file, NO_ENV))
                    .isInstanceOf(OptionsLoadException.class)
                    .hasMessageContaining("context.initial-capacity");
        }

        @Test
        void invalidValueFails() throws IOException {
            Path file = write("""
                    context:
                      initial-capacity: 0
                    """);

            assertThatThrownBy(() -> OptionsLoader.load(file, NO_ENV))
                    .isInstanceOf(OptionsLoadException.class)
                    .hasMessageContaining("Invalid context options")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class EnvironmentOverlay {

        @Test
        void envOverridesFile() throws IOException {
            Path file = write("""
                    context:
                      initial-capacity: 64
                      max-folded-exponent: 512
                    """);
            Map<String, String> env = Map.of(OptionsLoader.ENV_MAX_FOLDED_EXPONENT, "16");

            ContextOptions options = OptionsLoader.load(file, env::get);

            assertThat(options).isEqualTo(new ContextOptions(64, 16));
        }

        @Test
        void blankEnvIsIgnored() {
            Map<String, String> env = Map.of(OptionsLoader.ENV_INITIAL_CAPACITY, "   ");

            assertThat(OptionsLoader.fromEnvironment(env::get)).isEqualTo(ContextOptions.DEFAULT);
        }

        @Test
        void envValuesAreTrimmed() {
            Map<String, String> env = Map.of(
                    OptionsLoader.ENV_INITIAL_CAPACITY, " 128 ",
                    OptionsLoader.ENV_MAX_FOLDED_EXPONENT, "0");

            assertThat(OptionsLoader.fromEnvironment(env::get)).isEqualTo(new ContextOptions(128, 0));
        }

        @Test
        void nonIntegerEnvFails() {
            Map<String, String> env = Map.of(OptionsLoader.ENV_INITIAL_CAPACITY, "big");

            assertThatThrownBy(() -> OptionsLoader.fromEnvironment(env::get))
                    .isInstanceOf(OptionsLoadException.class)
                    .hasMessageContaining(OptionsLoader.ENV_INITIAL_CAPACITY);
        }

        @Test
        void invalidEnvValueFails() {
            Map<String, String> env = Map.of(OptionsLoader.ENV_MAX_FOLDED_EXPONENT, "-5");

            assertThatThrownBy(() -> OptionsLoader.fromEnvironment(env::get))
                    .isInstanceOf(OptionsLoadException.class)
                    .hasMessageContaining("environment");
        }
    }
}
