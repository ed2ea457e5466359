package com.localedata.assembler.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.localedata.assembler.cli.exception.OptionsValidationException;
import com.localedata.assembler.cli.model.AssembleOptions;
import com.localedata.assembler.cli.model.ValidatedAssembleOptions;
import com.localedata.assembler.config.AssemblerConfig;
import com.localedata.assembler.support.RepositoryFixture;

import picocli.CommandLine;

/**
 * Unit tests for AssembleOptionsValidator.
 */
class AssembleOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final AssembleOptionsValidator validator = new AssembleOptionsValidator();

    private Path sourceDir;
    private Path repositoryRoot;

    @BeforeEach
    void setUp() throws Exception {
        sourceDir = Files.createDirectories(tempDir.resolve("src"));
        repositoryRoot = new RepositoryFixture(tempDir.resolve("repo")).withNumberFormats().getRoot();
    }

    private static AssembleOptions parse(String... args) {
        AssembleOptions options = new AssembleOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return options;
    }

    @Test
    void testValidOptions() {
        AssembleOptions options = parse("-s", sourceDir.toString(), "-r", repositoryRoot.toString(),
                "-o", tempDir.resolve("out").toString(), "-l", "en-US, fr-FR", "-a", "dynamicdata");

        ValidatedAssembleOptions validated = validator.validate(options);

        assertThat(validated.getLocales()).containsExactly("en-US", "fr-FR");
        assertThat(validated.getLocaleDataDir()).isEqualTo(repositoryRoot.resolve("js").resolve("locale"));
        assertThat(validated.getNormalizedOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
        assertThat(options.getAssembly()).isEqualTo(com.localedata.assembler.model.AssemblyMode.DYNAMICDATA);
    }

    @Test
    void testDefaultLocales() {
        ValidatedAssembleOptions validated = validator.validate(
                parse("-s", sourceDir.toString(), "-r", repositoryRoot.toString(), "-o", tempDir.resolve("out").toString()));

        assertThat(validated.getLocales()).isEqualTo(AssemblerConfig.DEFAULT_LOCALES);
    }

    @Test
    void testAllErrorsAreReportedTogether() {
        AssembleOptions options = parse("-s", tempDir.resolve("nope").toString(),
                "-r", repositoryRoot.toString(), "--size", "small",
                "-o", tempDir.resolve("out").toString(),
                "-l", "en-US,42", "--quiescence-ms=-5");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(4)
                        .anyMatch(m -> m.startsWith("Source directory does not exist"))
                        .anyMatch(m -> m.contains("locale-small"))
                        .anyMatch(m -> m.contains("'42'"))
                        .anyMatch(m -> m.contains("-5")));
    }

    @Test
    void testExistingLocalesDirectoryRequiresForce() throws Exception {
        Path out = tempDir.resolve("out");
        Files.createDirectories(out.resolve("locales"));
        String[] args = { "-s", sourceDir.toString(), "-r", repositoryRoot.toString(), "-o", out.toString() };

        assertThatThrownBy(() -> validator.validate(parse(args)))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--force");

        String[] forced = { "-s", sourceDir.toString(), "-r", repositoryRoot.toString(), "-o", out.toString(), "--force" };
        assertThatCode(() -> validator.validate(parse(forced))).doesNotThrowAnyException();
    }

    @Test
    void testCompiledLayout() throws Exception {
        Files.createDirectories(repositoryRoot.resolve("output/js/locale"));

        ValidatedAssembleOptions validated = validator.validate(parse("-s", sourceDir.toString(),
                "-r", repositoryRoot.toString(), "--compilation", "compiled", "-o", tempDir.resolve("out").toString()));

        assertThat(validated.getLocaleDataDir()).isEqualTo(repositoryRoot.resolve("output/js/locale"));
    }
}
