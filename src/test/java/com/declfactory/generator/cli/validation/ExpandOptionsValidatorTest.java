package com.declfactory.generator.cli.validation;

import com.declfactory.generator.cli.exception.OptionsValidationException;
import com.declfactory.generator.cli.model.ExpandOptions;
import com.declfactory.generator.cli.model.ValidatedExpandOptions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ExpandOptionsValidatorTest {

    private final ExpandOptionsValidator validator = new ExpandOptionsValidator();

    @TempDir
    Path tempDir;

    @Test
    void testValidOptionsAreNormalized() {
        ExpandOptions options = parse("--input", tempDir.toString(), "--output-dir", tempDir.resolve("out").toString());

        ValidatedExpandOptions validated = validator.validate(options);

        assertThat(validated.getNormalizedInputs()).containsExactly(tempDir.toAbsolutePath().normalize());
        assertThat(validated.getNormalizedOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
    }

    @Test
    void testAllErrorsAreReportedTogether() {
        ExpandOptions options = parse("--input", tempDir.resolve("missing").toString(),
                "--extension", "java", "--basis-marker", "class");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(4)
                        .anySatisfy(error -> assertThat(error).startsWith("Input does not exist"))
                        .anySatisfy(error -> assertThat(error).startsWith("Extension must start with"))
                        .anySatisfy(error -> assertThat(error).startsWith("Basis marker is not a valid"))
                        .anySatisfy(error -> assertThat(error).startsWith("Output directory is required")));
    }

    @Test
    void testDryRunNeedsNoOutputDirectory() {
        ExpandOptions options = parse("--input", tempDir.toString(), "--dry-run");

        assertThat(validator.validate(options).getNormalizedOutputDir()).isNull();
    }

    @Test
    void testNonEmptyOutputDirectoryNeedsForce() throws IOException {
        Path out = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(out.resolve("Existing.java"), "class Existing {}");

        assertThatThrownBy(() -> validator.validate(parse("--input", tempDir.toString(), "--output-dir", out.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Use --force to overwrite");

        assertThat(validator.validate(parse("--input", tempDir.toString(), "--output-dir", out.toString(), "--force")))
                .isNotNull();
    }

    @Test
    void testMarkersMustDiffer() {
        ExpandOptions options = parse("--input", tempDir.toString(), "--dry-run",
                "--basis-marker", "Loop", "--template-marker", "Loop");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("must differ");
    }

    @ParameterizedTest
    @ValueSource(strings = { "Matrix", "Each", "_Loop", "$Gen" })
    void testMarkerNamesThatAreIdentifiersAreAccepted(String marker) {
        ExpandOptions options = parse("--input", tempDir.toString(), "--dry-run", "--template-marker", marker);

        assertThatCode(() -> validator.validate(options)).doesNotThrowAnyException();
    }

    private static ExpandOptions parse(String... args) {
        return CommandLine.populateCommand(new ExpandOptions(), args);
    }
}
