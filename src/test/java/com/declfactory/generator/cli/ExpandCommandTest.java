package com.declfactory.generator.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ExpandCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testSuccessfulRunExitsWithZero() throws IOException {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(in.resolve("Sizes.java"), """
            class Sizes {
                @Template(n = {1, 2})
                static final int SIZE_n = n;
            }
            """);
        Path out = tempDir.resolve("out");

        int exitCode = execute("--input", in.toString(), "--output-dir", out.toString());

        assertThat(exitCode).isEqualTo(ExpandCommand.EXIT_OK);
        assertThat(out.resolve("Sizes.java")).exists();
    }

    @Test
    void testInvalidOptionsExitWithTwo() {
        int exitCode = execute("--input", tempDir.resolve("missing").toString(), "--dry-run");

        assertThat(exitCode).isEqualTo(ExpandCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testExpansionFailureExitsWithOne() throws IOException {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(in.resolve("Broken.java"), """
            class Broken {
                @Template(v = undefined)
                int f() { return v; }
            }
            """);

        int exitCode = execute("--input", in.toString(), "--dry-run");

        assertThat(exitCode).isEqualTo(ExpandCommand.EXIT_FAILURE);
    }

    private static int execute(String... args) {
        return new CommandLine(new ExpandCommand()).execute(args);
    }
}
