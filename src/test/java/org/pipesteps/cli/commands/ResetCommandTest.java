package org.pipesteps.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("integration")
class ResetCommandTest {

    @TempDir
    Path tempDir;

    private CommandTestSupport cli;

    @BeforeEach
    void setUp() throws IOException {
        cli = new CommandTestSupport(tempDir);
    }

    @Test
    void testDryRunDeletesNothing() {
        cli.execute("run");

        assertThat(cli.execute("reset")).isZero();

        assertThat(cli.output()).contains("dry-run").contains("3 artifacts to delete");
        assertThat(Files.exists(cli.checkpointDir.resolve("frontier.json"))).isTrue();
    }

    @Test
    void testForceDeletesEverything() {
        cli.execute("run");

        assertThat(cli.execute("reset", "--force")).isZero();

        assertThat(Files.exists(cli.checkpointDir.resolve("frontier.json"))).isFalse();
        assertThat(Files.exists(cli.checkpointDir.resolve("steps"))).isFalse();

        assertThat(cli.execute("run")).isZero();
        assertThat(cli.output()).contains("Committed 3 batches");
    }
}
