package org.pipesteps.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

@Tag("integration")
class StatusCommandTest {

    @TempDir
    Path tempDir;

    private CommandTestSupport cli;

    @BeforeEach
    void setUp() throws IOException {
        cli = new CommandTestSupport(tempDir);
    }

    @Test
    void testStatusBeforeFirstRun() {
        assertThat(cli.execute("status")).isZero();

        assertThat(cli.output()).contains("No batch committed yet");
    }

    @Test
    void testStatusAfterRun() {
        cli.execute("run");

        assertThat(cli.execute("status")).isZero();

        assertThat(cli.output())
            .contains("Last completed batch: 2")
            .contains("Total rows processed: 25")
            .contains("Next batch:           3")
            .containsPattern("filter_data\\s+committed=2 artifacts=3");
    }

    @Test
    void testCorruptFrontierIsReported() throws IOException {
        Files.createDirectories(cli.checkpointDir);
        Files.writeString(cli.checkpointDir.resolve("frontier.json"), "not json");

        assertThat(cli.execute("status")).isEqualTo(1);
        assertThat(cli.errors()).contains("corrupt");
    }

    @Test
    void testFailureCauseIsLoggedAtDebug() throws IOException {
        // First execution applies the logging configuration
        assertThat(cli.execute("status")).isZero();

        Files.createDirectories(cli.checkpointDir);
        Files.writeString(cli.checkpointDir.resolve("frontier.json"), "not json");
        Logger logger = (Logger) LoggerFactory.getLogger(StatusCommand.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
        try {
            assertThat(cli.execute("status")).isEqualTo(1);
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(null);
            logger.setAdditive(true);
        }

        assertThat(appender.list).hasSize(1);
        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender.list.get(0).getThrowableProxy()).isNotNull();
    }
}
