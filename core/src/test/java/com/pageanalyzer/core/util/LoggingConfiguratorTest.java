package com.pageanalyzer.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LoggingConfiguratorTest {

    private final Logger root = LogManager.getLogManager().getLogger("");
    private Handler[] saved;
    private Level savedLevel;

    @BeforeEach
    void save() {
        saved = root.getHandlers();
        savedLevel = root.getLevel();
    }

    @AfterEach
    void restore() {
        for (Handler h : root.getHandlers()) {
            root.removeHandler(h);
            h.close();
        }
        for (Handler h : saved) root.addHandler(h);
        root.setLevel(savedLevel);
    }

    @Test
    void structured_lines_reach_the_log_file(@TempDir Path dir) throws Exception {
        LoggingConfigurator.init(dir.resolve("logs"), Level.INFO, 1_000_000, 2);

        StructuredLog.get(LoggingConfiguratorTest.class).info("config.loaded", "maxConcurrent", 5);
        StructuredLog.get(LoggingConfiguratorTest.class).debug("below.threshold");

        Path log = dir.resolve("logs").resolve("page-analyzer-0.log");
        assertTrue(Files.exists(log));
        String content = Files.readString(log);
        assertThat(content).contains("\"event\":\"config.loaded\"").contains("\"maxConcurrent\":5");
        assertThat(content).doesNotContain("below.threshold");
        assertEquals(Level.INFO, root.getLevel());
    }

    @Test
    void console_only() {
        LoggingConfigurator.init(Level.WARNING);

        assertEquals(1, root.getHandlers().length);
        assertEquals(Level.WARNING, root.getHandlers()[0].getLevel());
    }
}
