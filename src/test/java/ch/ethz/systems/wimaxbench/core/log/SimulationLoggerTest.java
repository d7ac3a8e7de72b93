package ch.ethz.systems.wimaxbench.core.log;

import ch.ethz.systems.wimaxbench.core.config.BaseAllowedProperties;
import ch.ethz.systems.wimaxbench.core.config.WBProperties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SimulationLoggerTest {

    @TempDir
    Path baseDir;

    private String expectedRunFolder;

    @BeforeEach
    void setUp() {
        Properties properties = new Properties();
        properties.setProperty("run_folder_name", "logger_run");
        properties.setProperty("run_folder_base_dir", baseDir.toString());
        SimulationLogger.open(new WBProperties(properties, BaseAllowedProperties.PROPERTIES_RUN));
        expectedRunFolder = baseDir.toString() + File.separator + "logger_run";
    }

    @AfterEach
    void tearDown() {
        SimulationLogger.closeAndThrowaway();
    }

    @Test
    void runFolderOpenUntilClose() {
        assertEquals(expectedRunFolder, SimulationLogger.getRunFolderFull());
        assertTrue(new File(expectedRunFolder, "config.properties").exists());

        SimulationLogger.close();

        assertNull(SimulationLogger.getRunFolderFull());
        assertTrue(new File(expectedRunFolder, "statistics.log").exists());
    }

    @Test
    void logsAreWrittenAsUtf8() throws IOException {
        SimulationLogger.logInfo("STATION", "Zürich, 5 µs");
        SimulationLogger.increaseStatisticCounter("BYTES_ÜBER_LUFT", 7);
        SimulationLogger.close();

        byte[] info = Files.readAllBytes(Path.of(expectedRunFolder, "info.log"));
        assertEquals("STATION: Zürich, 5 µs\n", new String(info, StandardCharsets.UTF_8));
        String statistics = Files.readString(Path.of(expectedRunFolder, "statistics.log"), StandardCharsets.UTF_8);
        assertTrue(statistics.contains("BYTES_ÜBER_LUFT: 7"));
    }

    @Test
    void countersClearedOnClose() {
        SimulationLogger.increaseStatisticCounter("DROPS");
        SimulationLogger.increaseStatisticCounter("DROPS", 2);
        assertEquals(3, SimulationLogger.getStatisticCounter("DROPS"));

        SimulationLogger.close();

        assertEquals(0, SimulationLogger.getStatisticCounter("DROPS"));
    }

}
