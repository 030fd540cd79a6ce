package work.lcod.dispatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.dispatch.api.DispatchConfiguration;

class DispatchConfigurationLoaderTest {
    private static final Path CONFIG_DIR = Path.of("src", "test", "resources", "config");

    @Test
    void readsTomlSection() {
        var config = DispatchConfigurationLoader.load(CONFIG_DIR.resolve("dispatch.toml").toAbsolutePath());
        assertEquals(Duration.ofMillis(25), config.pollInterval());
        assertEquals(3, config.workerThreads());
        assertEquals('>', config.pipeDelimiter());
        assertEquals("toml-queue", config.threadName());
    }

    @Test
    void readsYamlSectionKeepingUnsetDefaults() {
        var config = DispatchConfigurationLoader.load(CONFIG_DIR.resolve("dispatch.yaml").toAbsolutePath());
        assertEquals(Duration.ofSeconds(2), config.pollInterval());
        assertEquals(5, config.workerThreads());
        assertEquals(DispatchConfiguration.DEFAULT_PIPE_DELIMITER, config.pipeDelimiter());
        assertEquals("yaml-queue", config.threadName());
    }

    @Test
    void readsJsonFiles(@TempDir Path dir) throws Exception {
        var file = dir.resolve("dispatch.json");
        Files.writeString(file, "{\"dispatch\": {\"worker_threads\": 7, \"pipe_delimiter\": \"!\"}}");
        var config = DispatchConfigurationLoader.load(file);
        assertEquals(7, config.workerThreads());
        assertEquals('!', config.pipeDelimiter());
    }

    @Test
    void missingSectionKeepsBase() {
        var base = DispatchConfiguration.builder().workerThreads(9).build();
        assertEquals(base, DispatchConfigurationLoader.fromToml("[other]\nvalue = 1\n", base));
        assertEquals(base, DispatchConfigurationLoader.fromTree(new ObjectMapper().createObjectNode(), base));
    }

    @Test
    void rejectsInvalidValues() {
        var base = DispatchConfiguration.defaults();
        assertThrows(IllegalArgumentException.class,
            () -> DispatchConfigurationLoader.fromToml("[dispatch]\npipe_delimiter = \"||\"\n", base));
        assertThrows(IllegalArgumentException.class,
            () -> DispatchConfigurationLoader.fromToml("[dispatch]\nworker_threads = 0\n", base));
        assertThrows(IllegalArgumentException.class,
            () -> DispatchConfigurationLoader.fromToml("[dispatch\n", base));
    }

    @Test
    void rejectsUnknownExtensions(@TempDir Path dir) throws Exception {
        var file = dir.resolve("dispatch.ini");
        Files.writeString(file, "poll=1");
        assertThrows(IllegalArgumentException.class, () -> DispatchConfigurationLoader.load(file));
    }
}
