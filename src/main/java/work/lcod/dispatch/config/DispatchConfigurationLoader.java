package work.lcod.dispatch.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.dispatch.api.DispatchConfiguration;
import work.lcod.dispatch.shared.DurationParser;

/**
 * Reads the {@code [dispatch]} section of a TOML, YAML or JSON file on top of a base configuration.
 *
 * <pre>
 * [dispatch]
 * poll_interval = "100ms"
 * worker_threads = 4
 * pipe_delimiter = "|"
 * thread_name = "command-queue"
 * </pre>
 */
public final class DispatchConfigurationLoader {
    static final String SECTION = "dispatch";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private DispatchConfigurationLoader() {}

    public static DispatchConfiguration load(Path path) {
        return load(path, DispatchConfiguration.defaults());
    }

    public static DispatchConfiguration load(Path path, DispatchConfiguration base) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (name.endsWith(".toml")) {
                return fromToml(Files.readString(path), base);
            }
            if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                return fromTree(YAML_MAPPER.readTree(path.toFile()), base);
            }
            if (name.endsWith(".json")) {
                return fromTree(JSON_MAPPER.readTree(path.toFile()), base);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read dispatch configuration: " + path, ex);
        }
        throw new IllegalArgumentException("Unsupported configuration format (expected .toml, .yaml or .json): " + path);
    }

    public static DispatchConfiguration fromToml(String text, DispatchConfiguration base) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid TOML configuration: " + result.errors().get(0).toString());
        }
        TomlTable section = result.getTable(SECTION);
        var builder = base.toBuilder();
        if (section == null) {
            return builder.build();
        }
        if (section.contains("poll_interval")) {
            builder.pollInterval(DurationParser.parse(section.getString("poll_interval")).orElse(base.pollInterval()));
        }
        if (section.contains("worker_threads")) {
            Long threads = section.getLong("worker_threads");
            builder.workerThreads(Math.toIntExact(threads));
        }
        if (section.contains("pipe_delimiter")) {
            builder.pipeDelimiter(delimiter(section.getString("pipe_delimiter")));
        }
        if (section.contains("thread_name")) {
            builder.threadName(section.getString("thread_name"));
        }
        return builder.build();
    }

    public static DispatchConfiguration fromTree(JsonNode root, DispatchConfiguration base) {
        var builder = base.toBuilder();
        JsonNode section = root == null ? null : root.get(SECTION);
        if (section == null || !section.isObject()) {
            return builder.build();
        }
        if (section.hasNonNull("poll_interval")) {
            builder.pollInterval(DurationParser.parse(section.get("poll_interval").asText()).orElse(base.pollInterval()));
        }
        if (section.hasNonNull("worker_threads")) {
            JsonNode threads = section.get("worker_threads");
            if (!threads.canConvertToInt()) {
                throw new IllegalArgumentException("worker_threads must be an integer: " + threads);
            }
            builder.workerThreads(threads.asInt());
        }
        if (section.hasNonNull("pipe_delimiter")) {
            builder.pipeDelimiter(delimiter(section.get("pipe_delimiter").asText()));
        }
        if (section.hasNonNull("thread_name")) {
            builder.threadName(section.get("thread_name").asText());
        }
        return builder.build();
    }

    private static char delimiter(String raw) {
        if (raw == null || raw.length() != 1) {
            throw new IllegalArgumentException("pipe_delimiter must be a single character: " + raw);
        }
        return raw.charAt(0);
    }
}
