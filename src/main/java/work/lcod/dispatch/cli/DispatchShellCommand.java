package work.lcod.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import picocli.CommandLine;
import work.lcod.dispatch.api.DispatchConfiguration;
import work.lcod.dispatch.api.InputResult;
import work.lcod.dispatch.api.LogLevel;
import work.lcod.dispatch.config.DispatchConfigurationLoader;
import work.lcod.dispatch.convert.ConverterRegistry;
import work.lcod.dispatch.demo.BuiltinCommands;
import work.lcod.dispatch.runtime.CommandContext;
import work.lcod.dispatch.runtime.CommandQueue;
import work.lcod.dispatch.shared.DurationParser;

@CommandLine.Command(
    name = "dispatch-shell",
    description = "Dispatch command lines (one per line on stdin, or via --execute) through a command queue.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class DispatchShellCommand implements java.util.concurrent.Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    @CommandLine.Option(
        names = {"-e", "--execute"},
        paramLabel = "LINE",
        description = "Command line to dispatch; repeatable. Stdin is read when absent."
    )
    private List<String> lines = new ArrayList<>();

    @CommandLine.Option(
        names = "--config",
        description = "Configuration file (.toml, .yaml or .json) with a [dispatch] section.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--poll-interval",
        description = "Worker poll interval (e.g. 100ms, 1s).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String pollIntervalRaw;

    @CommandLine.Option(
        names = "--workers",
        description = "Size of the command execution pool.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer workers;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--timeout",
        description = "How long to wait for outstanding commands before giving up.",
        defaultValue = "30s"
    )
    private String timeoutRaw;

    private PrintStream out = System.out;

    DispatchShellCommand() {}

    DispatchShellCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws Exception {
        LogLevels.apply(LogLevel.from(logLevelRaw));
        var configuration = resolveConfiguration();
        var timeout = DurationParser.parse(timeoutRaw)
            .orElseThrow(() -> new CommandLine.ParameterException(new CommandLine(this), "--timeout must not be blank"));

        var outcomes = new ArrayList<CompletableFuture<InputResult>>();
        var queue = new CommandQueue(ConverterRegistry.withDefaults(), configuration);
        try {
            BuiltinCommands.register(queue);
            queue.start();
            if (lines != null && !lines.isEmpty()) {
                for (String line : lines) {
                    submit(queue, line, outcomes);
                }
            } else {
                var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                String line;
                while ((line = reader.readLine()) != null) {
                    submit(queue, line, outcomes);
                }
            }
            CompletableFuture.allOf(outcomes.toArray(CompletableFuture[]::new))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            queue.close();
            queue.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        int exitCode = 0;
        for (var outcome : outcomes) {
            if (outcome.join() != InputResult.SUCCESS) {
                exitCode = 1;
            }
        }
        return exitCode;
    }

    private DispatchConfiguration resolveConfiguration() {
        var configuration = config == null ? DispatchConfiguration.defaults() : DispatchConfigurationLoader.load(config);
        var builder = configuration.toBuilder();
        DurationParser.parse(pollIntervalRaw).ifPresent(builder::pollInterval);
        if (workers != null) {
            builder.workerThreads(workers);
        }
        return builder.build();
    }

    private void submit(CommandQueue queue, String line, List<CompletableFuture<InputResult>> outcomes) {
        if (line.isBlank()) {
            return;
        }
        var outcome = new CompletableFuture<InputResult>();
        outcomes.add(outcome);
        queue.submit(line, CommandContext.empty(), (result, payload) -> {
            print(line, result, payload);
            outcome.complete(result);
        });
    }

    private void print(String line, InputResult result, Object payload) {
        var record = new LinkedHashMap<String, Object>();
        record.put("input", line);
        record.put("status", result.label());
        if (payload instanceof Throwable error) {
            record.put("error", error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
        } else if (payload != null) {
            record.put("value", payload);
        }
        String rendered;
        try {
            rendered = JSON.writeValueAsString(record);
        } catch (JsonProcessingException ex) {
            rendered = JSON.createObjectNode()
                .put("input", line)
                .put("status", result.label())
                .put("value", String.valueOf(payload))
                .toString();
        }
        synchronized (this) {
            out.println(rendered);
        }
    }
}
