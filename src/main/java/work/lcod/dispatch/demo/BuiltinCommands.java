package work.lcod.dispatch.demo;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import work.lcod.dispatch.convert.ValueType;
import work.lcod.dispatch.runtime.CommandArguments;
import work.lcod.dispatch.runtime.CommandContext;
import work.lcod.dispatch.runtime.CommandDefinition;
import work.lcod.dispatch.runtime.CommandQueue;

/**
 * Small command set used by the shell and the tests.
 *
 * <ul>
 *   <li>{@code echo <text...>} returns its text</li>
 *   <li>{@code upper <text...>} returns its text upper-cased</li>
 *   <li>{@code sum <int...>} adds integers</li>
 *   <li>{@code count <word...>} counts words</li>
 *   <li>{@code json <document>} validates a document; {@code json get <field> <document>} extracts a field</li>
 *   <li>{@code delay <millis> <text...>} returns its text after a delay, asynchronously</li>
 * </ul>
 */
public final class BuiltinCommands {
    static final Duration MAX_DELAY = Duration.ofMinutes(1);

    private BuiltinCommands() {}

    public static CommandQueue register(CommandQueue queue) {
        queue.registerMetadata(CommandDefinition.command("echo")
            .remaining(ValueType.STRING)
            .returns(ValueType.STRING)
            .handler(BuiltinCommands::echo)
            .build());
        queue.registerMetadata(CommandDefinition.command("upper")
            .remaining(ValueType.STRING)
            .returns(ValueType.STRING)
            .handler(BuiltinCommands::upper)
            .build());
        queue.registerMetadata(CommandDefinition.command("sum")
            .alias("sum")
            .alias("add")
            .remaining(ValueType.INT_ARRAY)
            .returns(ValueType.INTEGER)
            .handler(BuiltinCommands::sum)
            .build());
        queue.registerMetadata(CommandDefinition.command("count")
            .remaining(ValueType.STRING_LIST)
            .returns(ValueType.INTEGER)
            .handler(BuiltinCommands::count)
            .build());
        queue.registerMetadata(CommandDefinition.command("json")
            .remaining(ValueType.JSON)
            .returns(ValueType.JSON)
            .subcommand(CommandDefinition.command("get")
                .parameter(ValueType.STRING)
                .remaining(ValueType.JSON)
                .returns(ValueType.JSON)
                .handler(BuiltinCommands::jsonGet))
            .handler(BuiltinCommands::json)
            .build());
        queue.registerMetadata(CommandDefinition.command("delay")
            .parameter(ValueType.LONG)
            .remaining(ValueType.STRING)
            .returns(ValueType.STRING)
            .async()
            .handler(BuiltinCommands::delay)
            .build());
        return queue;
    }

    private static Object echo(CommandContext ctx, CommandArguments args) {
        return args.get(0, ValueType.STRING);
    }

    private static Object upper(CommandContext ctx, CommandArguments args) {
        return args.get(0, ValueType.STRING).toUpperCase(Locale.ROOT);
    }

    private static Object sum(CommandContext ctx, CommandArguments args) {
        int total = 0;
        for (int value : args.get(0, ValueType.INT_ARRAY)) {
            total = Math.addExact(total, value);
        }
        return total;
    }

    private static Object count(CommandContext ctx, CommandArguments args) {
        List<String> words = args.get(0, ValueType.STRING_LIST);
        return words.size();
    }

    private static Object json(CommandContext ctx, CommandArguments args) {
        JsonNode document = args.get(0, ValueType.JSON);
        if (document.isMissingNode()) {
            throw new IllegalArgumentException("json expects a document");
        }
        return document;
    }

    private static Object jsonGet(CommandContext ctx, CommandArguments args) {
        String field = args.get(0, ValueType.STRING);
        JsonNode document = args.get(1, ValueType.JSON);
        JsonNode value = document.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Field '" + field + "' not found");
        }
        return value;
    }

    private static Object delay(CommandContext ctx, CommandArguments args) {
        long millis = args.get(0, ValueType.LONG);
        if (millis < 0 || millis > MAX_DELAY.toMillis()) {
            throw new IllegalArgumentException("delay must be between 0 and " + MAX_DELAY.toMillis() + " ms");
        }
        String text = args.get(1, ValueType.STRING);
        return CompletableFuture.supplyAsync(() -> text, CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
    }
}
