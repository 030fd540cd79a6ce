package work.lcod.dispatch.runtime;

/**
 * Body of a command. Asynchronous commands return a {@link java.util.concurrent.CompletionStage}.
 */
@FunctionalInterface
public interface CommandHandler {
    Object invoke(CommandContext ctx, CommandArguments args) throws Exception;
}
