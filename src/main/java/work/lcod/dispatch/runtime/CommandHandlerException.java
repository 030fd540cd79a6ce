package work.lcod.dispatch.runtime;

/**
 * Wraps anything a command handler threw, including the failure of an asynchronous handler's
 * completion stage.
 */
public final class CommandHandlerException extends RuntimeException {
    private final String command;

    public CommandHandlerException(String command, Throwable cause) {
        super(describe(command, cause), cause);
        this.command = command;
    }

    public CommandHandlerException(String command, String message) {
        super("Command '" + command + "' failed: " + message);
        this.command = command;
    }

    public String command() {
        return command;
    }

    private static String describe(String command, Throwable cause) {
        String detail = cause == null ? null : cause.getMessage();
        if (detail == null || detail.isBlank()) {
            detail = cause == null ? "unknown error" : cause.getClass().getSimpleName();
        }
        return "Command '" + command + "' failed: " + detail;
    }
}
