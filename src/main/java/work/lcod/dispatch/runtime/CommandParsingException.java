package work.lcod.dispatch.runtime;

import java.util.List;
import work.lcod.dispatch.convert.ValueType;

/**
 * Raised while binding input to a handler's parameters. Carries the offending tokens and the
 * target type when a conversion failed.
 */
public final class CommandParsingException extends RuntimeException {
    private final ParserFailReason reason;
    private final List<String> tokens;
    private final ValueType<?> targetType;

    public CommandParsingException(ParserFailReason reason, String message) {
        this(reason, message, List.of(), null, null);
    }

    public CommandParsingException(
        ParserFailReason reason,
        String message,
        List<String> tokens,
        ValueType<?> targetType,
        Throwable cause
    ) {
        super(message, cause);
        this.reason = reason;
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.targetType = targetType;
    }

    public ParserFailReason reason() {
        return reason;
    }

    public List<String> tokens() {
        return tokens;
    }

    public ValueType<?> targetType() {
        return targetType;
    }
}
