package work.lcod.dispatch.runtime;

/**
 * Why binding a command's arguments failed.
 */
public enum ParserFailReason {
    /** Null input reached the binder. */
    INVALID_ARGUMENTS,
    /** A converter or fallback factory could not build a parameter value. */
    PARSING_FAILED
}
