package app.zenjin.sequencing.common;

/**
 * Common view over the engine's exceptions. Each failure extends the JDK exception
 * matching its category, so callers may catch either the typed failure or the JDK type.
 */
public interface SequencingFailure {

    ErrorCode code();

    default ErrorCategory category() {
        return code().category();
    }
}
