package app.zenjin.sequencing.common;

public enum ErrorCategory {
    NOT_FOUND,
    INVALID_INPUT,
    ALREADY_INITIALIZED,
    INVARIANT_VIOLATION
}
