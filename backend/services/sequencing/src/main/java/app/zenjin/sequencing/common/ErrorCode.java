package app.zenjin.sequencing.common;

public enum ErrorCode {
    USER_NOT_FOUND(ErrorCategory.NOT_FOUND),
    FACT_NOT_FOUND(ErrorCategory.NOT_FOUND),
    STITCH_NOT_FOUND(ErrorCategory.NOT_FOUND),
    PATH_NOT_FOUND(ErrorCategory.NOT_FOUND),
    NO_MASTERY_DATA(ErrorCategory.NOT_FOUND),
    NO_ACTIVE_PATH(ErrorCategory.NOT_FOUND),
    NO_TRIPLE_HELIX_STATE(ErrorCategory.NOT_FOUND),
    NO_STITCHES_AVAILABLE(ErrorCategory.NOT_FOUND),

    INVALID_LEVEL(ErrorCategory.INVALID_INPUT),
    INVALID_DIFFICULTY(ErrorCategory.INVALID_INPUT),
    INVALID_PERFORMANCE_DATA(ErrorCategory.INVALID_INPUT),
    INVALID_SNAPSHOT(ErrorCategory.INVALID_INPUT),
    INVALID_ARGUMENT(ErrorCategory.INVALID_INPUT),

    ALREADY_INITIALIZED(ErrorCategory.ALREADY_INITIALIZED),

    QUEUE_INVARIANT_BROKEN(ErrorCategory.INVARIANT_VIOLATION),
    HELIX_INVARIANT_BROKEN(ErrorCategory.INVARIANT_VIOLATION),
    MASTERY_INVARIANT_BROKEN(ErrorCategory.INVARIANT_VIOLATION);

    private final ErrorCategory category;
    ErrorCode(ErrorCategory category) { this.category = category; }
    public ErrorCategory category() { return category; }
}
