package app.zenjin.sequencing.common;

/**
 * Internal consistency failure. Never caused by caller input; the operation that raised
 * it has not mutated any state.
 */
public class InvariantViolationException extends IllegalStateException implements SequencingFailure {

    private final ErrorCode code;

    public InvariantViolationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    @Override
    public ErrorCode code() {
        return code;
    }
}
