package app.zenjin.sequencing.common;

public class InvalidInputException extends IllegalArgumentException implements SequencingFailure {

    private final ErrorCode code;

    public InvalidInputException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public InvalidInputException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public ErrorCode code() {
        return code;
    }
}
