package app.zenjin.sequencing.common;

public class AlreadyInitializedException extends IllegalStateException implements SequencingFailure {

    public AlreadyInitializedException(String message) {
        super(message);
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.ALREADY_INITIALIZED;
    }
}
