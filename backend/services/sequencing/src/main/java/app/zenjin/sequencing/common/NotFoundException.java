package app.zenjin.sequencing.common;

import java.util.NoSuchElementException;

public class NotFoundException extends NoSuchElementException implements SequencingFailure {

    private final ErrorCode code;

    public NotFoundException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    @Override
    public ErrorCode code() {
        return code;
    }
}
