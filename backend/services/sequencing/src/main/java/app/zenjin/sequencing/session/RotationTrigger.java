package app.zenjin.sequencing.session;

/**
 * Why the host is asking for a rotation.
 *
 * @param answeredSinceRotation questions answered on the active path since the last
 *                              rotation, as counted by the host
 */
public record RotationTrigger(Reason reason, int answeredSinceRotation) {

    public enum Reason {
        MANUAL,
        STITCH_COMPLETED,
        QUESTION_COUNT
    }

    public static RotationTrigger manual() {
        return new RotationTrigger(Reason.MANUAL, 0);
    }

    public static RotationTrigger stitchCompleted() {
        return new RotationTrigger(Reason.STITCH_COMPLETED, 0);
    }

    public static RotationTrigger afterQuestions(int answeredSinceRotation) {
        return new RotationTrigger(Reason.QUESTION_COUNT, answeredSinceRotation);
    }
}
