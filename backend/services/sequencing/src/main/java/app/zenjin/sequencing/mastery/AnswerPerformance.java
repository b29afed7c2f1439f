package app.zenjin.sequencing.mastery;

/**
 * Outcome of a single answered question.
 *
 * @param consecutiveCorrect streak as counted by the caller; optional and only validated,
 *                           the tracker keeps its own authoritative streak
 */
public record AnswerPerformance(
        boolean correctFirstAttempt,
        long responseTimeMs,
        Integer consecutiveCorrect
) {
    public static AnswerPerformance correct(long responseTimeMs) {
        return new AnswerPerformance(true, responseTimeMs, null);
    }

    public static AnswerPerformance incorrect(long responseTimeMs) {
        return new AnswerPerformance(false, responseTimeMs, null);
    }
}
