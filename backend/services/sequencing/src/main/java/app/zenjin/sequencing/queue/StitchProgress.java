package app.zenjin.sequencing.queue;

import java.time.Instant;

/**
 * Running totals of a user's work on one stitch. Answers add to the counts; only whole
 * passes through the stitch add to {@code completionCount}.
 *
 * @param totalResponseTimeMs sum of response times over all {@code totalCount} questions
 */
public record StitchProgress(
        String stitchId,
        String pathId,
        int completionCount,
        int correctCount,
        int totalCount,
        long totalResponseTimeMs,
        Instant lastAttemptAt
) {
    public static StitchProgress empty(String stitchId, String pathId) {
        return new StitchProgress(stitchId, pathId, 0, 0, 0, 0L, null);
    }

    public double accuracy() {
        return totalCount == 0 ? 0.0 : (double) correctCount / totalCount;
    }

    public long averageResponseTimeMs() {
        return totalCount == 0 ? 0L : Math.max(1L, Math.round((double) totalResponseTimeMs / totalCount));
    }

    boolean isConsistent() {
        return stitchId != null && pathId != null
                && completionCount >= 0 && correctCount >= 0 && totalCount >= 0
                && correctCount <= totalCount && totalResponseTimeMs >= 0;
    }

    StitchProgress plus(StitchPerformance pass, boolean completed, Instant at) {
        return new StitchProgress(
                stitchId,
                pathId,
                completed ? completionCount + 1 : completionCount,
                correctCount + pass.correctCount(),
                totalCount + pass.totalCount(),
                totalResponseTimeMs + pass.averageResponseTimeMs() * pass.totalCount(),
                at
        );
    }

    /**
     * The accumulated record, in the form the skip formula takes.
     */
    StitchPerformance asPerformance(Instant completedAt) {
        return new StitchPerformance(correctCount, totalCount, averageResponseTimeMs(), completedAt);
    }
}
