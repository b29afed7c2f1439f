package app.zenjin.sequencing.queue;

import java.time.Instant;

/**
 * Performance over one pass through a stitch.
 *
 * @param completedAt optional; the engine clock is used when absent
 */
public record StitchPerformance(
        int correctCount,
        int totalCount,
        long averageResponseTimeMs,
        Instant completedAt
) {
    public StitchPerformance(int correctCount, int totalCount, long averageResponseTimeMs) {
        this(correctCount, totalCount, averageResponseTimeMs, null);
    }

    public static StitchPerformance ofAnswer(boolean correct, long responseTimeMs) {
        return new StitchPerformance(correct ? 1 : 0, 1, responseTimeMs, null);
    }

    public double accuracy() {
        return totalCount == 0 ? 0.0 : (double) correctCount / totalCount;
    }
}
