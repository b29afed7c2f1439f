package app.zenjin.sequencing.session;

public record AnswerOutcome(
        String pathId,
        String stitchId,
        String factId,
        int previousLevel,
        int newLevel,
        boolean changed,
        double masteryScore,
        int previousPosition,
        int newPosition,
        int skipNumber
) {
}
