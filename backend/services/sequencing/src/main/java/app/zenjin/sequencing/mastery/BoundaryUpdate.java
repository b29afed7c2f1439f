package app.zenjin.sequencing.mastery;

public record BoundaryUpdate(
        String factId,
        int previousLevel,
        int newLevel,
        boolean changed,
        double masteryScore,
        int consecutiveCorrect
) {
}
