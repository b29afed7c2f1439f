package app.zenjin.sequencing.session;

public record QuestionSource(
        String pathId,
        String stitchId,
        String factId,
        int boundaryLevel,
        int difficulty
) {
}
