package app.zenjin.sequencing.queue;

public record StitchPosition(
        String userId,
        String pathId,
        String stitchId,
        int position
) {
}
