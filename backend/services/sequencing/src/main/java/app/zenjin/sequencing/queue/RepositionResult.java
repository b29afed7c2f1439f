package app.zenjin.sequencing.queue;

import java.time.Instant;

public record RepositionResult(
        String stitchId,
        String pathId,
        int previousPosition,
        int newPosition,
        int skipNumber,
        Instant timestamp
) {
}
