package app.zenjin.sequencing.helix;

import java.time.Instant;
import java.util.List;

public record HelixSnapshot(
        String userId,
        List<LearningPath> paths,
        long rotationCount,
        Instant lastRotationAt
) {
}
