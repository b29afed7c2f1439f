package app.zenjin.sequencing.helix;

import java.time.Instant;

public record RotationResult(
        LearningPath previousActive,
        LearningPath newActive,
        long rotationCount,
        Instant rotatedAt
) {
}
