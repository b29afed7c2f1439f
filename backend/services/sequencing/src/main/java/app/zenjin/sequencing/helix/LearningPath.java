package app.zenjin.sequencing.helix;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One strand of the triple helix. {@code currentStitchId} is set while the path is
 * active; {@code nextStitchId} names the stitch lined up to be served next.
 */
public record LearningPath(
        String pathId,
        String name,
        String description,
        PathStatus status,
        String currentStitchId,
        String nextStitchId,
        int difficulty,
        int rotationsSinceActive
) {
    @JsonIgnore
    public boolean isActive() {
        return status == PathStatus.ACTIVE;
    }

    LearningPath activate() {
        return new LearningPath(pathId, name, description, PathStatus.ACTIVE,
                nextStitchId != null ? nextStitchId : currentStitchId, null, difficulty, 0);
    }

    LearningPath deactivate() {
        return new LearningPath(pathId, name, description, PathStatus.PREPARING,
                null, currentStitchId != null ? currentStitchId : nextStitchId, difficulty, 0);
    }

    LearningPath waitedOneMoreRotation() {
        return new LearningPath(pathId, name, description, status,
                currentStitchId, nextStitchId, difficulty, rotationsSinceActive + 1);
    }

    LearningPath withDifficulty(int newDifficulty) {
        return new LearningPath(pathId, name, description, status,
                currentStitchId, nextStitchId, newDifficulty, rotationsSinceActive);
    }

    LearningPath withPointers(String current, String next) {
        return new LearningPath(pathId, name, description, status, current, next, difficulty, rotationsSinceActive);
    }
}
