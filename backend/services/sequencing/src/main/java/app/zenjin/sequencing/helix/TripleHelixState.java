package app.zenjin.sequencing.helix;

import java.time.Instant;
import java.util.List;

/**
 * The three learning paths of one user. Starts out empty; {@link PathRotator} fills it
 * once and is the only writer afterwards.
 */
public final class TripleHelixState {

    public static final int PATH_COUNT = 3;

    private final String userId;
    private List<LearningPath> paths = List.of();
    private long rotationCount;
    private Instant lastRotationAt;

    public TripleHelixState(String userId) {
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }

    public boolean isInitialized() {
        return !paths.isEmpty();
    }

    public List<LearningPath> paths() {
        return paths;
    }

    public long rotationCount() {
        return rotationCount;
    }

    public Instant lastRotationAt() {
        return lastRotationAt;
    }

    public HelixSnapshot snapshot() {
        return new HelixSnapshot(userId, paths, rotationCount, lastRotationAt);
    }

    void apply(List<LearningPath> newPaths, long newRotationCount, Instant newLastRotationAt) {
        this.paths = List.copyOf(newPaths);
        this.rotationCount = newRotationCount;
        this.lastRotationAt = newLastRotationAt;
    }
}
