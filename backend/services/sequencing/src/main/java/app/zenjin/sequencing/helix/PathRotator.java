package app.zenjin.sequencing.helix;

import app.zenjin.sequencing.common.AlreadyInitializedException;
import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.InvalidInputException;
import app.zenjin.sequencing.common.InvariantViolationException;
import app.zenjin.sequencing.common.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps exactly one of a user's three paths active while the other two prepare, and
 * hands the active role on round-robin: the preparing path that has waited the most
 * rotations goes next.
 */
@Service
public class PathRotator {

    private static final Logger log = LoggerFactory.getLogger(PathRotator.class);

    public static final int MIN_DIFFICULTY = 1;
    public static final int MAX_DIFFICULTY = 5;

    private final Clock clock;

    public PathRotator(Clock clock) {
        this.clock = clock;
    }

    public TripleHelixState initialize(TripleHelixState state, List<PathSeed> seeds) {
        return initialize(state, seeds, MIN_DIFFICULTY);
    }

    public TripleHelixState initialize(TripleHelixState state, List<PathSeed> seeds, int initialDifficulty) {
        validateDifficulty(initialDifficulty);
        if (state.isInitialized()) {
            throw new AlreadyInitializedException("Triple helix already initialized for user: " + state.userId());
        }
        if (seeds == null || seeds.size() != TripleHelixState.PATH_COUNT) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                    "Exactly " + TripleHelixState.PATH_COUNT + " paths are required, got "
                            + (seeds == null ? 0 : seeds.size()));
        }
        Set<String> ids = new HashSet<>();
        for (PathSeed seed : seeds) {
            if (seed == null || seed.pathId() == null || seed.pathId().isBlank() || !ids.add(seed.pathId())) {
                throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT, "Path ids must be present and distinct");
            }
        }

        List<LearningPath> paths = new ArrayList<>(TripleHelixState.PATH_COUNT);
        for (int i = 0; i < seeds.size(); i++) {
            PathSeed seed = seeds.get(i);
            if (i == 0) {
                paths.add(new LearningPath(seed.pathId(), seed.name(), seed.description(), PathStatus.ACTIVE,
                        seed.headStitchId(), seed.followingStitchId(), initialDifficulty, 0));
            } else {
                // slot 2 starts one rotation "older" so the first rotation has a definite winner
                paths.add(new LearningPath(seed.pathId(), seed.name(), seed.description(), PathStatus.PREPARING,
                        null, seed.headStitchId(), initialDifficulty, i - 1));
            }
        }
        commit(state, paths, 0, null);
        log.info("Triple helix initialized userId={} active={} difficulty={}",
                state.userId(), paths.get(0).pathId(), initialDifficulty);
        return state;
    }

    public LearningPath getActive(TripleHelixState state) {
        return requireInitialized(state).paths().stream()
                .filter(LearningPath::isActive)
                .findFirst()
                .orElseThrow(() -> new NotFoundException(ErrorCode.NO_ACTIVE_PATH,
                        "No active learning path exists for user: " + state.userId()));
    }

    public List<LearningPath> getPreparing(TripleHelixState state) {
        return requireInitialized(state).paths().stream()
                .filter(p -> !p.isActive())
                .toList();
    }

    public LearningPath getPath(TripleHelixState state, String pathId) {
        return requireInitialized(state).paths().get(slotOf(state, pathId));
    }

    public RotationResult rotate(TripleHelixState state) {
        List<LearningPath> paths = new ArrayList<>(requireInitialized(state).paths());
        int activeSlot = -1;
        int nextSlot = -1;
        for (int i = 0; i < paths.size(); i++) {
            LearningPath p = paths.get(i);
            if (p.isActive()) {
                activeSlot = i;
            } else if (nextSlot < 0 || p.rotationsSinceActive() > paths.get(nextSlot).rotationsSinceActive()) {
                nextSlot = i;
            }
        }
        if (activeSlot < 0) {
            throw new NotFoundException(ErrorCode.NO_ACTIVE_PATH, "No active learning path exists for user: " + state.userId());
        }

        LearningPath previousActive = paths.get(activeSlot);
        for (int i = 0; i < paths.size(); i++) {
            if (i == activeSlot) {
                paths.set(i, previousActive.deactivate());
            } else if (i == nextSlot) {
                paths.set(i, paths.get(i).activate());
            } else {
                paths.set(i, paths.get(i).waitedOneMoreRotation());
            }
        }

        Instant now = clock.instant();
        long rotationCount = state.rotationCount() + 1;
        commit(state, paths, rotationCount, now);

        RotationResult result = new RotationResult(paths.get(activeSlot), paths.get(nextSlot), rotationCount, now);
        log.info("Learning paths rotated userId={} from={} to={} rotationCount={}",
                state.userId(), previousActive.pathId(), result.newActive().pathId(), rotationCount);
        return result;
    }

    public LearningPath setDifficulty(TripleHelixState state, String pathId, int newDifficulty) {
        validateDifficulty(newDifficulty);
        int slot = slotOf(requireInitialized(state), pathId);
        List<LearningPath> paths = new ArrayList<>(state.paths());
        LearningPath updated = paths.get(slot).withDifficulty(newDifficulty);
        paths.set(slot, updated);
        commit(state, paths, state.rotationCount(), state.lastRotationAt());
        return updated;
    }

    /**
     * Points a path at the stitches now at the front of its queue. The active path serves
     * {@code head} and has {@code following} lined up; a preparing path has {@code head}
     * lined up for when it becomes active.
     */
    public LearningPath trackQueueHead(TripleHelixState state, String pathId, String head, String following) {
        int slot = slotOf(requireInitialized(state), pathId);
        List<LearningPath> paths = new ArrayList<>(state.paths());
        LearningPath path = paths.get(slot);
        LearningPath updated = path.isActive()
                ? path.withPointers(head, following)
                : path.withPointers(null, head);
        paths.set(slot, updated);
        commit(state, paths, state.rotationCount(), state.lastRotationAt());
        return updated;
    }

    public void restore(TripleHelixState state, HelixSnapshot snapshot) {
        if (snapshot == null || snapshot.paths() == null || snapshot.paths().size() != TripleHelixState.PATH_COUNT) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                    "Helix snapshot must hold exactly " + TripleHelixState.PATH_COUNT + " paths");
        }
        if (!state.userId().equals(snapshot.userId())) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                    "Helix snapshot of user " + snapshot.userId() + " cannot be loaded for " + state.userId());
        }
        if (snapshot.rotationCount() < 0) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "rotationCount must not be negative");
        }
        Set<String> ids = new HashSet<>();
        long active = 0;
        for (LearningPath p : snapshot.paths()) {
            if (p == null || p.pathId() == null || p.status() == null || !ids.add(p.pathId())
                    || p.difficulty() < MIN_DIFFICULTY || p.difficulty() > MAX_DIFFICULTY
                    || p.rotationsSinceActive() < 0) {
                throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "Invalid path in helix snapshot");
            }
            if (p.isActive()) active++;
        }
        if (active != 1) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                    "Helix snapshot must have exactly one active path, found " + active);
        }
        state.apply(snapshot.paths(), snapshot.rotationCount(), snapshot.lastRotationAt());
    }

    private void commit(TripleHelixState state, List<LearningPath> paths, long rotationCount, Instant lastRotationAt) {
        long active = paths.stream().filter(LearningPath::isActive).count();
        if (paths.size() != TripleHelixState.PATH_COUNT || active != 1) {
            log.error("Helix invariant broken userId={} paths={} active={}", state.userId(), paths.size(), active);
            throw new InvariantViolationException(ErrorCode.HELIX_INVARIANT_BROKEN,
                    "Helix of user " + state.userId() + " must have exactly one active path of three");
        }
        state.apply(paths, rotationCount, lastRotationAt);
    }

    private static TripleHelixState requireInitialized(TripleHelixState state) {
        if (!state.isInitialized()) {
            throw new NotFoundException(ErrorCode.NO_TRIPLE_HELIX_STATE, "No triple helix exists for user: " + state.userId());
        }
        return state;
    }

    private static int slotOf(TripleHelixState state, String pathId) {
        List<LearningPath> paths = state.paths();
        for (int i = 0; i < paths.size(); i++) {
            if (paths.get(i).pathId().equals(pathId)) return i;
        }
        throw new NotFoundException(ErrorCode.PATH_NOT_FOUND, "Learning path not found: " + pathId + " for user: " + state.userId());
    }

    private static void validateDifficulty(int difficulty) {
        if (difficulty < MIN_DIFFICULTY || difficulty > MAX_DIFFICULTY) {
            throw new InvalidInputException(ErrorCode.INVALID_DIFFICULTY,
                    "Invalid difficulty level: " + difficulty + ". Must be between " + MIN_DIFFICULTY + " and " + MAX_DIFFICULTY);
        }
    }
}
