package app.zenjin.sequencing.session;

import app.zenjin.sequencing.common.AlreadyInitializedException;
import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.InvalidInputException;
import app.zenjin.sequencing.common.NotFoundException;
import app.zenjin.sequencing.content.FactRepository;
import app.zenjin.sequencing.content.PathDefinition;
import app.zenjin.sequencing.content.StitchContentProvider;
import app.zenjin.sequencing.content.StitchDefinition;
import app.zenjin.sequencing.helix.HelixSnapshot;
import app.zenjin.sequencing.helix.LearningPath;
import app.zenjin.sequencing.helix.PathRotator;
import app.zenjin.sequencing.helix.PathSeed;
import app.zenjin.sequencing.helix.RotationResult;
import app.zenjin.sequencing.helix.TripleHelixState;
import app.zenjin.sequencing.mastery.AnswerPerformance;
import app.zenjin.sequencing.mastery.BoundaryLevel;
import app.zenjin.sequencing.mastery.BoundaryTracker;
import app.zenjin.sequencing.mastery.BoundaryUpdate;
import app.zenjin.sequencing.mastery.UserFactMastery;
import app.zenjin.sequencing.queue.QueuedStitch;
import app.zenjin.sequencing.queue.RepositionEngine;
import app.zenjin.sequencing.queue.RepositionResult;
import app.zenjin.sequencing.queue.StitchPerformance;
import app.zenjin.sequencing.queue.StitchPosition;
import app.zenjin.sequencing.queue.StitchProgress;
import app.zenjin.sequencing.queue.StitchQueue;
import app.zenjin.sequencing.queue.StitchQueueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Entry point for hosts. Combines mastery tracking, stitch repositioning and path
 * rotation into per-learner operations, each applied completely or not at all.
 */
@Service
public class SequencingFacade {

    private static final Logger log = LoggerFactory.getLogger(SequencingFacade.class);

    private final BoundaryTracker tracker;
    private final RepositionEngine engine;
    private final PathRotator rotator;
    private final FactRepository facts;
    private final StitchContentProvider content;
    private final LearnerStateRegistry registry;
    private final SessionProps props;
    private final Clock clock;

    public SequencingFacade(BoundaryTracker tracker,
                            RepositionEngine engine,
                            PathRotator rotator,
                            FactRepository facts,
                            StitchContentProvider content,
                            LearnerStateRegistry registry,
                            SessionProps props,
                            Clock clock) {
        this.tracker = tracker;
        this.engine = engine;
        this.rotator = rotator;
        this.facts = facts;
        this.content = content;
        this.registry = registry;
        this.props = props;
        this.clock = clock;
    }

    public LearnerSnapshot initializeUser(String userId) {
        return initializeUser(userId, props.defaultDifficulty());
    }

    /**
     * Seeds queues, mastery records and the helix for a new learner from the curriculum.
     * The state is assembled off to the side and registered only once every step passed.
     */
    public LearnerSnapshot initializeUser(String userId, int initialDifficulty) {
        requireUserId(userId);
        if (registry.contains(userId)) {
            throw new AlreadyInitializedException("User already initialized: " + userId);
        }

        List<PathDefinition> paths = content.pathsFor(userId);
        if (paths == null || paths.size() != TripleHelixState.PATH_COUNT) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                    "Curriculum must provide exactly " + TripleHelixState.PATH_COUNT + " paths for user " + userId);
        }

        LearnerState state = new LearnerState(userId);
        Set<String> factIds = new LinkedHashSet<>();
        List<PathSeed> seeds = new ArrayList<>();
        for (PathDefinition path : paths) {
            if (path.stitches().isEmpty()) {
                throw new NotFoundException(ErrorCode.NO_STITCHES_AVAILABLE, "Path " + path.pathId() + " has no stitches");
            }
            List<QueuedStitch> queued = new ArrayList<>();
            for (StitchDefinition stitch : path.stitches()) {
                if (stitch.factIds().isEmpty()) {
                    throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                            "Stitch " + stitch.stitchId() + " of path " + path.pathId() + " has no facts");
                }
                stitch.factIds().forEach(facts::getFactById);
                factIds.addAll(stitch.factIds());
                queued.add(new QueuedStitch(stitch.stitchId(), stitch.primaryFactId()));
            }
            StitchQueue queue = engine.initializePath(state.queues(), path.pathId(), queued);
            seeds.add(new PathSeed(
                    path.pathId(),
                    path.name(),
                    path.description(),
                    stitchIdAt(queue, 0),
                    stitchIdAt(queue, 1)
            ));
        }
        factIds.forEach(factId -> tracker.initialize(state.mastery(), factId));
        rotator.initialize(state.helix(), seeds, initialDifficulty);

        registry.register(state);
        log.info("Learner initialized userId={} paths={} facts={} difficulty={}",
                userId, seeds.size(), factIds.size(), initialDifficulty);
        return snapshotOf(state);
    }

    public QuestionSource nextQuestionSource(String userId) {
        return locked(userId, state -> {
            LearningPath active = rotator.getActive(state.helix());
            QueuedStitch stitch = engine.front(state.queues(), active.pathId());
            int level = tracker.getLevel(state.mastery(), stitch.primaryFactId());
            return new QuestionSource(active.pathId(), stitch.stitchId(), stitch.primaryFactId(), level, active.difficulty());
        });
    }

    /**
     * Applies one answer: updates the fact's boundary level, moves the stitch back in its
     * queue, and re-points the path at the new queue head. If any step fails, the learner's
     * state is left exactly as it was before the call.
     */
    public AnswerOutcome recordAnswer(String userId,
                                      String pathId,
                                      String stitchId,
                                      String factId,
                                      AnswerPerformance performance) {
        return locked(userId, state -> {
            facts.getFactById(factId);
            rotator.getPath(state.helix(), pathId);
            requireStitchInPath(state, pathId, stitchId);
            if (performance == null) {
                throw new InvalidInputException(ErrorCode.INVALID_PERFORMANCE_DATA, "Performance data is required");
            }

            Checkpoint checkpoint = checkpoint(state, factId);
            try {
                if (!state.mastery().contains(factId)) {
                    tracker.initialize(state.mastery(), factId);
                }
                BoundaryUpdate update = tracker.update(state.mastery(), factId, performance);
                RepositionResult moved = engine.repositionAfterAnswer(state.queues(), pathId, stitchId,
                        performance.correctFirstAttempt(), performance.responseTimeMs());
                syncPointers(state, pathId);

                return new AnswerOutcome(
                        pathId,
                        stitchId,
                        factId,
                        update.previousLevel(),
                        update.newLevel(),
                        update.changed(),
                        update.masteryScore(),
                        moved.previousPosition(),
                        moved.newPosition(),
                        moved.skipNumber()
                );
            } catch (RuntimeException ex) {
                rollback(state, checkpoint);
                log.warn("Answer rejected userId={} pathId={} stitchId={} factId={}: {}",
                        userId, pathId, stitchId, factId, ex.getMessage());
                throw ex;
            }
        });
    }

    public RepositionResult recordStitchCompletion(String userId,
                                                   String pathId,
                                                   String stitchId,
                                                   StitchPerformance performance) {
        return locked(userId, state -> {
            rotator.getPath(state.helix(), pathId);
            requireStitchInPath(state, pathId, stitchId);

            Checkpoint checkpoint = checkpoint(state, null);
            try {
                RepositionResult result = engine.reposition(state.queues(), pathId, stitchId, performance);
                syncPointers(state, pathId);
                log.debug("Stitch completed userId={} pathId={} stitchId={} skip={}",
                        userId, pathId, stitchId, result.skipNumber());
                return result;
            } catch (RuntimeException ex) {
                rollback(state, checkpoint);
                throw ex;
            }
        });
    }

    /**
     * Rotates when the trigger calls for it. Question-count triggers rotate only on a
     * positive multiple of {@code app.sequencing.session.rotate-every-questions}.
     */
    public Optional<RotationResult> maybeRotate(String userId, RotationTrigger trigger) {
        if (trigger == null || trigger.reason() == null) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT, "Rotation trigger is required");
        }
        if (trigger.answeredSinceRotation() < 0) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                    "answeredSinceRotation must not be negative: " + trigger.answeredSinceRotation());
        }
        boolean due = switch (trigger.reason()) {
            case MANUAL, STITCH_COMPLETED -> true;
            case QUESTION_COUNT -> trigger.answeredSinceRotation() > 0
                    && trigger.answeredSinceRotation() % props.rotateEveryQuestions() == 0;
        };
        if (!due) {
            registry.require(userId);
            return Optional.empty();
        }
        return Optional.of(rotate(userId));
    }

    public RotationResult rotate(String userId) {
        return locked(userId, state -> {
            HelixSnapshot before = state.helix().snapshot();
            try {
                RotationResult result = rotator.rotate(state.helix());
                syncPointers(state, result.previousActive().pathId());
                syncPointers(state, result.newActive().pathId());
                return new RotationResult(
                        rotator.getPath(state.helix(), result.previousActive().pathId()),
                        rotator.getPath(state.helix(), result.newActive().pathId()),
                        result.rotationCount(),
                        result.rotatedAt()
                );
            } catch (RuntimeException ex) {
                rotator.restore(state.helix(), before);
                throw ex;
            }
        });
    }

    public LearningPath setPathDifficulty(String userId, String pathId, int difficulty) {
        return locked(userId, state -> rotator.setDifficulty(state.helix(), pathId, difficulty));
    }

    public LearnerSnapshot getState(String userId) {
        return locked(userId, state -> snapshotOf(state));
    }

    /**
     * Replaces the learner's in-memory state with an exported snapshot. The snapshot is
     * checked in full before anything the learner can see changes.
     */
    public void loadState(LearnerSnapshot snapshot) {
        if (snapshot == null) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "Snapshot is required");
        }
        requireUserId(snapshot.userId());
        if (snapshot.mastery() == null || snapshot.queues() == null || snapshot.helix() == null) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                    "Snapshot of user " + snapshot.userId() + " is missing mastery, queues or helix");
        }

        LearnerState state = new LearnerState(snapshot.userId());
        tracker.restore(state.mastery(), snapshot.mastery());
        engine.restore(state.queues(), snapshot.queues());
        rotator.restore(state.helix(), snapshot.helix());

        Set<String> helixPaths = new HashSet<>();
        state.helix().paths().forEach(p -> helixPaths.add(p.pathId()));
        if (!helixPaths.equals(new HashSet<>(state.queues().pathIds()))) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                    "Queues of user " + snapshot.userId() + " do not match the helix paths " + helixPaths);
        }

        for (StitchQueueSnapshot queue : snapshot.queues()) {
            for (QueuedStitch stitch : queue.stitches()) {
                if (!state.mastery().contains(stitch.primaryFactId())) {
                    throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                            "No mastery record for fact " + stitch.primaryFactId() + " of queued stitch " + stitch.stitchId());
                }
            }
        }

        install(state);
        log.info("Learner state loaded userId={} facts={} rotationCount={}",
                snapshot.userId(), snapshot.mastery().size(), snapshot.helix().rotationCount());
    }

    /**
     * Drops the learner from memory. Waits for a call already running for that learner.
     */
    public boolean evict(String userId) {
        while (true) {
            Optional<LearnerState> current = registry.find(userId);
            if (current.isEmpty()) {
                return false;
            }
            LearnerState old = current.get();
            boolean removed = old.withLock(() -> {
                if (old.isRetired() || !registry.remove(old)) {
                    return false;
                }
                old.retire();
                return true;
            });
            if (removed) {
                log.info("Learner evicted userId={}", userId);
                return true;
            }
        }
    }

    public List<StitchPosition> getStitchQueue(String userId, String pathId) {
        return locked(userId, state -> engine.positions(state.queues(), pathId));
    }

    public List<RepositionResult> getRepositioningHistory(String userId, String stitchId, Integer limit) {
        return locked(userId, state -> engine.history(state.queues(), stitchId, limit));
    }

    public StitchProgress getStitchProgress(String userId, String stitchId) {
        return locked(userId, state -> engine.progress(state.queues(), stitchId));
    }

    public UserFactMastery getMastery(String userId, String factId) {
        return locked(userId, state -> tracker.getMastery(state.mastery(), factId));
    }

    public BoundaryLevel describeLevel(int level) {
        return tracker.describe(level);
    }

    /**
     * Runs an action under the learner's lock. A state retired while the caller waited
     * for the lock is looked up again, so no write lands on a discarded state.
     */
    private <T> T locked(String userId, Function<LearnerState, T> action) {
        while (true) {
            LearnerState state = registry.require(userId);
            Optional<T> result = state.withLock(() -> state.isRetired()
                    ? Optional.<T>empty()
                    : Optional.of(action.apply(state)));
            if (result.isPresent()) {
                return result.get();
            }
        }
    }

    /**
     * Puts a loaded state in place of the current one, after any running call for the
     * learner has finished.
     */
    private void install(LearnerState fresh) {
        while (true) {
            Optional<LearnerState> current = registry.find(fresh.userId());
            if (current.isEmpty()) {
                if (registry.add(fresh)) {
                    return;
                }
                continue;
            }
            LearnerState old = current.get();
            boolean swapped = old.withLock(() -> {
                if (old.isRetired() || !registry.swap(old, fresh)) {
                    return false;
                }
                old.retire();
                return true;
            });
            if (swapped) {
                return;
            }
        }
    }

    private void syncPointers(LearnerState state, String pathId) {
        StitchQueue queue = state.queues().find(pathId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PATH_NOT_FOUND, "Learning path not found: " + pathId));
        rotator.trackQueueHead(state.helix(), pathId, stitchIdAt(queue, 0), stitchIdAt(queue, 1));
    }

    private static void requireStitchInPath(LearnerState state, String pathId, String stitchId) {
        boolean queued = state.queues().find(pathId)
                .map(q -> q.contains(stitchId))
                .orElse(false);
        if (!queued) {
            throw new NotFoundException(ErrorCode.STITCH_NOT_FOUND,
                    "Stitch " + stitchId + " not found in path " + pathId + " for user " + state.userId());
        }
    }

    private static String stitchIdAt(StitchQueue queue, int position) {
        return queue.at(position).map(QueuedStitch::stitchId).orElse(null);
    }

    private LearnerSnapshot snapshotOf(LearnerState state) {
        return new LearnerSnapshot(
                state.userId(),
                state.mastery().records(),
                engine.snapshot(state.queues()),
                state.helix().snapshot(),
                clock.instant()
        );
    }

    private Checkpoint checkpoint(LearnerState state, String factId) {
        Optional<UserFactMastery> mastery = factId == null ? Optional.empty() : state.mastery().find(factId);
        return new Checkpoint(factId, mastery, engine.snapshot(state.queues()), state.helix().snapshot());
    }

    private void rollback(LearnerState state, Checkpoint checkpoint) {
        if (checkpoint.factId() != null) {
            tracker.revert(state.mastery(), checkpoint.factId(), checkpoint.mastery());
        }
        engine.restore(state.queues(), checkpoint.queues());
        rotator.restore(state.helix(), checkpoint.helix());
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT, "User id is required");
        }
    }

    private record Checkpoint(
            String factId,
            Optional<UserFactMastery> mastery,
            List<StitchQueueSnapshot> queues,
            HelixSnapshot helix
    ) {
    }
}
