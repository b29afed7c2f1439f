package app.zenjin.sequencing.queue;

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
import java.util.Map;
import java.util.Set;

/**
 * Stitch repositioning for spaced repetition. A stitch that was just worked on moves
 * back in its path queue by a skip number that grows with accuracy and speed, so well
 * known material comes round less often.
 * <p>
 * Every change to a queue is made on a working copy, checked, and only then swapped in,
 * so a half-shifted queue is never visible.
 */
@Service
public class RepositionEngine {

    private static final Logger log = LoggerFactory.getLogger(RepositionEngine.class);

    private final RepositionProps props;
    private final Clock clock;

    public RepositionEngine(RepositionProps props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public int calculateSkip(StitchPerformance performance) {
        validate(performance);
        double ratio = performance.accuracy();
        double speedFactor = clamp(
                (double) props.expectedResponseTimeMs() / performance.averageResponseTimeMs(),
                props.minSpeedFactor(),
                props.maxSpeedFactor()
        );
        long raw = Math.round(props.baseSkip() * ratio * ratio * speedFactor);
        return (int) Math.max(props.minSkip(), raw);
    }

    /**
     * Skip number bounded by the queue: never more than {@code queueLength - 1}. A queue
     * of one stitch has nowhere to move it, so the skip is 0.
     */
    public int calculateSkip(StitchPerformance performance, int queueLength) {
        int skip = calculateSkip(performance);
        int maxSkip = queueLength - 1;
        if (maxSkip < props.minSkip()) {
            return Math.max(0, maxSkip);
        }
        return Math.min(skip, maxSkip);
    }

    /**
     * Moves a stitch back after a whole pass through it, by the skip that pass earned,
     * and adds the pass to the stitch's progress.
     */
    public RepositionResult reposition(UserQueues queues,
                                       String pathId,
                                       String stitchId,
                                       StitchPerformance performance) {
        validate(performance);
        StitchProgress before = currentProgress(queues, pathId, stitchId);
        RepositionResult result = move(queues, pathId, stitchId, performance);
        queues.putProgress(before.plus(performance, true, result.timestamp()));
        return result;
    }

    /**
     * Moves a stitch back after a single answer. The answer is added to the stitch's
     * progress first and the skip is taken from the accumulated record, so partial
     * correctness over many answers shortens the skip.
     */
    public RepositionResult repositionAfterAnswer(UserQueues queues,
                                                  String pathId,
                                                  String stitchId,
                                                  boolean correct,
                                                  long responseTimeMs) {
        StitchPerformance answer = StitchPerformance.ofAnswer(correct, responseTimeMs);
        validate(answer);
        Instant now = clock.instant();
        StitchProgress updated = currentProgress(queues, pathId, stitchId).plus(answer, false, now);
        RepositionResult result = move(queues, pathId, stitchId, updated.asPerformance(now));
        queues.putProgress(updated);
        return result;
    }

    public StitchProgress progress(UserQueues queues, String stitchId) {
        String pathId = queues.pathOf(stitchId).orElseThrow(() -> new NotFoundException(ErrorCode.STITCH_NOT_FOUND,
                "Stitch " + stitchId + " not found for user " + queues.userId()));
        return currentProgress(queues, pathId, stitchId);
    }

    private RepositionResult move(UserQueues queues, String pathId, String stitchId, StitchPerformance performance) {
        StitchQueue queue = require(queues, pathId);
        int previousPosition = queue.indexOf(stitchId);
        int skipNumber = calculateSkip(performance, queue.size());
        int newPosition = Math.min(previousPosition + skipNumber, queue.size() - 1);

        StitchQueue working = queue.copy();
        QueuedStitch moved = working.removeAt(previousPosition);
        working.insertAt(newPosition, moved);
        verify(queue, working, null);
        queue.adopt(working);

        Instant timestamp = performance.completedAt() != null ? performance.completedAt() : clock.instant();
        RepositionResult result = new RepositionResult(stitchId, pathId, previousPosition, newPosition, skipNumber, timestamp);
        queues.record(result, props.historyLimit());

        log.debug("Stitch repositioned userId={} pathId={} stitchId={} from={} to={} skip={}",
                queues.userId(), pathId, stitchId, previousPosition, newPosition, skipNumber);
        return result;
    }

    private static StitchProgress currentProgress(UserQueues queues, String pathId, String stitchId) {
        StitchQueue queue = require(queues, pathId);
        if (!queue.contains(stitchId)) {
            throw new NotFoundException(ErrorCode.STITCH_NOT_FOUND,
                    "Stitch " + stitchId + " not found in path " + pathId + " for user " + queues.userId());
        }
        return queues.progressOf(stitchId).orElseGet(() -> StitchProgress.empty(stitchId, pathId));
    }

    public StitchQueue initializePath(UserQueues queues, String pathId, List<QueuedStitch> stitches) {
        if (pathId == null || pathId.isBlank()) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT, "Path id is required");
        }
        if (queues.find(pathId).isPresent()) {
            throw new AlreadyInitializedException("Path " + pathId + " already has a queue for user " + queues.userId());
        }
        Set<String> ids = new HashSet<>();
        for (QueuedStitch stitch : stitches) {
            requireStitch(stitch);
            if (!ids.add(stitch.stitchId()) || queues.pathOf(stitch.stitchId()).isPresent()) {
                throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                        "Stitch " + stitch.stitchId() + " appears more than once for user " + queues.userId());
            }
        }
        StitchQueue queue = new StitchQueue(queues.userId(), pathId, stitches);
        queues.put(queue);
        return queue;
    }

    /**
     * Adds a stitch to a path. Without a position it goes to the back; with one, the
     * stitches from that slot onwards move back by one.
     */
    public StitchPosition insert(UserQueues queues, String pathId, QueuedStitch stitch, Integer position) {
        requireStitch(stitch);
        StitchQueue queue = require(queues, pathId);
        if (queues.pathOf(stitch.stitchId()).isPresent()) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                    "Stitch " + stitch.stitchId() + " is already queued for user " + queues.userId());
        }
        if (position != null && (position < 0 || position > queue.size())) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                    "Position " + position + " outside queue of size " + queue.size());
        }

        StitchQueue working = queue.copy();
        int slot = position == null ? queue.size() : position;
        working.insertAt(slot, stitch);
        verify(queue, working, stitch);
        queue.adopt(working);
        return new StitchPosition(queues.userId(), pathId, stitch.stitchId(), slot);
    }

    public QueuedStitch front(UserQueues queues, String pathId) {
        return require(queues, pathId).front()
                .orElseThrow(() -> new NotFoundException(ErrorCode.NO_STITCHES_AVAILABLE,
                        "No stitches queued in path " + pathId + " for user " + queues.userId()));
    }

    public List<StitchPosition> positions(UserQueues queues, String pathId) {
        return require(queues, pathId).positions();
    }

    public List<RepositionResult> history(UserQueues queues, String stitchId, Integer limit) {
        if (limit != null && limit < 0) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT, "History limit must not be negative: " + limit);
        }
        List<RepositionResult> entries = queues.historyOf(stitchId);
        if (entries.isEmpty() && queues.pathOf(stitchId).isEmpty()) {
            throw new NotFoundException(ErrorCode.STITCH_NOT_FOUND,
                    "Stitch " + stitchId + " not found for user " + queues.userId());
        }
        if (limit == null || limit >= entries.size()) {
            return entries;
        }
        return entries.subList(0, limit);
    }

    public List<StitchQueueSnapshot> snapshot(UserQueues queues) {
        List<StitchQueueSnapshot> out = new ArrayList<>();
        for (String pathId : queues.pathIds()) {
            StitchQueue queue = require(queues, pathId);
            out.add(new StitchQueueSnapshot(pathId, queue.stitches(),
                    queues.historyForPath(pathId), queues.progressForPath(pathId)));
        }
        return out;
    }

    public void restore(UserQueues queues, List<StitchQueueSnapshot> snapshots) {
        Set<String> seenPaths = new HashSet<>();
        Set<String> seenStitches = new HashSet<>();
        for (StitchQueueSnapshot snapshot : snapshots) {
            if (snapshot == null || snapshot.pathId() == null || snapshot.pathId().isBlank() || snapshot.stitches() == null) {
                throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "Queue snapshot requires a path id and stitches");
            }
            if (!seenPaths.add(snapshot.pathId())) {
                throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "Duplicate queue for path " + snapshot.pathId());
            }
            Set<String> pathStitches = new HashSet<>();
            for (QueuedStitch stitch : snapshot.stitches()) {
                if (stitch == null || stitch.stitchId() == null || !seenStitches.add(stitch.stitchId())) {
                    throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                            "Queue positions of path " + snapshot.pathId() + " are not a permutation");
                }
                pathStitches.add(stitch.stitchId());
            }
            validateHistory(snapshot, pathStitches);
            validateProgress(snapshot, pathStitches);
        }

        queues.clear();
        for (StitchQueueSnapshot snapshot : snapshots) {
            queues.put(new StitchQueue(queues.userId(), snapshot.pathId(), snapshot.stitches()));
            Map<String, List<RepositionResult>> history = snapshot.history() == null ? Map.of() : snapshot.history();
            history.forEach(queues::replaceHistory);
            Map<String, StitchProgress> progress = snapshot.progress() == null ? Map.of() : snapshot.progress();
            progress.values().forEach(queues::putProgress);
        }
    }

    private static void validateHistory(StitchQueueSnapshot snapshot, Set<String> pathStitches) {
        if (snapshot.history() == null) return;
        for (Map.Entry<String, List<RepositionResult>> e : snapshot.history().entrySet()) {
            if (!pathStitches.contains(e.getKey()) || e.getValue() == null) {
                throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                        "Invalid reposition history for stitch " + e.getKey() + " in path " + snapshot.pathId());
            }
            for (RepositionResult r : e.getValue()) {
                if (r == null || !e.getKey().equals(r.stitchId()) || !snapshot.pathId().equals(r.pathId())
                        || r.previousPosition() < 0 || r.newPosition() < 0 || r.skipNumber() < 0) {
                    throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                            "Invalid reposition history entry for stitch " + e.getKey() + " in path " + snapshot.pathId());
                }
            }
        }
    }

    private static void validateProgress(StitchQueueSnapshot snapshot, Set<String> pathStitches) {
        if (snapshot.progress() == null) return;
        for (Map.Entry<String, StitchProgress> e : snapshot.progress().entrySet()) {
            StitchProgress p = e.getValue();
            if (!pathStitches.contains(e.getKey()) || p == null || !p.isConsistent()
                    || !e.getKey().equals(p.stitchId()) || !snapshot.pathId().equals(p.pathId())) {
                throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                        "Invalid progress for stitch " + e.getKey() + " in path " + snapshot.pathId());
            }
        }
    }

    private void verify(StitchQueue live, StitchQueue working, QueuedStitch added) {
        int expectedSize = live.size() + (added == null ? 0 : 1);
        Set<String> expected = new HashSet<>();
        live.stitches().forEach(s -> expected.add(s.stitchId()));
        if (added != null) expected.add(added.stitchId());

        Set<String> actual = new HashSet<>();
        boolean duplicates = false;
        for (QueuedStitch s : working.stitches()) {
            duplicates |= !actual.add(s.stitchId());
        }

        if (working.size() != expectedSize || duplicates || !actual.equals(expected)) {
            log.error("Queue invariant broken userId={} pathId={} expectedSize={} actualSize={} duplicates={}",
                    live.userId(), live.pathId(), expectedSize, working.size(), duplicates);
            throw new InvariantViolationException(ErrorCode.QUEUE_INVARIANT_BROKEN,
                    "Queue of path " + live.pathId() + " would not be a permutation of its stitches");
        }
    }

    private static StitchQueue require(UserQueues queues, String pathId) {
        return queues.find(pathId).orElseThrow(() -> new NotFoundException(ErrorCode.PATH_NOT_FOUND,
                "Learning path not found: " + pathId + " for user " + queues.userId()));
    }

    private static void requireStitch(QueuedStitch stitch) {
        if (stitch == null || stitch.stitchId() == null || stitch.stitchId().isBlank()
                || stitch.primaryFactId() == null || stitch.primaryFactId().isBlank()) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT, "Stitch requires an id and a primary fact");
        }
    }

    private static void validate(StitchPerformance performance) {
        if (performance == null) {
            throw new InvalidInputException(ErrorCode.INVALID_PERFORMANCE_DATA, "Performance data is required");
        }
        if (performance.correctCount() < 0
                || performance.totalCount() <= 0
                || performance.correctCount() > performance.totalCount()) {
            throw new InvalidInputException(ErrorCode.INVALID_PERFORMANCE_DATA,
                    "Invalid counts correct=" + performance.correctCount() + " total=" + performance.totalCount());
        }
        if (performance.averageResponseTimeMs() <= 0) {
            throw new InvalidInputException(ErrorCode.INVALID_PERFORMANCE_DATA,
                    "averageResponseTimeMs must be positive: " + performance.averageResponseTimeMs());
        }
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
