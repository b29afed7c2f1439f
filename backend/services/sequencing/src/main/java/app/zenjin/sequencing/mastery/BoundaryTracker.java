package app.zenjin.sequencing.mastery;

import app.zenjin.sequencing.common.AlreadyInitializedException;
import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.InvalidInputException;
import app.zenjin.sequencing.common.InvariantViolationException;
import app.zenjin.sequencing.common.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Promotion/demotion state machine over the five boundary levels.
 * <p>
 * Promotion needs a correct-first-attempt streak of {@code promoteThreshold} answered
 * under the level's response ceiling; demotion needs {@code demoteThreshold} misses in a
 * row and is allowed at most once per {@code demotionDwell} for a fact. Any level change
 * consumes both counters, so a level moves by at most one step per update.
 */
@Service
public class BoundaryTracker {

    private static final Logger log = LoggerFactory.getLogger(BoundaryTracker.class);

    private final MasteryProps props;
    private final Clock clock;

    public BoundaryTracker(MasteryProps props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public int getLevel(MasteryLedger ledger, String factId) {
        return require(ledger, factId).currentLevel();
    }

    public UserFactMastery getMastery(MasteryLedger ledger, String factId) {
        return require(ledger, factId);
    }

    public UserFactMastery initialize(MasteryLedger ledger, String factId) {
        return initialize(ledger, factId, BoundaryLevel.MIN);
    }

    public UserFactMastery initialize(MasteryLedger ledger, String factId, int initialLevel) {
        requireFactId(factId);
        BoundaryLevel.of(initialLevel);
        if (ledger.contains(factId)) {
            throw new AlreadyInitializedException(
                    "Mastery data already exists for user " + ledger.userId() + " and fact " + factId);
        }
        UserFactMastery fresh = UserFactMastery.fresh(ledger.userId(), factId, initialLevel, props.initialScore());
        ledger.put(fresh);
        return fresh;
    }

    public BoundaryUpdate update(MasteryLedger ledger, String factId, AnswerPerformance performance) {
        validate(performance);
        UserFactMastery current = require(ledger, factId);
        Instant now = clock.instant();

        UserFactMastery next = advance(current, performance, now);
        if (Math.abs(next.currentLevel() - current.currentLevel()) > 1) {
            log.error("Mastery invariant broken userId={} factId={} from={} to={}",
                    ledger.userId(), factId, current.currentLevel(), next.currentLevel());
            throw new InvariantViolationException(ErrorCode.MASTERY_INVARIANT_BROKEN,
                    "Boundary level of fact " + factId + " would skip a level");
        }
        ledger.put(next);

        boolean changed = next.currentLevel() != current.currentLevel();
        if (changed) {
            log.debug("Boundary level changed userId={} factId={} from={} to={} score={}",
                    ledger.userId(), factId, current.currentLevel(), next.currentLevel(), next.masteryScore());
        }
        return new BoundaryUpdate(
                factId,
                current.currentLevel(),
                next.currentLevel(),
                changed,
                next.masteryScore(),
                next.consecutiveCorrect()
        );
    }

    /**
     * Puts a fact's record back to what it was before an update; an absent previous
     * record removes the fact again. Used to undo a mastery write when a later step of
     * the same answer fails.
     */
    public void revert(MasteryLedger ledger, String factId, Optional<UserFactMastery> previous) {
        previous.ifPresentOrElse(ledger::put, () -> ledger.remove(factId));
    }

    public void restore(MasteryLedger ledger, List<UserFactMastery> records) {
        Set<String> seen = new HashSet<>();
        for (UserFactMastery m : records) {
            if (m == null) {
                throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "Null mastery record");
            }
            if (!ledger.userId().equals(m.userId())) {
                throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT,
                        "Mastery record of user " + m.userId() + " cannot be loaded for " + ledger.userId());
            }
            if (!seen.add(m.factId())) {
                throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "Duplicate mastery record for fact " + m.factId());
            }
        }
        ledger.replaceAll(records);
    }

    public BoundaryLevel describe(int level) {
        return BoundaryLevel.of(level);
    }

    public List<BoundaryLevel> levels() {
        return Arrays.asList(BoundaryLevel.values());
    }

    private UserFactMastery advance(UserFactMastery m, AnswerPerformance performance, Instant now) {
        boolean correct = performance.correctFirstAttempt();
        double outcome = correct ? 1.0 : 0.0;
        double score = clamp01(m.masteryScore() + props.smoothingFactor() * (outcome - m.masteryScore()));

        int level = m.currentLevel();
        int streak = correct ? m.consecutiveCorrect() + 1 : 0;
        int misses = correct ? 0 : m.consecutiveIncorrect() + 1;
        Instant lastDemotion = m.lastDemotionAt();

        if (correct && canPromote(level, streak, performance.responseTimeMs())) {
            level++;
            streak = 0;
            misses = 0;
        } else if (!correct && canDemote(level, misses, lastDemotion, now)) {
            level--;
            streak = 0;
            misses = 0;
            lastDemotion = now;
        }

        return new UserFactMastery(
                m.userId(),
                m.factId(),
                level,
                score,
                streak,
                misses,
                performance.responseTimeMs(),
                now,
                lastDemotion
        );
    }

    private boolean canPromote(int level, int streak, long responseTimeMs) {
        return level < BoundaryLevel.MAX
                && streak >= props.promoteThreshold()
                && responseTimeMs < props.ceilingFor(level);
    }

    private boolean canDemote(int level, int misses, Instant lastDemotion, Instant now) {
        if (level <= BoundaryLevel.MIN || misses < props.demoteThreshold()) {
            return false;
        }
        return lastDemotion == null
                || Duration.between(lastDemotion, now).compareTo(props.demotionDwell()) >= 0;
    }

    private UserFactMastery require(MasteryLedger ledger, String factId) {
        requireFactId(factId);
        return ledger.find(factId).orElseThrow(() -> new NotFoundException(ErrorCode.NO_MASTERY_DATA,
                "No mastery data exists for user " + ledger.userId() + " and fact " + factId));
    }

    private static void requireFactId(String factId) {
        if (factId == null || factId.isBlank()) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT, "Fact id is required");
        }
    }

    private static void validate(AnswerPerformance performance) {
        if (performance == null) {
            throw new InvalidInputException(ErrorCode.INVALID_PERFORMANCE_DATA, "Performance data is required");
        }
        if (performance.responseTimeMs() <= 0) {
            throw new InvalidInputException(ErrorCode.INVALID_PERFORMANCE_DATA,
                    "responseTimeMs must be positive: " + performance.responseTimeMs());
        }
        if (performance.consecutiveCorrect() != null && performance.consecutiveCorrect() < 0) {
            throw new InvalidInputException(ErrorCode.INVALID_PERFORMANCE_DATA,
                    "consecutiveCorrect must be non-negative: " + performance.consecutiveCorrect());
        }
    }

    private static double clamp01(double v) {
        if (v < 0) return 0;
        if (v > 1) return 1;
        return v;
    }
}
