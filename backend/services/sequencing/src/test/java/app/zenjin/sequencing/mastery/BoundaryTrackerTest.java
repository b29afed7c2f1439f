package app.zenjin.sequencing.mastery;

import app.zenjin.sequencing.common.AlreadyInitializedException;
import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.InvalidInputException;
import app.zenjin.sequencing.common.NotFoundException;
import app.zenjin.sequencing.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BoundaryTrackerTest {

    private static final String FACT = "mult-7-8";

    MutableClock clock;
    BoundaryTracker tracker;
    MasteryLedger ledger;

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        tracker = new BoundaryTracker(MasteryProps.defaults(), clock);
        ledger = new MasteryLedger("user-1");
    }

    @Test
    void initialize_startsAtCategoryLevelWithNeutralScore() {
        UserFactMastery m = tracker.initialize(ledger, FACT);

        assertThat(m.currentLevel()).isEqualTo(1);
        assertThat(m.masteryScore()).isEqualTo(0.5);
        assertThat(m.consecutiveCorrect()).isZero();
        assertThat(m.boundary()).isEqualTo(BoundaryLevel.CATEGORY);
        assertThat(tracker.getLevel(ledger, FACT)).isEqualTo(1);
    }

    @Test
    void initialize_twiceFails() {
        tracker.initialize(ledger, FACT);

        assertThatThrownBy(() -> tracker.initialize(ledger, FACT))
                .isInstanceOf(AlreadyInitializedException.class);
    }

    @Test
    void initialize_rejectsLevelOutsideRange() {
        assertThatThrownBy(() -> tracker.initialize(ledger, FACT, 6))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ErrorCode.INVALID_LEVEL));
        assertThat(ledger.contains(FACT)).isFalse();
    }

    @Test
    void getLevel_unknownFactIsNoMasteryData() {
        assertThatThrownBy(() -> tracker.getLevel(ledger, "add-1-1"))
                .isInstanceOfSatisfying(NotFoundException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ErrorCode.NO_MASTERY_DATA));
    }

    @Test
    void update_threeFastCorrectAnswersPromoteOnceAndConsumeStreak() {
        tracker.initialize(ledger, FACT);

        BoundaryUpdate first = tracker.update(ledger, FACT, AnswerPerformance.correct(1000));
        BoundaryUpdate second = tracker.update(ledger, FACT, AnswerPerformance.correct(1000));
        BoundaryUpdate third = tracker.update(ledger, FACT, AnswerPerformance.correct(1000));

        assertThat(first.changed()).isFalse();
        assertThat(second.changed()).isFalse();
        assertThat(third.changed()).isTrue();
        assertThat(third.previousLevel()).isEqualTo(1);
        assertThat(third.newLevel()).isEqualTo(2);
        assertThat(third.consecutiveCorrect()).isZero();

        BoundaryUpdate fourth = tracker.update(ledger, FACT, AnswerPerformance.correct(1000));
        assertThat(fourth.changed()).isFalse();
        assertThat(fourth.newLevel()).isEqualTo(2);
    }

    @Test
    void update_levelMovesAtMostOneStepPerAnswer() {
        tracker.initialize(ledger, FACT);

        int previous = 1;
        for (int i = 0; i < 30; i++) {
            BoundaryUpdate u = tracker.update(ledger, FACT, AnswerPerformance.correct(500));
            assertThat(Math.abs(u.newLevel() - previous)).isLessThanOrEqualTo(1);
            previous = u.newLevel();
        }
        assertThat(previous).isEqualTo(5);
    }

    @Test
    void update_alternatingAnswersNeverChangeLevel() {
        tracker.initialize(ledger, FACT, 3);

        for (int i = 0; i < 20; i++) {
            AnswerPerformance p = i % 2 == 0 ? AnswerPerformance.correct(800) : AnswerPerformance.incorrect(800);
            assertThat(tracker.update(ledger, FACT, p).changed()).isFalse();
        }
        assertThat(tracker.getLevel(ledger, FACT)).isEqualTo(3);
    }

    @Test
    void update_slowAnswersDoNotPromote() {
        tracker.initialize(ledger, FACT);

        for (int i = 0; i < 3; i++) {
            tracker.update(ledger, FACT, AnswerPerformance.correct(6000));
        }
        assertThat(tracker.getLevel(ledger, FACT)).isEqualTo(1);
        assertThat(tracker.getMastery(ledger, FACT).consecutiveCorrect()).isEqualTo(3);

        BoundaryUpdate fast = tracker.update(ledger, FACT, AnswerPerformance.correct(1000));
        assertThat(fast.newLevel()).isEqualTo(2);
    }

    @Test
    void update_twoMissesDemote() {
        tracker.initialize(ledger, FACT, 3);

        assertThat(tracker.update(ledger, FACT, AnswerPerformance.incorrect(2000)).changed()).isFalse();
        BoundaryUpdate second = tracker.update(ledger, FACT, AnswerPerformance.incorrect(2000));

        assertThat(second.changed()).isTrue();
        assertThat(second.newLevel()).isEqualTo(2);
        UserFactMastery m = tracker.getMastery(ledger, FACT);
        assertThat(m.consecutiveIncorrect()).isZero();
        assertThat(m.lastDemotionAt()).isEqualTo(clock.instant());
    }

    @Test
    void update_secondDemotionWaitsForDwell() {
        tracker.initialize(ledger, FACT, 3);
        tracker.update(ledger, FACT, AnswerPerformance.incorrect(2000));
        tracker.update(ledger, FACT, AnswerPerformance.incorrect(2000));

        tracker.update(ledger, FACT, AnswerPerformance.incorrect(2000));
        tracker.update(ledger, FACT, AnswerPerformance.incorrect(2000));
        assertThat(tracker.getLevel(ledger, FACT)).isEqualTo(2);

        clock.advance(Duration.ofMinutes(10));
        BoundaryUpdate afterDwell = tracker.update(ledger, FACT, AnswerPerformance.incorrect(2000));
        assertThat(afterDwell.changed()).isTrue();
        assertThat(afterDwell.newLevel()).isEqualTo(1);
    }

    @Test
    void update_levelOneIsFloorAndLevelFiveIsTerminal() {
        tracker.initialize(ledger, "add-1-1");
        tracker.initialize(ledger, FACT, 5);

        for (int i = 0; i < 6; i++) {
            tracker.update(ledger, "add-1-1", AnswerPerformance.incorrect(1000));
            tracker.update(ledger, FACT, AnswerPerformance.correct(100));
        }

        assertThat(tracker.getLevel(ledger, "add-1-1")).isEqualTo(1);
        assertThat(tracker.getLevel(ledger, FACT)).isEqualTo(5);
        assertThat(tracker.getMastery(ledger, FACT).boundary().isTerminal()).isTrue();
    }

    @Test
    void update_masteryScoreFollowsSmoothedOutcome() {
        tracker.initialize(ledger, FACT);

        tracker.update(ledger, FACT, AnswerPerformance.correct(1000));
        assertThat(tracker.getMastery(ledger, FACT).masteryScore()).isCloseTo(0.6, within(1e-9));

        tracker.update(ledger, FACT, AnswerPerformance.incorrect(1000));
        assertThat(tracker.getMastery(ledger, FACT).masteryScore()).isCloseTo(0.48, within(1e-9));
        assertThat(tracker.getMastery(ledger, FACT).lastResponseTimeMs()).isEqualTo(1000L);
    }

    @Test
    void update_rejectsInvalidPerformanceWithoutTouchingRecord() {
        UserFactMastery before = tracker.initialize(ledger, FACT);

        assertThatThrownBy(() -> tracker.update(ledger, FACT, AnswerPerformance.correct(0)))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ErrorCode.INVALID_PERFORMANCE_DATA));
        assertThatThrownBy(() -> tracker.update(ledger, FACT, new AnswerPerformance(true, 900, -1)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> tracker.update(ledger, FACT, null))
                .isInstanceOf(InvalidInputException.class);

        assertThat(tracker.getMastery(ledger, FACT)).isEqualTo(before);
    }

    @Test
    void update_callerStreakDoesNotOverrideTrackedStreak() {
        tracker.initialize(ledger, FACT);

        BoundaryUpdate u = tracker.update(ledger, FACT, new AnswerPerformance(true, 1000, 10));

        assertThat(u.changed()).isFalse();
        assertThat(u.consecutiveCorrect()).isEqualTo(1);
    }

    @Test
    void revert_restoresPreviousRecordOrRemovesFact() {
        UserFactMastery before = tracker.initialize(ledger, FACT);
        tracker.update(ledger, FACT, AnswerPerformance.correct(1000));

        tracker.revert(ledger, FACT, Optional.of(before));
        assertThat(tracker.getMastery(ledger, FACT)).isEqualTo(before);

        tracker.revert(ledger, FACT, Optional.empty());
        assertThat(ledger.contains(FACT)).isFalse();
    }

    @Test
    void restore_rejectsRecordsOfAnotherUser() {
        UserFactMastery foreign = new UserFactMastery("user-2", FACT, 2, 0.7, 0, 0, null, null, null);

        assertThatThrownBy(() -> tracker.restore(ledger, List.of(foreign)))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ErrorCode.INVALID_SNAPSHOT));
    }

    @Test
    void restore_replacesLedgerContents() {
        tracker.initialize(ledger, "add-2-2");
        UserFactMastery loaded = new UserFactMastery("user-1", FACT, 4, 0.9, 2, 0, 1200L, null, null);

        tracker.restore(ledger, List.of(loaded));

        assertThat(ledger.size()).isEqualTo(1);
        assertThat(tracker.getLevel(ledger, FACT)).isEqualTo(4);
    }

    @Test
    void describe_listsAllFiveLevelsInOrder() {
        assertThat(tracker.levels()).hasSize(5).first().isEqualTo(BoundaryLevel.CATEGORY);
        assertThat(tracker.describe(4).title()).isEqualTo("Related Fact Boundaries");
        assertThatThrownBy(() -> tracker.describe(0)).isInstanceOf(InvalidInputException.class);
    }
}
