package app.zenjin.sequencing.mastery;

import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.InvalidInputException;

import java.time.Instant;

/**
 * Mastery of one fact by one user. Optional fields are null until the first attempt
 * (or first demotion) has happened.
 */
public record UserFactMastery(
        String userId,
        String factId,
        int currentLevel,
        double masteryScore,
        int consecutiveCorrect,
        int consecutiveIncorrect,
        Long lastResponseTimeMs,
        Instant lastAttemptAt,
        Instant lastDemotionAt
) {
    public UserFactMastery {
        if (userId == null || userId.isBlank() || factId == null || factId.isBlank()) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT, "Mastery record requires userId and factId");
        }
        BoundaryLevel.of(currentLevel);
        if (Double.isNaN(masteryScore) || masteryScore < 0.0 || masteryScore > 1.0) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                    "Mastery score out of range [0,1]: " + masteryScore);
        }
        if (consecutiveCorrect < 0 || consecutiveIncorrect < 0) {
            throw new InvalidInputException(ErrorCode.INVALID_ARGUMENT,
                    "Streak counters must be non-negative for fact " + factId);
        }
    }

    static UserFactMastery fresh(String userId, String factId, int level, double initialScore) {
        return new UserFactMastery(userId, factId, level, initialScore, 0, 0, null, null, null);
    }

    public BoundaryLevel boundary() {
        return BoundaryLevel.of(currentLevel);
    }
}
