package app.zenjin.sequencing.mastery;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hysteresis parameters of the boundary tracker.
 *
 * @param smoothingFactor    weight of the newest outcome in the mastery score (alpha)
 * @param promoteThreshold   correct-first-attempt streak needed to move one level up
 * @param demoteThreshold    consecutive misses needed to move one level down
 * @param demotionDwell      minimum time between two demotions of the same fact
 * @param responseCeilingsMs per level, the response time a promoting answer must beat
 */
@ConfigurationProperties(prefix = "app.sequencing.mastery")
public record MasteryProps(
        Double smoothingFactor,
        Double initialScore,
        Integer promoteThreshold,
        Integer demoteThreshold,
        Duration demotionDwell,
        Map<Integer, Long> responseCeilingsMs
) {
    public static final double DEFAULT_SMOOTHING_FACTOR = 0.2;
    public static final double DEFAULT_INITIAL_SCORE = 0.5;
    public static final int DEFAULT_PROMOTE_THRESHOLD = 3;
    public static final int DEFAULT_DEMOTE_THRESHOLD = 2;
    public static final Duration DEFAULT_DEMOTION_DWELL = Duration.ofMinutes(10);

    public MasteryProps {
        if (smoothingFactor == null) smoothingFactor = DEFAULT_SMOOTHING_FACTOR;
        if (initialScore == null) initialScore = DEFAULT_INITIAL_SCORE;
        if (promoteThreshold == null) promoteThreshold = DEFAULT_PROMOTE_THRESHOLD;
        if (demoteThreshold == null) demoteThreshold = DEFAULT_DEMOTE_THRESHOLD;
        if (demotionDwell == null) demotionDwell = DEFAULT_DEMOTION_DWELL;

        Map<Integer, Long> ceilings = new TreeMap<>(defaultCeilings());
        if (responseCeilingsMs != null) ceilings.putAll(responseCeilingsMs);
        responseCeilingsMs = Map.copyOf(ceilings);

        if (smoothingFactor <= 0.0 || smoothingFactor > 1.0) {
            throw new IllegalArgumentException("smoothingFactor must be in (0,1]: " + smoothingFactor);
        }
        if (initialScore < 0.0 || initialScore > 1.0) {
            throw new IllegalArgumentException("initialScore must be in [0,1]: " + initialScore);
        }
        if (promoteThreshold < 1 || demoteThreshold < 1) {
            throw new IllegalArgumentException("promote/demote thresholds must be positive");
        }
        if (demotionDwell.isNegative()) {
            throw new IllegalArgumentException("demotionDwell must not be negative");
        }
    }

    public static MasteryProps defaults() {
        return new MasteryProps(null, null, null, null, null, null);
    }

    public long ceilingFor(int level) {
        Long ceiling = responseCeilingsMs.get(level);
        return ceiling == null ? Long.MAX_VALUE : ceiling;
    }

    private static Map<Integer, Long> defaultCeilings() {
        return Map.of(
                1, 5000L,
                2, 4000L,
                3, 3000L,
                4, 2500L,
                5, 2000L
        );
    }
}
