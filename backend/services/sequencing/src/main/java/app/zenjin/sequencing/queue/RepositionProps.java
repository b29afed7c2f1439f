package app.zenjin.sequencing.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parameters of the skip-number formula
 * {@code round(baseSkip * accuracy^2 * clamp(expected / average, minSpeedFactor, maxSpeedFactor))}.
 */
@ConfigurationProperties(prefix = "app.sequencing.reposition")
public record RepositionProps(
        Integer baseSkip,
        Integer minSkip,
        Long expectedResponseTimeMs,
        Double minSpeedFactor,
        Double maxSpeedFactor,
        Integer historyLimit
) {
    public RepositionProps {
        if (baseSkip == null) baseSkip = 30;
        if (minSkip == null) minSkip = 1;
        if (expectedResponseTimeMs == null) expectedResponseTimeMs = 3000L;
        if (minSpeedFactor == null) minSpeedFactor = 0.5;
        if (maxSpeedFactor == null) maxSpeedFactor = 1.5;
        if (historyLimit == null) historyLimit = 50;

        if (baseSkip < 1 || minSkip < 0 || expectedResponseTimeMs <= 0 || historyLimit < 0) {
            throw new IllegalArgumentException("Invalid reposition settings");
        }
        if (minSpeedFactor <= 0 || maxSpeedFactor < minSpeedFactor) {
            throw new IllegalArgumentException("Speed factor bounds must satisfy 0 < min <= max");
        }
    }

    public static RepositionProps defaults() {
        return new RepositionProps(null, null, null, null, null, null);
    }
}
