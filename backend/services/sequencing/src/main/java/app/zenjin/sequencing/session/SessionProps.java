package app.zenjin.sequencing.session;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param rotateEveryQuestions answered-question cadence at which a
 *                             {@link RotationTrigger.Reason#QUESTION_COUNT} trigger rotates
 * @param defaultDifficulty    path difficulty used when a user is initialized without one
 */
@Validated
@ConfigurationProperties(prefix = "app.sequencing.session")
public record SessionProps(
        @Positive Integer rotateEveryQuestions,
        @Min(1) @Max(5) Integer defaultDifficulty
) {
    public SessionProps {
        if (rotateEveryQuestions == null) rotateEveryQuestions = 20;
        if (defaultDifficulty == null) defaultDifficulty = 1;
    }

    public static SessionProps defaults() {
        return new SessionProps(null, null);
    }
}
