package app.zenjin.sequencing.session;

import app.zenjin.sequencing.helix.HelixSnapshot;
import app.zenjin.sequencing.mastery.UserFactMastery;
import app.zenjin.sequencing.queue.StitchQueueSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Complete state of one learner, for the host to persist and load back later.
 */
public record LearnerSnapshot(
        String userId,
        List<UserFactMastery> mastery,
        List<StitchQueueSnapshot> queues,
        HelixSnapshot helix,
        Instant exportedAt
) {
}
