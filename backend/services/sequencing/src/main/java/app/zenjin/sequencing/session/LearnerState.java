package app.zenjin.sequencing.session;

import app.zenjin.sequencing.helix.TripleHelixState;
import app.zenjin.sequencing.mastery.MasteryLedger;
import app.zenjin.sequencing.queue.UserQueues;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Everything the engine knows about one learner. Calls for the same learner run one at a
 * time under this state's lock; different learners never share anything. A state that
 * was swapped out of the registry is retired and must not be written again.
 */
final class LearnerState {

    private final String userId;
    private final MasteryLedger mastery;
    private final UserQueues queues;
    private final TripleHelixState helix;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean retired;

    LearnerState(String userId) {
        this.userId = userId;
        this.mastery = new MasteryLedger(userId);
        this.queues = new UserQueues(userId);
        this.helix = new TripleHelixState(userId);
    }

    String userId() { return userId; }
    MasteryLedger mastery() { return mastery; }
    UserQueues queues() { return queues; }
    TripleHelixState helix() { return helix; }

    /**
     * Marks this state as replaced or evicted. Callers must hold the lock; anyone who
     * acquires it afterwards has to look the learner up again.
     */
    void retire() {
        retired = true;
    }

    boolean isRetired() {
        return retired;
    }

    <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
