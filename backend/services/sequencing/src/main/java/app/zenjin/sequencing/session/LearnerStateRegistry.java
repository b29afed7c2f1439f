package app.zenjin.sequencing.session;

import app.zenjin.sequencing.common.AlreadyInitializedException;
import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.NotFoundException;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Learners whose state is loaded in this process. Hands out the per-user state handle;
 * holds no engine state of its own.
 */
@Component
class LearnerStateRegistry {

    private final ConcurrentMap<String, LearnerState> learners = new ConcurrentHashMap<>();

    LearnerState require(String userId) {
        return find(userId).orElseThrow(() -> new NotFoundException(ErrorCode.USER_NOT_FOUND, "User not found: " + userId));
    }

    Optional<LearnerState> find(String userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(learners.get(userId));
    }

    boolean contains(String userId) {
        return learners.containsKey(userId);
    }

    void register(LearnerState state) {
        if (!add(state)) {
            throw new AlreadyInitializedException("User already initialized: " + state.userId());
        }
    }

    boolean add(LearnerState state) {
        return learners.putIfAbsent(state.userId(), state) == null;
    }

    boolean swap(LearnerState current, LearnerState replacement) {
        return learners.replace(current.userId(), current, replacement);
    }

    boolean remove(LearnerState state) {
        return learners.remove(state.userId(), state);
    }
}
