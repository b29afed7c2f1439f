package app.zenjin.sequencing.queue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All stitch queues of one user, keyed by path, plus the per-stitch reposition history.
 * Only {@link RepositionEngine} changes queue order.
 */
public final class UserQueues {

    private final String userId;
    private final Map<String, StitchQueue> queues = new LinkedHashMap<>();
    private final Map<String, Deque<RepositionResult>> history = new LinkedHashMap<>();
    private final Map<String, StitchProgress> progress = new LinkedHashMap<>();

    public UserQueues(String userId) {
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }

    public Optional<StitchQueue> find(String pathId) {
        return Optional.ofNullable(queues.get(pathId));
    }

    public List<String> pathIds() {
        return List.copyOf(queues.keySet());
    }

    public Optional<String> pathOf(String stitchId) {
        return queues.values().stream()
                .filter(q -> q.contains(stitchId))
                .map(StitchQueue::pathId)
                .findFirst();
    }

    List<RepositionResult> historyOf(String stitchId) {
        Deque<RepositionResult> entries = history.get(stitchId);
        return entries == null ? List.of() : List.copyOf(entries);
    }

    Map<String, List<RepositionResult>> historyForPath(String pathId) {
        Map<String, List<RepositionResult>> out = new LinkedHashMap<>();
        history.forEach((stitchId, entries) -> {
            if (!entries.isEmpty() && pathId.equals(entries.peekFirst().pathId())) {
                out.put(stitchId, List.copyOf(entries));
            }
        });
        return out;
    }

    Optional<StitchProgress> progressOf(String stitchId) {
        return Optional.ofNullable(progress.get(stitchId));
    }

    Map<String, StitchProgress> progressForPath(String pathId) {
        Map<String, StitchProgress> out = new LinkedHashMap<>();
        progress.forEach((stitchId, p) -> {
            if (pathId.equals(p.pathId())) {
                out.put(stitchId, p);
            }
        });
        return out;
    }

    void putProgress(StitchProgress stitchProgress) {
        progress.put(stitchProgress.stitchId(), stitchProgress);
    }

    void put(StitchQueue queue) {
        queues.put(queue.pathId(), queue);
    }

    void record(RepositionResult result, int limit) {
        Deque<RepositionResult> entries = history.computeIfAbsent(result.stitchId(), k -> new ArrayDeque<>());
        entries.addFirst(result);
        while (entries.size() > limit) {
            entries.removeLast();
        }
    }

    void replaceHistory(String stitchId, List<RepositionResult> entries) {
        history.put(stitchId, new ArrayDeque<>(entries));
    }

    void clear() {
        queues.clear();
        history.clear();
        progress.clear();
    }
}
