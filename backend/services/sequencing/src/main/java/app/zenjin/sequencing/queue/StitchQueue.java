package app.zenjin.sequencing.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Ordered stitches of one path for one user. The list index is the stitch's position,
 * which keeps positions dense by construction.
 */
public final class StitchQueue {

    private final String userId;
    private final String pathId;
    private List<QueuedStitch> entries;

    StitchQueue(String userId, String pathId, List<QueuedStitch> entries) {
        this.userId = userId;
        this.pathId = pathId;
        this.entries = new ArrayList<>(entries);
    }

    public String userId() {
        return userId;
    }

    public String pathId() {
        return pathId;
    }

    public int size() {
        return entries.size();
    }

    public Optional<QueuedStitch> front() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0));
    }

    public Optional<QueuedStitch> at(int position) {
        if (position < 0 || position >= entries.size()) return Optional.empty();
        return Optional.of(entries.get(position));
    }

    public int indexOf(String stitchId) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).stitchId().equals(stitchId)) return i;
        }
        return -1;
    }

    public boolean contains(String stitchId) {
        return indexOf(stitchId) >= 0;
    }

    public List<QueuedStitch> stitches() {
        return List.copyOf(entries);
    }

    public List<StitchPosition> positions() {
        return IntStream.range(0, entries.size())
                .mapToObj(i -> new StitchPosition(userId, pathId, entries.get(i).stitchId(), i))
                .toList();
    }

    StitchQueue copy() {
        return new StitchQueue(userId, pathId, entries);
    }

    QueuedStitch removeAt(int position) {
        return entries.remove(position);
    }

    void insertAt(int position, QueuedStitch stitch) {
        entries.add(position, stitch);
    }

    /**
     * Takes over the order of a verified working copy in a single assignment.
     */
    void adopt(StitchQueue working) {
        this.entries = new ArrayList<>(working.entries);
    }
}
