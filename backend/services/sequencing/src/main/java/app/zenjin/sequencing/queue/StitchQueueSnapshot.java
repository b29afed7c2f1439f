package app.zenjin.sequencing.queue;

import java.util.List;
import java.util.Map;

/**
 * Export form of one path queue. Stitches are listed front to back, so a stitch's index
 * is its position. {@code history} and {@code progress} are keyed by stitch id.
 */
public record StitchQueueSnapshot(
        String pathId,
        List<QueuedStitch> stitches,
        Map<String, List<RepositionResult>> history,
        Map<String, StitchProgress> progress
) {
}
