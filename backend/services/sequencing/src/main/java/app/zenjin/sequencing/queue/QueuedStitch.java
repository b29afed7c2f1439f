package app.zenjin.sequencing.queue;

/**
 * Reference to a stitch sitting in a path queue, together with the fact that is asked
 * first whenever the stitch comes to the front.
 */
public record QueuedStitch(String stitchId, String primaryFactId) {
}
