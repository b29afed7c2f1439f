package app.zenjin.sequencing.helix;

/**
 * What the rotator needs to know about a path when a user's helix is first built.
 */
public record PathSeed(
        String pathId,
        String name,
        String description,
        String headStitchId,
        String followingStitchId
) {
}
