package app.zenjin.sequencing.content;

import java.util.List;

/**
 * An authored bundle of facts. The first fact is the stitch's primary fact.
 */
public record StitchDefinition(
        String stitchId,
        String name,
        List<String> factIds
) {
    public StitchDefinition {
        factIds = List.copyOf(factIds);
    }

    public String primaryFactId() {
        return factIds.isEmpty() ? null : factIds.get(0);
    }
}
