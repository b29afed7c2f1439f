package app.zenjin.sequencing.content;

import java.util.List;

public record PathDefinition(
        String pathId,
        String name,
        String description,
        List<StitchDefinition> stitches
) {
    public PathDefinition {
        stitches = List.copyOf(stitches);
    }
}
