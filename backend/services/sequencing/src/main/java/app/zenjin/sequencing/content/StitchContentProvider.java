package app.zenjin.sequencing.content;

import java.util.List;

/**
 * Source of the initial curriculum. Consulted once, when a user is initialized.
 */
public interface StitchContentProvider {

    /**
     * @return the learner's paths in helix slot order; the first one starts active
     */
    List<PathDefinition> pathsFor(String userId);
}
