package app.zenjin.sequencing.content;

import app.zenjin.sequencing.common.NotFoundException;

public interface FactRepository {

    /**
     * @throws NotFoundException with {@code FACT_NOT_FOUND} when no such fact exists
     */
    Fact getFactById(String factId);

    boolean exists(String factId);
}
