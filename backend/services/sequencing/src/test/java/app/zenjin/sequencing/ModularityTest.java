package app.zenjin.sequencing;

import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModules;

class ModularityTest {

    @Test
    void verifyModules() {
        ApplicationModules modules = ApplicationModules.of(SequencingApplication.class);
        modules.verify();
    }
}
