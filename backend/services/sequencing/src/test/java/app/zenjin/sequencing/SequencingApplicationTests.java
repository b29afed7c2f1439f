package app.zenjin.sequencing;

import app.zenjin.sequencing.mastery.MasteryProps;
import app.zenjin.sequencing.session.SequencingFacade;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SequencingApplicationTests {

    @Autowired
    SequencingFacade facade;

    @Autowired
    MasteryProps masteryProps;

    @Test
    void contextLoads() {
        assertThat(facade).isNotNull();
        assertThat(masteryProps.ceilingFor(3)).isEqualTo(3000L);
    }

    @Test
    void servesQuestionsFromStandardCurriculum() {
        facade.initializeUser("context-user");

        assertThat(facade.nextQuestionSource("context-user").pathId()).isEqualTo("addition");
        assertThat(facade.evict("context-user")).isTrue();
    }
}
