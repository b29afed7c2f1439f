package app.zenjin.sequencing.catalog;

import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.NotFoundException;
import app.zenjin.sequencing.content.Fact;
import app.zenjin.sequencing.content.Operation;
import app.zenjin.sequencing.content.PathDefinition;
import app.zenjin.sequencing.content.StitchDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArithmeticFactRepositoryTest {

    private final ArithmeticFactRepository repository = new ArithmeticFactRepository();

    @Test
    void getFactById_resolvesEveryOperation() {
        Fact mult = repository.getFactById("mult-7-8");
        assertThat(mult.operation()).isEqualTo(Operation.MULTIPLICATION);
        assertThat(mult.operands()).containsExactly(7, 8);
        assertThat(mult.result()).isEqualTo(56);

        assertThat(repository.getFactById("add-0-12").result()).isEqualTo(12);
        assertThat(repository.getFactById("sub-15-6").result()).isEqualTo(9);
        assertThat(repository.getFactById("div-56-8").result()).isEqualTo(7);
    }

    @Test
    void getFactById_unknownIsFactNotFound() {
        assertThatThrownBy(() -> repository.getFactById("mult-13-1"))
                .isInstanceOfSatisfying(NotFoundException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ErrorCode.FACT_NOT_FOUND));
        assertThat(repository.exists(null)).isFalse();
        assertThat(repository.exists("div-7-0")).isFalse();
    }

    @Test
    void catalogueCoversAllTables() {
        assertThat(repository.size()).isEqualTo(13 * 13 * 2 + 12 * 12 * 2);
    }

    @Test
    void standardCurriculum_onlyReferencesKnownFacts() {
        List<PathDefinition> paths = new StandardCurriculumProvider().pathsFor("anyone");

        assertThat(paths).extracting(PathDefinition::pathId)
                .containsExactly("addition", "multiplication", "division");
        for (PathDefinition path : paths) {
            assertThat(path.stitches()).isNotEmpty();
            for (StitchDefinition stitch : path.stitches()) {
                assertThat(stitch.factIds()).allSatisfy(id -> assertThat(repository.exists(id)).isTrue());
            }
        }
        assertThat(paths.get(2).stitches().get(0).primaryFactId()).isEqualTo("div-2-2");
    }
}
