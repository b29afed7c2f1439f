package app.zenjin.sequencing.mastery;

import app.zenjin.sequencing.common.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundaryLevelTest {

    @Test
    void of_mapsNumbersToLevelsInOrder() {
        assertThat(BoundaryLevel.of(1)).isEqualTo(BoundaryLevel.CATEGORY);
        assertThat(BoundaryLevel.of(3)).isEqualTo(BoundaryLevel.OPERATION);
        assertThat(BoundaryLevel.of(5)).isEqualTo(BoundaryLevel.NEAR_MISS);
        for (BoundaryLevel level : BoundaryLevel.values()) {
            assertThat(BoundaryLevel.of(level.level())).isSameAs(level);
        }
    }

    @Test
    void of_rejectsOutOfRange() {
        assertThatThrownBy(() -> BoundaryLevel.of(0)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> BoundaryLevel.of(6)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void onlyNearMissIsTerminal() {
        assertThat(BoundaryLevel.NEAR_MISS.isTerminal()).isTrue();
        assertThat(BoundaryLevel.RELATED_FACT.isTerminal()).isFalse();
        assertThat(BoundaryLevel.CATEGORY.title()).isEqualTo("Category Boundaries");
    }
}
