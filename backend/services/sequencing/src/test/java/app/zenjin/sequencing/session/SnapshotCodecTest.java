package app.zenjin.sequencing.session;

import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.InvalidInputException;
import app.zenjin.sequencing.helix.HelixSnapshot;
import app.zenjin.sequencing.helix.LearningPath;
import app.zenjin.sequencing.helix.PathStatus;
import app.zenjin.sequencing.mastery.UserFactMastery;
import app.zenjin.sequencing.queue.QueuedStitch;
import app.zenjin.sequencing.queue.RepositionResult;
import app.zenjin.sequencing.queue.StitchProgress;
import app.zenjin.sequencing.queue.StitchQueueSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotCodecTest {

    private static final ObjectMapper MAPPER = JsonMapper.builder().addModule(new JavaTimeModule()).build();
    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    private final SnapshotCodec codec = new SnapshotCodec(MAPPER);

    @Test
    void toJson_keepsFieldNamesAndReadsBackEqual() {
        LearnerSnapshot snapshot = sample();

        String json = codec.toJson(snapshot);

        assertThat(json).contains("\"currentLevel\"", "\"rotationsSinceActive\"", "\"primaryFactId\"",
                "\"completionCount\"");
        assertThat(json).doesNotContain("\"active\"");
        assertThat(codec.fromJson(json)).isEqualTo(snapshot);
    }

    @Test
    void fromJson_malformedIsInvalidSnapshot() {
        assertThatThrownBy(() -> codec.fromJson("{\"userId\": "))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ErrorCode.INVALID_SNAPSHOT));
        assertThatThrownBy(() -> codec.fromJson(" "))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void fromJson_recordOutsideLevelRangeIsInvalidSnapshot() {
        String json = codec.toJson(sample()).replace("\"currentLevel\":2", "\"currentLevel\":9");

        assertThatThrownBy(() -> codec.fromJson(json))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ErrorCode.INVALID_SNAPSHOT));
    }

    private static LearnerSnapshot sample() {
        UserFactMastery mastery = new UserFactMastery("user-1", "mult-7-8", 2, 0.68, 1, 0, 1800L, NOW, null);
        RepositionResult moved = new RepositionResult("mult-7", "multiplication", 0, 2, 4, NOW);
        StitchQueueSnapshot queue = new StitchQueueSnapshot(
                "multiplication",
                List.of(new QueuedStitch("mult-8", "mult-8-1"), new QueuedStitch("mult-9", "mult-9-1"),
                        new QueuedStitch("mult-7", "mult-7-8")),
                Map.of("mult-7", List.of(moved)),
                Map.of("mult-7", new StitchProgress("mult-7", "multiplication", 1, 3, 4, 7200L, NOW))
        );
        HelixSnapshot helix = new HelixSnapshot("user-1", List.of(
                new LearningPath("multiplication", "Multiplication", "Times tables", PathStatus.ACTIVE,
                        "mult-8", "mult-9", 2, 0),
                new LearningPath("addition", "Addition", "Adding", PathStatus.PREPARING, null, "add-1", 1, 0),
                new LearningPath("division", "Division", "Dividing", PathStatus.PREPARING, null, "div-2", 1, 1)
        ), 1, NOW);
        return new LearnerSnapshot("user-1", List.of(mastery), List.of(queue), helix, NOW);
    }
}
