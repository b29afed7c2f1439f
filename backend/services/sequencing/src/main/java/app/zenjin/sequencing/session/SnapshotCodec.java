package app.zenjin.sequencing.session;

import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.InvalidInputException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class SnapshotCodec {

    private final ObjectMapper om;

    public SnapshotCodec(ObjectMapper om) {
        this.om = om;
    }

    public String toJson(LearnerSnapshot snapshot) {
        try {
            return om.writeValueAsString(snapshot);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize snapshot of user " + snapshot.userId(), ex);
        }
    }

    public LearnerSnapshot fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "Snapshot JSON is empty");
        }
        try {
            return om.readValue(json, LearnerSnapshot.class);
        } catch (JsonProcessingException ex) {
            throw new InvalidInputException(ErrorCode.INVALID_SNAPSHOT, "Malformed snapshot: " + ex.getOriginalMessage(), ex);
        }
    }
}
