package app.zenjin.sequencing.mastery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mastery records of a single user. Readable by anyone holding the handle; only
 * {@link BoundaryTracker} writes to it.
 */
public final class MasteryLedger {

    private final String userId;
    private final Map<String, UserFactMastery> records = new LinkedHashMap<>();

    public MasteryLedger(String userId) {
        this.userId = userId;
    }

    public String userId() {
        return userId;
    }

    public Optional<UserFactMastery> find(String factId) {
        return Optional.ofNullable(records.get(factId));
    }

    public boolean contains(String factId) {
        return records.containsKey(factId);
    }

    public int size() {
        return records.size();
    }

    public List<UserFactMastery> records() {
        return List.copyOf(records.values());
    }

    void put(UserFactMastery mastery) {
        records.put(mastery.factId(), mastery);
    }

    void remove(String factId) {
        records.remove(factId);
    }

    void replaceAll(List<UserFactMastery> replacement) {
        records.clear();
        for (UserFactMastery m : replacement) {
            records.put(m.factId(), m);
        }
    }
}
