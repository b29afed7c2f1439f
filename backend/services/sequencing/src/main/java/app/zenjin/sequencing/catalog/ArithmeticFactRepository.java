package app.zenjin.sequencing.catalog;

import app.zenjin.sequencing.common.ErrorCode;
import app.zenjin.sequencing.common.NotFoundException;
import app.zenjin.sequencing.content.Fact;
import app.zenjin.sequencing.content.FactRepository;
import app.zenjin.sequencing.content.Operation;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generated catalogue of the basic number facts: addition and subtraction within the
 * 0..12 tables, multiplication and division within 1..12.
 */
@Component
public class ArithmeticFactRepository implements FactRepository {

    static final int TABLE_SIZE = 12;

    private final Map<String, Fact> facts;

    public ArithmeticFactRepository() {
        Map<String, Fact> map = new HashMap<>();
        for (int a = 0; a <= TABLE_SIZE; a++) {
            for (int b = 0; b <= TABLE_SIZE; b++) {
                put(map, Operation.ADDITION, a, b, a + b);
                put(map, Operation.SUBTRACTION, a + b, b, a);
            }
        }
        for (int a = 1; a <= TABLE_SIZE; a++) {
            for (int b = 1; b <= TABLE_SIZE; b++) {
                put(map, Operation.MULTIPLICATION, a, b, a * b);
                put(map, Operation.DIVISION, a * b, b, a);
            }
        }
        this.facts = Map.copyOf(map);
    }

    @Override
    public Fact getFactById(String factId) {
        Fact fact = factId == null ? null : facts.get(factId);
        if (fact == null) {
            throw new NotFoundException(ErrorCode.FACT_NOT_FOUND, "Mathematical fact not found: " + factId);
        }
        return fact;
    }

    @Override
    public boolean exists(String factId) {
        return factId != null && facts.containsKey(factId);
    }

    int size() {
        return facts.size();
    }

    static String idOf(Operation operation, int left, int right) {
        return operation.idPrefix() + "-" + left + "-" + right;
    }

    private static void put(Map<String, Fact> map, Operation operation, int left, int right, int result) {
        String id = idOf(operation, left, right);
        map.putIfAbsent(id, new Fact(id, operation, List.of(left, right), result));
    }
}
