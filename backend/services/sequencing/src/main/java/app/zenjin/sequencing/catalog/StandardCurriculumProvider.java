package app.zenjin.sequencing.catalog;

import app.zenjin.sequencing.content.Operation;
import app.zenjin.sequencing.content.PathDefinition;
import app.zenjin.sequencing.content.StitchContentProvider;
import app.zenjin.sequencing.content.StitchDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Default curriculum: addition, multiplication and division paths, one stitch per
 * number, the stitch holding that number's table.
 */
@Component
public class StandardCurriculumProvider implements StitchContentProvider {

    @Override
    public List<PathDefinition> pathsFor(String userId) {
        return List.of(
                new PathDefinition("addition", "Addition Facts", "Adding numbers up to 10 + 10",
                        tables(1, 10, StandardCurriculumProvider::addition)),
                new PathDefinition("multiplication", "Multiplication Facts", "Times tables from 2 to 12",
                        tables(2, ArithmeticFactRepository.TABLE_SIZE, StandardCurriculumProvider::multiplication)),
                new PathDefinition("division", "Division Facts", "Dividing by 2 to 12",
                        tables(2, ArithmeticFactRepository.TABLE_SIZE, StandardCurriculumProvider::division))
        );
    }

    private static List<StitchDefinition> tables(int from, int to, IntFunction<StitchDefinition> stitch) {
        List<StitchDefinition> out = new ArrayList<>();
        for (int n = from; n <= to; n++) {
            out.add(stitch.apply(n));
        }
        return out;
    }

    private static StitchDefinition addition(int n) {
        List<String> ids = new ArrayList<>();
        for (int k = 1; k <= 10; k++) {
            ids.add(ArithmeticFactRepository.idOf(Operation.ADDITION, n, k));
        }
        return new StitchDefinition("add-table-" + n, "Adding to " + n, ids);
    }

    private static StitchDefinition multiplication(int n) {
        List<String> ids = new ArrayList<>();
        for (int k = 1; k <= ArithmeticFactRepository.TABLE_SIZE; k++) {
            ids.add(ArithmeticFactRepository.idOf(Operation.MULTIPLICATION, n, k));
        }
        return new StitchDefinition("mult-table-" + n, n + " times table", ids);
    }

    private static StitchDefinition division(int n) {
        List<String> ids = new ArrayList<>();
        for (int k = 1; k <= ArithmeticFactRepository.TABLE_SIZE; k++) {
            ids.add(ArithmeticFactRepository.idOf(Operation.DIVISION, n * k, n));
        }
        return new StitchDefinition("div-table-" + n, "Dividing by " + n, ids);
    }
}
