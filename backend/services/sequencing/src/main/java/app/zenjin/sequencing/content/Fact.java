package app.zenjin.sequencing.content;

import java.util.List;

/**
 * An atomic arithmetic relation such as {@code 7 × 8 = 56}, identified by
 * {@code mult-7-8}.
 */
public record Fact(
        String id,
        Operation operation,
        List<Integer> operands,
        int result
) {
    public Fact {
        operands = List.copyOf(operands);
    }
}
