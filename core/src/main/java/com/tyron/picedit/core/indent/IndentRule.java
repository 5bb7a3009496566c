package com.tyron.picedit.core.indent;

import java.util.List;
import java.util.Objects;

/**
 * An indentation rule: when every condition holds, the line is indented
 * {@code unitMultiplier * indentUnit + columns} from the anchor.
 */
public record IndentRule(String name, List<IndentCondition> conditions, IndentAnchor anchor,
                         int unitMultiplier, int columns) {

    public IndentRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(anchor, "anchor");
        conditions = List.copyOf(conditions);
    }

    public boolean matches(IndentContext context) {
        for (IndentCondition condition : conditions) {
            if (!condition.test(context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * A rule without conditions, or with only catch-all ones, matches every context.
     */
    public boolean isCatchAll() {
        for (IndentCondition condition : conditions) {
            if (condition.kind() != IndentCondition.Kind.CATCH_ALL) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws ArithmeticException if the offset does not fit in an int
     */
    public int offset(int indentUnit) {
        return Math.addExact(Math.multiplyExact(unitMultiplier, indentUnit), columns);
    }
}
