package com.tyron.picedit.core.indent;

import com.tyron.picedit.core.rules.NodeVocabulary;
import com.tyron.picedit.core.rules.RuleTableException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered indentation rules; the first rule whose conditions all hold wins. Reordering the
 * rules changes the result, so the table is a list and never a set.
 * <p>
 * A table is only built if its last rule is a catch-all, which guarantees every query
 * resolves, and if no rule follows a catch-all.
 */
public final class IndentRuleTable {

    private final List<IndentRule> rules;

    private IndentRuleTable(List<IndentRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static IndentRuleTable of(@NotNull List<IndentRule> rules, @NotNull NodeVocabulary vocabulary) {
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(vocabulary, "vocabulary");
        validate(rules, vocabulary);
        return new IndentRuleTable(rules);
    }

    public static Builder builder(@NotNull NodeVocabulary vocabulary) {
        return new Builder(vocabulary);
    }

    public List<IndentRule> getRules() {
        return rules;
    }

    /**
     * @return the first matching rule, or null if none matches (never for a valid table).
     */
    public @Nullable IndentRule firstMatch(IndentContext context) {
        for (IndentRule rule : rules) {
            if (rule.matches(context)) {
                return rule;
            }
        }
        return null;
    }

    private static void validate(List<IndentRule> rules, NodeVocabulary vocabulary) {
        if (rules.isEmpty()) {
            throw new RuleTableException("Indentation table is empty");
        }
        for (int i = 0; i < rules.size(); i++) {
            IndentRule rule = rules.get(i);
            if (rule.isCatchAll() && i != rules.size() - 1) {
                throw new RuleTableException("Rule '" + rules.get(i + 1).name() + "' is unreachable after catch-all '" + rule.name() + "'");
            }
            for (IndentCondition condition : rule.conditions()) {
                validate(rule, condition, vocabulary);
            }
        }
        IndentRule last = rules.get(rules.size() - 1);
        if (!last.isCatchAll()) {
            throw new RuleTableException("Last indentation rule '" + last.name() + "' must be a catch-all");
        }
    }

    private static void validate(IndentRule rule, IndentCondition condition, NodeVocabulary vocabulary) {
        IndentCondition.Kind kind = condition.kind();
        if (!kind.takesValues()) {
            if (!condition.values().isEmpty()) {
                throw new RuleTableException("Rule '" + rule.name() + "': " + kind.id() + " takes no values");
            }
            if (kind == IndentCondition.Kind.CATCH_ALL && condition.negated()) {
                throw new RuleTableException("Rule '" + rule.name() + "': catch-all cannot be negated");
            }
            return;
        }
        if (condition.values().isEmpty()) {
            throw new RuleTableException("Rule '" + rule.name() + "': " + kind.id() + " needs at least one value");
        }
        for (String value : condition.values()) {
            boolean known = switch (kind) {
                case FIELD_IS -> vocabulary.isField(value);
                case NODE_TEXT_IS -> true;
                default -> vocabulary.isType(value);
            };
            if (!known) {
                throw new RuleTableException("Rule '" + rule.name() + "': unknown "
                        + (kind == IndentCondition.Kind.FIELD_IS ? "field" : "node type") + " '" + value + "'");
            }
        }
    }

    public static final class Builder {

        private final NodeVocabulary vocabulary;
        private final List<IndentRule> rules = new ArrayList<>();

        private Builder(NodeVocabulary vocabulary) {
            this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        }

        public Builder rule(String name, IndentAnchor anchor, int unitMultiplier, int columns, IndentCondition... conditions) {
            rules.add(new IndentRule(name, List.of(conditions), anchor, unitMultiplier, columns));
            return this;
        }

        public Builder catchAll(String name, IndentAnchor anchor, int unitMultiplier, int columns) {
            return rule(name, anchor, unitMultiplier, columns);
        }

        public IndentRuleTable build() {
            return of(rules, vocabulary);
        }
    }
}
